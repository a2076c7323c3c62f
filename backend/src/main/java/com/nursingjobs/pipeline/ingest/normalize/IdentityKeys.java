package com.nursingjobs.pipeline.ingest.normalize;

import com.nursingjobs.pipeline.ingest.util.HashUtils;

import java.util.Locale;

public final class IdentityKeys {
    private IdentityKeys() {
    }

    /**
     * Stable key for a listing within one employer. The upstream id wins when there is one;
     * otherwise title, location and posted date are hashed together.
     */
    public static String of(String employerSlug, String externalId, String title, String location, String postedDate) {
        String employer = employerSlug == null ? "" : employerSlug.trim().toLowerCase(Locale.ROOT);
        if (externalId != null && !externalId.isBlank()) {
            return HashUtils.sha256Hex(employer + ":id:" + externalId.trim());
        }
        return HashUtils.sha256Hex(employer + ":h:" + canonical(title) + "|" + canonical(location) + "|" + canonical(postedDate));
    }

    private static String canonical(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
