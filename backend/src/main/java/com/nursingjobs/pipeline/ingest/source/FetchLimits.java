package com.nursingjobs.pipeline.ingest.source;

import java.util.function.BooleanSupplier;

/**
 * Bounds for one traversal. Null limits mean unbounded; {@code cancelled} is polled before
 * every page request.
 */
public record FetchLimits(
    Integer maxPages,
    Integer maxItems,
    BooleanSupplier cancelled
) {
    public FetchLimits {
        maxPages = maxPages == null ? null : Math.max(1, maxPages);
        maxItems = maxItems == null ? null : Math.max(1, maxItems);
        cancelled = cancelled == null ? () -> false : cancelled;
    }

    public static FetchLimits unbounded() {
        return new FetchLimits(null, null, null);
    }

    public boolean pageLimitReached(int pagesFetched) {
        return maxPages != null && pagesFetched >= maxPages;
    }

    public boolean itemLimitReached(int itemsEmitted) {
        return maxItems != null && itemsEmitted >= maxItems;
    }
}
