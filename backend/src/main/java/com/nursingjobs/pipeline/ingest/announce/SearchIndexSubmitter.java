package com.nursingjobs.pipeline.ingest.announce;

import com.nursingjobs.pipeline.ingest.model.HttpFetchResult;

import java.util.List;

public interface SearchIndexSubmitter {
    HttpFetchResult submit(String endpoint, List<String> urls);

    default boolean isAccepted(HttpFetchResult result) {
        return result != null && result.errorCode() == null
            && (result.statusCode() == 200 || result.statusCode() == 202);
    }
}
