package com.nursingjobs.pipeline.ingest.source;

import com.nursingjobs.pipeline.ingest.model.ListingPage;

public interface ListingPageParser {
    /**
     * @throws AdapterFetchException when the page does not have the expected listing structure
     */
    ListingPage parse(String body, String pageUrl);

    String acceptHeader();
}
