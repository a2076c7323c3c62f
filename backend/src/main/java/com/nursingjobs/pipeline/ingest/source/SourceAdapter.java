package com.nursingjobs.pipeline.ingest.source;

import com.nursingjobs.pipeline.ingest.model.PaginationStrategy;
import com.nursingjobs.pipeline.ingest.model.RawListing;

import java.util.stream.Stream;

/**
 * Reads one employer's listings. The returned stream is lazy: pages are requested as the
 * stream is consumed and the stream ends when the source is exhausted or a limit is hit.
 * Any page that cannot be fetched or parsed surfaces as {@link AdapterFetchException}
 * from the consuming operation.
 */
public interface SourceAdapter {
    String employerSlug();

    PaginationStrategy strategy();

    Stream<RawListing> fetchListings(FetchLimits limits);
}
