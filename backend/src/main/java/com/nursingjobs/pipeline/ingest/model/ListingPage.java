package com.nursingjobs.pipeline.ingest.model;

import java.util.List;
import java.util.Map;

/**
 * A parsed listing page. {@code nextReference} is set for cursor sources, {@code pageLinks}
 * maps page numbers to URLs for indexed sources.
 */
public record ListingPage(
    List<RawListing> listings,
    String nextReference,
    boolean nextDisabled,
    Map<Integer, String> pageLinks
) {
    public ListingPage {
        listings = listings == null ? List.of() : List.copyOf(listings);
        pageLinks = pageLinks == null ? Map.of() : Map.copyOf(pageLinks);
    }
}
