package com.nursingjobs.pipeline.ingest.model;

/**
 * How a source exposes its listing pages. A source uses exactly one strategy.
 */
public enum PaginationStrategy {
    /** Page index or offset embedded as a request parameter. */
    PARAMETER,
    /** Follow the "next" reference supplied by the previous page. */
    CURSOR,
    /** Enumerate numbered page links until no higher page number is offered. */
    INDEXED
}
