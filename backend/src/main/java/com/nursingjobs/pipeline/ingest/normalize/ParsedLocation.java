package com.nursingjobs.pipeline.ingest.normalize;

public record ParsedLocation(
    String city,
    String state
) {
    public static ParsedLocation empty() {
        return new ParsedLocation(null, null);
    }

    public boolean isEmpty() {
        return city == null && state == null;
    }
}
