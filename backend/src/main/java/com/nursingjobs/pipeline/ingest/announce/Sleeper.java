package com.nursingjobs.pipeline.ingest.announce;

@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
}
