package com.newsresolver.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decode counters for one search. Created per search and handed to the scheduler,
 * so concurrent searches never share counts.
 */
public class BatchStats {

    private final AtomicInteger total = new AtomicInteger();
    private final AtomicInteger successful = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger batches = new AtomicInteger();
    private final AtomicLong elapsedMs = new AtomicLong();

    public void recordSuccess() {
        total.incrementAndGet();
        successful.incrementAndGet();
    }

    public void recordFailure() {
        total.incrementAndGet();
        failed.incrementAndGet();
    }

    public void recordBatch() {
        batches.incrementAndGet();
    }

    public void addElapsedMs(long ms) {
        elapsedMs.addAndGet(ms);
    }

    @JsonProperty
    public int getTotal() {
        return total.get();
    }

    @JsonProperty
    public int getSuccessful() {
        return successful.get();
    }

    @JsonProperty
    public int getFailed() {
        return failed.get();
    }

    @JsonProperty
    public int getBatches() {
        return batches.get();
    }

    @JsonProperty
    public long getElapsedMs() {
        return elapsedMs.get();
    }

    @Override
    public String toString() {
        return "BatchStats{total=" + getTotal() + ", successful=" + getSuccessful()
                + ", failed=" + getFailed() + ", batches=" + getBatches() + ", elapsedMs=" + getElapsedMs() + "}";
    }
}
