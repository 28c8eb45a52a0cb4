package com.imagescanner.app.inventory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * Contadores vivos de um run. Seguros para os workers de hash.
 */
public final class ScanMetrics {
    public final LongAdder found = new LongAdder();
    public final LongAdder unchanged = new LongAdder();
    public final LongAdder added = new LongAdder();
    public final LongAdder modified = new LongAdder();
    public final LongAdder moved = new LongAdder();
    public final LongAdder skipped = new LongAdder();
    public final LongAdder errors = new LongAdder();
    public final LongAdder abandoned = new LongAdder();
    public final LongAdder bytesCounted = new LongAdder();
    public final LongAdder dbBatches = new LongAdder();
    public final LongAdder walkErrors = new LongAdder();
    public final AtomicBoolean running = new AtomicBoolean(false);

    public volatile Instant start = Instant.EPOCH;

    void record(FileOutcome outcome) {
        switch (outcome) {
            case UNCHANGED -> unchanged.increment();
            case NEW -> added.increment();
            case MODIFIED -> modified.increment();
            case MOVED -> moved.increment();
            case SKIPPED_POLICY -> skipped.increment();
            case SKIPPED_ERROR -> errors.increment();
            case ABANDONED -> abandoned.increment();
        }
    }
}
