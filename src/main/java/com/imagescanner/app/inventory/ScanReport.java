package com.imagescanner.app.inventory;

import java.time.Duration;

/**
 * Resumo agregado de um run; é o que a camada de apresentação formata.
 */
public record ScanReport(
        long scanId,
        ScanStatus status,
        long found,
        long unchanged,
        long added,
        long modified,
        long moved,
        long skipped,
        long errors,
        long abandoned, // descobertos, mas não reconciliados por causa do cancelamento
        long bytesCounted,
        Duration elapsed,
        String message
) {

    static ScanReport snapshot(long scanId, ScanStatus status, ScanMetrics m, Duration elapsed, String message) {
        return new ScanReport(
                scanId,
                status,
                m.found.sum(),
                m.unchanged.sum(),
                m.added.sum(),
                m.modified.sum(),
                m.moved.sum(),
                m.skipped.sum(),
                m.errors.sum(),
                m.abandoned.sum(),
                m.bytesCounted.sum(),
                elapsed,
                message
        );
    }

    public boolean cancelled() {
        return status == ScanStatus.CANCELLED;
    }
}
