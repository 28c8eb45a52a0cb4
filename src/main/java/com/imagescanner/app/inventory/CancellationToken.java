package com.imagescanner.app.inventory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sinal de cancelamento cooperativo de um scan. Passado explicitamente para cada componente
 * (descoberta, hash, reconciliação); nunca é estado global.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) throw new ScanCancelledException();
    }
}
