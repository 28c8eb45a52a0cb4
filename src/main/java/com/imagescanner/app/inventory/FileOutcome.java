package com.imagescanner.app.inventory;

/**
 * Classificação de um arquivo após a reconciliação.
 */
public enum FileOutcome {
    UNCHANGED,
    NEW,
    MODIFIED,
    MOVED,
    /** Fora de [minSize, maxSize]; nunca chega a ser lido. */
    SKIPPED_POLICY,
    /** Falha recuperável de I/O, hash ou metadados. */
    SKIPPED_ERROR,
    /** Cancelado no meio do hash; nada foi gravado. */
    ABANDONED;

    public boolean entersBatch() {
        return this == NEW || this == MODIFIED || this == MOVED;
    }
}
