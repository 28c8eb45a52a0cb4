package com.imagescanner.app.inventory;

import java.nio.file.Path;
import java.time.Instant;

import com.imagescanner.app.metadata.ImageMetadata;

/**
 * Resultado das etapas que não dependem do estado do lote (tamanho, hash, marcador, metadados).
 * {@code outcome == null} significa que ainda falta a resolução de identidade.
 */
record Observation(
        Path file,
        FileOutcome outcome,
        long sizeBytes,
        Instant createdAt,
        Instant modifiedAt,
        String contentHash,
        ImageMetadata metadata
) {

    static Observation terminal(Path file, FileOutcome outcome, long sizeBytes) {
        return new Observation(file, outcome, sizeBytes, null, null, null, null);
    }

    static Observation unchanged(Path file, long sizeBytes, String contentHash) {
        return new Observation(file, FileOutcome.UNCHANGED, sizeBytes, null, null, contentHash, null);
    }

    static Observation toResolve(Path file, long sizeBytes, Instant createdAt, Instant modifiedAt,
                                 String contentHash, ImageMetadata metadata) {
        return new Observation(file, null, sizeBytes, createdAt, modifiedAt, contentHash, metadata);
    }

    boolean needsResolution() {
        return outcome == null;
    }

    String path() {
        return file.toString();
    }
}
