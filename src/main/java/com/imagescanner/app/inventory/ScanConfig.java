package com.imagescanner.app.inventory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Configuração de um run, já validada pela camada de CLI.
 */
public record ScanConfig(
        Path root,
        List<String> extensions,
        boolean recursive,
        long minFileSize,
        long maxFileSize, // 0 = sem limite
        int batchSize,
        List<String> metadataFields,
        int hashWorkers
) {

    public ScanConfig {
        Objects.requireNonNull(root, "root");
        extensions = List.copyOf(extensions);
        metadataFields = List.copyOf(metadataFields);
        if (batchSize < 1) throw new IllegalArgumentException("batchSize deve ser >= 1");
        if (minFileSize < 0 || maxFileSize < 0) throw new IllegalArgumentException("limites de tamanho negativos");
        if (hashWorkers < 1) throw new IllegalArgumentException("hashWorkers deve ser >= 1");
    }

    public long effectiveMaxFileSize() {
        return maxFileSize == 0 ? Long.MAX_VALUE : maxFileSize;
    }

    public boolean acceptsSize(long size) {
        return size >= minFileSize && size <= effectiveMaxFileSize();
    }

    public ScanConfig withBatchSize(int n) {
        return new ScanConfig(root, extensions, recursive, minFileSize, maxFileSize, n, metadataFields, hashWorkers);
    }

    public ScanConfig withHashWorkers(int n) {
        return new ScanConfig(root, extensions, recursive, minFileSize, maxFileSize, batchSize, metadataFields, n);
    }

    public ScanConfig withSizeBounds(long min, long max) {
        return new ScanConfig(root, extensions, recursive, min, max, batchSize, metadataFields, hashWorkers);
    }
}
