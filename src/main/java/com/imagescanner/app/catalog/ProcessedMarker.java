package com.imagescanner.app.catalog;

import java.time.Instant;

/**
 * Cache caminho → hash usado só para evitar re-hash de arquivos inalterados.
 */
public record ProcessedMarker(String path, String contentHash, Instant lastProcessed) {

    public boolean matches(String hash) {
        return contentHash != null && contentHash.equals(hash);
    }
}
