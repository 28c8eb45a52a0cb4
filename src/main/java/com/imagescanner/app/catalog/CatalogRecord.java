package com.imagescanner.app.catalog;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Uma linha do catálogo: um conteúdo distinto visto num caminho vivo.
 * <p>
 * A identidade é atribuída pelo store no insert; {@link OptionalLong#empty()} significa
 * "ainda não persistido". Valores imutáveis: toda alteração passa por um {@code with*}
 * e volta ao store via {@link CatalogStore#upsertRecordsBatch}.
 */
public record CatalogRecord(
        OptionalLong id,
        String name,
        String path,
        long sizeBytes,
        int width,
        int height,
        String contentHash,
        Instant fileCreatedAt,
        Instant fileModifiedAt,
        LocalDateTime dateTaken,
        String cameraModel,
        Map<String, String> extraMetadata,
        Instant scannedAt
) {

    public CatalogRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(scannedAt, "scannedAt");
        extraMetadata = extraMetadata == null ? Map.of() : Map.copyOf(extraMetadata);
    }

    public boolean isPersisted() {
        return id.isPresent();
    }

    public CatalogRecord withId(long newId) {
        return new CatalogRecord(OptionalLong.of(newId), name, path, sizeBytes, width, height, contentHash,
                fileCreatedAt, fileModifiedAt, dateTaken, cameraModel, extraMetadata, scannedAt);
    }

    public CatalogRecord withScannedAt(Instant at) {
        return new CatalogRecord(id, name, path, sizeBytes, width, height, contentHash,
                fileCreatedAt, fileModifiedAt, dateTaken, cameraModel, extraMetadata, at);
    }

    /**
     * Mesmo conteúdo visto em outro caminho: localização, timestamps de arquivo e scannedAt vêm de
     * {@code seen}; dateTaken/cameraModel só são trocados quando a nova extração trouxe valor.
     */
    public CatalogRecord movedTo(CatalogRecord seen) {
        return new CatalogRecord(id, seen.name, seen.path, sizeBytes, width, height, contentHash,
                seen.fileCreatedAt, seen.fileModifiedAt,
                seen.dateTaken != null ? seen.dateTaken : dateTaken,
                seen.cameraModel != null ? seen.cameraModel : cameraModel,
                extraMetadata, seen.scannedAt);
    }

    /** Substitui os metadados derivados mantendo a identidade. */
    public CatalogRecord refreshedFrom(CatalogRecord fresh) {
        return new CatalogRecord(id, fresh.name, fresh.path, fresh.sizeBytes, fresh.width, fresh.height,
                fresh.contentHash, fresh.fileCreatedAt, fresh.fileModifiedAt, fresh.dateTaken, fresh.cameraModel,
                fresh.extraMetadata, fresh.scannedAt);
    }
}
