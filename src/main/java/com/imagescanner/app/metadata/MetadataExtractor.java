package com.imagescanner.app.metadata;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Optional;

/**
 * Colaborador de extração de metadados.
 * <p>
 * {@link Optional#empty()} significa "extração falhou" e nunca "zero metadados".
 */
@FunctionalInterface
public interface MetadataExtractor {

    /**
     * @param requestedFields nomes de tags (case-insensitive); {@code "*"} pede todas
     */
    Optional<ImageMetadata> extract(Path file, Collection<String> requestedFields);
}
