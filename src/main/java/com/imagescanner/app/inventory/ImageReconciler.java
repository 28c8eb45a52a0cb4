package com.imagescanner.app.inventory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagescanner.app.catalog.CatalogRecord;
import com.imagescanner.app.catalog.CatalogStore;
import com.imagescanner.app.catalog.ProcessedMarker;
import com.imagescanner.app.metadata.ExifValues;
import com.imagescanner.app.metadata.ImageMetadata;
import com.imagescanner.app.metadata.MetadataExtractor;

/**
 * Classifica cada arquivo contra o catálogo em duas fases.
 * <p>
 * {@link #observe} (filtro de tamanho, hash, marcador, metadados) só lê o store e pode rodar em
 * vários workers. {@link #resolve} decide a identidade e entrega o registro ao lote; roda sempre na
 * thread coordenadora, uma observação por vez, o que serializa a resolução por hash.
 */
final class ImageReconciler {

    private static final Logger logger = LoggerFactory.getLogger(ImageReconciler.class);

    private final CatalogStore store;
    private final FileHasher hasher;
    private final MetadataExtractor extractor;
    private final ScanConfig config;
    private final Clock clock;

    ImageReconciler(CatalogStore store, FileHasher hasher, MetadataExtractor extractor, ScanConfig config, Clock clock) {
        this.store = store;
        this.hasher = hasher;
        this.extractor = extractor;
        this.config = config;
        this.clock = clock;
    }

    Observation observe(Path file, CancellationToken cancel) {
        if (cancel.isCancellationRequested()) return Observation.terminal(file, FileOutcome.ABANDONED, 0);
        try {
            return observeChecked(file, cancel);
        } catch (ScanCancelledException e) {
            logger.debug("Hash abandonado por cancelamento: {}", file);
            return Observation.terminal(file, FileOutcome.ABANDONED, 0);
        } catch (RuntimeException e) {
            logger.warn("Erro inesperado em {}: {}", file, e.toString());
            return Observation.terminal(file, FileOutcome.SKIPPED_ERROR, 0);
        }
    }

    private Observation observeChecked(Path file, CancellationToken cancel) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
            logger.warn("Falha ao ler atributos de {}: {}", file, e.toString());
            return Observation.terminal(file, FileOutcome.SKIPPED_ERROR, 0);
        }

        long size = attrs.size();
        if (!config.acceptsSize(size)) {
            logger.debug("Fora dos limites de tamanho ({} bytes): {}", size, file);
            return Observation.terminal(file, FileOutcome.SKIPPED_POLICY, size);
        }

        String hash;
        try {
            hash = hasher.hash(file, cancel);
        } catch (IOException e) {
            logger.warn("Falha ao calcular hash de {}: {}", file, e.toString());
            return Observation.terminal(file, FileOutcome.SKIPPED_ERROR, size);
        }

        Optional<ProcessedMarker> marker = store.findMarkerByPath(file.toString());
        if (marker.isPresent() && marker.get().matches(hash)) {
            logger.debug("Inalterado: {}", file);
            return Observation.unchanged(file, size, hash);
        }

        Optional<ImageMetadata> metadata = extractor.extract(file, config.metadataFields());
        if (metadata.isEmpty()) {
            logger.warn("Metadados indisponíveis: {}", file);
            return Observation.terminal(file, FileOutcome.SKIPPED_ERROR, size);
        }

        return Observation.toResolve(file, size,
                attrs.creationTime().toInstant(), attrs.lastModifiedTime().toInstant(), hash, metadata.get());
    }

    /**
     * Precedência: registro já no caminho → MODIFIED (a identidade do caminho vence);
     * senão registro com o mesmo hash em outro caminho → MOVED; senão NEW.
     * O lote pendente sombreia o store; por hash vence o registro mais antigo que não está no lote.
     *
     * @return o desfecho; NEW/MODIFIED/MOVED já foram entregues ao lote
     */
    FileOutcome resolve(Observation obs, BatchCommitter batch) {
        String path = obs.path();
        try {
            Instant now = clock.instant();
            CatalogRecord seen = recordFrom(obs, now);
            ProcessedMarker marker = new ProcessedMarker(path, obs.contentHash(), now);

            Optional<CatalogRecord> atPath = batch.pendingAtPath(path)
                    .or(() -> store.findRecordByPath(path).filter(r -> !batch.isPending(r)));
            if (atPath.isPresent()) {
                CatalogRecord prev = atPath.get();
                CatalogRecord updated = prev.refreshedFrom(seen.withScannedAt(nextScannedAt(prev, now)));
                batch.stage(updated, marker, FileOutcome.MODIFIED, obs.sizeBytes());
                logger.debug("Modificado: {}", path);
                return FileOutcome.MODIFIED;
            }

            Optional<CatalogRecord> byHash = batch.pendingWithHash(obs.contentHash())
                    .or(() -> store.findRecordsByHash(obs.contentHash()).stream()
                            .filter(r -> !batch.isPending(r))
                            .findFirst());
            if (byHash.isPresent()) {
                CatalogRecord prev = byHash.get();
                CatalogRecord moved = prev.movedTo(seen.withScannedAt(nextScannedAt(prev, now)));
                batch.stage(moved, marker, FileOutcome.MOVED, obs.sizeBytes());
                logger.info("Movido: {} -> {}", prev.path(), path);
                return FileOutcome.MOVED;
            }

            batch.stage(seen, marker, FileOutcome.NEW, obs.sizeBytes());
            logger.debug("Novo: {}", path);
            return FileOutcome.NEW;
        } catch (RuntimeException e) {
            logger.warn("Falha ao resolver identidade de {}: {}", path, e.toString());
            return FileOutcome.SKIPPED_ERROR;
        }
    }

    private static CatalogRecord recordFrom(Observation obs, Instant now) {
        ImageMetadata md = obs.metadata();
        Path name = obs.file().getFileName();
        return new CatalogRecord(
                OptionalLong.empty(),
                name == null ? obs.path() : name.toString(),
                obs.path(),
                obs.sizeBytes(),
                md.width(),
                md.height(),
                obs.contentHash(),
                obs.createdAt(),
                obs.modifiedAt(),
                ExifValues.dateTaken(md.tags()),
                ExifValues.cameraModel(md.tags()),
                md.tags(),
                now
        );
    }

    // scannedAt cresce estritamente por registro, mesmo com relógio parado ou voltando
    private static Instant nextScannedAt(CatalogRecord prev, Instant now) {
        Instant floor = prev.scannedAt().plusMillis(1);
        return now.isBefore(floor) ? floor : now;
    }
}
