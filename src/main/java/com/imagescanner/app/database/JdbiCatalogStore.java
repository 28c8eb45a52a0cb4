package com.imagescanner.app.database;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imagescanner.app.catalog.CatalogRecord;
import com.imagescanner.app.catalog.CatalogStorageException;
import com.imagescanner.app.catalog.CatalogStore;
import com.imagescanner.app.catalog.ProcessedMarker;
import com.imagescanner.app.database.CatalogDao.ImageRow;
import com.imagescanner.app.database.CatalogDao.MarkerRow;

/**
 * {@link CatalogStore} sobre SQLite. Um lote (registros + marcadores) é uma transação Jdbi.
 */
public class JdbiCatalogStore implements CatalogStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbiCatalogStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, String>> TAGS_TYPE = new TypeReference<>() {};

    private final Jdbi jdbi;

    public JdbiCatalogStore(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public Optional<ProcessedMarker> findMarkerByPath(String path) {
        return read(() -> jdbi.withExtension(CatalogDao.class, dao -> dao.findMarker(path)))
                .map(r -> new ProcessedMarker(r.path(), r.contentHash(), Instant.ofEpochMilli(r.lastProcessedMillis())));
    }

    @Override
    public Optional<CatalogRecord> findRecordByPath(String path) {
        return read(() -> jdbi.withExtension(CatalogDao.class, dao -> dao.findImageByPath(path)))
                .map(JdbiCatalogStore::toRecord);
    }

    @Override
    public Optional<CatalogRecord> findRecordByHash(String contentHash) {
        return read(() -> jdbi.withExtension(CatalogDao.class, dao -> dao.findImageByHash(contentHash)))
                .map(JdbiCatalogStore::toRecord);
    }

    @Override
    public List<CatalogRecord> findRecordsByHash(String contentHash) {
        return read(() -> jdbi.withExtension(CatalogDao.class, dao -> dao.findImagesByHash(contentHash)))
                .stream()
                .map(JdbiCatalogStore::toRecord)
                .toList();
    }

    public Optional<CatalogRecord> findRecordById(long id) {
        return read(() -> jdbi.withExtension(CatalogDao.class, dao -> dao.findImageById(id)))
                .map(JdbiCatalogStore::toRecord);
    }

    public long countRecords() {
        return read(() -> jdbi.withExtension(CatalogDao.class, CatalogDao::countImages));
    }

    public long countMarkers() {
        return read(() -> jdbi.withExtension(CatalogDao.class, CatalogDao::countMarkers));
    }

    @Override
    public List<CatalogRecord> upsertRecordsBatch(List<CatalogRecord> records) {
        return commitBatch(records, List.of());
    }

    @Override
    public void upsertMarker(ProcessedMarker marker) {
        try {
            jdbi.useExtension(CatalogDao.class, dao -> dao.upsertMarker(toRow(marker)));
        } catch (JdbiException e) {
            throw new CatalogStorageException("Falha ao gravar marcador: " + marker.path(), e);
        }
    }

    /**
     * Registros e marcadores no mesmo commit: ou o lote inteiro fica visível, ou nada.
     */
    @Override
    public List<CatalogRecord> commitBatch(List<CatalogRecord> records, List<ProcessedMarker> markers) {
        if (records.isEmpty() && markers.isEmpty()) return List.of();
        try {
            List<CatalogRecord> saved = jdbi.inTransaction(handle -> {
                CatalogDao dao = handle.attach(CatalogDao.class);
                for (CatalogRecord r : records) {
                    if (r.isPersisted()) dao.parkImagePath(r.id().getAsLong());
                }
                List<CatalogRecord> out = new ArrayList<>(records.size());
                for (CatalogRecord r : records) {
                    out.add(writeRecord(dao, r));
                }
                for (ProcessedMarker m : markers) {
                    dao.upsertMarker(toRow(m));
                }
                return out;
            });
            logger.debug("Lote gravado: {} registros, {} marcadores", records.size(), markers.size());
            return saved;
        } catch (CatalogStorageException e) {
            throw e;
        } catch (RuntimeException e) {
            // JdbiException ou falha inesperada: a transação já sofreu rollback
            throw new CatalogStorageException("Falha ao gravar lote de " + records.size() + " registros", e);
        }
    }

    /** Grava um registro dentro da transação do lote. */
    protected CatalogRecord writeRecord(CatalogDao dao, CatalogRecord record) {
        ImageRow row = toRow(record);
        if (record.isPersisted()) {
            int n = dao.updateImage(row);
            if (n != 1) {
                throw new CatalogStorageException("Registro " + record.id().getAsLong() + " não existe mais no catálogo");
            }
            return record;
        }
        return record.withId(dao.insertImage(row));
    }

    private static <T> T read(Supplier<T> query) {
        try {
            return query.get();
        } catch (JdbiException e) {
            throw new CatalogStorageException("Falha de leitura no catálogo", e);
        }
    }

    // --- Conversões ----------------------------------------------------------

    static CatalogRecord toRecord(ImageRow row) {
        return new CatalogRecord(
                row.id() == null ? OptionalLong.empty() : OptionalLong.of(row.id()),
                row.name(),
                row.path(),
                row.sizeBytes(),
                row.width(),
                row.height(),
                row.contentHash(),
                row.fileCreatedMillis() == null ? null : Instant.ofEpochMilli(row.fileCreatedMillis()),
                row.fileModifiedMillis() == null ? null : Instant.ofEpochMilli(row.fileModifiedMillis()),
                parseDate(row.dateTaken()),
                row.cameraModel(),
                readTags(row.extraMetadata()),
                Instant.ofEpochMilli(row.scannedAtMillis())
        );
    }

    static ImageRow toRow(CatalogRecord r) {
        return new ImageRow(
                r.id().isPresent() ? r.id().getAsLong() : null,
                r.name(),
                r.path(),
                r.sizeBytes(),
                r.width(),
                r.height(),
                r.contentHash(),
                r.fileCreatedAt() == null ? null : r.fileCreatedAt().toEpochMilli(),
                r.fileModifiedAt() == null ? null : r.fileModifiedAt().toEpochMilli(),
                r.dateTaken() == null ? null : r.dateTaken().toString(),
                r.cameraModel(),
                writeTags(r.extraMetadata()),
                r.scannedAt().toEpochMilli()
        );
    }

    private static MarkerRow toRow(ProcessedMarker m) {
        return new MarkerRow(m.path(), m.contentHash(), m.lastProcessed().toEpochMilli());
    }

    private static LocalDateTime parseDate(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return LocalDateTime.parse(raw);
        } catch (DateTimeParseException e) {
            logger.warn("date_taken inválido no catálogo: {}", raw);
            return null;
        }
    }

    private static String writeTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) return null;
        try {
            return MAPPER.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new CatalogStorageException("Falha ao serializar metadados", e);
        }
    }

    private static Map<String, String> readTags(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return MAPPER.readValue(json, TAGS_TYPE);
        } catch (JsonProcessingException e) {
            logger.warn("extra_metadata ilegível, ignorando: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
