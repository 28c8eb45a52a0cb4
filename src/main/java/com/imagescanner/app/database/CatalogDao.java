package com.imagescanner.app.database;

import java.util.List;
import java.util.Optional;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public interface CatalogDao {

    /** Linha crua de {@code images}; a conversão para o domínio fica no {@link JdbiCatalogStore}. */
    record ImageRow(
            Long id,
            String name,
            String path,
            long sizeBytes,
            int width,
            int height,
            String contentHash,
            Long fileCreatedMillis,
            Long fileModifiedMillis,
            String dateTaken,
            String cameraModel,
            String extraMetadata,
            long scannedAtMillis
    ) {}

    record MarkerRow(String path, String contentHash, long lastProcessedMillis) {}

    // --- Images --------------------------------------------------------------

    @SqlQuery("""
        SELECT id,
               name,
               path,
               size_bytes AS sizeBytes,
               width,
               height,
               content_hash AS contentHash,
               file_created_millis AS fileCreatedMillis,
               file_modified_millis AS fileModifiedMillis,
               date_taken AS dateTaken,
               camera_model AS cameraModel,
               extra_metadata AS extraMetadata,
               scanned_at_millis AS scannedAtMillis
          FROM images
         WHERE path = :path
        """)
    @RegisterConstructorMapper(ImageRow.class)
    Optional<ImageRow> findImageByPath(@Bind("path") String path);

    // mais de um candidato: vence a identidade mais antiga
    @SqlQuery("""
        SELECT id,
               name,
               path,
               size_bytes AS sizeBytes,
               width,
               height,
               content_hash AS contentHash,
               file_created_millis AS fileCreatedMillis,
               file_modified_millis AS fileModifiedMillis,
               date_taken AS dateTaken,
               camera_model AS cameraModel,
               extra_metadata AS extraMetadata,
               scanned_at_millis AS scannedAtMillis
          FROM images
         WHERE content_hash = :hash
         ORDER BY id
         LIMIT 1
        """)
    @RegisterConstructorMapper(ImageRow.class)
    Optional<ImageRow> findImageByHash(@Bind("hash") String hash);

    @SqlQuery("""
        SELECT id,
               name,
               path,
               size_bytes AS sizeBytes,
               width,
               height,
               content_hash AS contentHash,
               file_created_millis AS fileCreatedMillis,
               file_modified_millis AS fileModifiedMillis,
               date_taken AS dateTaken,
               camera_model AS cameraModel,
               extra_metadata AS extraMetadata,
               scanned_at_millis AS scannedAtMillis
          FROM images
         WHERE content_hash = :hash
         ORDER BY id
        """)
    @RegisterConstructorMapper(ImageRow.class)
    List<ImageRow> findImagesByHash(@Bind("hash") String hash);

    @SqlQuery("""
        SELECT id,
               name,
               path,
               size_bytes AS sizeBytes,
               width,
               height,
               content_hash AS contentHash,
               file_created_millis AS fileCreatedMillis,
               file_modified_millis AS fileModifiedMillis,
               date_taken AS dateTaken,
               camera_model AS cameraModel,
               extra_metadata AS extraMetadata,
               scanned_at_millis AS scannedAtMillis
          FROM images
         WHERE id = :id
        """)
    @RegisterConstructorMapper(ImageRow.class)
    Optional<ImageRow> findImageById(@Bind("id") long id);

    @SqlQuery("SELECT COUNT(*) FROM images")
    long countImages();

    @SqlUpdate("""
        INSERT INTO images (name, path, size_bytes, width, height, content_hash,
                            file_created_millis, file_modified_millis, date_taken, camera_model,
                            extra_metadata, scanned_at_millis)
        VALUES (:name, :path, :sizeBytes, :width, :height, :contentHash,
                :fileCreatedMillis, :fileModifiedMillis, :dateTaken, :cameraModel,
                :extraMetadata, :scannedAtMillis)
        """)
    @GetGeneratedKeys("id")
    long insertImage(@BindMethods ImageRow row);

    @SqlUpdate("""
        UPDATE images
           SET name = :name,
               path = :path,
               size_bytes = :sizeBytes,
               width = :width,
               height = :height,
               content_hash = :contentHash,
               file_created_millis = :fileCreatedMillis,
               file_modified_millis = :fileModifiedMillis,
               date_taken = :dateTaken,
               camera_model = :cameraModel,
               extra_metadata = :extraMetadata,
               scanned_at_millis = :scannedAtMillis
         WHERE id = :id
        """)
    int updateImage(@BindMethods ImageRow row);

    /**
     * Tira o registro do caminho atual dentro da transação do lote, para que trocas de caminho
     * entre registros do mesmo lote não esbarrem no UNIQUE(path). Caminhos gravados são
     * absolutos, então o prefixo "#parked:" nunca colide.
     */
    @SqlUpdate("UPDATE images SET path = '#parked:' || id WHERE id = :id")
    int parkImagePath(@Bind("id") long id);

    // --- Processed markers ---------------------------------------------------

    @SqlQuery("""
        SELECT path,
               content_hash AS contentHash,
               last_processed_millis AS lastProcessedMillis
          FROM processed_files
         WHERE path = :path
        """)
    @RegisterConstructorMapper(MarkerRow.class)
    Optional<MarkerRow> findMarker(@Bind("path") String path);

    @SqlUpdate("""
        INSERT INTO processed_files(path, content_hash, last_processed_millis)
        VALUES(:path, :contentHash, :lastProcessedMillis)
        ON CONFLICT(path) DO UPDATE SET
            content_hash = excluded.content_hash,
            last_processed_millis = excluded.last_processed_millis
        """)
    void upsertMarker(@BindMethods MarkerRow marker);

    @SqlQuery("SELECT COUNT(*) FROM processed_files")
    long countMarkers();
}
