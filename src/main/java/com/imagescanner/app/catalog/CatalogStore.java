package com.imagescanner.app.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Contrato do catálogo persistido consumido pelo reconciliador.
 * <p>
 * Todas as escritas lançam {@link CatalogStorageException}. O store atribui as identidades
 * de registros novos e garante a unicidade de {@code path}.
 */
public interface CatalogStore {

    Optional<ProcessedMarker> findMarkerByPath(String path);

    Optional<CatalogRecord> findRecordByPath(String path);

    /** Busca por conteúdo, independente do caminho. Com mais de um candidato vence a identidade mais antiga. */
    Optional<CatalogRecord> findRecordByHash(String contentHash);

    /** Todos os registros com o conteúdo, do mais antigo para o mais novo. */
    default List<CatalogRecord> findRecordsByHash(String contentHash) {
        return findRecordByHash(contentHash).map(List::of).orElse(List.of());
    }

    /**
     * Insere/atualiza todos os registros numa única transação (tudo ou nada).
     *
     * @return os registros como persistidos, na mesma ordem, com identidade atribuída
     */
    List<CatalogRecord> upsertRecordsBatch(List<CatalogRecord> records);

    void upsertMarker(ProcessedMarker marker);

    /**
     * Grava um lote de registros e, em seguida, os marcadores correspondentes.
     * Implementações transacionais devem sobrescrever para gravar os dois no mesmo commit.
     */
    default List<CatalogRecord> commitBatch(List<CatalogRecord> records, List<ProcessedMarker> markers) {
        List<CatalogRecord> saved = records.isEmpty() ? List.of() : upsertRecordsBatch(records);
        for (ProcessedMarker m : markers) {
            upsertMarker(m);
        }
        return saved;
    }
}
