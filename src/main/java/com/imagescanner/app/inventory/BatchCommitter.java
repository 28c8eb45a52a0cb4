package com.imagescanner.app.inventory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagescanner.app.catalog.CatalogRecord;
import com.imagescanner.app.catalog.CatalogStorageException;
import com.imagescanner.app.catalog.CatalogStore;
import com.imagescanner.app.catalog.ProcessedMarker;

/**
 * Acumula registros NEW/MODIFIED/MOVED e grava em lotes atômicos (registros + marcadores).
 * <p>
 * Enquanto não gravados, os registros pendentes são a verdade para a resolução de identidade:
 * um registro do store cuja identidade está pendente é ignorado nas buscas.
 * Contadores e bytes dos arquivos do lote só entram em {@link ScanMetrics} depois do commit.
 * Não é thread-safe; só a thread coordenadora usa.
 */
final class BatchCommitter {

    private static final Logger logger = LoggerFactory.getLogger(BatchCommitter.class);

    private record Staged(FileOutcome outcome, long bytes) {}

    private final CatalogStore store;
    private final int batchSize;
    private final ScanMetrics metrics;

    // chave: "id:N" para registros persistidos, "new:<hash>" para novos
    private final Map<String, CatalogRecord> pending = new LinkedHashMap<>();
    private final Map<String, String> keyByPath = new HashMap<>();
    private final Map<String, String> keyByHash = new HashMap<>();
    private final List<ProcessedMarker> markers = new ArrayList<>();
    private final List<Staged> staged = new ArrayList<>();

    // marcadores de arquivos inalterados: vão junto com o próximo lote
    private final List<ProcessedMarker> touches = new ArrayList<>();

    BatchCommitter(CatalogStore store, int batchSize, ScanMetrics metrics) {
        this.store = store;
        this.batchSize = batchSize;
        this.metrics = metrics;
    }

    Optional<CatalogRecord> pendingAtPath(String path) {
        return Optional.ofNullable(keyByPath.get(path)).map(pending::get);
    }

    Optional<CatalogRecord> pendingWithHash(String contentHash) {
        return Optional.ofNullable(keyByHash.get(contentHash)).map(pending::get);
    }

    /** true se a identidade do registro lido do store já tem versão pendente neste lote. */
    boolean isPending(CatalogRecord stored) {
        return stored.isPersisted() && pending.containsKey(keyOf(stored));
    }

    void stage(CatalogRecord record, ProcessedMarker marker, FileOutcome outcome, long bytes) {
        if (!outcome.entersBatch()) throw new IllegalArgumentException("Desfecho fora do lote: " + outcome);
        String key = keyOf(record);
        CatalogRecord previous = pending.put(key, record);
        if (previous != null) {
            keyByPath.remove(previous.path(), key);
            keyByHash.remove(previous.contentHash(), key);
        }
        keyByPath.put(record.path(), key);
        keyByHash.put(record.contentHash(), key);
        markers.add(marker);
        staged.add(new Staged(outcome, bytes));
    }

    void touch(ProcessedMarker marker) {
        touches.add(marker);
        if (touches.size() >= batchSize) flush();
    }

    void flushIfFull() {
        if (staged.size() >= batchSize) flush();
    }

    /**
     * Grava tudo que está pendente numa única transação.
     *
     * @throws CatalogStorageException o lote inteiro sofreu rollback; o scan deve parar
     */
    void flush() {
        if (pending.isEmpty() && markers.isEmpty() && touches.isEmpty()) return;

        List<ProcessedMarker> allMarkers = new ArrayList<>(markers.size() + touches.size());
        allMarkers.addAll(markers);
        allMarkers.addAll(touches);
        List<CatalogRecord> records = new ArrayList<>(pending.values());

        store.commitBatch(records, allMarkers);

        metrics.dbBatches.increment();
        for (Staged s : staged) {
            metrics.record(s.outcome());
            metrics.bytesCounted.add(s.bytes());
        }
        if (!records.isEmpty()) {
            logger.info("[DB] Lote gravado: {} registros, {} marcadores", records.size(), allMarkers.size());
        }
        clear();
    }

    private void clear() {
        pending.clear();
        keyByPath.clear();
        keyByHash.clear();
        markers.clear();
        staged.clear();
        touches.clear();
    }

    private static String keyOf(CatalogRecord r) {
        return r.isPersisted() ? "id:" + r.id().getAsLong() : "new:" + r.contentHash();
    }
}
