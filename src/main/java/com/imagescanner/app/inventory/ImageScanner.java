package com.imagescanner.app.inventory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagescanner.app.catalog.CatalogStorageException;
import com.imagescanner.app.catalog.CatalogStore;
import com.imagescanner.app.catalog.ProcessedMarker;
import com.imagescanner.app.metadata.MetadataExtractor;

/**
 * Orquestra um run: descoberta → reconciliação → lotes → resumo.
 * <p>
 * Erros por arquivo viram contadores; só falha de gravação no catálogo encerra o run (status FAILED).
 * Com cancelamento nenhum arquivo novo começa, os que já passaram do hash terminam e o lote
 * pendente é gravado antes do retorno.
 */
public final class ImageScanner {

    private static final Logger logger = LoggerFactory.getLogger(ImageScanner.class);

    private final CatalogStore store;
    private final ScanLog scanLog;
    private final MetadataExtractor extractor;
    private final FileHasher hasher;
    private final Clock clock;
    private final Consumer<String> uiLogger;

    private volatile ScanMetrics metrics = new ScanMetrics();

    public ImageScanner(CatalogStore store, ScanLog scanLog, MetadataExtractor extractor, Consumer<String> uiLogger) {
        this(store, scanLog, extractor, new FileHasher(), Clock.systemUTC(), uiLogger);
    }

    public ImageScanner(CatalogStore store, ScanLog scanLog, MetadataExtractor extractor,
                        FileHasher hasher, Clock clock, Consumer<String> uiLogger) {
        this.store = store;
        this.scanLog = scanLog;
        this.extractor = extractor;
        this.hasher = hasher;
        this.clock = clock;
        this.uiLogger = uiLogger;
    }

    /** Contadores do run em andamento (ou do último). */
    public ScanMetrics metrics() {
        return metrics;
    }

    public ScanReport run(ScanConfig config, CancellationToken cancel) {
        ScanMetrics m = new ScanMetrics();
        this.metrics = m;

        Path root = config.root().toAbsolutePath().normalize();
        Instant start = clock.instant();
        m.start = start;
        m.running.set(true);

        long scanId = scanLog.start(root.toString());
        uiLogger.accept(">> Escaneando " + root + " (lote " + config.batchSize() + ", workers " + config.hashWorkers() + ")");

        var reconciler = new ImageReconciler(store, hasher, extractor, config, clock);
        var batch = new BatchCommitter(store, config.batchSize(), m);
        var discoverer = new FileDiscoverer(msg -> uiLogger.accept(">> Aviso: " + msg), m.walkErrors);

        ScanStatus status;
        String message = null;
        try (Stream<Path> files = discoverer.discover(root, config.extensions(), config.recursive(), cancel)) {
            if (config.hashWorkers() > 1) {
                runParallel(files.iterator(), reconciler, batch, m, config.hashWorkers(), cancel);
            } else {
                runSequential(files.iterator(), reconciler, batch, m, cancel);
            }
            // também no cancelamento: o que já foi reconciliado fica durável
            batch.flush();
            status = cancel.isCancellationRequested() ? ScanStatus.CANCELLED : ScanStatus.COMPLETED;
        } catch (CatalogStorageException e) {
            logger.error("Falha fatal ao gravar no catálogo; scan interrompido", e);
            status = ScanStatus.FAILED;
            message = e.getMessage();
        } finally {
            m.running.set(false);
        }

        ScanReport report = ScanReport.snapshot(scanId, status, m, Duration.between(start, clock.instant()), message);
        scanLog.finish(report);

        switch (status) {
            case COMPLETED -> uiLogger.accept(">> FINALIZADO! " + report.found() + " arquivos encontrados.");
            case CANCELLED -> uiLogger.accept(">> Cancelado pelo usuário.");
            case FAILED -> uiLogger.accept(">> FALHOU: " + message);
        }
        logger.info("[SCAN] {} found={} unchanged={} new={} modified={} moved={} skipped={} errors={} abandoned={} bytes={} em {} ms",
                status, report.found(), report.unchanged(), report.added(), report.modified(), report.moved(),
                report.skipped(), report.errors(), report.abandoned(), report.bytesCounted(), report.elapsed().toMillis());
        return report;
    }

    private void runSequential(Iterator<Path> files, ImageReconciler reconciler, BatchCommitter batch,
                               ScanMetrics m, CancellationToken cancel) {
        while (!cancel.isCancellationRequested() && files.hasNext()) {
            Path file = files.next();
            m.found.increment();
            settle(reconciler.observe(file, cancel), reconciler, batch, m);
        }
    }

    /**
     * Observação em paralelo com janela limitada; a resolução segue a ordem de submissão na
     * thread atual.
     */
    private void runParallel(Iterator<Path> files, ImageReconciler reconciler, BatchCommitter batch,
                             ScanMetrics m, int workers, CancellationToken cancel) {
        ExecutorService pool = Executors.newFixedThreadPool(workers, new HashThreadFactory());
        Deque<InFlight> inFlight = new ArrayDeque<>();
        int window = workers * 2;
        try {
            while (!cancel.isCancellationRequested() && files.hasNext()) {
                Path file = files.next();
                m.found.increment();
                inFlight.add(new InFlight(file, pool.submit(() -> reconciler.observe(file, cancel))));
                if (inFlight.size() >= window) {
                    settle(await(inFlight.poll()), reconciler, batch, m);
                }
            }
            while (!inFlight.isEmpty()) {
                settle(await(inFlight.poll()), reconciler, batch, m);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static Observation await(InFlight f) {
        try {
            return f.result().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Observation.terminal(f.file(), FileOutcome.ABANDONED, 0);
        } catch (ExecutionException e) {
            logger.warn("Erro inesperado em {}: {}", f.file(), String.valueOf(e.getCause()));
            return Observation.terminal(f.file(), FileOutcome.SKIPPED_ERROR, 0);
        }
    }

    private void settle(Observation obs, ImageReconciler reconciler, BatchCommitter batch, ScanMetrics m) {
        if (obs.needsResolution()) {
            FileOutcome outcome = reconciler.resolve(obs, batch);
            if (outcome.entersBatch()) {
                batch.flushIfFull();
            } else {
                m.record(outcome);
            }
            return;
        }
        m.record(obs.outcome());
        if (obs.outcome() == FileOutcome.UNCHANGED) {
            // bytes foram lidos pelo hash, contam mesmo sem escrita
            m.bytesCounted.add(obs.sizeBytes());
            batch.touch(new ProcessedMarker(obs.path(), obs.contentHash(), clock.instant()));
        }
    }

    private record InFlight(Path file, Future<Observation> result) {}

    private static final class HashThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "image-hash-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
