package com.imagescanner.app.inventory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.imagescanner.app.catalog.CatalogRecord;
import com.imagescanner.app.catalog.CatalogStorageException;
import com.imagescanner.app.database.CatalogDao;
import com.imagescanner.app.database.CatalogDatabase;
import com.imagescanner.app.database.JdbiCatalogStore;
import com.imagescanner.app.metadata.ImageMetadata;
import com.imagescanner.app.metadata.MetadataExtractor;

import static org.junit.jupiter.api.Assertions.*;

public class ImageScannerIntegrationTest {

    @TempDir
    Path tmp;

    private Path root;
    private CatalogDatabase db;
    private JdbiCatalogStore store;

    private final AtomicInteger extractions = new AtomicInteger();
    private volatile Map<String, String> tags = Map.of("Model", "TestCam", "Date/Time Original", "2020:01:02 03:04:05");

    private final MetadataExtractor extractor = (file, fields) -> {
        extractions.incrementAndGet();
        if (file.getFileName().toString().startsWith("broken")) return Optional.empty();
        return Optional.of(new ImageMetadata(100, 50, tags));
    };

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tmp.resolve("photos"));
        db = CatalogDatabase.open(tmp.resolve("catalog.db"));
        store = db.catalogStore();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private ScanConfig config() {
        return new ScanConfig(root, List.of(".jpg", ".png", ".gif"), true, 0, 0, 100, List.of("*"), 1);
    }

    private ScanReport scan(ScanConfig cfg) {
        return scan(cfg, CancellationToken.create());
    }

    private ScanReport scan(ScanConfig cfg, CancellationToken cancel) {
        return new ImageScanner(store, db.scanLog(), extractor, msg -> { }).run(cfg, cancel);
    }

    private Path write(String rel, String content) throws IOException {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        return Files.writeString(p, content, StandardCharsets.UTF_8);
    }

    private String abs(String rel) {
        return root.resolve(rel).toAbsolutePath().normalize().toString();
    }

    @Test
    void secondRunOverUnmodifiedTree_isAllUnchanged() throws Exception {
        write("a.jpg", "aaa");
        write("sub/b.png", "bbbb");
        write("sub/deeper/c.gif", "ccccc");

        ScanReport first = scan(config());
        assertEquals(ScanStatus.COMPLETED, first.status());
        assertEquals(3, first.added());

        int extractionsAfterFirst = extractions.get();
        ScanReport second = scan(config());

        assertEquals(ScanStatus.COMPLETED, second.status());
        assertEquals(second.found(), second.unchanged());
        assertEquals(0, second.added());
        assertEquals(0, second.modified());
        assertEquals(0, second.moved());
        assertEquals(12, second.bytesCounted(), "Unchanged files still count the bytes hashed");
        assertEquals(extractionsAfterFirst, extractions.get(), "Unchanged files skip metadata extraction");
    }

    @Test
    void movedFile_keepsIdentity_andOldPathNoLongerMatches() throws Exception {
        Path old = write("old/c.gif", "gif-bytes");
        scan(config());
        CatalogRecord before = store.findRecordByPath(abs("old/c.gif")).orElseThrow();

        Files.createDirectories(root.resolve("new"));
        Files.move(old, root.resolve("new/c.gif"));
        tags = Map.of();
        ScanReport r = scan(config());

        assertEquals(1, r.moved());
        assertEquals(0, r.added());
        CatalogRecord after = store.findRecordByPath(abs("new/c.gif")).orElseThrow();
        assertEquals(before.id(), after.id());
        assertEquals(before.contentHash(), after.contentHash());
        assertTrue(store.findRecordByPath(abs("old/c.gif")).isEmpty());
        // nova extração sem valor não apaga o que já foi capturado
        assertEquals("TestCam", after.cameraModel());
        assertEquals(LocalDateTime.of(2020, 1, 2, 3, 4, 5), after.dateTaken());
        assertTrue(after.scannedAt().isAfter(before.scannedAt()));
    }

    @Test
    void contentChangeAtSamePath_isModified_withSameIdentity() throws Exception {
        write("a.jpg", "version-1");
        scan(config());
        CatalogRecord before = store.findRecordByPath(abs("a.jpg")).orElseThrow();

        write("a.jpg", "version-2-longer");
        ScanReport r = scan(config());

        assertEquals(1, r.modified());
        assertEquals(0, r.added());
        assertEquals(0, r.moved());
        CatalogRecord after = store.findRecordByPath(abs("a.jpg")).orElseThrow();
        assertEquals(before.id(), after.id());
        assertNotEquals(before.contentHash(), after.contentHash());
        assertEquals("version-2-longer".length(), after.sizeBytes());
        assertTrue(after.scannedAt().isAfter(before.scannedAt()));
        assertEquals(after.contentHash(), store.findMarkerByPath(abs("a.jpg")).orElseThrow().contentHash());
    }

    @Test
    void scannedAt_increasesStrictly_evenWithFrozenClock() throws Exception {
        Clock frozen = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        ImageScanner scanner = new ImageScanner(store, db.scanLog(), extractor, new FileHasher(), frozen, msg -> { });

        write("a.jpg", "one");
        scanner.run(config(), CancellationToken.create());
        Instant first = store.findRecordByPath(abs("a.jpg")).orElseThrow().scannedAt();

        write("a.jpg", "two!");
        scanner.run(config(), CancellationToken.create());
        Instant second = store.findRecordByPath(abs("a.jpg")).orElseThrow().scannedAt();

        assertEquals(first.plusMillis(1), second);
    }

    @Test
    void fileBelowMinSize_isSkippedByPolicy_andNeverHashed() throws Exception {
        write("small.jpg", "123456789");   // 9 bytes
        write("exact.jpg", "1234567890");  // 10 bytes
        AtomicInteger hashed = new AtomicInteger();
        FileHasher counting = new FileHasher() {
            @Override
            public String hash(Path file, CancellationToken cancel) throws IOException {
                hashed.incrementAndGet();
                return super.hash(file, cancel);
            }
        };

        ScanReport r = new ImageScanner(store, db.scanLog(), extractor, counting, Clock.systemUTC(), msg -> { })
                .run(config().withSizeBounds(10, 0), CancellationToken.create());

        assertEquals(2, r.found());
        assertEquals(1, r.skipped());
        assertEquals(1, r.added());
        assertEquals(0, r.unchanged());
        assertEquals(1, hashed.get(), "Only the file inside the bounds is hashed");
        assertTrue(store.findMarkerByPath(abs("small.jpg")).isEmpty());
    }

    @Test
    void fileAboveMaxSize_isSkippedByPolicy() throws Exception {
        write("big.jpg", "x".repeat(100));
        write("ok.jpg", "y".repeat(10));

        ScanReport r = scan(config().withSizeBounds(0, 50));

        assertEquals(1, r.skipped());
        assertEquals(1, r.added());
    }

    @Test
    void newUnchangedAndMovedInOneRun_matchExpectedSummary() throws Exception {
        write("b.png", "b-content");
        Path oldC = write("old/c.gif", "c-content");
        scan(config());

        write("a.jpg", "a".repeat(2048));
        Files.move(oldC, root.resolve("c.gif"));
        ScanReport r = scan(config());

        assertEquals(3, r.found());
        assertEquals(1, r.added());
        assertEquals(1, r.moved());
        assertEquals(1, r.unchanged());
        assertEquals(0, r.modified());
        assertEquals(0, r.errors());
        assertEquals(ScanStatus.COMPLETED, r.status());
    }

    @Test
    void cancelAfterTwoFiles_flushesPartialBatch_andNextRunResumes() throws Exception {
        for (int i = 1; i <= 5; i++) write("f" + i + ".jpg", "content-" + i);
        CancellationToken cancel = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        MetadataExtractor cancelling = (file, fields) -> {
            if (calls.incrementAndGet() == 2) cancel.cancel();
            return extractor.extract(file, fields);
        };

        ScanReport first = new ImageScanner(store, db.scanLog(), cancelling, msg -> { }).run(config(), cancel);

        assertEquals(ScanStatus.CANCELLED, first.status());
        assertEquals(130, first.status().exitCode());
        assertEquals(2, first.added());
        assertEquals(2, store.countRecords());
        assertEquals(2, store.countMarkers());

        int before = extractions.get();
        ScanReport second = scan(config());

        assertEquals(ScanStatus.COMPLETED, second.status());
        assertEquals(2, second.unchanged());
        assertEquals(3, second.added());
        assertEquals(3, extractions.get() - before, "Files committed before the cancel are not reprocessed");
        assertEquals("CANCELED", db.scanLog().recent(2).get(1).status());
    }

    @Test
    void parallelCancel_countsAbandonedFiles_andCountersReconcile() throws Exception {
        // um worker por arquivo: os "late" ficam presos no hash sem bloquear os "keep"
        write("keep1.jpg", "keep-1");
        write("keep2.jpg", "keep-2");
        for (int i = 1; i <= 6; i++) write("late" + i + ".jpg", "late-" + i);

        CancellationToken cancel = CancellationToken.create();
        CountDownLatch cancelled = new CountDownLatch(1);
        FileHasher gated = new FileHasher() {
            @Override
            public String hash(Path file, CancellationToken token) throws IOException {
                if (file.getFileName().toString().startsWith("late")) {
                    try {
                        assertTrue(cancelled.await(10, TimeUnit.SECONDS));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.hash(file, token);
            }
        };
        AtomicInteger keepExtracted = new AtomicInteger();
        MetadataExtractor cancelling = (file, fields) -> {
            Optional<ImageMetadata> md = extractor.extract(file, fields);
            if (keepExtracted.incrementAndGet() == 2) {
                cancel.cancel();
                cancelled.countDown();
            }
            return md;
        };

        ScanReport first = new ImageScanner(store, db.scanLog(), cancelling, gated, Clock.systemUTC(), msg -> { })
                .run(config().withHashWorkers(8), cancel);

        assertEquals(ScanStatus.CANCELLED, first.status());
        assertEquals(8, first.found());
        assertEquals(2, first.added());
        assertEquals(6, first.abandoned());
        assertEquals(first.found(), first.unchanged() + first.added() + first.modified() + first.moved()
                + first.skipped() + first.errors() + first.abandoned());
        assertEquals(2, store.countRecords());
        assertEquals(2, store.countMarkers());

        var row = db.scanLog().recent(1).get(0);
        assertEquals("CANCELED", row.status());
        assertEquals(6L, row.filesAbandoned());

        int before = extractions.get();
        ScanReport second = scan(config().withHashWorkers(4));

        assertEquals(ScanStatus.COMPLETED, second.status());
        assertEquals(0, second.abandoned());
        assertEquals(2, second.unchanged());
        assertEquals(6, second.added());
        assertEquals(6, extractions.get() - before, "Committed files are not extracted again");
    }

    @Test
    void storageFailureInsideBatch_rollsBackWholeBatch_andFailsRun() throws Exception {
        for (int i = 1; i <= 8; i++) write("f" + i + ".jpg", "content-" + i);
        JdbiCatalogStore failing = new JdbiCatalogStore(db.jdbi()) {
            private int writes;

            @Override
            protected CatalogRecord writeRecord(CatalogDao dao, CatalogRecord record) {
                if (++writes == 4) throw new CatalogStorageException("simulated write failure");
                return super.writeRecord(dao, record);
            }
        };

        ScanReport r = new ImageScanner(failing, db.scanLog(), extractor, msg -> { })
                .run(config().withBatchSize(8), CancellationToken.create());

        assertEquals(ScanStatus.FAILED, r.status());
        assertEquals(1, r.status().exitCode());
        assertTrue(r.message().contains("simulated"));
        assertEquals(0, store.countRecords(), "No record of the failed batch may be visible");
        assertEquals(0, store.countMarkers(), "No marker of the failed batch may be visible");
        assertEquals("FAILED", db.scanLog().recent(1).get(0).status());
    }

    @Test
    void smallBatches_commitIndependently() throws Exception {
        for (int i = 1; i <= 7; i++) write("f" + i + ".jpg", "content-" + i);

        ImageScanner scanner = new ImageScanner(store, db.scanLog(), extractor, msg -> { });
        ScanReport r = scanner.run(config().withBatchSize(3), CancellationToken.create());

        assertEquals(7, r.added());
        assertEquals(7, store.countRecords());
        assertEquals(3, scanner.metrics().dbBatches.sum(), "3 + 3 + final flush of 1");
        assertFalse(scanner.metrics().running.get());
        assertNotEquals(Instant.EPOCH, scanner.metrics().start);
    }

    @Test
    void metadataUnavailable_isCountedAsError_andLeavesNoMarker() throws Exception {
        write("good.jpg", "good");
        write("broken.jpg", "broken");

        ScanReport r = scan(config());

        assertEquals(ScanStatus.COMPLETED, r.status());
        assertEquals(1, r.added());
        assertEquals(1, r.errors());
        assertTrue(store.findMarkerByPath(abs("broken.jpg")).isEmpty());

        ScanReport again = scan(config());
        assertEquals(1, again.unchanged());
        assertEquals(1, again.errors(), "Failed files are retried on the next run");
    }

    @Test
    void duplicateContentInSameRun_isNotClassifiedNewTwice() throws Exception {
        write("one.jpg", "same-bytes");
        write("two.jpg", "same-bytes");

        ScanReport r = scan(config());

        assertEquals(1, r.added());
        assertEquals(1, r.moved());
        assertEquals(1, store.countRecords());
        assertEquals(2, store.countMarkers());
    }

    @Test
    void swappedContents_areModifiedInPlace_pathIdentityWins() throws Exception {
        write("a.jpg", "alpha");
        write("b.jpg", "bravo");
        scan(config());
        long idA = store.findRecordByPath(abs("a.jpg")).orElseThrow().id().getAsLong();
        long idB = store.findRecordByPath(abs("b.jpg")).orElseThrow().id().getAsLong();

        write("a.jpg", "bravo");
        write("b.jpg", "alpha");
        ScanReport r = scan(config());

        assertEquals(ScanStatus.COMPLETED, r.status());
        assertEquals(2, r.modified());
        assertEquals(0, r.moved());
        assertEquals(idA, store.findRecordByPath(abs("a.jpg")).orElseThrow().id().getAsLong());
        assertEquals(idB, store.findRecordByPath(abs("b.jpg")).orElseThrow().id().getAsLong());
    }

    @Test
    void moveIntoBatchAlongsideNewFileAtVacatedPath_commitsCleanly() throws Exception {
        Path a = write("a.jpg", "original");
        scan(config());

        Files.move(a, root.resolve("b.jpg"));
        write("a.jpg", "replacement");
        ScanReport r = scan(config());

        assertEquals(ScanStatus.COMPLETED, r.status());
        assertEquals(0, r.errors());
        assertEquals(1, r.added());
        assertEquals(1, r.modified() + r.moved());
        assertEquals(2, store.countRecords());
        assertTrue(store.findRecordByPath(abs("a.jpg")).isPresent());
        assertTrue(store.findRecordByPath(abs("b.jpg")).isPresent());
    }

    @Test
    void parallelObservation_matchesSequentialResults() throws Exception {
        for (int i = 0; i < 20; i++) write("dir" + (i % 3) + "/f" + i + ".jpg", "content-" + (i % 17));

        ScanReport parallel = scan(config().withHashWorkers(4));

        try (CatalogDatabase other = CatalogDatabase.open(tmp.resolve("sequential.db"))) {
            ScanReport sequential = new ImageScanner(other.catalogStore(), other.scanLog(), extractor, msg -> { })
                    .run(config(), CancellationToken.create());

            assertEquals(sequential.found(), parallel.found());
            assertEquals(sequential.added(), parallel.added());
            assertEquals(sequential.moved(), parallel.moved());
            assertEquals(other.catalogStore().countRecords(), store.countRecords());
        }
        assertEquals(17, store.countRecords(), "One record per distinct content");

        ScanReport again = scan(config().withHashWorkers(4));
        assertEquals(20, again.unchanged());
    }

    @Test
    void scanLog_recordsCountersOfCompletedRun() throws Exception {
        write("a.jpg", "a");
        write("b.jpg", "b");

        ScanReport r = scan(config());

        var row = db.scanLog().recent(1).get(0);
        assertEquals(r.scanId(), row.scanId());
        assertEquals("DONE", row.status());
        assertEquals(2L, row.filesFound());
        assertEquals(2L, row.filesAdded());
        assertNotNull(row.finishedAt());
    }
}
