package com.imagescanner.app.database;

import java.util.List;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagescanner.app.catalog.CatalogStorageException;
import com.imagescanner.app.database.ScanLogDao.ScanSummary;
import com.imagescanner.app.database.ScanLogDao.ScanTotals;
import com.imagescanner.app.inventory.ScanLog;
import com.imagescanner.app.inventory.ScanReport;

public final class JdbiScanLog implements ScanLog {

    private static final Logger logger = LoggerFactory.getLogger(JdbiScanLog.class);

    private final Jdbi jdbi;

    public JdbiScanLog(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public long start(String rootPath) {
        try {
            return jdbi.withExtension(ScanLogDao.class, dao -> dao.startScanLog(rootPath));
        } catch (JdbiException e) {
            logger.error("Falha ao registrar início do scan", e);
            return 0;
        }
    }

    @Override
    public void finish(ScanReport report) {
        if (report.scanId() <= 0) return;
        var totals = new ScanTotals(
                report.scanId(),
                report.status().logStatus(),
                report.found(),
                report.unchanged(),
                report.added(),
                report.modified(),
                report.moved(),
                report.skipped(),
                report.errors(),
                report.abandoned(),
                report.bytesCounted(),
                report.message()
        );
        try {
            int n = jdbi.withExtension(ScanLogDao.class, dao -> dao.finishScanLog(totals));
            if (n == 0) logger.warn("Scan {} não estava RUNNING; log não atualizado", report.scanId());
        } catch (JdbiException e) {
            logger.error("Falha ao marcar scan {} como {}", report.scanId(), report.status().logStatus(), e);
        }
    }

    public List<ScanSummary> recent(int limit) {
        try {
            return jdbi.withExtension(ScanLogDao.class, dao -> dao.fetchRecentScans(Math.max(1, limit)));
        } catch (JdbiException e) {
            throw new CatalogStorageException("Falha ao ler histórico de scans", e);
        }
    }
}
