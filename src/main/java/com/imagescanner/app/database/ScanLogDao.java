package com.imagescanner.app.database;

import java.util.List;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public interface ScanLogDao {

    record ScanSummary(
            long scanId,
            String rootPath,
            String startedAt,
            String finishedAt,
            String status,
            Long filesFound,
            Long filesUnchanged,
            Long filesAdded,
            Long filesModified,
            Long filesMoved,
            Long filesSkipped,
            Long errors,
            Long filesAbandoned,
            Long bytesCounted,
            String message
    ) {}

    record ScanTotals(
            long scanId,
            String status,
            long filesFound,
            long filesUnchanged,
            long filesAdded,
            long filesModified,
            long filesMoved,
            long filesSkipped,
            long errors,
            long filesAbandoned,
            long bytesCounted,
            String message
    ) {}

    @SqlUpdate("INSERT INTO scans(root_path, started_at, status) VALUES(:rootPath, datetime('now'), 'RUNNING')")
    @GetGeneratedKeys("scan_id")
    long startScanLog(@Bind("rootPath") String rootPath);

    @SqlUpdate("""
        UPDATE scans
           SET finished_at = datetime('now'),
               status = :status,
               files_found = :filesFound,
               files_unchanged = :filesUnchanged,
               files_added = :filesAdded,
               files_modified = :filesModified,
               files_moved = :filesMoved,
               files_skipped = :filesSkipped,
               errors = :errors,
               files_abandoned = :filesAbandoned,
               bytes_counted = :bytesCounted,
               message = :message
         WHERE scan_id = :scanId
           AND status = 'RUNNING'
        """)
    int finishScanLog(@BindMethods ScanTotals totals);

    @SqlQuery("""
        SELECT scan_id AS scanId,
               root_path AS rootPath,
               started_at AS startedAt,
               finished_at AS finishedAt,
               status,
               files_found AS filesFound,
               files_unchanged AS filesUnchanged,
               files_added AS filesAdded,
               files_modified AS filesModified,
               files_moved AS filesMoved,
               files_skipped AS filesSkipped,
               errors,
               files_abandoned AS filesAbandoned,
               bytes_counted AS bytesCounted,
               message
          FROM scans
         ORDER BY scan_id DESC
         LIMIT :limit
        """)
    @RegisterConstructorMapper(ScanSummary.class)
    List<ScanSummary> fetchRecentScans(@Bind("limit") int limit);
}
