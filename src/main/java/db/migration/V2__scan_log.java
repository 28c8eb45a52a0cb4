package db.migration;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V2__scan_log extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();

        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS scans (
                    scan_id INTEGER PRIMARY KEY AUTOINCREMENT,
                    root_path TEXT NOT NULL,
                    started_at TEXT NOT NULL,
                    finished_at TEXT,
                    status TEXT NOT NULL
                )
                """);
        }

        // contadores agregados do run (mesmo formato do ScanReport)
        addColumnIfMissing(conn, "scans", "files_found", "INTEGER");
        addColumnIfMissing(conn, "scans", "files_unchanged", "INTEGER");
        addColumnIfMissing(conn, "scans", "files_added", "INTEGER");
        addColumnIfMissing(conn, "scans", "files_modified", "INTEGER");
        addColumnIfMissing(conn, "scans", "files_moved", "INTEGER");
        addColumnIfMissing(conn, "scans", "files_skipped", "INTEGER");
        addColumnIfMissing(conn, "scans", "errors", "INTEGER");
        addColumnIfMissing(conn, "scans", "bytes_counted", "INTEGER");
        addColumnIfMissing(conn, "scans", "message", "TEXT");
    }

    private void addColumnIfMissing(Connection conn, String table, String column, String type) throws SQLException {
        if (columnExists(conn, table, column)) return;
        try (var st = conn.createStatement()) {
            st.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + type);
        }
    }

    private boolean columnExists(Connection conn, String table, String column) throws SQLException {
        try (var st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                if (column.equalsIgnoreCase(rs.getString("name"))) return true;
            }
        }
        return false;
    }
}
