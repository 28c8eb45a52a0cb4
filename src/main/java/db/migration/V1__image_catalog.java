package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V1__image_catalog extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        ensureSchema(conn);
        ensureIndexes(conn);
    }

    private void ensureSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            // path único entre registros vivos; a identidade sobrevive a moves (só o path muda)
            st.execute("""
                CREATE TABLE IF NOT EXISTS images (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    name TEXT NOT NULL,
                    path TEXT NOT NULL UNIQUE,
                    size_bytes INTEGER NOT NULL,
                    width INTEGER NOT NULL DEFAULT 0,
                    height INTEGER NOT NULL DEFAULT 0,
                    content_hash TEXT NOT NULL,
                    file_created_millis INTEGER,
                    file_modified_millis INTEGER,
                    date_taken TEXT,
                    camera_model TEXT,
                    extra_metadata TEXT,
                    scanned_at_millis INTEGER NOT NULL
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS processed_files (
                    path TEXT PRIMARY KEY,
                    content_hash TEXT NOT NULL,
                    last_processed_millis INTEGER NOT NULL
                )
                """);
        }
    }

    private void ensureIndexes(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE INDEX IF NOT EXISTS idx_images_hash ON images(content_hash)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_processed_hash ON processed_files(content_hash)");
        }
    }
}
