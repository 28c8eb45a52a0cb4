package db.migration;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Arquivos descobertos mas não reconciliados por causa do cancelamento.
 */
public final class V3__scan_abandoned extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        if (columnExists(conn, "scans", "files_abandoned")) return;
        try (var st = conn.createStatement()) {
            st.execute("ALTER TABLE scans ADD COLUMN files_abandoned INTEGER");
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
