package db.migration;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/** Helpers shared by the Java migrations. Not a migration itself. */
final class MigrationSupport {

    // keeps "ALTER TABLE ... ADD COLUMN foo BLAH" out of the schema
    private static final Set<String> ALLOWED_TYPES = Set.of("INTEGER", "TEXT", "BLOB", "REAL", "NUMERIC");

    private MigrationSupport() {}

    static void addColumnIfMissing(Connection conn, String table, String column, String typeDecl) throws SQLException {
        String baseType = typeDecl.trim().split("\\s+")[0].toUpperCase(Locale.ROOT);
        if (!ALLOWED_TYPES.contains(baseType)) {
            throw new IllegalArgumentException("Unsupported column type: " + typeDecl);
        }
        if (columns(conn, table).contains(column.toLowerCase(Locale.ROOT))) return;
        try (Statement st = conn.createStatement()) {
            st.execute("ALTER TABLE " + q(table) + " ADD COLUMN " + q(column) + " " + typeDecl);
        }
    }

    static Set<String> columns(Connection conn, String table) throws SQLException {
        Set<String> cols = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + q(table) + ")")) {
            while (rs.next()) {
                cols.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return cols;
    }

    static void execAll(Connection conn, String... statements) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
        }
    }

    private static String q(String ident) {
        if (ident == null || ident.isBlank() || ident.contains("\"")) {
            throw new IllegalArgumentException("Invalid identifier: " + ident);
        }
        return "\"" + ident + "\"";
    }
}
