package insights.model.repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SQLite {
    private static final String MIGRATION = "/sql/migrate.sql";

    private final String dbPath;

    public SQLite(String dbPath) {
        this.dbPath = dbPath;
    }

    /** A fresh connection; callers close it. */
    public Connection connect() {
        try {
            return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
        } catch (SQLException e) {
            throw new RuntimeException("Cannot open SQLite database " + dbPath, e);
        }
    }

    public void migrate() {
        Path parent = Path.of(dbPath).toAbsolutePath().getParent();
        try {
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        String sql;
        try (InputStream in = getClass().getResourceAsStream(MIGRATION)) {
            if (in == null) throw new IllegalStateException("Migration file not found at " + MIGRATION);
            sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        try (Connection con = connect(); Statement stmt = con.createStatement()) {
            for (String part : sql.split(";")) {
                if (!part.isBlank()) stmt.executeUpdate(part);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Migration failed for " + dbPath, e);
        }
    }
}
