package de.bsommerfeld.bindiff.db;

import de.bsommerfeld.bindiff.core.config.Permission;
import de.bsommerfeld.bindiff.core.config.ResultFileConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteOpenMode;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens JDBC connections to result files with the flags each access mode
 * needs.
 *
 * <ul>
 * <li>read-only: SQLite opens the file with {@code SQLITE_OPEN_READONLY}; a
 * missing file fails instead of being created</li>
 * <li>read-write: the file must already exist; auto-commit is off so that
 * nothing reaches disk before an explicit commit</li>
 * <li>create: the file is created when absent; auto-commit is off</li>
 * </ul>
 */
final class SqliteConnections {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteConnections.class);

    private SqliteConnections() {
    }

    static Connection open(Path file, Permission permission, ResultFileConfig config) throws SQLException {
        SQLiteConfig sqlite = baseConfig(config);
        if (permission.isWritable()) {
            sqlite.resetOpenMode(SQLiteOpenMode.CREATE);
            sqlite.setJournalMode(SQLiteConfig.JournalMode.valueOf(config.journalMode()));
        } else {
            sqlite.setReadOnly(true);
        }
        return connect(file, sqlite, permission.isWritable());
    }

    static Connection create(Path file, ResultFileConfig config) throws SQLException {
        SQLiteConfig sqlite = baseConfig(config);
        sqlite.setJournalMode(SQLiteConfig.JournalMode.valueOf(config.journalMode()));
        return connect(file, sqlite, true);
    }

    private static SQLiteConfig baseConfig(ResultFileConfig config) {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(config.busyTimeoutMillis());
        return sqlite;
    }

    private static Connection connect(Path file, SQLiteConfig sqlite, boolean writable) throws SQLException {
        String url = "jdbc:sqlite:" + file.toAbsolutePath();
        LOG.debug("Connecting to {} ({})", url, writable ? "rw" : "ro");
        Connection conn = DriverManager.getConnection(url, sqlite.toProperties());
        if (writable) {
            try {
                conn.setAutoCommit(false);
            } catch (SQLException e) {
                conn.close();
                throw e;
            }
        }
        return conn;
    }
}
