package de.bsommerfeld.bindiff.db;

import de.bsommerfeld.bindiff.core.domain.BasicBlockAlgorithm;
import de.bsommerfeld.bindiff.core.domain.FunctionAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;

/**
 * Installs the result-file schema on an empty database.
 *
 * <p>
 * The DDL lives in {@code schema.sql}: seven tables ({@code file},
 * {@code metadata}, {@code functionalgorithm}, {@code function},
 * {@code basicblockalgorithm}, {@code basicblock}, {@code instruction})
 * linked by foreign keys
 *
 * <pre>
 *   metadata.file1/file2  → file.id
 *   function.algorithm    → functionalgorithm.id
 *   basicblock.functionid → function.id
 *   basicblock.algorithm  → basicblockalgorithm.id
 *   instruction.basicblockid → basicblock.id
 * </pre>
 *
 * After the DDL both algorithm lookup tables receive one row per enum member,
 * keyed by the member's code.
 */
public final class ResultFileSchema {

    private static final Logger LOG = LoggerFactory.getLogger(ResultFileSchema.class);

    /**
     * Format of {@code metadata.created} and {@code metadata.modified}.
     * Strict resolution: impossible dates such as {@code 2023-02-30} fail to
     * parse.
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final String SCHEMA_RESOURCE = "schema.sql";

    private ResultFileSchema() {
    }

    /**
     * Creates all tables and fills the lookup tables in one transaction. The
     * connection's auto-commit setting is restored afterwards.
     *
     * @throws SQLException if any statement fails, including when a table
     *                      already exists; nothing is committed in that case
     */
    public static void install(Connection conn) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            applySchema(conn);
            fillFunctionAlgorithms(conn);
            fillBasicBlockAlgorithms(conn);
            conn.commit();
            LOG.info("Result file schema installed.");
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    /**
     * Splits {@code schema.sql} on statement-terminating semicolons and runs
     * each statement individually.
     */
    private static void applySchema(Connection conn) throws SQLException {
        String schemaSql = SqlLoader.readScript(SCHEMA_RESOURCE);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty())
                    continue;
                stmt.execute(sql.trim());
            }
        }
    }

    private static void fillFunctionAlgorithms(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-function-algorithm"))) {
            for (FunctionAlgorithm algorithm : FunctionAlgorithm.values()) {
                ps.setInt(1, algorithm.code());
                ps.setString(2, algorithm.lookupLabel());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void fillBasicBlockAlgorithms(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-basicblock-algorithm"))) {
            for (BasicBlockAlgorithm algorithm : BasicBlockAlgorithm.values()) {
                ps.setInt(1, algorithm.code());
                ps.setString(2, algorithm.lookupLabel());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }
}
