package de.bsommerfeld.bindiff.db;

import de.bsommerfeld.bindiff.core.domain.Address;
import de.bsommerfeld.bindiff.core.domain.FileStatistics;
import de.bsommerfeld.bindiff.core.util.AddressCodec;
import de.bsommerfeld.bindiff.core.util.BinaryHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Append-only writer used by a diffing engine to fill a result file while the
 * diff is being computed.
 *
 * <h3>Call order</h3>
 * <ol>
 * <li>{@link #writeMetadata} once, right after the schema is installed</li>
 * <li>{@link #addFile} exactly twice: primary first, secondary second. The
 * loader pairs the rows by position only.</li>
 * <li>any number of {@link #addFunctionMatch} calls, each followed by zero or
 * more {@link #addBasicBlockMatch} calls, each followed by zero or more
 * {@link #addInstructionMatch} calls. The returned ids link the rows.</li>
 * <li>{@link #commit()} at checkpoints of the caller's choosing</li>
 * </ol>
 *
 * <h3>Transactions</h3>
 * The connection runs with auto-commit off. Nothing is durable until
 * {@link #commit()}; a failed statement is reported as the driver's
 * {@link SQLException} and leaves previously committed work untouched.
 */
public final class ResultFileWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultFileWriter.class);

    private final Connection conn;
    private final Clock clock;

    ResultFileWriter(Connection conn, Clock clock) {
        this.conn = conn;
        this.clock = clock;
    }

    // =====================================================================
    // Metadata
    // =====================================================================

    /**
     * Inserts the single metadata row. {@code created} and {@code modified}
     * are both set to the current time.
     */
    public void writeMetadata(String version, String description, double similarity, double confidence)
            throws SQLException {
        String now = now();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-metadata"))) {
            ps.setString(1, version);
            ps.setString(2, description);
            ps.setString(3, now);
            ps.setString(4, now);
            ps.setDouble(5, similarity);
            ps.setDouble(6, confidence);
            ps.executeUpdate();
        }
    }

    /** Sets {@code metadata.modified} to the current time. */
    public void touchModified() throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-metadata-modified"))) {
            ps.setString(1, now());
            ps.executeUpdate();
        }
    }

    /** Rewrites the overall similarity and confidence of the diff. */
    public void updateScores(double similarity, double confidence) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-metadata-scores"))) {
            ps.setDouble(1, similarity);
            ps.setDouble(2, confidence);
            ps.executeUpdate();
        }
    }

    // =====================================================================
    // Files
    // =====================================================================

    /**
     * Adds a file with all counters set to zero and the executable name
     * derived from the export name.
     *
     * @see #addFile(String, String, String, FileStatistics)
     */
    public long addFile(String exportName, String hash) throws SQLException {
        return addFile(exportName, hash, null, FileStatistics.EMPTY);
    }

    /**
     * Adds one analyzed binary. The display name is the last path component
     * of {@code exportName} without its extension, e.g.
     * {@code /tmp/libfoo.so.BinExport} becomes {@code libfoo.so}.
     *
     * @param exportName     export file name, extension included
     * @param hash           hex content digest of the binary
     * @param executableName executable name; {@code null} or empty reuses the
     *                       display name
     * @param statistics     counters of the binary
     * @return id of the inserted row, for {@link #updateFileInfo}
     */
    public long addFile(String exportName, String hash, String executableName, FileStatistics statistics)
            throws SQLException {
        String filename = stripExtension(exportName);
        String exeFilename = (executableName == null || executableName.isEmpty()) ? filename : executableName;

        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-file"))) {
            ps.setString(1, filename);
            ps.setString(2, exeFilename);
            ps.setString(3, hash);
            ps.setInt(4, statistics.functions());
            ps.setInt(5, statistics.libFunctions());
            ps.setInt(6, statistics.calls());
            ps.setInt(7, statistics.basicBlocks());
            ps.setInt(8, statistics.libBasicBlocks());
            ps.setInt(9, statistics.edges());
            ps.setInt(10, statistics.libEdges());
            ps.setInt(11, statistics.instructions());
            ps.setInt(12, statistics.libInstructions());
            ps.executeUpdate();
        }
        long id = lastInsertRowId();
        LOG.debug("[DB] Added file {} ({}) as row {}", filename, hash, id);
        return id;
    }

    /**
     * Adds one analyzed binary, hashing its content with SHA-256 and using
     * its file name as executable name.
     *
     * @throws IOException if the binary cannot be read
     */
    public long addFile(String exportName, Path binary, FileStatistics statistics)
            throws SQLException, IOException {
        String hash = BinaryHash.of(binary);
        return addFile(exportName, hash, binary.getFileName().toString(), statistics);
    }

    /**
     * Overwrites the function, library function, basic block and instruction
     * counters of a file row. The other counters keep their value.
     */
    public void updateFileInfo(long fileId, int functions, int libFunctions, int basicBlocks, int instructions)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-file-infos"))) {
            ps.setInt(1, functions);
            ps.setInt(2, libFunctions);
            ps.setInt(3, basicBlocks);
            ps.setInt(4, instructions);
            ps.setLong(5, fileId);
            ps.executeUpdate();
        }
    }

    // =====================================================================
    // Matches
    // =====================================================================

    /** Adds a function match with zero confidence and no identical blocks. */
    public long addFunctionMatch(Address address1, Address address2, String name1, String name2,
            double similarity) throws SQLException {
        return addFunctionMatch(address1, address2, name1, name2, similarity, 0.0, 0);
    }

    /** Adds a function match without identical basic blocks. */
    public long addFunctionMatch(Address address1, Address address2, String name1, String name2,
            double similarity, double confidence) throws SQLException {
        return addFunctionMatch(address1, address2, name1, name2, similarity, confidence, 0);
    }

    /**
     * Adds a function match. The algorithm is always recorded as
     * {@code manual} (19) and the flag columns as zero.
     *
     * @param identicalBasicBlocks number of identical basic blocks, stored in
     *                             {@code function.basicblocks}
     * @return id of the inserted row, for {@link #addBasicBlockMatch}
     * @throws SQLException also when the address pair was already added
     */
    public long addFunctionMatch(Address address1, Address address2, String name1, String name2,
            double similarity, double confidence, int identicalBasicBlocks) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-function"))) {
            ps.setLong(1, AddressCodec.encode(address1));
            ps.setLong(2, AddressCodec.encode(address2));
            ps.setString(3, name1);
            ps.setString(4, name2);
            ps.setDouble(5, similarity);
            ps.setDouble(6, confidence);
            ps.setInt(7, identicalBasicBlocks);
            ps.executeUpdate();
        }
        return lastInsertRowId();
    }

    /** Overwrites the identical basic block count of a function match. */
    public void updateSameBasicBlockCount(long functionMatchId, int sameBasicBlocks) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-function-basicblocks"))) {
            ps.setInt(1, sameBasicBlocks);
            ps.setLong(2, functionMatchId);
            ps.executeUpdate();
        }
    }

    /**
     * Adds a basic block match below a function match. The algorithm is
     * always recorded as {@code edges prime product} (1).
     *
     * @return id of the inserted row, for {@link #addInstructionMatch}
     */
    public long addBasicBlockMatch(long functionMatchId, Address address1, Address address2) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-basicblock"))) {
            ps.setLong(1, functionMatchId);
            ps.setLong(2, AddressCodec.encode(address1));
            ps.setLong(3, AddressCodec.encode(address2));
            ps.executeUpdate();
        }
        return lastInsertRowId();
    }

    /** Adds an instruction match below a basic block match. */
    public void addInstructionMatch(long basicBlockMatchId, Address address1, Address address2) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-instruction"))) {
            ps.setLong(1, basicBlockMatchId);
            ps.setLong(2, AddressCodec.encode(address1));
            ps.setLong(3, AddressCodec.encode(address2));
            ps.executeUpdate();
        }
    }

    /** Makes every write since the previous commit durable. */
    public void commit() throws SQLException {
        conn.commit();
        LOG.debug("[DB] Committed pending writes.");
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private long lastInsertRowId() throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-last-rowid"));
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private String now() {
        return LocalDateTime.now(clock).format(ResultFileSchema.TIMESTAMP_FORMAT);
    }

    /**
     * Last path component without its final extension. Leading-dot names and
     * names ending in a dot are kept as they are.
     */
    static String stripExtension(String exportName) {
        Path fileName = Path.of(exportName).getFileName();
        String name = fileName == null ? exportName : fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0 && dot < name.length() - 1) {
            return name.substring(0, dot);
        }
        return name;
    }
}
