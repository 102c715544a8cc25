package de.bsommerfeld.bindiff.db;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import de.bsommerfeld.bindiff.core.config.Permission;
import de.bsommerfeld.bindiff.core.config.ResultFileConfig;
import de.bsommerfeld.bindiff.core.domain.Address;
import de.bsommerfeld.bindiff.core.domain.BasicBlockMatch;
import de.bsommerfeld.bindiff.core.domain.BinaryFile;
import de.bsommerfeld.bindiff.core.domain.FileStatistics;
import de.bsommerfeld.bindiff.core.domain.FunctionMatch;
import de.bsommerfeld.bindiff.core.domain.ResultMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Map;

/**
 * Handle on one BinDiff result file.
 *
 * <h3>Read-only handles</h3>
 * {@link #open(Path, String) open(path, "ro")} loads the whole file before
 * returning: metadata, both files, and the function, basic-block and
 * instruction indices. If any pass fails the connection is closed and the
 * failure propagates; a partially loaded handle is never returned. The
 * indices are an immutable snapshot and do not see later writes by other
 * handles.
 *
 * <h3>Read-write handles</h3>
 * {@link #open(Path, String) open(path, "rw")} and
 * {@link #create(Path, String, String, double, double) create} skip loading
 * and expose the {@link ResultFileWriter} operations. Index accessors throw
 * {@link IllegalStateException} on such a handle; reopen read-only after the
 * final {@link #commit()} to read the result back.
 *
 * <p>
 * A handle owns its connection exclusively and is not thread-safe.
 */
public final class BinDiffFile implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BinDiffFile.class);

    private final Path file;
    private final Permission permission;
    private final Connection conn;
    private final ResultIndex index;
    private final ResultFileWriter writer;

    private BinDiffFile(Path file, Permission permission, Connection conn, ResultIndex index, Clock clock) {
        this.file = file;
        this.permission = permission;
        this.conn = conn;
        this.index = index;
        this.writer = permission.isWritable() ? new ResultFileWriter(conn, clock) : null;
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /**
     * Opens an existing result file with the environment's configuration.
     *
     * @param permission {@code "ro"} or {@code "rw"}
     * @throws IllegalArgumentException for any other permission, before the
     *                                  file is touched
     */
    public static BinDiffFile open(Path file, String permission) throws SQLException {
        return open(file, Permission.fromMode(permission));
    }

    public static BinDiffFile open(Path file, Permission permission) throws SQLException {
        return open(file, permission, ResultFileConfig.resolve(), Clock.systemDefaultZone());
    }

    static BinDiffFile open(Path file, Permission permission, ResultFileConfig config, Clock clock)
            throws SQLException {
        LOG.info("Opening result file {} ({})", file, permission.mode());
        Connection conn = SqliteConnections.open(file, permission, config);
        if (permission.isWritable()) {
            return new BinDiffFile(file, permission, conn, null, clock);
        }
        try {
            ResultIndex index = ResultFileLoader.load(conn);
            LOG.info("Loaded {}: {} function matches, {} basic block matches",
                    file, index.primaryFunctions().size(), index.primaryBasicBlocks().size());
            return new BinDiffFile(file, permission, conn, index, clock);
        } catch (SQLException | RuntimeException e) {
            closeAfterFailure(conn, e);
            throw e;
        }
    }

    /**
     * Creates a new result file, replacing any file at {@code file}, installs
     * the schema and writes the metadata row. The returned handle is
     * read-write and ready for {@link #addFile}.
     */
    public static BinDiffFile create(Path file, String version, String description,
            double similarity, double confidence) throws SQLException, IOException {
        return create(file, version, description, similarity, confidence,
                ResultFileConfig.resolve(), Clock.systemDefaultZone());
    }

    static BinDiffFile create(Path file, String version, String description, double similarity,
            double confidence, ResultFileConfig config, Clock clock) throws SQLException, IOException {
        if (Files.deleteIfExists(file)) {
            LOG.info("Replaced existing result file {}", file);
        }
        try (Connection conn = SqliteConnections.create(file, config)) {
            ResultFileSchema.install(conn);
            ResultFileWriter init = new ResultFileWriter(conn, clock);
            init.writeMetadata(version, description, similarity, confidence);
            init.commit();
        }
        LOG.info("Created result file {} (differ version {})", file, version);
        return open(file, Permission.READ_WRITE, config, clock);
    }

    /**
     * Closes the connection. Writes since the last {@link #commit()} are
     * discarded.
     */
    @Override
    public void close() throws SQLException {
        conn.close();
        LOG.debug("Closed result file {}", file);
    }

    public Path path() {
        return file;
    }

    public Permission permission() {
        return permission;
    }

    // =====================================================================
    // Read Access (read-only handles)
    // =====================================================================

    public ResultMetadata metadata() {
        return requireIndex().metadata();
    }

    /** The file row inserted first. */
    public BinaryFile primaryFile() {
        return requireIndex().primaryFile();
    }

    /** The file row inserted second. */
    public BinaryFile secondaryFile() {
        return requireIndex().secondaryFile();
    }

    /** Function matches keyed by their primary entry address. */
    public ImmutableMap<Address, FunctionMatch> primaryFunctionMatches() {
        return requireIndex().primaryFunctions();
    }

    /** Function matches keyed by their secondary entry address. */
    public ImmutableMap<Address, FunctionMatch> secondaryFunctionMatches() {
        return requireIndex().secondaryFunctions();
    }

    /**
     * Basic-block matches keyed by primary block address (row) and primary
     * entry address of the owning function (column).
     */
    public ImmutableTable<Address, Address, BasicBlockMatch> primaryBasicBlockMatches() {
        return requireIndex().primaryBasicBlocks();
    }

    /**
     * Basic-block matches keyed by secondary block address (row) and
     * secondary entry address of the owning function (column).
     */
    public ImmutableTable<Address, Address, BasicBlockMatch> secondaryBasicBlockMatches() {
        return requireIndex().secondaryBasicBlocks();
    }

    /** Matches of one primary block, keyed by owning function address. */
    public Map<Address, BasicBlockMatch> primaryBasicBlockMatches(Address blockAddress) {
        return requireIndex().primaryBasicBlocks().row(blockAddress);
    }

    /** Matches of one secondary block, keyed by owning function address. */
    public Map<Address, BasicBlockMatch> secondaryBasicBlockMatches(Address blockAddress) {
        return requireIndex().secondaryBasicBlocks().row(blockAddress);
    }

    /**
     * Matched secondary instruction addresses keyed by primary instruction
     * address (row) and primary entry address of the owning function
     * (column).
     */
    public ImmutableTable<Address, Address, Address> primaryInstructionMatches() {
        return requireIndex().primaryInstructions();
    }

    /**
     * Matched primary instruction addresses keyed by secondary instruction
     * address (row) and secondary entry address of the owning function
     * (column).
     */
    public ImmutableTable<Address, Address, Address> secondaryInstructionMatches() {
        return requireIndex().secondaryInstructions();
    }

    /**
     * Primary functions (library functions included) that have no match:
     * {@code functions + libfunctions} of the primary file minus the number of
     * distinct matched primary addresses.
     */
    public int unmatchedPrimaryCount() {
        return requireIndex().unmatchedPrimaryCount();
    }

    /** Secondary counterpart of {@link #unmatchedPrimaryCount()}. */
    public int unmatchedSecondaryCount() {
        return requireIndex().unmatchedSecondaryCount();
    }

    /** All function matches in load order. */
    public ImmutableList<FunctionMatch> functionMatches() {
        return requireIndex().functionMatches();
    }

    /** All basic-block matches, each listed once. */
    public ImmutableList<BasicBlockMatch> basicBlockMatches() {
        return requireIndex().basicBlockMatches();
    }

    // =====================================================================
    // Write Access (read-write handles)
    // =====================================================================

    /** @see ResultFileWriter#addFile(String, String) */
    public long addFile(String exportName, String hash) throws SQLException {
        return requireWriter().addFile(exportName, hash);
    }

    /** @see ResultFileWriter#addFile(String, String, String, FileStatistics) */
    public long addFile(String exportName, String hash, String executableName, FileStatistics statistics)
            throws SQLException {
        return requireWriter().addFile(exportName, hash, executableName, statistics);
    }

    /** @see ResultFileWriter#addFile(String, Path, FileStatistics) */
    public long addFile(String exportName, Path binary, FileStatistics statistics)
            throws SQLException, IOException {
        return requireWriter().addFile(exportName, binary, statistics);
    }

    /** @see ResultFileWriter#updateFileInfo */
    public void updateFileInfo(long fileId, int functions, int libFunctions, int basicBlocks, int instructions)
            throws SQLException {
        requireWriter().updateFileInfo(fileId, functions, libFunctions, basicBlocks, instructions);
    }

    /** @see ResultFileWriter#addFunctionMatch(Address, Address, String, String, double) */
    public long addFunctionMatch(Address address1, Address address2, String name1, String name2,
            double similarity) throws SQLException {
        return requireWriter().addFunctionMatch(address1, address2, name1, name2, similarity);
    }

    /** @see ResultFileWriter#addFunctionMatch(Address, Address, String, String, double, double) */
    public long addFunctionMatch(Address address1, Address address2, String name1, String name2,
            double similarity, double confidence) throws SQLException {
        return requireWriter().addFunctionMatch(address1, address2, name1, name2, similarity, confidence);
    }

    /** @see ResultFileWriter#addFunctionMatch(Address, Address, String, String, double, double, int) */
    public long addFunctionMatch(Address address1, Address address2, String name1, String name2,
            double similarity, double confidence, int identicalBasicBlocks) throws SQLException {
        return requireWriter().addFunctionMatch(address1, address2, name1, name2, similarity, confidence,
                identicalBasicBlocks);
    }

    /** @see ResultFileWriter#updateSameBasicBlockCount */
    public void updateSameBasicBlockCount(long functionMatchId, int sameBasicBlocks) throws SQLException {
        requireWriter().updateSameBasicBlockCount(functionMatchId, sameBasicBlocks);
    }

    /** @see ResultFileWriter#addBasicBlockMatch */
    public long addBasicBlockMatch(long functionMatchId, Address address1, Address address2) throws SQLException {
        return requireWriter().addBasicBlockMatch(functionMatchId, address1, address2);
    }

    /** @see ResultFileWriter#addInstructionMatch */
    public void addInstructionMatch(long basicBlockMatchId, Address address1, Address address2)
            throws SQLException {
        requireWriter().addInstructionMatch(basicBlockMatchId, address1, address2);
    }

    /** @see ResultFileWriter#touchModified */
    public void touchModified() throws SQLException {
        requireWriter().touchModified();
    }

    /** @see ResultFileWriter#updateScores */
    public void updateScores(double similarity, double confidence) throws SQLException {
        requireWriter().updateScores(similarity, confidence);
    }

    /** @see ResultFileWriter#commit */
    public void commit() throws SQLException {
        requireWriter().commit();
        LOG.info("Committed result file {}", file);
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private ResultIndex requireIndex() {
        if (index == null) {
            throw new IllegalStateException("Result file " + file + " was opened read-write; indices are not loaded");
        }
        return index;
    }

    private ResultFileWriter requireWriter() {
        if (writer == null) {
            throw new IllegalStateException("Result file " + file + " was opened read-only");
        }
        return writer;
    }

    private static void closeAfterFailure(Connection conn, Exception failure) {
        try {
            conn.close();
        } catch (SQLException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }
}
