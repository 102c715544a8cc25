package de.bsommerfeld.bindiff.db;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import com.google.common.collect.Tables;
import de.bsommerfeld.bindiff.core.domain.Address;
import de.bsommerfeld.bindiff.core.domain.BasicBlockAlgorithm;
import de.bsommerfeld.bindiff.core.domain.BasicBlockMatch;
import de.bsommerfeld.bindiff.core.domain.BinaryFile;
import de.bsommerfeld.bindiff.core.domain.FunctionAlgorithm;
import de.bsommerfeld.bindiff.core.domain.FunctionMatch;
import de.bsommerfeld.bindiff.core.domain.ResultMetadata;
import de.bsommerfeld.bindiff.core.util.AddressCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a complete result file into a {@link ResultIndex}.
 *
 * <p>
 * Five full-table passes run in a fixed order, each depending on the ones
 * before it:
 * <ol>
 * <li>metadata: the single row, timestamps parsed, scores rounded</li>
 * <li>files: first row primary, second row secondary</li>
 * <li>function matches: indexed by primary and by secondary address</li>
 * <li>basic-block matches: owning function resolved by id, indexed by block
 * address then function address</li>
 * <li>instruction matches: owning block resolved by id, indexed by
 * instruction address then function address</li>
 * </ol>
 *
 * <p>
 * Loading is all-or-nothing. The first inconsistency aborts with a
 * {@link ResultFileException}, storage failures abort with the driver's
 * {@link SQLException}.
 *
 * <p>
 * When two stored function matches share an address on one side, the row read
 * last replaces the earlier one in that side's index. The same applies to two
 * block or instruction matches sharing both their address and their owning
 * function address.
 */
final class ResultFileLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ResultFileLoader.class);

    private final Connection conn;

    private ResultMetadata metadata;
    private BinaryFile primaryFile;
    private BinaryFile secondaryFile;

    private final Map<Long, FunctionMatch> functionsById = new HashMap<>();
    private final Map<Address, FunctionMatch> primaryFunctions = new LinkedHashMap<>();
    private final Map<Address, FunctionMatch> secondaryFunctions = new LinkedHashMap<>();

    private final Map<Long, BasicBlockMatch> basicBlocksById = new HashMap<>();
    private final Table<Address, Address, BasicBlockMatch> primaryBasicBlocks = newTable();
    private final Table<Address, Address, BasicBlockMatch> secondaryBasicBlocks = newTable();

    private final Table<Address, Address, Address> primaryInstructions = newTable();
    private final Table<Address, Address, Address> secondaryInstructions = newTable();

    private ResultFileLoader(Connection conn) {
        this.conn = conn;
    }

    static ResultIndex load(Connection conn) throws SQLException {
        return new ResultFileLoader(conn).run();
    }

    private ResultIndex run() throws SQLException {
        loadMetadata();
        loadFiles();
        loadFunctionMatches();
        loadBasicBlockMatches();
        loadInstructionMatches();

        return new ResultIndex(metadata, primaryFile, secondaryFile,
                ImmutableMap.copyOf(primaryFunctions),
                ImmutableMap.copyOf(secondaryFunctions),
                ImmutableTable.copyOf(primaryBasicBlocks),
                ImmutableTable.copyOf(secondaryBasicBlocks),
                ImmutableTable.copyOf(primaryInstructions),
                ImmutableTable.copyOf(secondaryInstructions));
    }

    // =====================================================================
    // Passes
    // =====================================================================

    private void loadMetadata() throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-metadata"));
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                throw new MissingRecordException("Result file has no metadata row");
            }
            metadata = new ResultMetadata(
                    rs.getString("version"),
                    rs.getString("description"),
                    parseTimestamp("created", rs.getString("created")),
                    parseTimestamp("modified", rs.getString("modified")),
                    roundScore(rs.getDouble("similarity")),
                    roundScore(rs.getDouble("confidence")));
        }
        LOG.debug("[DB] Loaded metadata: version={}, created={}", metadata.version(), metadata.created());
    }

    private void loadFiles() throws SQLException {
        List<BinaryFile> files = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-files"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                files.add(mapFile(rs));
            }
        }
        if (files.size() < 2) {
            throw new MissingRecordException("Result file must contain two file rows, found " + files.size());
        }
        primaryFile = files.get(0);
        secondaryFile = files.get(1);
        LOG.debug("[DB] Loaded files: primary={}, secondary={}", primaryFile.filename(), secondaryFile.filename());
    }

    private void loadFunctionMatches() throws SQLException {
        int rows = 0;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-functions"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                FunctionMatch match = mapFunctionMatch(rs);
                functionsById.put(match.id(), match);
                primaryFunctions.put(match.address1(), match);
                secondaryFunctions.put(match.address2(), match);
                rows++;
            }
        }
        LOG.debug("[DB] Loaded {} function matches ({} primary, {} secondary addresses)",
                rows, primaryFunctions.size(), secondaryFunctions.size());
    }

    private void loadBasicBlockMatches() throws SQLException {
        int rows = 0;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-basicblocks"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long id = rs.getLong("id");
                long functionId = rs.getLong("functionid");
                FunctionMatch owner = functionsById.get(functionId);
                if (owner == null) {
                    throw new ReferentialIntegrityException(
                            "Basic block match " + id + " references unknown function match " + functionId);
                }
                BasicBlockMatch match = new BasicBlockMatch(id, owner,
                        AddressCodec.decode(rs.getLong("address1")),
                        AddressCodec.decode(rs.getLong("address2")),
                        BasicBlockAlgorithm.fromCode(rs.getInt("algorithm")));

                basicBlocksById.put(id, match);
                primaryBasicBlocks.put(match.address1(), owner.address1(), match);
                secondaryBasicBlocks.put(match.address2(), owner.address2(), match);
                rows++;
            }
        }
        LOG.debug("[DB] Loaded {} basic block matches", rows);
    }

    private void loadInstructionMatches() throws SQLException {
        int rows = 0;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-instructions"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long basicBlockId = rs.getLong("basicblockid");
                BasicBlockMatch block = basicBlocksById.get(basicBlockId);
                if (block == null) {
                    throw new ReferentialIntegrityException(
                            "Instruction match references unknown basic block match " + basicBlockId);
                }
                Address address1 = AddressCodec.decode(rs.getLong("address1"));
                Address address2 = AddressCodec.decode(rs.getLong("address2"));
                FunctionMatch owner = block.functionMatch();

                primaryInstructions.put(address1, owner.address1(), address2);
                secondaryInstructions.put(address2, owner.address2(), address1);
                rows++;
            }
        }
        LOG.debug("[DB] Loaded {} instruction matches", rows);
    }

    // =====================================================================
    // ResultSet → Domain Mapping
    // =====================================================================

    private BinaryFile mapFile(ResultSet rs) throws SQLException {
        return new BinaryFile(
                rs.getLong("id"), rs.getString("filename"),
                rs.getString("exefilename"), rs.getString("hash"),
                rs.getInt("functions"), rs.getInt("libfunctions"),
                rs.getInt("calls"), rs.getInt("basicblocks"),
                rs.getInt("libbasicblocks"), rs.getInt("edges"),
                rs.getInt("libedges"), rs.getInt("instructions"),
                rs.getInt("libinstructions"));
    }

    private FunctionMatch mapFunctionMatch(ResultSet rs) throws SQLException {
        return new FunctionMatch(
                rs.getLong("id"),
                AddressCodec.decode(rs.getLong("address1")), rs.getString("name1"),
                AddressCodec.decode(rs.getLong("address2")), rs.getString("name2"),
                rs.getDouble("similarity"), rs.getDouble("confidence"),
                FunctionAlgorithm.fromCode(rs.getInt("algorithm")));
    }

    private static LocalDateTime parseTimestamp(String column, String value) {
        if (value == null) {
            throw new MetadataParseException("Metadata column '" + column + "' is empty");
        }
        try {
            return LocalDateTime.parse(value, ResultFileSchema.TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            throw new MetadataParseException(
                    "Metadata column '" + column + "' is not a 'yyyy-MM-dd HH:mm:ss' timestamp: " + value, e);
        }
    }

    /**
     * Rounds half-even on the exact binary value, so 0.1235 (stored as
     * 0.12349999...) becomes 0.123 and 0.0625 becomes 0.062. Infinite and NaN
     * scores are returned unchanged.
     */
    static double roundScore(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(3, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static <V> Table<Address, Address, V> newTable() {
        return Tables.newCustomTable(new LinkedHashMap<>(), LinkedHashMap::new);
    }
}
