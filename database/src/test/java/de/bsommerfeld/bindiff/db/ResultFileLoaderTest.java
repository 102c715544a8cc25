package de.bsommerfeld.bindiff.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;

import static de.bsommerfeld.bindiff.db.ResultFileFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Loading of damaged or inconsistent result files. Each test builds a valid
 * file through the writer, then corrupts it with raw SQL.
 */
class ResultFileLoaderTest {

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        file = tempDir.resolve("corrupt.BinDiff");
        try (BinDiffFile rw = createWithFiles(file)) {
            long fn = rw.addFunctionMatch(addr(0x1000L), addr(0x2000L), "f1", "f2", 0.87, 0.5);
            long bb = rw.addBasicBlockMatch(fn, addr(0x1100L), addr(0x2100L));
            rw.addInstructionMatch(bb, addr(0x1104L), addr(0x2104L));
            rw.commit();
        }
    }

    @Test
    void load_shouldSucceedOnIntactFile() throws SQLException {
        try (BinDiffFile ro = openReadOnly(file)) {
            assertEquals(1, ro.functionMatches().size());
        }
    }

    // -- Metadata --

    @Test
    void load_shouldFailWithoutMetadataRow() throws SQLException {
        execute(file, "DELETE FROM metadata");

        MissingRecordException e = assertThrows(MissingRecordException.class, () -> openReadOnly(file));
        assertEquals("Result file has no metadata row", e.getMessage());
    }

    @Test
    void load_shouldFailOnMalformedTimestamp() throws SQLException {
        execute(file, "UPDATE metadata SET created = '01.03.2024 12:34'");

        MetadataParseException e = assertThrows(MetadataParseException.class, () -> openReadOnly(file));
        assertTrue(e.getMessage().contains("created"));
        assertNotNull(e.getCause());
    }

    @Test
    void load_shouldFailOnInvalidCalendarDate() throws SQLException {
        execute(file, "UPDATE metadata SET created = '2023-02-30 10:00:00'");

        MetadataParseException e = assertThrows(MetadataParseException.class, () -> openReadOnly(file));
        assertTrue(e.getMessage().contains("2023-02-30"));
    }

    @Test
    void load_shouldFailOnOutOfRangeTime() throws SQLException {
        execute(file, "UPDATE metadata SET modified = '2024-03-01 24:00:00'");

        assertThrows(MetadataParseException.class, () -> openReadOnly(file));
    }

    @Test
    void load_shouldFailOnMissingTimestamp() throws SQLException {
        execute(file, "UPDATE metadata SET modified = NULL");

        MetadataParseException e = assertThrows(MetadataParseException.class, () -> openReadOnly(file));
        assertTrue(e.getMessage().contains("modified"));
    }

    @Test
    void load_shouldRoundScoresToThreeDecimals() throws SQLException {
        execute(file, "UPDATE metadata SET similarity = 0.1235, confidence = 0.0625");

        try (BinDiffFile ro = openReadOnly(file)) {
            assertEquals(0.123, ro.metadata().similarity());
            assertEquals(0.062, ro.metadata().confidence());
        }
    }

    @Test
    void load_shouldKeepInfiniteScores() throws Exception {
        try (BinDiffFile rw = openReadWrite(file)) {
            rw.updateScores(Double.POSITIVE_INFINITY, 0.5);
            rw.commit();
        }

        try (BinDiffFile ro = openReadOnly(file)) {
            assertEquals(Double.POSITIVE_INFINITY, ro.metadata().similarity());
            assertEquals(0.5, ro.metadata().confidence());
        }
    }

    // -- Files --

    @Test
    void load_shouldFailWithSingleFileRow() throws SQLException {
        execute(file, "DELETE FROM file WHERE id = 2");

        MissingRecordException e = assertThrows(MissingRecordException.class, () -> openReadOnly(file));
        assertTrue(e.getMessage().contains("found 1"));
    }

    @Test
    void load_shouldPairFilesByRowOrder() throws SQLException {
        execute(file, "INSERT INTO file (filename) VALUES ('third')");

        try (BinDiffFile ro = openReadOnly(file)) {
            assertEquals("primary.exe", ro.primaryFile().filename());
            assertEquals("secondary.exe", ro.secondaryFile().filename());
        }
    }

    // -- Referential Integrity --

    @Test
    void load_shouldFailOnBasicBlockWithUnknownFunction() throws SQLException {
        execute(file, "UPDATE basicblock SET functionid = 999");

        ReferentialIntegrityException e = assertThrows(ReferentialIntegrityException.class,
                () -> openReadOnly(file));
        assertTrue(e.getMessage().contains("999"));
    }

    @Test
    void load_shouldFailOnInstructionWithUnknownBasicBlock() throws SQLException {
        execute(file, "INSERT INTO instruction (basicblockid, address1, address2) VALUES (42, 1, 2)");

        ReferentialIntegrityException e = assertThrows(ReferentialIntegrityException.class,
                () -> openReadOnly(file));
        assertTrue(e.getMessage().contains("42"));
    }

    @Test
    void load_shouldFailOnUnknownAlgorithmCode() throws SQLException {
        execute(file, "UPDATE function SET algorithm = 77");

        assertThrows(IllegalArgumentException.class, () -> openReadOnly(file));
    }

    // -- Score Rounding --

    @Test
    void roundScore_shouldRoundHalfEvenOnExactValue() {
        assertEquals(0.870, ResultFileLoader.roundScore(0.87));
        assertEquals(0.868, ResultFileLoader.roundScore(0.8675));
        assertEquals(0.123, ResultFileLoader.roundScore(0.1235));
        assertEquals(0.062, ResultFileLoader.roundScore(0.0625));
        assertEquals(1.0, ResultFileLoader.roundScore(0.9995));
        assertEquals(0.0, ResultFileLoader.roundScore(0.0));
    }

    @Test
    void roundScore_shouldPassNonFiniteValuesThrough() {
        assertEquals(Double.POSITIVE_INFINITY, ResultFileLoader.roundScore(Double.POSITIVE_INFINITY));
        assertEquals(Double.NEGATIVE_INFINITY, ResultFileLoader.roundScore(Double.NEGATIVE_INFINITY));
        assertTrue(Double.isNaN(ResultFileLoader.roundScore(Double.NaN)));
    }
}
