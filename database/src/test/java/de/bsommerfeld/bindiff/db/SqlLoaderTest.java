package de.bsommerfeld.bindiff.db;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlLoaderTest {

    private static final String[] STATEMENTS = {
            "insert-function-algorithm", "insert-basicblock-algorithm",
            "insert-metadata", "update-metadata-modified", "update-metadata-scores",
            "insert-file", "update-file-infos",
            "insert-function", "update-function-basicblocks",
            "insert-basicblock", "insert-instruction",
            "select-last-rowid",
            "select-metadata", "select-files", "select-functions", "select-basicblocks", "select-instructions"
    };

    @Test
    void load_shouldReadEveryStatementFile() {
        for (String name : STATEMENTS) {
            String sql = SqlLoader.load(name);
            assertFalse(sql.isBlank(), name);
            assertEquals(sql.trim(), sql, name + " should be trimmed");
        }
    }

    @Test
    void load_shouldReturnExpectedStatement() {
        String sql = SqlLoader.load("insert-instruction");
        assertTrue(sql.startsWith("INSERT INTO instruction"));
        assertTrue(sql.contains("basicblockid"));
    }

    @Test
    void load_shouldCacheResults() {
        String first = SqlLoader.load("select-functions");
        String second = SqlLoader.load("select-functions");
        assertSame(first, second);
    }

    @Test
    void load_shouldThrowForMissingResource() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> SqlLoader.load("drop-everything"));
        assertTrue(e.getMessage().contains("sql/drop-everything.sql"));
    }

    @Test
    void readScript_shouldReadSchemaUntrimmed() {
        String schema = SqlLoader.readScript("schema.sql");
        assertTrue(schema.contains("CREATE TABLE file"));
        assertTrue(schema.contains("CREATE TABLE instruction"));
        assertTrue(schema.contains("UNIQUE(address1, address2)"));
    }
}
