package de.bsommerfeld.bindiff.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classpath access to the result-file SQL.
 *
 * <p>
 * Statements live one per file under {@code sql/} and fall into three
 * groups:
 * <ul>
 * <li>lookup inserts run once by {@link ResultFileSchema} after the DDL
 * ({@code insert-*-algorithm})</li>
 * <li>producer inserts and updates issued by {@link ResultFileWriter}, plus
 * {@code select-last-rowid} to hand surrogate ids back to the caller</li>
 * <li>the five full-table scans of {@link ResultFileLoader}
 * ({@code select-metadata} through {@code select-instructions})</li>
 * </ul>
 * Statements are trimmed and cached per name, since the writer issues the
 * same few inserts once per match. {@code schema.sql} is read uncached
 * through {@link #readScript(String)}.
 */
final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * @param name file stem under {@code sql/}, e.g. {@code insert-function}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    static String load(String name) {
        return CACHE.computeIfAbsent(name, key -> readScript("sql/" + key + ".sql").trim());
    }

    /**
     * Reads a classpath resource verbatim.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    static String readScript(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
