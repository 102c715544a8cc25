package de.bsommerfeld.bindiff.core.util;

import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Value of the {@code file.hash} column for an analyzed binary.
 *
 * <p>
 * BinDiff writes the lower-case hex SHA-256 of the executable (64
 * characters). The column is declared {@code CHARACTER(40)}, a leftover of
 * SHA-1, but SQLite does not enforce the length and readers treat the value
 * as opaque text.
 */
public final class BinaryHash {

    private BinaryHash() {
    }

    /**
     * Hashes the executable at {@code binary}, streaming its content.
     *
     * @throws IOException if the binary cannot be read
     */
    public static String of(Path binary) throws IOException {
        return MoreFiles.asByteSource(binary).hash(Hashing.sha256()).toString();
    }
}
