package de.bsommerfeld.bindiff.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BinaryHashTest {

    @TempDir
    Path tempDir;

    @Test
    void of_shouldWriteLowerCaseSha256Hex() throws IOException {
        Path binary = Files.write(tempDir.resolve("abc.bin"), "abc".getBytes(StandardCharsets.US_ASCII));

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", BinaryHash.of(binary));
    }

    @Test
    void of_shouldHashEmptyBinary() throws IOException {
        Path binary = Files.write(tempDir.resolve("empty.bin"), new byte[0]);

        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", BinaryHash.of(binary));
    }

    @Test
    void of_shouldStreamLargeBinaries() throws IOException {
        byte[] content = new byte[100_000];
        content[99_999] = 1;
        Path binary = Files.write(tempDir.resolve("large.bin"), content);
        Path other = Files.write(tempDir.resolve("large-zero.bin"), new byte[100_000]);

        String hash = BinaryHash.of(binary);
        assertEquals(64, hash.length());
        assertNotEquals(BinaryHash.of(other), hash);
    }

    @Test
    void of_shouldThrowForMissingBinary() {
        assertThrows(IOException.class, () -> BinaryHash.of(tempDir.resolve("missing.exe")));
    }
}
