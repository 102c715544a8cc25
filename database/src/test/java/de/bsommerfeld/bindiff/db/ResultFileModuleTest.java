package de.bsommerfeld.bindiff.db;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.bindiff.core.config.ResultFileConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;

import static de.bsommerfeld.bindiff.db.ResultFileFixtures.addr;
import static de.bsommerfeld.bindiff.db.ResultFileFixtures.queryString;
import static org.junit.jupiter.api.Assertions.*;

class ResultFileModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void injector_shouldProvideSingletonFactory() {
        Injector injector = Guice.createInjector(new ResultFileModule(ResultFileConfig.DEFAULTS));

        ResultFileFactory first = injector.getInstance(ResultFileFactory.class);
        ResultFileFactory second = injector.getInstance(ResultFileFactory.class);

        assertSame(first, second);
    }

    @Test
    void injector_shouldBindGivenConfig() {
        ResultFileConfig config = new ResultFileConfig(250, "truncate");
        Injector injector = Guice.createInjector(new ResultFileModule(config));

        assertSame(config, injector.getInstance(ResultFileConfig.class));
        assertNotNull(injector.getInstance(Clock.class));
    }

    @Test
    void factory_shouldApplyBoundJournalMode() throws Exception {
        Injector injector = Guice.createInjector(new ResultFileModule(new ResultFileConfig(250, "wal")));
        Path file = tempDir.resolve("wal.BinDiff");

        try (BinDiffFile rw = injector.getInstance(ResultFileFactory.class)
                .create(file, "8.0", "wal", 0.0, 0.0)) {
            rw.commit();
        }

        // WAL is persisted in the database header
        assertEquals("wal", queryString(file, "PRAGMA journal_mode"));
    }

    @Test
    void defaultModule_shouldResolveConfigFromEnvironment() {
        Injector injector = Guice.createInjector(new ResultFileModule());

        ResultFileConfig config = injector.getInstance(ResultFileConfig.class);
        assertTrue(ResultFileConfig.JOURNAL_MODES.contains(config.journalMode()));
    }

    @Test
    void factory_shouldCreateAndReopenFiles() throws Exception {
        ResultFileFactory factory = Guice.createInjector(new ResultFileModule(ResultFileConfig.DEFAULTS))
                .getInstance(ResultFileFactory.class);
        Path file = tempDir.resolve("injected.BinDiff");

        try (BinDiffFile rw = factory.create(file, "8.0", "via guice", 0.5, 0.5)) {
            rw.addFile("a.BinExport", "aa");
            rw.addFile("b.BinExport", "bb");
            rw.addFunctionMatch(addr(0x10L), addr(0x20L), "a", "b", 0.75);
            rw.commit();
        }

        try (BinDiffFile ro = factory.open(file, "ro")) {
            assertEquals("via guice", ro.metadata().description());
            assertEquals(1, ro.functionMatches().size());
        }
    }

    @Test
    void factory_shouldRejectUnknownPermission() {
        ResultFileFactory factory = new ResultFileFactory(ResultFileConfig.DEFAULTS, Clock.systemUTC());

        assertThrows(IllegalArgumentException.class, () -> factory.open(tempDir.resolve("x.BinDiff"), "wr"));
    }
}
