package de.bsommerfeld.bindiff.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.bindiff.core.config.Permission;
import de.bsommerfeld.bindiff.core.config.ResultFileConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Injectable entry point for opening and creating result files with a bound
 * {@link ResultFileConfig} and {@link Clock}. The static methods on
 * {@link BinDiffFile} cover callers that do not use Guice.
 *
 * @see ResultFileModule
 */
@Singleton
public class ResultFileFactory {

    private final ResultFileConfig config;
    private final Clock clock;

    @Inject
    public ResultFileFactory(ResultFileConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param permission {@code "ro"} or {@code "rw"}
     * @throws IllegalArgumentException for any other permission
     */
    public BinDiffFile open(Path file, String permission) throws SQLException {
        return open(file, Permission.fromMode(permission));
    }

    public BinDiffFile open(Path file, Permission permission) throws SQLException {
        return BinDiffFile.open(file, permission, config, clock);
    }

    public BinDiffFile create(Path file, String version, String description, double similarity,
            double confidence) throws SQLException, IOException {
        return BinDiffFile.create(file, version, description, similarity, confidence, config, clock);
    }
}
