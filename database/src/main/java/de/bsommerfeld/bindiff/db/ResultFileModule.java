package de.bsommerfeld.bindiff.db;

import com.google.inject.AbstractModule;
import de.bsommerfeld.bindiff.core.config.ResultFileConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Guice module for result-file access. Binds the configuration resolved from
 * system properties and environment, the system clock used for metadata
 * timestamps, and {@link ResultFileFactory}.
 */
public class ResultFileModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ResultFileModule.class);

    private final ResultFileConfig config;

    public ResultFileModule() {
        this(ResultFileConfig.resolve());
    }

    public ResultFileModule(ResultFileConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        LOG.info("Result file configuration: busy timeout {} ms, journal mode {}",
                config.busyTimeoutMillis(), config.journalMode());

        bind(ResultFileConfig.class).toInstance(config);
        bind(Clock.class).toInstance(Clock.systemDefaultZone());
        bind(ResultFileFactory.class);
    }
}
