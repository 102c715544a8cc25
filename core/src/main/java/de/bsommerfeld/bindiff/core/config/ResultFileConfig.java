package de.bsommerfeld.bindiff.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

/**
 * Connection settings applied whenever a result file is opened.
 *
 * <p>
 * Values are resolved by {@link #resolve()} from system properties first,
 * environment variables second, falling back to {@link #DEFAULTS}:
 * <ul>
 * <li>{@code bindiff.busy-timeout} / {@code BINDIFF_BUSY_TIMEOUT}: how long
 * SQLite waits on a locked file, in milliseconds</li>
 * <li>{@code bindiff.journal-mode} / {@code BINDIFF_JOURNAL_MODE}: journal
 * mode of writable connections, one of {@link #JOURNAL_MODES}</li>
 * </ul>
 *
 * @param busyTimeoutMillis SQLite busy timeout, never negative
 * @param journalMode       upper-case SQLite journal mode
 */
public record ResultFileConfig(int busyTimeoutMillis, String journalMode) {

    private static final Logger LOG = LoggerFactory.getLogger(ResultFileConfig.class);

    public static final Set<String> JOURNAL_MODES = Set.of("DELETE", "TRUNCATE", "PERSIST", "MEMORY", "WAL", "OFF");

    public static final ResultFileConfig DEFAULTS = new ResultFileConfig(3000, "DELETE");

    public ResultFileConfig {
        if (busyTimeoutMillis < 0) {
            throw new IllegalArgumentException("Busy timeout must not be negative: " + busyTimeoutMillis);
        }
        journalMode = journalMode.toUpperCase(Locale.ROOT);
        if (!JOURNAL_MODES.contains(journalMode)) {
            throw new IllegalArgumentException("Unknown journal mode: " + journalMode);
        }
    }

    /**
     * Resolves the configuration from the environment. Invalid values are
     * logged and replaced by their default.
     */
    public static ResultFileConfig resolve() {
        int busyTimeout = DEFAULTS.busyTimeoutMillis();
        String timeoutValue = lookup("bindiff.busy-timeout", "BINDIFF_BUSY_TIMEOUT");
        if (timeoutValue != null) {
            try {
                busyTimeout = Integer.parseInt(timeoutValue.trim());
                if (busyTimeout < 0) {
                    LOG.warn("Negative busy timeout '{}'. Defaulting to {}.", timeoutValue, DEFAULTS.busyTimeoutMillis());
                    busyTimeout = DEFAULTS.busyTimeoutMillis();
                }
            } catch (NumberFormatException e) {
                LOG.warn("Invalid busy timeout '{}'. Defaulting to {}.", timeoutValue, DEFAULTS.busyTimeoutMillis());
            }
        }

        String journalMode = DEFAULTS.journalMode();
        String modeValue = lookup("bindiff.journal-mode", "BINDIFF_JOURNAL_MODE");
        if (modeValue != null) {
            String candidate = modeValue.trim().toUpperCase(Locale.ROOT);
            if (JOURNAL_MODES.contains(candidate)) {
                journalMode = candidate;
            } else {
                LOG.warn("Unknown journal mode '{}'. Defaulting to {}.", modeValue, DEFAULTS.journalMode());
            }
        }

        return new ResultFileConfig(busyTimeout, journalMode);
    }

    private static String lookup(String property, String environmentVariable) {
        String value = System.getProperty(property);
        if (value == null || value.isEmpty()) {
            value = System.getenv(environmentVariable);
        }
        return (value == null || value.isEmpty()) ? null : value;
    }
}
