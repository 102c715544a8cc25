package de.bsommerfeld.bindiff.db;

/**
 * Base of all failures detected while reading a result file. Storage errors
 * are not wrapped: they surface as the driver's {@link java.sql.SQLException}.
 */
public class ResultFileException extends RuntimeException {

    public ResultFileException(String message) {
        super(message);
    }

    public ResultFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
