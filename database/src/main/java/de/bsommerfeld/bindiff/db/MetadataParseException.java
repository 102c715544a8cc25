package de.bsommerfeld.bindiff.db;

/**
 * Thrown when a metadata timestamp does not match {@code yyyy-MM-dd HH:mm:ss}.
 */
public class MetadataParseException extends ResultFileException {

    public MetadataParseException(String message) {
        super(message);
    }

    public MetadataParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
