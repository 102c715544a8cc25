package de.bsommerfeld.bindiff.db;

/**
 * Thrown when a row the file format requires is absent, e.g. a result file
 * with fewer than two {@code file} rows or without a {@code metadata} row.
 */
public class MissingRecordException extends ResultFileException {

    public MissingRecordException(String message) {
        super(message);
    }
}
