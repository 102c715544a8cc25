package de.bsommerfeld.bindiff.db;

/**
 * Thrown when a basic-block or instruction row points at a function or
 * basic-block id that does not exist. Always a producer bug.
 */
public class ReferentialIntegrityException extends ResultFileException {

    public ReferentialIntegrityException(String message) {
        super(message);
    }
}
