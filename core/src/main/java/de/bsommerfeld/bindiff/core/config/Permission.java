package de.bsommerfeld.bindiff.core.config;

/**
 * Access mode of an opened result file.
 *
 * <p>
 * {@link #READ_ONLY} handles load every index eagerly and reject writes;
 * {@link #READ_WRITE} handles skip loading and expose the writer.
 */
public enum Permission {

    READ_ONLY("ro"),
    READ_WRITE("rw");

    private final String mode;

    Permission(String mode) {
        this.mode = mode;
    }

    /** The short form used on the command line and in SQLite URIs. */
    public String mode() {
        return mode;
    }

    public boolean isWritable() {
        return this == READ_WRITE;
    }

    /**
     * Resolves {@code "ro"} or {@code "rw"}. Matching is exact.
     *
     * @throws IllegalArgumentException for any other value, including
     *                                  {@code null}
     */
    public static Permission fromMode(String mode) {
        for (Permission permission : values()) {
            if (permission.mode.equals(mode)) {
                return permission;
            }
        }
        throw new IllegalArgumentException("Unsupported permission '" + mode + "', expected 'ro' or 'rw'");
    }
}
