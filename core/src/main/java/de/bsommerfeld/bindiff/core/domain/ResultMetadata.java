package de.bsommerfeld.bindiff.core.domain;

import java.time.LocalDateTime;

/**
 * Contents of the single {@code metadata} row. Timestamps are wall-clock
 * local time with second precision, as the file format stores them.
 * Similarity and confidence are already rounded to three decimals when
 * produced by the loader.
 *
 * @param version     version string of the differ that produced the file
 * @param description free-text description
 * @param created     creation time
 * @param modified    last modification time, as last refreshed by a producer
 * @param similarity  overall similarity of the two binaries
 * @param confidence  overall confidence of the diff
 */
public record ResultMetadata(
        String version,
        String description,
        LocalDateTime created,
        LocalDateTime modified,
        double similarity,
        double confidence) {
}
