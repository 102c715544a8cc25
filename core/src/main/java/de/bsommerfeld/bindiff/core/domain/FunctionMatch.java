package de.bsommerfeld.bindiff.core.domain;

/**
 * A matched pair of functions, one row of the {@code function} table.
 *
 * @param id         surrogate row id, referenced by basic-block matches
 * @param address1   entry address in the primary binary
 * @param name1      function name in the primary binary
 * @param address2   entry address in the secondary binary
 * @param name2      function name in the secondary binary
 * @param similarity similarity score, 0.0–1.0
 * @param confidence confidence of the match, 0.0–1.0
 * @param algorithm  heuristic that produced the match
 */
public record FunctionMatch(
        long id,
        Address address1,
        String name1,
        Address address2,
        String name2,
        double similarity,
        double confidence,
        FunctionAlgorithm algorithm) {
}
