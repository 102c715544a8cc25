package de.bsommerfeld.bindiff.core.domain;

/**
 * A matched pair of basic blocks, one row of the {@code basicblock} table.
 * The owning function match is resolved eagerly at load time, so the same
 * block address may legitimately occur in several matches that differ only
 * in {@link #functionMatch()}.
 *
 * @param id            surrogate row id, referenced by instruction matches
 * @param functionMatch function match this block pair belongs to
 * @param address1      block address in the primary binary
 * @param address2      block address in the secondary binary
 * @param algorithm     heuristic that produced the match
 */
public record BasicBlockMatch(
        long id,
        FunctionMatch functionMatch,
        Address address1,
        Address address2,
        BasicBlockAlgorithm algorithm) {
}
