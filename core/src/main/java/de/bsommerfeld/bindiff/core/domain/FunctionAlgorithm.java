package de.bsommerfeld.bindiff.core.domain;

/**
 * Heuristic that produced a function match. The integer {@link #code()} is
 * what the {@code function.algorithm} column stores; the
 * {@link #displayName()} is what the {@code functionalgorithm} lookup table
 * carries so that viewers can render names without knowing this enum.
 *
 * <p>
 * Codes are part of the file format. Append new members, never reorder.
 */
public enum FunctionAlgorithm {

    NONE(0, "none"),
    NAME_HASH_MATCHING(1, "name hash matching"),
    HASH_MATCHING(2, "hash matching"),
    EDGES_FLOWGRAPH_MD_INDEX(3, "edges flowgraph MD index"),
    EDGES_CALLGRAPH_MD_INDEX(4, "edges callgraph MD index"),
    MD_INDEX_MATCHING_FLOWGRAPH_TOP_DOWN(5, "MD index matching (flowgraph MD index, top down)"),
    MD_INDEX_MATCHING_FLOWGRAPH_BOTTOM_UP(6, "MD index matching (flowgraph MD index, bottom up)"),
    PRIME_SIGNATURE_MATCHING(7, "signature matching"),
    MD_INDEX_MATCHING_CALLGRAPH_TOP_DOWN(8, "MD index matching (callGraph MD index, top down)"),
    MD_INDEX_MATCHING_CALLGRAPH_BOTTOM_UP(9, "MD index matching (callGraph MD index, bottom up)"),
    RELAXED_MD_INDEX_MATCHING(10, "MD index matching (flowgraph MD index, relaxed)"),
    INSTRUCTION_COUNT(11, "instruction count"),
    ADDRESS_SEQUENCE(12, "address sequence"),
    STRING_REFERENCES(13, "string references"),
    LOOP_COUNT_MATCHING(14, "loop count matching"),
    CALL_SEQUENCE_MATCHING_EXACT(15, "call sequence matching(exact)"),
    CALL_SEQUENCE_MATCHING_TOPOLOGY(16, "call sequence matching(topology)"),
    CALL_SEQUENCE_MATCHING_SEQUENCE(17, "call sequence matching(sequence)"),
    CALL_REFERENCE_MATCHING(18, "call reference matching"),
    MANUAL(19, "manual");

    private final int code;
    private final String displayName;

    FunctionAlgorithm(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    /** Label written to the {@code functionalgorithm} lookup table. */
    public String lookupLabel() {
        return "function: " + displayName;
    }

    /**
     * Resolves a persisted code.
     *
     * @throws IllegalArgumentException if no member carries the code
     */
    public static FunctionAlgorithm fromCode(int code) {
        for (FunctionAlgorithm algorithm : values()) {
            if (algorithm.code == code) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown function algorithm code: " + code);
    }
}
