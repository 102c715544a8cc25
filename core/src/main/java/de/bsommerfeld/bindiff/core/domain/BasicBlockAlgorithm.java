package de.bsommerfeld.bindiff.core.domain;

/**
 * Heuristic that produced a basic-block match, stored in
 * {@code basicblock.algorithm} and described in the
 * {@code basicblockalgorithm} lookup table.
 *
 * <p>
 * Codes are part of the file format. Append new members, never reorder.
 */
public enum BasicBlockAlgorithm {

    NONE(0, "none"),
    EDGES_PRIME_PRODUCT(1, "edges prime product"),
    HASH_MATCHING_FOUR_INST_MIN(2, "hash matching (4 instructions minimum)"),
    PRIME_MATCHING_FOUR_INST_MIN(3, "prime matching (4 instructions minimum)"),
    CALL_REFERENCE_MATCHING(4, "call reference matching"),
    STRING_REFERENCES_MATCHING(5, "string references matching"),
    EDGES_MD_INDEX_TOP_DOWN(6, "edges MD index (top down)"),
    MD_INDEX_MATCHING_TOP_DOWN(7, "MD index matching (top down)"),
    EDGES_MD_INDEX_BOTTOM_UP(8, "edges MD index (bottom up)"),
    MD_INDEX_MATCHING_BOTTOM_UP(9, "MD index matching (bottom up)"),
    RELAXED_MD_INDEX_MATCHING(10, "relaxed MD index matching"),
    PRIME_MATCHING_NO_INST_MIN(11, "prime matching (0 instructions minimum)"),
    EDGES_LENGAUER_TARJAN_DOMINATED(12, "edges Lengauer Tarjan dominated"),
    LOOP_ENTRY_MATCHING(13, "loop entry matching"),
    SELF_LOOP_MATCHING(14, "self loop matching"),
    ENTRY_POINT_MATCHING(15, "entry point matching"),
    EXIT_POINT_MATCHING(16, "exit point matching"),
    INSTRUCTION_COUNT_MATCHING(17, "instruction count matching"),
    JUMP_SEQUENCE_MATCHING(18, "jump sequence matching"),
    PROPAGATION_SIZE_ONE(19, "propagation (size==1)"),
    MANUAL(20, "manual");

    private final int code;
    private final String displayName;

    BasicBlockAlgorithm(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    /** Label written to the {@code basicblockalgorithm} lookup table. */
    public String lookupLabel() {
        return "basicBlock: " + displayName;
    }

    /**
     * Resolves a persisted code.
     *
     * @throws IllegalArgumentException if no member carries the code
     */
    public static BasicBlockAlgorithm fromCode(int code) {
        for (BasicBlockAlgorithm algorithm : values()) {
            if (algorithm.code == code) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown basic block algorithm code: " + code);
    }
}
