package de.bsommerfeld.bindiff.core.domain;

/**
 * Counters describing one analyzed binary. Producers that do not know a
 * counter pass zero; BinDiff's own viewers render such files, but some
 * statistics panes will show zeros.
 */
public record FileStatistics(
        int functions,
        int libFunctions,
        int calls,
        int basicBlocks,
        int libBasicBlocks,
        int edges,
        int libEdges,
        int instructions,
        int libInstructions) {

    public static final FileStatistics EMPTY = new FileStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0);

    /**
     * Convenience constructor for the four counters producers usually know
     * up front. All other counters are zero.
     */
    public FileStatistics(int functions, int libFunctions, int basicBlocks, int instructions) {
        this(functions, libFunctions, 0, basicBlocks, 0, 0, 0, instructions, 0);
    }
}
