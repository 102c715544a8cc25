package de.bsommerfeld.bindiff.core.domain;

/**
 * One of the two binaries recorded in a result file, as stored in the
 * {@code file} table. Which of the two is primary is decided purely by row
 * order: the first inserted row is the primary binary.
 *
 * @param id              surrogate row id
 * @param filename        display name (export name without extension)
 * @param exeFilename     executable name
 * @param hash            hex content digest, opaque to this library
 * @param functions       number of non-library functions
 * @param libFunctions    number of functions identified as library code
 * @param calls           number of call sites
 * @param basicBlocks     number of basic blocks
 * @param libBasicBlocks  number of basic blocks inside library functions
 * @param edges           number of call graph edges
 * @param libEdges        number of call graph edges targeting library code
 * @param instructions    number of instructions
 * @param libInstructions number of instructions inside library functions
 */
public record BinaryFile(
        long id,
        String filename,
        String exeFilename,
        String hash,
        int functions,
        int libFunctions,
        int calls,
        int basicBlocks,
        int libBasicBlocks,
        int edges,
        int libEdges,
        int instructions,
        int libInstructions) {

    /** Functions of any kind, i.e. {@code functions + libFunctions}. */
    public int totalFunctions() {
        return functions + libFunctions;
    }

    /** The nine counters of this row. */
    public FileStatistics statistics() {
        return new FileStatistics(functions, libFunctions, calls, basicBlocks, libBasicBlocks,
                edges, libEdges, instructions, libInstructions);
    }
}
