package de.bsommerfeld.bindiff.db;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import de.bsommerfeld.bindiff.core.domain.Address;
import de.bsommerfeld.bindiff.core.domain.BasicBlockMatch;
import de.bsommerfeld.bindiff.core.domain.BinaryFile;
import de.bsommerfeld.bindiff.core.domain.FunctionMatch;
import de.bsommerfeld.bindiff.core.domain.ResultMetadata;

/**
 * Immutable snapshot of a result file as built by {@link ResultFileLoader}.
 *
 * <p>
 * Basic-block and instruction indices are two-level tables: row key is the
 * block or instruction address, column key the entry address of the owning
 * function on the same side. A single block address may therefore map to
 * several matches, one per owning function.
 */
final class ResultIndex {

    private final ResultMetadata metadata;
    private final BinaryFile primaryFile;
    private final BinaryFile secondaryFile;
    private final ImmutableMap<Address, FunctionMatch> primaryFunctions;
    private final ImmutableMap<Address, FunctionMatch> secondaryFunctions;
    private final ImmutableTable<Address, Address, BasicBlockMatch> primaryBasicBlocks;
    private final ImmutableTable<Address, Address, BasicBlockMatch> secondaryBasicBlocks;
    private final ImmutableTable<Address, Address, Address> primaryInstructions;
    private final ImmutableTable<Address, Address, Address> secondaryInstructions;

    ResultIndex(ResultMetadata metadata,
            BinaryFile primaryFile,
            BinaryFile secondaryFile,
            ImmutableMap<Address, FunctionMatch> primaryFunctions,
            ImmutableMap<Address, FunctionMatch> secondaryFunctions,
            ImmutableTable<Address, Address, BasicBlockMatch> primaryBasicBlocks,
            ImmutableTable<Address, Address, BasicBlockMatch> secondaryBasicBlocks,
            ImmutableTable<Address, Address, Address> primaryInstructions,
            ImmutableTable<Address, Address, Address> secondaryInstructions) {
        this.metadata = metadata;
        this.primaryFile = primaryFile;
        this.secondaryFile = secondaryFile;
        this.primaryFunctions = primaryFunctions;
        this.secondaryFunctions = secondaryFunctions;
        this.primaryBasicBlocks = primaryBasicBlocks;
        this.secondaryBasicBlocks = secondaryBasicBlocks;
        this.primaryInstructions = primaryInstructions;
        this.secondaryInstructions = secondaryInstructions;
    }

    ResultMetadata metadata() {
        return metadata;
    }

    BinaryFile primaryFile() {
        return primaryFile;
    }

    BinaryFile secondaryFile() {
        return secondaryFile;
    }

    ImmutableMap<Address, FunctionMatch> primaryFunctions() {
        return primaryFunctions;
    }

    ImmutableMap<Address, FunctionMatch> secondaryFunctions() {
        return secondaryFunctions;
    }

    ImmutableTable<Address, Address, BasicBlockMatch> primaryBasicBlocks() {
        return primaryBasicBlocks;
    }

    ImmutableTable<Address, Address, BasicBlockMatch> secondaryBasicBlocks() {
        return secondaryBasicBlocks;
    }

    ImmutableTable<Address, Address, Address> primaryInstructions() {
        return primaryInstructions;
    }

    ImmutableTable<Address, Address, Address> secondaryInstructions() {
        return secondaryInstructions;
    }

    /** Primary functions without a match, library functions included. */
    int unmatchedPrimaryCount() {
        return primaryFile.totalFunctions() - primaryFunctions.size();
    }

    /** Secondary functions without a match, library functions included. */
    int unmatchedSecondaryCount() {
        return secondaryFile.totalFunctions() - secondaryFunctions.size();
    }

    ImmutableList<FunctionMatch> functionMatches() {
        return primaryFunctions.values().asList();
    }

    /**
     * All basic-block matches, flattened from the primary-side table. Each
     * match occupies exactly one cell there, so no match is listed twice.
     */
    ImmutableList<BasicBlockMatch> basicBlockMatches() {
        return primaryBasicBlocks.values().asList();
    }
}
