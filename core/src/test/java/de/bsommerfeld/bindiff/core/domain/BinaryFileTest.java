package de.bsommerfeld.bindiff.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BinaryFileTest {

    @Test
    void totalFunctions_shouldIncludeLibraryFunctions() {
        BinaryFile file = new BinaryFile(1, "a", "a.exe", "h", 10, 4, 0, 0, 0, 0, 0, 0, 0);
        assertEquals(14, file.totalFunctions());
    }

    @Test
    void statistics_shouldCarryAllNineCountersInOrder() {
        BinaryFile file = new BinaryFile(1, "a", "a.exe", "h", 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertEquals(new FileStatistics(1, 2, 3, 4, 5, 6, 7, 8, 9), file.statistics());
    }

    @Test
    void fileStatistics_shortConstructorShouldZeroOtherCounters() {
        FileStatistics stats = new FileStatistics(10, 2, 300, 4000);

        assertEquals(10, stats.functions());
        assertEquals(2, stats.libFunctions());
        assertEquals(300, stats.basicBlocks());
        assertEquals(4000, stats.instructions());
        assertEquals(0, stats.calls());
        assertEquals(0, stats.libBasicBlocks());
        assertEquals(0, stats.edges());
        assertEquals(0, stats.libEdges());
        assertEquals(0, stats.libInstructions());
    }

    @Test
    void fileStatistics_emptyShouldBeAllZero() {
        assertEquals(new FileStatistics(0, 0, 0, 0), FileStatistics.EMPTY);
    }
}
