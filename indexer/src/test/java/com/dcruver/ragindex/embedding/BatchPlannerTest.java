package com.dcruver.ragindex.embedding;

import com.dcruver.ragindex.chunking.TokenEstimator;
import com.dcruver.ragindex.config.ConfigurationException;
import com.dcruver.ragindex.domain.Batch;
import com.dcruver.ragindex.domain.FingerprintedUnit;
import com.dcruver.ragindex.domain.TextUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BatchPlannerTest {

    private BatchPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new BatchPlanner();
    }

    @Test
    void testCountLimitSplitsBatches() {
        List<FingerprintedUnit> units = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            units.add(unit("text " + i, i + 1));
        }

        List<Batch> batches = planner.plan(units, new BatchLimits(4, 10_000, 10_000));

        assertEquals(List.of(4, 4, 2), batches.stream().map(Batch::size).toList());
        assertEquals(List.of(1, 2, 3), batches.stream().map(Batch::getSequenceNumber).toList());
    }

    @Test
    void testCharLimitSplitsBatches() {
        List<FingerprintedUnit> units = List.of(
            unit("0123456789", 1), unit("abcdefghij", 2), unit("ABCDEFGHIJ", 3));

        List<Batch> batches = planner.plan(units, new BatchLimits(64, 25, 10_000));

        assertEquals(2, batches.size());
        assertEquals(20, batches.get(0).getEstimatedChars());
        assertEquals(10, batches.get(1).getEstimatedChars());
    }

    @Test
    void testTokenLimitSplitsBatches() {
        List<FingerprintedUnit> units = List.of(unit("a b c", 1), unit("d e f", 2), unit("g h i", 3));

        List<Batch> batches = planner.plan(units, new BatchLimits(64, 10_000, 7));

        assertEquals(List.of(2, 1), batches.stream().map(Batch::size).toList());
        assertEquals(6, batches.get(0).getEstimatedTokens());
    }

    @Test
    void testOversizedUnitIsRejected() {
        FingerprintedUnit huge = unit("x".repeat(30), 42);
        List<FingerprintedUnit> units = List.of(unit("small", 1), huge);

        BatchTooLargeException e = assertThrows(BatchTooLargeException.class,
            () -> planner.plan(units, new BatchLimits(64, 20, 10_000)));

        assertEquals(huge.getUnit(), e.getUnit());
        assertTrue(e.getMessage().contains("notes.md:42:42"));
    }

    @Test
    void testEmptyInputPlansNothing() {
        assertTrue(planner.plan(List.of(), new BatchLimits(1, 1, 1)).isEmpty());
    }

    @Test
    void testLimitsMustBePositive() {
        assertThrows(ConfigurationException.class, () -> new BatchLimits(0, 10, 10));
        assertThrows(ConfigurationException.class, () -> new BatchLimits(10, -1, 10));
        assertThrows(ConfigurationException.class, () -> new BatchLimits(10, 10, 0));
    }

    @Test
    void testEveryBatchRespectsAllLimitsAndOrder() {
        Random random = new Random(3);
        List<FingerprintedUnit> units = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            StringBuilder text = new StringBuilder();
            int words = 1 + random.nextInt(30);
            for (int w = 0; w < words; w++) {
                text.append(w > 0 ? " " : "").append("w".repeat(1 + random.nextInt(9)));
            }
            units.add(unit(text.toString(), i + 1));
        }
        BatchLimits limits = new BatchLimits(16, 1_000, 150);

        List<Batch> batches = planner.plan(units, limits);

        List<FingerprintedUnit> flattened = new ArrayList<>();
        for (Batch batch : batches) {
            assertFalse(batch.getUnits().isEmpty());
            assertTrue(batch.size() <= limits.getMaxCount());
            int chars = batch.getTexts().stream().mapToInt(String::length).sum();
            assertTrue(chars <= limits.getMaxChars());
            assertTrue(TokenEstimator.estimate(batch.getTexts()) <= limits.getMaxTokens());
            assertEquals(chars, batch.getEstimatedChars());
            flattened.addAll(batch.getUnits());
        }
        assertEquals(units, flattened);
    }

    private static FingerprintedUnit unit(String text, int line) {
        return FingerprintedUnit.of(TextUnit.builder()
            .text(text)
            .sourcePath("notes.md")
            .startLine(line)
            .endLine(line)
            .startOffset(0)
            .endOffset(text.length())
            .build());
    }
}
