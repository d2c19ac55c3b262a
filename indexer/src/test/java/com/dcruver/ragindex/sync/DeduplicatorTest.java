package com.dcruver.ragindex.sync;

import com.dcruver.ragindex.domain.FingerprintedUnit;
import com.dcruver.ragindex.domain.Fingerprints;
import com.dcruver.ragindex.domain.TextUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeduplicatorTest {

    private Deduplicator deduplicator;

    @BeforeEach
    void setUp() {
        deduplicator = new Deduplicator();
    }

    @Test
    void testDuplicatesWithinOneCallAreSkipped() {
        List<TextUnit> units = List.of(unit("alpha", "a.md", 1), unit("beta", "a.md", 2), unit("alpha", "b.md", 7));

        DedupResult result = deduplicator.filter(units, KnownFingerprints.empty());

        assertEquals(2, result.unique().size());
        assertEquals(1, result.skippedCount());
        assertEquals("a.md", result.unique().get(0).getUnit().getSourcePath());
        assertEquals("beta", result.unique().get(1).getText());
    }

    @Test
    void testPersistedFingerprintsAreSkipped() {
        KnownFingerprints known = KnownFingerprints.seededWith(Set.of(Fingerprints.of("alpha")));

        DedupResult result = deduplicator.filter(List.of(unit("alpha", "a.md", 1), unit("gamma", "a.md", 2)), known);

        assertEquals(List.of("gamma"), result.unique().stream().map(FingerprintedUnit::getText).toList());
        assertEquals(1, result.skippedCount());
    }

    @Test
    void testAcceptedFingerprintsCarryAcrossCalls() {
        KnownFingerprints known = KnownFingerprints.empty();

        DedupResult first = deduplicator.filter(List.of(unit("shared text", "a.md", 1)), known);
        DedupResult second = deduplicator.filter(List.of(unit("shared text", "b.md", 1)), known);

        assertEquals(1, first.unique().size());
        assertTrue(second.unique().isEmpty());
        assertEquals(1, second.skippedCount());
        assertTrue(known.contains(Fingerprints.of("shared text")));
    }

    @Test
    void testSeparateRunsDoNotShareState() {
        List<TextUnit> units = List.of(unit("alpha", "a.md", 1));

        assertEquals(1, deduplicator.filter(units, KnownFingerprints.empty()).unique().size());
        assertEquals(1, deduplicator.filter(units, KnownFingerprints.empty()).unique().size());
    }

    @Test
    void testFingerprintIgnoresSurroundingWhitespace() {
        assertEquals(Fingerprints.of("same text"), Fingerprints.of("  same text\n"));
        assertNotEquals(Fingerprints.of("same text"), Fingerprints.of("same  text"));
        assertEquals(64, Fingerprints.of("x").length());
        assertEquals("2d711642b726b04401627ca9fbac32f5c8530fb1903cc4db02258717921a4881", Fingerprints.of("x"));
    }

    @Test
    void testLargeInputKeepsOrder() {
        List<TextUnit> units = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            units.add(unit("unit " + (i % 400), "big.md", i + 1));
        }

        DedupResult result = deduplicator.filter(units, KnownFingerprints.empty());

        assertEquals(400, result.unique().size());
        assertEquals(600, result.skippedCount());
        for (int i = 0; i < 400; i++) {
            assertEquals("unit " + i, result.unique().get(i).getText());
        }
    }

    private static TextUnit unit(String text, String path, int line) {
        return TextUnit.builder()
            .text(text)
            .sourcePath(path)
            .startLine(line)
            .endLine(line)
            .startOffset(0)
            .endOffset(text.length())
            .build();
    }
}
