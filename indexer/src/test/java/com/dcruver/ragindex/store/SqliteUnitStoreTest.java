package com.dcruver.ragindex.store;

import com.dcruver.ragindex.domain.FileUnitCount;
import com.dcruver.ragindex.domain.Fingerprints;
import com.dcruver.ragindex.domain.IndexedUnit;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SQLite unit store against a temporary database file.
 */
class SqliteUnitStoreTest {

    @TempDir
    Path tempDir;

    private SqliteUnitStore store;

    @BeforeEach
    void setUp() {
        store = openStore(tempDir.resolve("index.db"));
    }

    @Test
    void testWriteAndCountUnits() {
        store.writeUnits(List.of(unit("a.md", 1, "alpha"), unit("a.md", 2, "beta"), unit("b.md", 1, "gamma")));

        assertEquals(3, store.countUnits());
        assertEquals(Set.of(Fingerprints.of("alpha"), Fingerprints.of("beta"), Fingerprints.of("gamma")),
            store.getKnownFingerprints());
    }

    @Test
    void testEmptyWriteIsIgnored() {
        store.writeUnits(List.of());

        assertEquals(0, store.countUnits());
    }

    @Test
    void testVectorsArePersistedAsWritten() {
        float[] vector = {0.25f, -1.5f, 3.0f};
        store.writeUnits(List.of(unit("a.md", 1, "alpha", vector)));

        List<float[]> stored = store.vectorsForPath("a.md");

        assertEquals(1, stored.size());
        assertArrayEquals(vector, stored.get(0));
    }

    @Test
    void testUpsertReplacesFileRecord() {
        store.upsertFileRecord("a.md", 100L);
        store.upsertFileRecord("b.md", 200L);
        store.upsertFileRecord("a.md", 150L);

        assertEquals(Map.of("a.md", 150L, "b.md", 200L), store.getFileRecords());
    }

    @Test
    void testDeletesOnlyTouchOnePath() {
        store.writeUnits(List.of(unit("a.md", 1, "alpha"), unit("b.md", 1, "beta"), unit("b.md", 2, "delta")));
        store.upsertFileRecord("a.md", 1L);
        store.upsertFileRecord("b.md", 2L);

        store.deleteUnitsForPath("b.md");
        store.deleteFileRecord("b.md");

        assertEquals(1, store.countUnits());
        assertEquals(Set.of(Fingerprints.of("alpha")), store.getKnownFingerprints());
        assertEquals(Map.of("a.md", 1L), store.getFileRecords());
    }

    @Test
    void testDeletingUnknownPathIsHarmless() {
        store.deleteUnitsForPath("missing.md");
        store.deleteFileRecord("missing.md");

        assertEquals(0, store.countUnits());
    }

    @Test
    void testFileStatsCountUnitsPerPath() {
        store.writeUnits(List.of(unit("b.md", 1, "one"), unit("a.md", 1, "two"), unit("b.md", 2, "three")));

        assertEquals(List.of(new FileUnitCount("a.md", 1), new FileUnitCount("b.md", 2)), store.fileStats());
    }

    @Test
    void testClearRemovesEverything() {
        store.writeUnits(List.of(unit("a.md", 1, "alpha")));
        store.upsertFileRecord("a.md", 1L);

        store.clear();

        assertEquals(0, store.countUnits());
        assertTrue(store.getFileRecords().isEmpty());
        assertTrue(store.fileStats().isEmpty());
    }

    @Test
    void testDataSurvivesReopen() {
        store.writeUnits(List.of(unit("a.md", 1, "alpha")));
        store.upsertFileRecord("a.md", 42L);

        SqliteUnitStore reopened = openStore(tempDir.resolve("index.db"));

        assertEquals(1, reopened.countUnits());
        assertEquals(Map.of("a.md", 42L), reopened.getFileRecords());
    }

    private static SqliteUnitStore openStore(Path database) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + database.toAbsolutePath());

        SqliteUnitStore store = new SqliteUnitStore(dataSource, new ObjectMapper(), "test-model");
        store.init();
        return store;
    }

    private static IndexedUnit unit(String path, int line, String text) {
        return unit(path, line, text, new float[] {line, text.length()});
    }

    private static IndexedUnit unit(String path, int line, String text, float[] vector) {
        return IndexedUnit.builder()
            .id(path + ":" + line + ":" + line)
            .text(text)
            .sourcePath(path)
            .startLine(line)
            .endLine(line)
            .startOffset(0)
            .endOffset(text.length())
            .fingerprint(Fingerprints.of(text))
            .vector(vector)
            .build();
    }
}
