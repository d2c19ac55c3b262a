package com.dcruver.ragindex.store;

import com.dcruver.ragindex.domain.FileUnitCount;
import com.dcruver.ragindex.domain.IndexedUnit;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persistence for indexed units and the file index. Every method throws
 * {@link StoreException} on failure; whether a failure is fatal is up to the caller.
 */
public interface UnitStore {

    Set<String> getKnownFingerprints();

    /**
     * Indexed source paths mapped to their recorded modification time (epoch millis)
     */
    Map<String, Long> getFileRecords();

    void deleteUnitsForPath(String path);

    /**
     * Replace the file record for {@code path}: any existing record is deleted first.
     */
    void upsertFileRecord(String path, long modifiedTime);

    void deleteFileRecord(String path);

    void writeUnits(List<IndexedUnit> units);

    long countUnits();

    /**
     * Remove every unit and file record
     */
    void clear();

    List<FileUnitCount> fileStats();
}
