package com.dcruver.ragindex.domain;

import lombok.Value;

import java.util.List;

/**
 * Result of reconciling a directory snapshot against the persisted file index.
 */
@Value
public class SyncPlan {
    /** New or modified files, sorted by path */
    List<String> toIndex;
    /** Files recorded in the index but no longer on disk, sorted by path */
    List<String> toDelete;
    int unchangedCount;

    public boolean isNoOp() {
        return toIndex.isEmpty() && toDelete.isEmpty();
    }
}
