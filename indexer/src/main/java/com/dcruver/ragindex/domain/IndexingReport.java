package com.dcruver.ragindex.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of one indexing run. A failed run keeps the counts reached before the failure.
 */
@Value
@Builder
public class IndexingReport {
    IndexingStage stage;
    /** Stage that was running when the run failed, null on success */
    IndexingStage failedStage;
    String failureMessage;

    int filesScanned;
    int filesIndexed;
    int filesDeleted;
    int filesUnchanged;
    int filesFailed;

    int unitsAdded;
    int unitsSkipped;
    long totalUnitsInStore;

    Duration duration;

    public boolean isSuccess() {
        return stage == IndexingStage.DONE;
    }
}
