package com.dcruver.ragindex.domain;

/**
 * Stages of one indexing run. DONE and FAILED are terminal.
 */
public enum IndexingStage {
    SCANNING,
    RECONCILING,
    PREPARING,
    EMBEDDING,
    WRITING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
