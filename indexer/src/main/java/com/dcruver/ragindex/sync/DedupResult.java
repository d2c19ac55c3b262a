package com.dcruver.ragindex.sync;

import com.dcruver.ragindex.domain.FingerprintedUnit;

import java.util.List;

/**
 * Units that survived deduplication and the number that were dropped.
 */
public record DedupResult(List<FingerprintedUnit> unique, int skippedCount) {}
