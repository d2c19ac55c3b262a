package com.dcruver.ragindex.sync;

import com.dcruver.ragindex.domain.FingerprintedUnit;
import com.dcruver.ragindex.domain.TextUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops units whose fingerprint is already known, recording every accepted one
 * so later units in the same call, or later calls sharing the set, see it.
 */
@Component
@Slf4j
public class Deduplicator {

    private static final int PROGRESS_INTERVAL = 100;

    public DedupResult filter(List<TextUnit> units, KnownFingerprints known) {
        List<FingerprintedUnit> unique = new ArrayList<>();
        int skipped = 0;

        for (int i = 0; i < units.size(); i++) {
            FingerprintedUnit candidate = FingerprintedUnit.of(units.get(i));
            if (known.accept(candidate.getFingerprint())) {
                unique.add(candidate);
            } else {
                skipped++;
            }

            if (i > 0 && i % PROGRESS_INTERVAL == 0) {
                log.debug("Fingerprinted {}/{} units", i, units.size());
            }
        }

        return new DedupResult(List.copyOf(unique), skipped);
    }
}
