package com.dcruver.ragindex.embedding;

import com.dcruver.ragindex.chunking.TokenEstimator;
import com.dcruver.ragindex.domain.Batch;
import com.dcruver.ragindex.domain.FingerprintedUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedily packs units into batches, preserving input order.
 */
@Component
@Slf4j
public class BatchPlanner {

    public List<Batch> plan(List<FingerprintedUnit> units, BatchLimits limits) {
        List<Batch> batches = new ArrayList<>();
        List<FingerprintedUnit> current = new ArrayList<>();
        int currentChars = 0;
        int currentTokens = 0;

        for (FingerprintedUnit unit : units) {
            int chars = unit.getText().length();
            int tokens = TokenEstimator.estimate(unit.getText());

            if (chars > limits.getMaxChars() || tokens > limits.getMaxTokens()) {
                throw new BatchTooLargeException(unit.getUnit(), chars, tokens, limits);
            }

            boolean fits = current.size() < limits.getMaxCount()
                && currentChars + chars <= limits.getMaxChars()
                && currentTokens + tokens <= limits.getMaxTokens();

            if (!current.isEmpty() && !fits) {
                batches.add(new Batch(batches.size() + 1, List.copyOf(current), currentTokens, currentChars));
                current.clear();
                currentChars = 0;
                currentTokens = 0;
            }

            current.add(unit);
            currentChars += chars;
            currentTokens += tokens;
        }

        if (!current.isEmpty()) {
            batches.add(new Batch(batches.size() + 1, List.copyOf(current), currentTokens, currentChars));
        }

        log.debug("Planned {} batches for {} units", batches.size(), units.size());
        return batches;
    }
}
