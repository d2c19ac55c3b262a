package com.dcruver.ragindex.embedding;

import com.dcruver.ragindex.config.ConfigurationException;
import lombok.Value;

/**
 * Per-batch bounds on unit count, characters and estimated tokens.
 */
@Value
public class BatchLimits {
    int maxCount;
    int maxChars;
    int maxTokens;

    public BatchLimits(int maxCount, int maxChars, int maxTokens) {
        if (maxCount <= 0 || maxChars <= 0 || maxTokens <= 0) {
            throw new ConfigurationException(String.format(
                "Batch limits must be positive (texts=%d, chars=%d, tokens=%d)",
                maxCount, maxChars, maxTokens));
        }
        this.maxCount = maxCount;
        this.maxChars = maxChars;
        this.maxTokens = maxTokens;
    }
}
