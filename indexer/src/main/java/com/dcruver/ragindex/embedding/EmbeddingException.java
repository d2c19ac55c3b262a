package com.dcruver.ragindex.embedding;

import com.dcruver.ragindex.domain.IndexingException;

/**
 * An embedding call failed and could not be recovered by splitting the batch.
 */
public class EmbeddingException extends IndexingException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
