package com.dcruver.ragindex.domain;

/**
 * Base class for errors that abort an indexing run.
 */
public class IndexingException extends RuntimeException {

    public IndexingException(String message) {
        super(message);
    }

    public IndexingException(String message, Throwable cause) {
        super(message, cause);
    }
}
