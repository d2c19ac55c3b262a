package com.dcruver.ragindex.store;

import com.dcruver.ragindex.domain.IndexingException;

/**
 * A read or write against the unit store failed.
 */
public class StoreException extends IndexingException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
