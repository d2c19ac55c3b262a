package com.dcruver.ragindex.config;

import com.dcruver.ragindex.domain.IndexingException;

/**
 * Invalid indexer settings. Raised while beans are built, before any work begins.
 */
public class ConfigurationException extends IndexingException {

    public ConfigurationException(String message) {
        super(message);
    }
}
