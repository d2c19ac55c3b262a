package com.dcruver.ragindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the RAG indexer.
 *
 * Keeps a SQLite store of embedded text units in sync with a directory of
 * documents. Only new and modified files are re-embedded on each run, and
 * identical content is embedded once.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class RagIndexerApplication {

    public static void main(String[] args) {
        log.info("Starting RAG indexer...");
        SpringApplication.run(RagIndexerApplication.class, args);
    }
}
