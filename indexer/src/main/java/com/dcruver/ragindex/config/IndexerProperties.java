package com.dcruver.ragindex.config;

import com.dcruver.ragindex.chunking.ChunkingStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Indexer settings bound from the {@code indexer.*} keys of application.yml.
 */
@ConfigurationProperties(prefix = "indexer")
@Data
public class IndexerProperties {

    private Source source = new Source();
    private Chunking chunking = new Chunking();
    private Batching batching = new Batching();
    private Store store = new Store();

    @Data
    public static class Source {
        /** Directory indexed when no path is given on the command line */
        private String path = ".";
        private List<String> extensions = new ArrayList<>(List.of(".txt", ".md", ".markdown"));
    }

    @Data
    public static class Chunking {
        private ChunkingStrategy strategy = ChunkingStrategy.RECURSIVE_TOKEN;
        /** Target tokens (recursive) or characters (fixed-size) per unit */
        private int size = 500;
        private int overlap = 50;
        /** Units shorter than this many characters are dropped; 0 keeps everything */
        private int minUnitChars = 0;
    }

    @Data
    public static class Batching {
        private int maxTextsPerBatch = 64;
        private int maxCharsPerBatch = 150_000;
        private int maxTokensPerBatch = 20_000;
        private int maxConcurrentEmbeddings = 4;
        private int retryDepth = 3;
        private Duration batchTimeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Store {
        private String database = System.getProperty("user.home") + "/.rag-indexer/index.db";
    }
}
