package com.dcruver.ragindex.config;

import com.dcruver.ragindex.chunking.Chunker;
import com.dcruver.ragindex.chunking.ChunkerFactory;
import com.dcruver.ragindex.chunking.ChunkingOptions;
import com.dcruver.ragindex.embedding.BatchLimits;
import com.dcruver.ragindex.embedding.EmbeddingExecutor;
import com.dcruver.ragindex.sync.SourceScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the pipeline components from {@link IndexerProperties}.
 * Invalid settings fail here, at startup, before any file is touched.
 */
@Configuration
@Slf4j
public class PipelineConfiguration {

    @Bean
    public ChunkingOptions chunkingOptions(IndexerProperties properties) {
        IndexerProperties.Chunking chunking = properties.getChunking();
        return new ChunkingOptions(chunking.getSize(), chunking.getOverlap());
    }

    @Bean
    public Chunker chunker(IndexerProperties properties) {
        IndexerProperties.Chunking chunking = properties.getChunking();
        log.info("Using {} chunking (size={}, overlap={}, min-unit-chars={})",
            chunking.getStrategy(), chunking.getSize(), chunking.getOverlap(), chunking.getMinUnitChars());
        return ChunkerFactory.create(chunking.getStrategy(), chunking.getMinUnitChars());
    }

    @Bean
    public BatchLimits batchLimits(IndexerProperties properties) {
        IndexerProperties.Batching batching = properties.getBatching();
        return new BatchLimits(
            batching.getMaxTextsPerBatch(),
            batching.getMaxCharsPerBatch(),
            batching.getMaxTokensPerBatch());
    }

    @Bean
    public EmbeddingExecutor embeddingExecutor(IndexerProperties properties) {
        IndexerProperties.Batching batching = properties.getBatching();
        return new EmbeddingExecutor(
            batching.getMaxConcurrentEmbeddings(),
            batching.getRetryDepth(),
            batching.getBatchTimeout());
    }

    @Bean
    public SourceScanner sourceScanner(IndexerProperties properties) {
        return new SourceScanner(properties.getSource().getExtensions());
    }
}
