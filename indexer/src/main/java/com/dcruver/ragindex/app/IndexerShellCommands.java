package com.dcruver.ragindex.app;

import com.dcruver.ragindex.config.IndexerProperties;
import com.dcruver.ragindex.domain.IndexingReport;
import com.dcruver.ragindex.pipeline.IndexingOrchestrator;
import com.dcruver.ragindex.reporting.IndexReportFormatter;
import com.dcruver.ragindex.store.UnitStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Spring Shell commands for the indexer.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class IndexerShellCommands {

    private final IndexingOrchestrator orchestrator;
    private final UnitStore unitStore;
    private final IndexReportFormatter formatter;
    private final IndexerProperties properties;

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${spring.ai.ollama.embedding.options.model:nomic-embed-text:latest}")
    private String embeddingModelName;

    @ShellMethod(key = "index", value = "Index new and modified files and drop removed ones")
    public String index(
            @ShellOption(defaultValue = ShellOption.NULL, help = "Source directory (defaults to indexer.source.path)") String path,
            @ShellOption(defaultValue = "false", help = "Drop the whole index and rebuild it") boolean clear) {
        Path root = Paths.get(path != null ? path : properties.getSource().getPath());
        log.info("Indexing {}{}", root, clear ? " (clearing first)" : "");

        IndexingReport report = orchestrator.index(root, clear);
        return formatter.format(report);
    }

    @ShellMethod(key = "status", value = "Show how many units and files are in the index")
    public String status() {
        try {
            long units = unitStore.countUnits();
            int files = unitStore.getFileRecords().size();

            StringBuilder sb = new StringBuilder();
            sb.append("Index status:\n");
            sb.append(String.format("- Database: %s\n", properties.getStore().getDatabase()));
            sb.append(String.format("- Files: %d\n", files));
            sb.append(String.format("- Units: %d\n", units));
            return sb.toString();
        } catch (Exception e) {
            log.error("Status failed", e);
            return "Status failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "files", value = "List indexed files with their unit counts")
    public String files() {
        try {
            return formatter.formatFileStats(unitStore.fileStats());
        } catch (Exception e) {
            log.error("Listing files failed", e);
            return "Listing files failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "config", value = "Show the active indexer configuration")
    public String config() {
        IndexerProperties.Chunking chunking = properties.getChunking();
        IndexerProperties.Batching batching = properties.getBatching();

        StringBuilder sb = new StringBuilder();
        sb.append("Source:\n");
        sb.append(String.format("- Path: %s\n", properties.getSource().getPath()));
        sb.append(String.format("- Extensions: %s\n", String.join(", ", properties.getSource().getExtensions())));
        sb.append("\nChunking:\n");
        sb.append(String.format("- Strategy: %s\n", chunking.getStrategy()));
        sb.append(String.format("- Size: %d\n", chunking.getSize()));
        sb.append(String.format("- Overlap: %d\n", chunking.getOverlap()));
        sb.append(String.format("- Minimum unit chars: %d\n", chunking.getMinUnitChars()));
        sb.append("\nBatching:\n");
        sb.append(String.format("- Max texts per batch: %d\n", batching.getMaxTextsPerBatch()));
        sb.append(String.format("- Max chars per batch: %d\n", batching.getMaxCharsPerBatch()));
        sb.append(String.format("- Max tokens per batch: %d\n", batching.getMaxTokensPerBatch()));
        sb.append(String.format("- Max concurrent embeddings: %d\n", batching.getMaxConcurrentEmbeddings()));
        sb.append(String.format("- Retry depth: %d\n", batching.getRetryDepth()));
        sb.append(String.format("- Batch timeout: %ds\n", batching.getBatchTimeout().toSeconds()));
        sb.append("\nEmbedding:\n");
        sb.append(String.format("- Ollama: %s\n", ollamaBaseUrl));
        sb.append(String.format("- Model: %s\n", embeddingModelName));
        sb.append(String.format("- Database: %s\n", properties.getStore().getDatabase()));
        return sb.toString();
    }
}
