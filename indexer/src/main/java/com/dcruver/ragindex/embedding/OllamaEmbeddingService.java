package com.dcruver.ragindex.embedding;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Embedding backend backed by a Spring AI {@link EmbeddingModel} talking to Ollama.
 * Failures propagate so the caller can bisect and retry.
 */
@Service
@Slf4j
public class OllamaEmbeddingService implements EmbeddingBackend {

    private final EmbeddingModel embeddingModel;

    public OllamaEmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
        log.info("OllamaEmbeddingService initialized with EmbeddingModel: {}", embeddingModel.getClass().getSimpleName());
    }

    /**
     * Generate embeddings for multiple texts, one vector per text in input order
     */
    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        EmbeddingResponse response;
        try {
            response = embeddingModel.embedForResponse(texts);
        } catch (RuntimeException e) {
            throw new EmbeddingException("Ollama embedding request failed: " + e.getMessage(), e);
        }

        List<float[]> vectors = response.getResults().stream()
            .map(result -> result.getOutput())
            .toList();

        if (vectors.size() != texts.size()) {
            throw new EmbeddingException(String.format(
                "Ollama returned %d embeddings for %d texts", vectors.size(), texts.size()));
        }
        return vectors;
    }
}
