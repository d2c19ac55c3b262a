package com.dcruver.ragindex.embedding;

import java.util.List;

/**
 * Turns texts into vectors. Implementations return one vector per input text,
 * in input order, with a constant dimensionality. Any runtime exception is
 * treated as a retryable failure.
 */
public interface EmbeddingBackend {

    List<float[]> embed(List<String> texts);
}
