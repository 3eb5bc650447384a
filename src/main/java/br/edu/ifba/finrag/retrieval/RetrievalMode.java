package br.edu.ifba.finrag.retrieval;

/**
 * How the retriever reacts when the query cannot be embedded.
 */
public enum RetrievalMode {
    /** Embedding failures propagate as {@link br.edu.ifba.finrag.exception.EmbeddingUnavailableException}. */
    STRICT,
    /** Embedding failures are logged and an empty bundle is returned. */
    BEST_EFFORT
}
