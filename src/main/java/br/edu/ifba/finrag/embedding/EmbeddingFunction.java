package br.edu.ifba.finrag.embedding;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for text-to-vector embedding.
 *
 * <p>Implementations must return exactly one vector per input text, in input order, and
 * every vector produced by one model must have the same dimensionality. The call may be
 * network-bound; callers bound it with a timeout.</p>
 */
@FunctionalInterface
public interface EmbeddingFunction {

    /**
     * Generate embeddings for a batch of texts.
     *
     * @param texts texts to embed
     * @return future with one embedding per input text
     */
    CompletableFuture<List<float[]>> embed(@NotNull List<String> texts);

    /**
     * Convenience method for embedding a single text.
     */
    default CompletableFuture<float[]> embedSingle(@NotNull String text) {
        return embed(List.of(text)).thenApply(embeddings -> embeddings.get(0));
    }
}
