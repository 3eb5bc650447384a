package br.edu.ifba.finrag.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.jetbrains.annotations.NotNull;

/**
 * Deterministic bag-of-words embedding for tests. Each lowercase word is hashed into one of
 * {@code dimension} buckets, so texts sharing words end up close by cosine distance.
 */
public class KeywordEmbeddingFunction implements EmbeddingFunction {

    private final int dimension;
    private final AtomicInteger calls = new AtomicInteger();

    public KeywordEmbeddingFunction() {
        this(1024);
    }

    public KeywordEmbeddingFunction(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public CompletableFuture<List<float[]>> embed(@NotNull List<String> texts) {
        calls.incrementAndGet();
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(vectorOf(text));
        }
        return CompletableFuture.completedFuture(vectors);
    }

    public float[] vectorOf(String text) {
        float[] vector = new float[dimension];
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!word.isEmpty()) {
                vector[Math.floorMod(word.hashCode(), dimension)] += 1f;
            }
        }
        return vector;
    }

    public int calls() {
        return calls.get();
    }
}
