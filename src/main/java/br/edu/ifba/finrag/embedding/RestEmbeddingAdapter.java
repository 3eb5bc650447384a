package br.edu.ifba.finrag.embedding;

import br.edu.ifba.finrag.config.FinRagConfig;
import br.edu.ifba.finrag.exception.EmbeddingUnavailableException;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges the REST embedding endpoint to the {@link EmbeddingFunction} port.
 *
 * <p>Texts are sent in batches of {@code finrag.embedding.batch-size} from a small worker
 * pool, so callers get a pending future and can bound the wait themselves. Any failure left
 * after the endpoint's own retries surfaces as {@link EmbeddingUnavailableException}.</p>
 */
@ApplicationScoped
public class RestEmbeddingAdapter implements EmbeddingFunction {

    private static final Logger LOG = Logger.getLogger(RestEmbeddingAdapter.class);

    private static final int WORKER_THREADS = 4;

    private final AtomicInteger threadCounter = new AtomicInteger();

    private final ExecutorService executor = Executors.newFixedThreadPool(WORKER_THREADS, runnable -> {
        final Thread thread = new Thread(runnable, "finrag-embedding-" + threadCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    @Inject
    EmbeddingEndpoint endpoint;

    @Inject
    FinRagConfig config;

    @Override
    public CompletableFuture<List<float[]>> embed(@NotNull final List<String> texts) {
        if (texts.isEmpty()) {
            LOG.warn("Empty text list provided for embedding");
            return CompletableFuture.completedFuture(List.of());
        }

        final List<String> input = List.copyOf(texts);
        return CompletableFuture.supplyAsync(() -> embedBatches(input), executor);
    }

    private List<float[]> embedBatches(final List<String> texts) {
        try {
            final int batchSize = config.embedding().batchSize();
            final List<float[]> embeddings = new ArrayList<>(texts.size());
            for (int i = 0; i < texts.size(); i += batchSize) {
                embeddings.addAll(endpoint.embedBatch(texts.subList(i, Math.min(i + batchSize, texts.size()))));
            }
            LOG.debugf("Generated %d embeddings with dimension %d",
                    Integer.valueOf(embeddings.size()),
                    Integer.valueOf(embeddings.get(0).length));
            return embeddings;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error calling embedding endpoint");
            throw new CompletionException(
                    new EmbeddingUnavailableException("Failed to generate embeddings: " + e.getMessage(), e));
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
