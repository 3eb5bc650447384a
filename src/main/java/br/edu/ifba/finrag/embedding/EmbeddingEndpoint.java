package br.edu.ifba.finrag.embedding;

import br.edu.ifba.finrag.config.FinRagConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Guarded single-batch call to the embedding endpoint.
 *
 * <p>Kept as its own bean so the fault tolerance interceptors apply when
 * {@link RestEmbeddingAdapter} calls it.</p>
 */
@ApplicationScoped
public class EmbeddingEndpoint {

    private static final Logger LOG = Logger.getLogger(EmbeddingEndpoint.class);

    @Inject
    @RestClient
    EmbeddingApiClient embeddingClient;

    @Inject
    FinRagConfig config;

    /**
     * Embeds one batch. Malformed responses abort immediately; transport failures and
     * timeouts are retried.
     *
     * @param batch texts to embed, at most {@code finrag.embedding.batch-size}
     * @return vectors in input order
     */
    @Timeout(value = 10, unit = ChronoUnit.SECONDS)
    @Retry(maxRetries = 2, delay = 500, abortOn = IllegalStateException.class)
    public List<float[]> embedBatch(final List<String> batch) {
        final EmbeddingApiResponse response = embeddingClient.embed(
                new EmbeddingApiRequest(config.embedding().model(), batch));

        if (response == null || response.getData() == null || response.getData().isEmpty()) {
            throw new IllegalStateException("Embedding endpoint returned no data");
        }
        if (response.getData().size() != batch.size()) {
            throw new IllegalStateException(String.format(
                    "Expected %d embeddings but received %d", batch.size(), response.getData().size()));
        }

        final int expectedDimension = config.embedding().dimension();
        final List<EmbeddingApiResponse.Embedding> ordered = new ArrayList<>(response.getData());
        ordered.sort(Comparator.comparingInt(EmbeddingApiResponse.Embedding::getIndex));

        final List<float[]> vectors = new ArrayList<>(ordered.size());
        for (final EmbeddingApiResponse.Embedding data : ordered) {
            final List<Double> values = data.getEmbedding();
            if (values == null || values.isEmpty()) {
                throw new IllegalStateException("Embedding endpoint returned an empty vector");
            }
            if (values.size() != expectedDimension) {
                throw new IllegalStateException(String.format(
                        "Vector dimension mismatch: expected %d but got %d", expectedDimension, values.size()));
            }
            final float[] vector = new float[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = values.get(i).floatValue();
            }
            vectors.add(vector);
        }

        LOG.debugf("Embedded batch of %d texts with model %s",
                Integer.valueOf(batch.size()), config.embedding().model());
        return vectors;
    }
}
