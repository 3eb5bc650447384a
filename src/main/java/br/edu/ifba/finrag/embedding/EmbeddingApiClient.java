package br.edu.ifba.finrag.embedding;

import br.edu.ifba.finrag.config.FinRagConfig;
import io.smallrye.config.SmallRyeConfig;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for an OpenAI-compatible {@code /embeddings} endpoint.
 */
@RegisterRestClient(configKey = "embedding-api")
@ClientHeaderParam(name = "Authorization", value = "{lookupAuth}")
public interface EmbeddingApiClient {

    @POST
    @Path("/embeddings")
    EmbeddingApiResponse embed(EmbeddingApiRequest request);

    default String lookupAuth() {
        return ConfigProvider.getConfig()
            .unwrap(SmallRyeConfig.class)
            .getConfigMapping(FinRagConfig.class)
            .embedding()
            .apiKey()
            .map(key -> "Bearer " + key)
            .orElse(null);
    }
}
