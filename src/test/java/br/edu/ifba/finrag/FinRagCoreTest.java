package br.edu.ifba.finrag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import br.edu.ifba.finrag.chunking.Chunk;
import br.edu.ifba.finrag.config.FinRagConfig;
import br.edu.ifba.finrag.embedding.EmbeddingApiClient;
import br.edu.ifba.finrag.embedding.EmbeddingApiRequest;
import br.edu.ifba.finrag.embedding.EmbeddingApiResponse;
import br.edu.ifba.finrag.embedding.EmbeddingFunction;
import br.edu.ifba.finrag.evidence.EvidenceFormatter;
import br.edu.ifba.finrag.evidence.EvidenceReport;
import br.edu.ifba.finrag.evidence.FootnoteKind;
import br.edu.ifba.finrag.exception.EmbeddingUnavailableException;
import br.edu.ifba.finrag.indexing.DocumentIndexingService;
import br.edu.ifba.finrag.indexing.IndexingResult;
import br.edu.ifba.finrag.metrics.FinancialSummary;
import br.edu.ifba.finrag.metrics.FiscalPeriod;
import br.edu.ifba.finrag.metrics.MetricsEngine;
import br.edu.ifba.finrag.metrics.TimeSeriesPoint;
import br.edu.ifba.finrag.retrieval.EvidenceBundle;
import br.edu.ifba.finrag.retrieval.RetrievalMode;
import br.edu.ifba.finrag.retrieval.Retriever;
import br.edu.ifba.finrag.storage.VectorStorage;
import br.edu.ifba.finrag.storage.impl.InMemoryVectorStorage;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;

/**
 * Wires the core through CDI with the embedding REST client mocked, then indexes,
 * retrieves and formats evidence for one filing.
 */
@QuarkusTest
class FinRagCoreTest {

    private static final Logger LOG = Logger.getLogger(FinRagCoreTest.class);

    private static final int DIMENSION = 8;

    @Inject
    FinRagConfig config;

    @Inject
    EmbeddingFunction embeddingFunction;

    @Inject
    VectorStorage vectorStorage;

    @Inject
    DocumentIndexingService indexingService;

    @Inject
    Retriever retriever;

    @Inject
    MetricsEngine metricsEngine;

    @Inject
    EvidenceFormatter evidenceFormatter;

    @InjectMock
    @RestClient
    EmbeddingApiClient embeddingClient;

    @BeforeEach
    void setUp() {
        when(embeddingClient.embed(any(EmbeddingApiRequest.class)))
            .thenAnswer(invocation -> respond(invocation.getArgument(0, EmbeddingApiRequest.class), DIMENSION));
    }

    @AfterEach
    void tearDown() {
        vectorStorage.clear().join();
    }

    private static EmbeddingApiResponse respond(EmbeddingApiRequest request, int dimension) {
        List<EmbeddingApiResponse.Embedding> data = new ArrayList<>();
        for (int i = 0; i < request.input().size(); i++) {
            data.add(new EmbeddingApiResponse.Embedding(i, vectorOf(request.input().get(i), dimension)));
        }
        return new EmbeddingApiResponse(request.model(), data);
    }

    private static EmbeddingApiResponse respondAfter(long delayMillis, EmbeddingApiRequest request) throws InterruptedException {
        Thread.sleep(delayMillis);
        return respond(request, DIMENSION);
    }

    private static List<Double> vectorOf(String text, int dimension) {
        double[] buckets = new double[dimension];
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            if (!word.isEmpty()) {
                buckets[Math.floorMod(word.hashCode(), dimension)] += 1.0;
            }
        }
        List<Double> vector = new ArrayList<>(dimension);
        for (double bucket : buckets) {
            vector.add(bucket);
        }
        return vector;
    }

    @Test
    void configurationIsLoadedFromTestProfile() {
        assertEquals(DIMENSION, config.embedding().dimension());
        assertEquals(RetrievalMode.STRICT, retriever.getMode());
        assertInstanceOf(InMemoryVectorStorage.class, vectorStorage);
        assertEquals(7, config.metrics().ratioRanges().size());
    }

    @Test
    void apiKeyFromConfigurationBecomesBearerHeader() {
        EmbeddingApiClient client = request -> null;

        assertEquals("Bearer test-key", client.lookupAuth());
    }

    @Test
    void indexedFilingIsRetrievedAndCited() {
        IndexingResult result = indexingService.onDocumentAdded("filing-1",
            "Revenue was $1,000,000 in Q1",
            Map.of(Chunk.META_COMPANY, "ACME", Chunk.META_PERIOD, "2023Q1")).join();
        assertTrue(result.isIndexed());

        EvidenceBundle bundle = retriever.retrieve("What was revenue?").join();
        LOG.infof("Retrieved %d hits", bundle.hits().size());

        assertTrue(bundle.hits().get(0).text().contains("Revenue"));
        assertEquals(1, bundle.citations().get(0).index());
        assertEquals("ACME", bundle.citations().get(0).company());
    }

    @Test
    void evidenceReportNumbersCitationsBeforeMetrics() {
        indexingService.onDocumentAdded("filing-2", "Revenue grew to $1,100,000 in Q2", Map.of()).join();
        FinancialSummary summary = metricsEngine.summarize("ACME", List.of(
            new TimeSeriesPoint("ACME", FiscalPeriod.quarter(2023, 1), "Revenue", 1_000_000),
            new TimeSeriesPoint("ACME", FiscalPeriod.quarter(2023, 2), "Revenue", 1_100_000)), null);

        EvidenceReport report = evidenceFormatter.format(retriever.retrieve("revenue").join(), summary);

        assertEquals(FootnoteKind.CITATION, report.footnotes().get(0).kind());
        assertEquals(FootnoteKind.DELTA, report.footnotes().get(report.footnotes().size() - 1).kind());
        assertTrue(report.renderFootnotes().contains("QoQ +10.00%"));
    }

    @Test
    void largeInputsAreSentInBatches() {
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < config.embedding().batchSize() + 6; i++) {
            texts.add("segment revenue " + i);
        }

        List<float[]> vectors = embeddingFunction.embed(texts).join();

        assertEquals(texts.size(), vectors.size());
        verify(embeddingClient, times(2)).embed(any(EmbeddingApiRequest.class));
    }

    @Test
    void wrongVectorDimensionIsAnEmbeddingFailure() {
        when(embeddingClient.embed(any(EmbeddingApiRequest.class)))
            .thenAnswer(invocation -> respond(invocation.getArgument(0, EmbeddingApiRequest.class), DIMENSION + 1));

        CompletionException error = assertThrows(CompletionException.class,
            () -> retriever.retrieve("What was revenue?").join());

        assertInstanceOf(EmbeddingUnavailableException.class, error.getCause());
        verify(embeddingClient, times(1)).embed(any(EmbeddingApiRequest.class));
    }

    @Test
    void embeddingRunsOffTheCallerThread() {
        when(embeddingClient.embed(any(EmbeddingApiRequest.class)))
            .thenAnswer(invocation -> respondAfter(300, invocation.getArgument(0, EmbeddingApiRequest.class)));

        CompletableFuture<List<float[]>> pending = embeddingFunction.embed(List.of("revenue"));

        assertFalse(pending.isDone());
        assertEquals(1, pending.join().size());
    }

    @Test
    void slowEndpointFailsClosedAtConfiguredTimeout() {
        long timeoutMillis = config.embedding().timeout().toMillis();
        when(embeddingClient.embed(any(EmbeddingApiRequest.class)))
            .thenAnswer(invocation -> respondAfter(timeoutMillis + 1_500, invocation.getArgument(0, EmbeddingApiRequest.class)));

        long started = System.nanoTime();
        CompletionException error = assertThrows(CompletionException.class,
            () -> retriever.retrieve("What was revenue?").join());
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertInstanceOf(EmbeddingUnavailableException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("timed out"));
        assertTrue(elapsedMillis < timeoutMillis + 1_000, "took " + elapsedMillis + " ms");
    }
}
