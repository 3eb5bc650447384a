package br.edu.ifba.finrag.config;

import br.edu.ifba.finrag.chunking.TextChunker;
import br.edu.ifba.finrag.embedding.EmbeddingFunction;
import br.edu.ifba.finrag.evidence.EvidenceFormatter;
import br.edu.ifba.finrag.indexing.DocumentIndexingService;
import br.edu.ifba.finrag.indexing.IndexWriter;
import br.edu.ifba.finrag.metrics.ConceptNormalizer;
import br.edu.ifba.finrag.metrics.DeltaCalculator;
import br.edu.ifba.finrag.metrics.FinancialRatio;
import br.edu.ifba.finrag.metrics.FinancialRatioCalculator;
import br.edu.ifba.finrag.metrics.MetricsEngine;
import br.edu.ifba.finrag.metrics.RatioAnomalyDetector;
import br.edu.ifba.finrag.metrics.RatioRange;
import br.edu.ifba.finrag.metrics.SeriesAnomalyDetector;
import br.edu.ifba.finrag.metrics.TrendAnalyzer;
import br.edu.ifba.finrag.metrics.forecast.ForecastService;
import br.edu.ifba.finrag.metrics.forecast.LinearForecastStrategy;
import br.edu.ifba.finrag.metrics.forecast.SeasonalForecastStrategy;
import br.edu.ifba.finrag.retrieval.Retriever;
import br.edu.ifba.finrag.storage.VectorStorage;
import br.edu.ifba.finrag.storage.impl.InMemoryVectorStorage;
import br.edu.ifba.finrag.storage.impl.SQLiteConnectionManager;
import br.edu.ifba.finrag.storage.impl.SQLiteVectorStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CDI producer wiring the core components from {@link FinRagConfig}.
 *
 * <p>The vector index backend is chosen by {@code finrag.storage.backend}. Storage and the
 * indexing worker pool are closed on shutdown.</p>
 */
@ApplicationScoped
public class FinRagProducers {

    private static final Logger LOG = Logger.getLogger(FinRagProducers.class);

    @Inject
    FinRagConfig config;

    @Inject
    EmbeddingFunction embeddingFunction;

    @Inject
    IndexWriter indexWriter;

    @Inject
    ObjectMapper objectMapper;

    private VectorStorage vectorStorage;
    private DocumentIndexingService indexingService;

    @PostConstruct
    void initialize() {
        config.validate();
        LOG.infof("FinRAG core configured: backend=%s, chunk=%d/%d, retrieval mode=%s",
            config.storage().backend(), config.chunk().size(), config.chunk().overlap(), config.retrieval().mode());
    }

    @PreDestroy
    void shutdown() {
        if (indexingService != null) {
            indexingService.close();
        }
        if (vectorStorage != null) {
            try {
                vectorStorage.close();
            } catch (Exception e) {
                LOG.warn("Failed to close vector storage", e);
            }
        }
    }

    @Produces
    @Singleton
    public TextChunker produceTextChunker() {
        return new TextChunker(config.chunk().size(), config.chunk().overlap());
    }

    @Produces
    @Singleton
    public synchronized VectorStorage produceVectorStorage() {
        if (vectorStorage != null) {
            return vectorStorage;
        }
        FinRagConfig.Storage storage = config.storage();
        if (storage.backend() == FinRagConfig.Storage.Backend.SQLITE) {
            FinRagConfig.Storage.Sqlite sqlite = storage.sqlite();
            SQLiteConnectionManager connectionManager = new SQLiteConnectionManager(
                sqlite.path(), sqlite.busyTimeout(), sqlite.readPoolSize());
            vectorStorage = new SQLiteVectorStorage(connectionManager, objectMapper, sqlite.tableName());
            LOG.infof("Using SQLite vector storage at %s", sqlite.path());
        } else {
            vectorStorage = new InMemoryVectorStorage();
            LOG.info("Using in-memory vector storage");
        }
        vectorStorage.initialize().join();
        return vectorStorage;
    }

    @Produces
    @Singleton
    public Retriever produceRetriever(VectorStorage storage) {
        FinRagConfig.Retrieval retrieval = config.retrieval();
        return new Retriever(embeddingFunction, storage, config.embedding().timeout(),
            retrieval.mode(), retrieval.topK(), retrieval.documentTopK());
    }

    @Produces
    @Singleton
    public synchronized DocumentIndexingService produceIndexingService(TextChunker chunker, VectorStorage storage) {
        if (indexingService == null) {
            FinRagConfig.Indexing indexing = config.indexing();
            indexingService = new DocumentIndexingService(chunker, embeddingFunction, storage, indexWriter,
                indexing.parallelism());
        }
        return indexingService;
    }

    @Produces
    @Singleton
    public MetricsEngine produceMetricsEngine() {
        FinRagConfig.Metrics metrics = config.metrics();
        FinRagConfig.Metrics.Forecast forecast = metrics.forecast();
        SeasonalForecastStrategy seasonal = forecast.seasonalEnabled()
            ? new SeasonalForecastStrategy(forecast.alpha(), forecast.beta(), forecast.gamma())
            : null;

        return new MetricsEngine(
            new ConceptNormalizer(),
            new FinancialRatioCalculator(),
            new DeltaCalculator(metrics.yoyLag()),
            new TrendAnalyzer(),
            new RatioAnomalyDetector(ratioRanges(metrics.ratioRanges())),
            new SeriesAnomalyDetector(),
            new ForecastService(new LinearForecastStrategy(), seasonal));
    }

    @Produces
    @Singleton
    public EvidenceFormatter produceEvidenceFormatter() {
        return new EvidenceFormatter();
    }

    /**
     * Converts configured ranges to ratio keys; falls back to the built-in table when none are set.
     */
    static Map<String, RatioRange> ratioRanges(Map<String, FinRagConfig.Metrics.Range> configured) {
        if (configured.isEmpty()) {
            return RatioAnomalyDetector.DEFAULT_RANGES;
        }
        Map<String, RatioRange> ranges = new LinkedHashMap<>();
        configured.forEach((name, range) -> {
            String key = name.toLowerCase(Locale.ROOT).replace('-', '_');
            if (FinancialRatio.fromKey(key).isEmpty()) {
                throw new IllegalArgumentException("Unknown ratio in finrag.metrics.ratio-ranges: " + name);
            }
            ranges.put(key, new RatioRange(range.min(), range.max()));
        });
        return ranges;
    }
}
