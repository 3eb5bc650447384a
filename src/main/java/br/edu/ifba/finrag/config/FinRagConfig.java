package br.edu.ifba.finrag.config;

import br.edu.ifba.finrag.retrieval.RetrievalMode;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration of the retrieval and metrics core.
 *
 * <p>All properties are read from application.properties with the prefix "finrag".</p>
 *
 * <h2>Configuration Groups:</h2>
 * <ul>
 *   <li><b>chunk</b> - chunk window and overlap</li>
 *   <li><b>embedding</b> - embedding model, batching and timeout</li>
 *   <li><b>retrieval</b> - default result sizes and failure mode</li>
 *   <li><b>storage</b> - vector index backend</li>
 *   <li><b>indexing</b> - parallelism and write retries</li>
 *   <li><b>metrics</b> - YoY lag, forecasting and ratio normal ranges</li>
 * </ul>
 *
 * <h2>Example Configuration:</h2>
 * <pre>{@code
 * finrag.chunk.size=1000
 * finrag.chunk.overlap=200
 * finrag.retrieval.mode=strict
 * finrag.storage.backend=sqlite
 * finrag.storage.sqlite.path=data/finrag.db
 * finrag.metrics.ratio-ranges.current-ratio.min=1.0
 * finrag.metrics.ratio-ranges.current-ratio.max=3.0
 * }</pre>
 */
@ConfigMapping(prefix = "finrag")
public interface FinRagConfig {

    Chunk chunk();

    Embedding embedding();

    Retrieval retrieval();

    Storage storage();

    Indexing indexing();

    Metrics metrics();

    /**
     * Validates relations between properties that constraint annotations cannot express.
     *
     * @throws IllegalArgumentException if the configuration is inconsistent
     */
    default void validate() {
        if (chunk().overlap() >= chunk().size()) {
            throw new IllegalArgumentException(String.format(
                "Chunk overlap (%d) must be smaller than chunk size (%d)", chunk().overlap(), chunk().size()));
        }
        if (embedding().timeout().isNegative() || embedding().timeout().isZero()) {
            throw new IllegalArgumentException("Embedding timeout must be positive, got " + embedding().timeout());
        }
        for (Map.Entry<String, Metrics.Range> range : metrics().ratioRanges().entrySet()) {
            if (range.getValue().min() > range.getValue().max()) {
                throw new IllegalArgumentException(String.format(
                    "Ratio range %s has min %.3f above max %.3f",
                    range.getKey(), range.getValue().min(), range.getValue().max()));
            }
        }
    }

    interface Chunk {
        /**
         * Maximum chunk length in characters.
         */
        @WithDefault("1000")
        @Min(1)
        int size();

        /**
         * Characters shared by consecutive chunks.
         */
        @WithDefault("200")
        @Min(0)
        int overlap();
    }

    interface Embedding {
        @WithDefault("text-embedding-3-small")
        String model();

        /**
         * Expected vector dimension; responses of another size are rejected.
         */
        @WithDefault("1536")
        @Min(1)
        int dimension();

        @WithName("batch-size")
        @WithDefault("64")
        @Min(1)
        @Max(2048)
        int batchSize();

        /**
         * Upper bound for one query embedding call made by the retriever.
         */
        @WithDefault("10s")
        Duration timeout();

        @WithName("api-key")
        Optional<String> apiKey();
    }

    interface Retrieval {
        @WithName("top-k")
        @WithDefault("5")
        @Min(0)
        int topK();

        @WithName("document-top-k")
        @WithDefault("10")
        @Min(0)
        int documentTopK();

        /**
         * STRICT fails closed when the query cannot be embedded; BEST_EFFORT returns empty evidence.
         */
        @WithDefault("strict")
        RetrievalMode mode();
    }

    interface Storage {
        /**
         * {@code memory} or {@code sqlite}.
         */
        @WithDefault("memory")
        Backend backend();

        Sqlite sqlite();

        enum Backend {
            MEMORY,
            SQLITE
        }

        interface Sqlite {
            @WithDefault("data/finrag.db")
            String path();

            @WithName("table-name")
            @WithDefault("chunk_vectors")
            String tableName();

            @WithName("busy-timeout")
            @WithDefault("30s")
            Duration busyTimeout();

            @WithName("read-pool-size")
            @WithDefault("4")
            @Min(1)
            int readPoolSize();
        }
    }

    interface Indexing {
        /**
         * Documents indexed concurrently by {@code indexAll}.
         */
        @WithDefault("4")
        @Min(1)
        @Max(64)
        int parallelism();

        /**
         * Retries of a failed index write; also read by the write's retry policy.
         */
        @WithName("max-write-retries")
        @WithDefault("2")
        @Min(0)
        int maxWriteRetries();
    }

    interface Metrics {
        /**
         * Points between a quarter and the same quarter of the previous year.
         */
        @WithName("yoy-lag")
        @WithDefault("4")
        @Min(1)
        int yoyLag();

        Forecast forecast();

        /**
         * Normal ranges keyed by ratio, e.g. {@code current-ratio} or {@code current_ratio}.
         * Values outside a range produce warnings.
         */
        @WithName("ratio-ranges")
        Map<String, Range> ratioRanges();

        interface Range {
            double min();

            double max();
        }

        interface Forecast {
            /**
             * Disabling makes every seasonal request fall back to the linear strategy.
             */
            @WithName("seasonal-enabled")
            @WithDefault("true")
            boolean seasonalEnabled();

            @WithDefault("0.5")
            @DecimalMin(value = "0.0", inclusive = false)
            @DecimalMax(value = "1.0", inclusive = false)
            double alpha();

            @WithDefault("0.1")
            @DecimalMin(value = "0.0", inclusive = false)
            @DecimalMax(value = "1.0", inclusive = false)
            double beta();

            @WithDefault("0.3")
            @DecimalMin(value = "0.0", inclusive = false)
            @DecimalMax(value = "1.0", inclusive = false)
            double gamma();
        }
    }
}
