package br.edu.ifba.finrag.indexing;

import br.edu.ifba.finrag.config.FinRagConfig;
import br.edu.ifba.finrag.exception.FinRagException;
import br.edu.ifba.finrag.exception.IndexUnavailableException;
import br.edu.ifba.finrag.storage.VectorStorage;
import br.edu.ifba.finrag.storage.VectorStorage.VectorEntry;
import br.edu.ifba.finrag.utils.RetryEventLogger;
import io.smallrye.faulttolerance.api.BeforeRetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jetbrains.annotations.NotNull;

import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Guarded per-document index write.
 *
 * <p>Writes failing with {@link IndexUnavailableException} are retried by the fault tolerance
 * interceptor. The limits come from
 * {@code br.edu.ifba.finrag.indexing.IndexWriter/replaceDocument/Retry/*} and default to
 * {@code finrag.indexing.max-write-retries}. Other failures propagate on the first attempt.
 * Built with {@code new}, the writer makes exactly one attempt.</p>
 */
@ApplicationScoped
public class IndexWriter {

    static final String OPERATION = "replaceDocument";

    private RetryEventLogger retryEventLogger;
    private int maxAttempts;

    @Inject
    public IndexWriter(RetryEventLogger retryEventLogger, FinRagConfig config) {
        this(retryEventLogger, config.indexing().maxWriteRetries() + 1);
    }

    public IndexWriter(@NotNull RetryEventLogger retryEventLogger, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.retryEventLogger = retryEventLogger;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Replaces the indexed chunks of a document, blocking until the storage confirms.
     *
     * @param attempts shared across retries; holds the attempt count afterwards
     */
    @Retry(maxRetries = 2, delay = 200, delayUnit = ChronoUnit.MILLIS, maxDuration = 30,
        durationUnit = ChronoUnit.SECONDS, retryOn = IndexUnavailableException.class)
    @BeforeRetry(methodName = "logRetry")
    public void replaceDocument(@NotNull VectorStorage storage, @NotNull String documentId,
                                @NotNull List<VectorEntry> entries, @NotNull WriteAttempts attempts) {
        int attempt = attempts.begin();
        try {
            storage.replaceDocument(documentId, entries).join();
        } catch (RuntimeException e) {
            RuntimeException failure = asRuntime(FinRagException.unwrap(e));
            attempts.failed(failure);
            if (failure instanceof IndexUnavailableException && attempt >= maxAttempts) {
                retryEventLogger.logRetryExhausted(OPERATION, documentId, attempt, failure);
            }
            throw failure;
        }
        retryEventLogger.logRetrySuccess(OPERATION, documentId, attempt);
    }

    void logRetry(VectorStorage storage, String documentId, List<VectorEntry> entries, WriteAttempts attempts) {
        retryEventLogger.logRetryAttempt(OPERATION, documentId, attempts.count(), maxAttempts, attempts.lastFailure());
    }

    private static RuntimeException asRuntime(Throwable failure) {
        if (failure instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IndexUnavailableException(OPERATION, failure);
    }
}
