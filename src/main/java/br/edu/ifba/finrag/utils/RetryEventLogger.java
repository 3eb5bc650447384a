package br.edu.ifba.finrag.utils;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging for retried index writes. {@link br.edu.ifba.finrag.indexing.IndexWriter}
 * calls it from its {@code @BeforeRetry} handler and after the final attempt.
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li><code>retry.operation</code> - the operation being retried, e.g. {@code replaceDocument}</li>
 *   <li><code>retry.document</code> - the document the write belongs to</li>
 *   <li><code>retry.attempt</code> - current attempt number (1-based)</li>
 *   <li><code>retry.exception</code> - exception class that triggered the retry</li>
 * </ul>
 *
 * <h2>Log Format Example:</h2>
 * <pre>
 * INFO  [RetryEventLogger] Retry attempt 2/3 for replaceDocument [doc-42]: IndexUnavailableException - database is locked
 * WARN  [RetryEventLogger] Retry exhausted for replaceDocument [doc-42] after 3 attempts: IndexUnavailableException - ...
 * INFO  [RetryEventLogger] replaceDocument [doc-42] succeeded on attempt 2
 * </pre>
 */
@ApplicationScoped
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    private static final String MDC_RETRY_OPERATION = "retry.operation";
    private static final String MDC_RETRY_DOCUMENT = "retry.document";
    private static final String MDC_RETRY_ATTEMPT = "retry.attempt";
    private static final String MDC_RETRY_EXCEPTION = "retry.exception";

    private static final int MAX_MESSAGE_LENGTH = 200;

    /**
     * Logs a failed attempt that is about to be retried.
     *
     * @param operation   operation name
     * @param documentId  document the write belongs to
     * @param attempt     the attempt that failed (1-based)
     * @param maxAttempts configured attempt limit
     * @param failure     the failure, may be null
     */
    public void logRetryAttempt(final String operation, final String documentId,
                                final int attempt, final int maxAttempts, final Throwable failure) {
        final String exceptionName = exceptionName(failure);
        try {
            putContext(operation, documentId, attempt, exceptionName);
            logger.info("Retry attempt {}/{} for {} [{}]: {} - {}",
                attempt, maxAttempts, operation, documentId, exceptionName, truncateMessage(message(failure)));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs that the last allowed attempt failed.
     */
    public void logRetryExhausted(final String operation, final String documentId,
                                  final int totalAttempts, final Throwable failure) {
        final String exceptionName = exceptionName(failure);
        try {
            putContext(operation, documentId, totalAttempts, exceptionName);
            logger.warn("Retry exhausted for {} [{}] after {} attempts: {} - {}",
                operation, documentId, totalAttempts, exceptionName, truncateMessage(message(failure)));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs success; silent when the first attempt succeeded.
     */
    public void logRetrySuccess(final String operation, final String documentId, final int totalAttempts) {
        if (totalAttempts <= 1) {
            return;
        }
        try {
            putContext(operation, documentId, totalAttempts, null);
            logger.info("{} [{}] succeeded on attempt {}", operation, documentId, totalAttempts);
        } finally {
            clearMDC();
        }
    }

    private void putContext(final String operation, final String documentId, final int attempt,
                            final String exceptionName) {
        MDC.put(MDC_RETRY_OPERATION, operation);
        MDC.put(MDC_RETRY_DOCUMENT, documentId);
        MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
        if (exceptionName != null) {
            MDC.put(MDC_RETRY_EXCEPTION, exceptionName);
        }
    }

    private void clearMDC() {
        MDC.remove(MDC_RETRY_OPERATION);
        MDC.remove(MDC_RETRY_DOCUMENT);
        MDC.remove(MDC_RETRY_ATTEMPT);
        MDC.remove(MDC_RETRY_EXCEPTION);
    }

    private static String exceptionName(final Throwable failure) {
        return failure != null ? failure.getClass().getSimpleName() : "unknown";
    }

    private static String message(final Throwable failure) {
        return failure != null ? failure.getMessage() : "no message";
    }

    private String truncateMessage(final String message) {
        if (message == null) {
            return "null";
        }
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
