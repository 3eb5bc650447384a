package br.edu.ifba.finrag.exception;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base type for failures raised by the retrieval and indexing core.
 */
public abstract class FinRagException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected FinRagException(final String message) {
        super(message);
    }

    protected FinRagException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the caller may retry the failed operation.
     */
    public abstract boolean isRetryable();

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers added by
     * {@code CompletableFuture} so callers can inspect the original failure.
     *
     * @param throwable the failure as observed on a future
     * @return the innermost non-wrapper cause
     */
    public static Throwable unwrap(final Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
