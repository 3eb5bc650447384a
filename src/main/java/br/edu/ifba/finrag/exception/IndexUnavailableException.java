package br.edu.ifba.finrag.exception;

/**
 * Thrown when the vector index cannot be reached or a storage operation fails.
 *
 * <p>Upserts are idempotent and may be retried; queries fail closed.</p>
 */
public class IndexUnavailableException extends FinRagException {

    private static final long serialVersionUID = 1L;

    private final String operation;

    public IndexUnavailableException(final String operation, final Throwable cause) {
        super("Vector index unavailable during '" + operation + "': " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public IndexUnavailableException(final String operation, final String message) {
        super("Vector index unavailable during '" + operation + "': " + message);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
