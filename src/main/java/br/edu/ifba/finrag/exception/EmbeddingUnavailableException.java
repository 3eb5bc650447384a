package br.edu.ifba.finrag.exception;

/**
 * Thrown when the embedding backend fails or does not answer within the configured timeout.
 */
public class EmbeddingUnavailableException extends FinRagException {

    private static final long serialVersionUID = 1L;

    public EmbeddingUnavailableException(final String message) {
        super(message);
    }

    public EmbeddingUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
