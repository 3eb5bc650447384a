package br.edu.ifba.finrag.exception;

/**
 * Thrown when caller-supplied parameters contradict each other, e.g. a chunk overlap
 * that is not smaller than the chunk size. Never retried.
 */
public class InvalidConfigException extends FinRagException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigException(final String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
