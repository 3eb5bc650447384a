package br.edu.ifba.finrag.indexing;

import org.jetbrains.annotations.Nullable;

/**
 * Attempt counter for one guarded index write. The same instance is passed to every
 * retry of the write, so it sees all attempts.
 */
public final class WriteAttempts {

    private int count;
    private Throwable lastFailure;

    int begin() {
        return ++count;
    }

    void failed(Throwable failure) {
        lastFailure = failure;
    }

    public int count() {
        return count;
    }

    @Nullable
    public Throwable lastFailure() {
        return lastFailure;
    }
}
