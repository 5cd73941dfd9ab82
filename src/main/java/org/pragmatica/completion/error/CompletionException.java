package org.pragmatica.completion.error;

/**
 * Unchecked carrier for a {@link CompletionError}.
 */
public final class CompletionException extends RuntimeException {
    private final CompletionError error;

    public CompletionException(CompletionError error) {
        super(error.message());
        this.error = error;
    }

    public CompletionError error() {
        return error;
    }
}
