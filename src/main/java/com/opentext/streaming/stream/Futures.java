package com.opentext.streaming.stream;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class Futures {

    private Futures() {
    }

    /** Strip the wrappers added by CompletableFuture composition. */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
