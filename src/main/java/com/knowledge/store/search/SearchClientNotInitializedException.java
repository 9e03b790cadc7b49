package com.knowledge.store.search;

/**
 * Thrown when {@link AsyncSearchClient} methods are called before {@link AsyncSearchClient#init()}
 * succeeded or after the client was closed.
 */
public class SearchClientNotInitializedException extends IllegalStateException {

    public static final String MESSAGE = "Search client not initialized; call init() first";

    public SearchClientNotInitializedException() {
        super(MESSAGE);
    }
}
