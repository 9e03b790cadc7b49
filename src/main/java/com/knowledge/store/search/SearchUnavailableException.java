package com.knowledge.store.search;

/**
 * Thrown by {@link AsyncSearchClient#init()} when the cluster does not answer the ping.
 */
public class SearchUnavailableException extends RuntimeException {

    public SearchUnavailableException(String message) {
        super(message);
    }

    public SearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
