package com.pos.completion.service;

/**
 * Thrown when a completion run fails for a reason other than dirty input data,
 * e.g. an unexpected error inside a worker thread. Dirty data never raises it.
 */
public class CompletionComputationException extends RuntimeException {

    public CompletionComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
