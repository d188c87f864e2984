package com.example.aijobscheduler.exception;

/**
 * Transient failure of the generation API (connection error, 429 or 5xx).
 * The only failure the generation client retries on.
 */
public class GenerationUnavailableException extends WorkerExecutionException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
