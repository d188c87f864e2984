package com.example.aijobscheduler.client;

/**
 * Produces markdown content for a prompt.
 */
public interface GenerationClient {

    /**
     * @throws com.example.aijobscheduler.exception.WorkerExecutionException if no content could be generated
     */
    String generate(String prompt);
}
