package com.example.aijobscheduler.service.worker;

import java.time.Duration;

/**
 * Launches the content-generating worker for one run and waits for it within a budget.
 */
public interface WorkerInvocation {

    /**
     * @return the worker result, successful or not, when it finished within {@code timeout}
     * @throws com.example.aijobscheduler.exception.ExecutionTimeoutException if the budget elapsed; the worker has been stopped
     * @throws com.example.aijobscheduler.exception.WorkerExecutionException  if the worker could not be launched
     */
    WorkerResult invoke(WorkerRequest request, Duration timeout);
}
