package com.example.aijobscheduler.controller;

import com.example.aijobscheduler.dto.ApiResponse;
import com.example.aijobscheduler.dto.CreateJobRequest;
import com.example.aijobscheduler.dto.JobResponse;
import com.example.aijobscheduler.dto.JobRunResponse;
import com.example.aijobscheduler.dto.UpdateJobRequest;
import com.example.aijobscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for job management.
 * <p>
 * Provides endpoints for:
 * - Creating, updating and deleting jobs
 * - Retrieving jobs with their running state and next fire time
 * - Triggering a run outside the schedule
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "APIs for managing scheduled AI jobs")
public class JobController {

    private final JobManagementService jobManagementService;

    // === Job Retrieval ===

    @GetMapping
    @Operation(summary = "List jobs", description = "List all jobs, newest first")
    public ResponseEntity<ApiResponse<List<JobResponse>>> listJobs() {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.listJobs()));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job by ID", description = "Retrieve a job and whether it is currently running")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJob(jobId)));
    }

    // === Job Mutation ===

    @PostMapping
    @Operation(summary = "Create a job", description = "Create a job and arm its schedule if enabled")
    public ResponseEntity<ApiResponse<JobResponse>> createJob(@Valid @RequestBody CreateJobRequest request) {
        log.info("API: Create job '{}' with cron '{}'", request.getName(), request.getCronExpression());

        var response = jobManagementService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Job created successfully"));
    }

    @PutMapping("/{jobId}")
    @Operation(summary = "Update a job", description = "Partially update a job and re-arm its schedule")
    public ResponseEntity<ApiResponse<JobResponse>> updateJob(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Valid @RequestBody UpdateJobRequest request) {
        log.info("API: Update job {}", jobId);

        var response = jobManagementService.updateJob(jobId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Job updated successfully"));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Delete a job", description = "Delete a job, its run history and its schedule")
    public ResponseEntity<Void> deleteJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Delete job {}", jobId);

        jobManagementService.deleteJob(jobId);
        return ResponseEntity.noContent().build();
    }

    // === Execution ===

    @PostMapping("/{jobId}/run")
    @Operation(summary = "Run a job now", description = "Start a run outside the schedule. Returns the running run unless wait=true.")
    public ResponseEntity<ApiResponse<JobRunResponse>> runJob(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Parameter(description = "Wait for the run to finish")
            @RequestParam(defaultValue = "false") boolean wait) {
        log.info("API: Manual run of job {} (wait={})", jobId, wait);

        var response = jobManagementService.triggerJobManually(jobId, wait);
        var status = wait ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(ApiResponse.success(response, wait ? "Job run finished" : "Job run started"));
    }
}
