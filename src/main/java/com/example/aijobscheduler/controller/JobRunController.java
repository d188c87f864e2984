package com.example.aijobscheduler.controller;

import com.example.aijobscheduler.dto.ApiResponse;
import com.example.aijobscheduler.dto.JobRunResponse;
import com.example.aijobscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for run history
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/job-runs")
@Tag(name = "Job Runs", description = "APIs for browsing job run history")
public class JobRunController {

    private final JobManagementService jobManagementService;

    @GetMapping
    @Operation(summary = "List recent runs", description = "Most recent runs across all jobs, newest first")
    public ResponseEntity<ApiResponse<List<JobRunResponse>>> listRuns(
            @Parameter(description = "Maximum number of runs (1-500)")
            @RequestParam(defaultValue = "" + JobManagementService.DEFAULT_RUN_LIMIT) int limit) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.listRuns(limit)));
    }

    @GetMapping("/{runId}")
    @Operation(summary = "Get run by ID", description = "Retrieve a run with its output and log")
    public ResponseEntity<ApiResponse<JobRunResponse>> getRun(@Parameter(description = "Run UUID") @PathVariable UUID runId) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getRun(runId)));
    }
}
