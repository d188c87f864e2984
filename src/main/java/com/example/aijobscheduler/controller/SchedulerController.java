package com.example.aijobscheduler.controller;

import com.example.aijobscheduler.dto.ApiResponse;
import com.example.aijobscheduler.dto.CronParseRequest;
import com.example.aijobscheduler.dto.CronParseResponse;
import com.example.aijobscheduler.dto.SchedulerStatusResponse;
import com.example.aijobscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Scheduler status and cron expression helper
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Scheduler", description = "Scheduler status and cron utilities")
public class SchedulerController {

    private final JobManagementService jobManagementService;

    @GetMapping("/status")
    @Operation(summary = "Scheduler status", description = "Whether the scheduler is running, armed timers and job counts")
    public ResponseEntity<ApiResponse<SchedulerStatusResponse>> getStatus() {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.schedulerStatus()));
    }

    @PostMapping("/cron/parse")
    @Operation(summary = "Parse a cron expression", description = "Validate, describe and preview the next 5 fire times")
    public ResponseEntity<ApiResponse<CronParseResponse>> parseCron(@Valid @RequestBody CronParseRequest request) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.parseCron(request.getCronExpression())));
    }
}
