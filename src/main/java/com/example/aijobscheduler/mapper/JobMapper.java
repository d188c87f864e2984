package com.example.aijobscheduler.mapper;

import com.example.aijobscheduler.domain.entity.Job;
import com.example.aijobscheduler.domain.entity.JobRun;
import com.example.aijobscheduler.dto.JobResponse;
import com.example.aijobscheduler.dto.JobRunResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    /**
     * Convert Job entity to JobResponse DTO. Derived fields (running, nextRunAt) are set by the caller.
     */
    @Mapping(target = "running", ignore = true)
    @Mapping(target = "nextRunAt", ignore = true)
    JobResponse toResponse(Job job);

    /**
     * Convert JobRun entity to JobRunResponse DTO
     */
    @Mapping(target = "id", source = "run.id")
    @Mapping(target = "jobId", source = "run.jobId")
    @Mapping(target = "jobName", source = "jobName")
    @Mapping(target = "status", source = "run.status.code")
    JobRunResponse toRunResponse(JobRun run, String jobName);
}
