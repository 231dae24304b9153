package com.example.jobscheduler.mapper;

import com.example.jobscheduler.domain.entity.SchedulerJob;
import com.example.jobscheduler.domain.model.JobMetadata;
import com.example.jobscheduler.dto.SchedulerJobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

/**
 * MapStruct mapper for converting stored jobs to DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface SchedulerJobMapper {

    /**
     * Combine the stored job with its decoded metadata
     */
    @Mapping(target = "id", source = "job.id")
    @Mapping(target = "schedule", source = "job.schedule")
    @Mapping(target = "runCount", source = "job.runCount")
    @Mapping(target = "stopped", source = "job.stopped")
    @Mapping(target = "lastTick", source = "job.lastTickInstant")
    @Mapping(target = "nextTick", source = "job.nextTickInstant")
    @Mapping(target = "jobType", source = "metadata.jobType")
    @Mapping(target = "retryAttempts", source = "metadata.retry.attempts")
    @Mapping(target = "retryNextAt", source = "metadata.retry.nextAt")
    SchedulerJobResponse toResponse(SchedulerJob job, JobMetadata metadata);
}
