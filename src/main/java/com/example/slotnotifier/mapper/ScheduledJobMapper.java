package com.example.slotnotifier.mapper;

import com.example.slotnotifier.domain.entity.JobExecutionLog;
import com.example.slotnotifier.domain.entity.ScheduledJob;
import com.example.slotnotifier.dto.JobExecutionLogResponse;
import com.example.slotnotifier.dto.ScheduledJobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ScheduledJobMapper {

    ScheduledJobResponse toResponse(ScheduledJob job);

    List<ScheduledJobResponse> toResponseList(List<ScheduledJob> jobs);

    JobExecutionLogResponse toLogResponse(JobExecutionLog log);

    List<JobExecutionLogResponse> toLogResponses(List<JobExecutionLog> logs);
}
