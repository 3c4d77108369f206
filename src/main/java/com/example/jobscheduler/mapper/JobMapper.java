package com.example.jobscheduler.mapper;

import com.example.jobscheduler.domain.entity.Job;
import com.example.jobscheduler.domain.entity.JobExecutionLog;
import com.example.jobscheduler.domain.entity.JobExecutionLogHistory;
import com.example.jobscheduler.domain.entity.Schedule;
import com.example.jobscheduler.dto.JobExecutionLogResponse;
import com.example.jobscheduler.dto.JobResponse;
import com.example.jobscheduler.dto.ScheduleResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    /**
     * Convert Job entity to JobResponse DTO; schedules are attached by the caller
     */
    @Mapping(target = "schedules", ignore = true)
    JobResponse toResponse(Job job);

    ScheduleResponse toScheduleResponse(Schedule schedule);

    List<ScheduleResponse> toScheduleResponses(List<Schedule> schedules);

    JobExecutionLogResponse toLogResponse(JobExecutionLog log);

    JobExecutionLogResponse toArchivedLogResponse(JobExecutionLogHistory archivedLog);
}
