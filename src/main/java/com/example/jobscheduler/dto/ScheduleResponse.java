package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.ScheduleStatus;
import com.example.jobscheduler.domain.enums.ScheduleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {

    private UUID id;
    private UUID jobId;
    private ScheduleType type;
    private String cronExpression;
    private Integer intervalSeconds;
    private Instant executeAt;
    private Instant startTime;
    private Instant endTime;
    private ScheduleStatus status;
    private String triggerHandle;
    private Instant createdAt;
    private Instant updatedAt;
}
