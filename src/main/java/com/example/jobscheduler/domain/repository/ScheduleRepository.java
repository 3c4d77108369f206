package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.Schedule;
import com.example.jobscheduler.domain.enums.ScheduleStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for Schedule entity
 */
@Repository
public interface ScheduleRepository extends JpaRepository<Schedule, UUID> {

    /**
     * Schedules of a job excluding the given status (typically DELETED)
     */
    List<Schedule> findByJobIdAndStatusNotOrderByCreatedAtAsc(UUID jobId, ScheduleStatus status);

    List<Schedule> findByJobIdAndStatus(UUID jobId, ScheduleStatus status);

    /**
     * Schedules still holding a registration with the durable scheduler
     */
    List<Schedule> findByJobIdAndTriggerHandleIsNotNull(UUID jobId);
}
