package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.JobExecutionLogHistory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for archived execution logs
 */
@Repository
public interface JobExecutionLogHistoryRepository extends JpaRepository<JobExecutionLogHistory, UUID> {

    Page<JobExecutionLogHistory> findByJobIdOrderByStartedAtDesc(UUID jobId, Pageable pageable);
}
