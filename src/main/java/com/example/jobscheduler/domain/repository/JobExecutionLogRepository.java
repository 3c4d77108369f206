package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.JobExecutionLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for JobExecutionLog entity
 */
@Repository
public interface JobExecutionLogRepository extends JpaRepository<JobExecutionLog, UUID> {

    /**
     * Execution history of a job, newest first
     */
    Page<JobExecutionLog> findByJobIdOrderByStartedAtDesc(UUID jobId, Pageable pageable);

    /**
     * Ids of terminal logs that ended before the cutoff, oldest first
     */
    @Query("""
            SELECT el.id FROM JobExecutionLog el
            WHERE el.status <> com.example.jobscheduler.domain.enums.ExecutionStatus.RUNNING
              AND el.endedAt < :cutoff
            ORDER BY el.endedAt ASC
            """)
    List<UUID> findArchivableIds(@Param("cutoff") Instant cutoff, Pageable pageable);

    /**
     * Copy the given logs into the history table
     */
    @Modifying
    @Query(value = """
            INSERT INTO job_execution_log_history
                (id, job_id, execution_id, status, attempts, started_at, ended_at, duration_ms,
                 result, error_message, error_stack, archived_at)
            SELECT el.id, el.job_id, el.execution_id, el.status, el.attempts, el.started_at, el.ended_at, el.duration_ms,
                   el.result, el.error_message, el.error_stack, :archivedAt
            FROM job_execution_logs el
            WHERE el.id IN (:ids)
            ON CONFLICT (id) DO NOTHING
            """, nativeQuery = true)
    int copyToHistory(@Param("ids") List<UUID> ids, @Param("archivedAt") Instant archivedAt);

    @Modifying
    @Query("DELETE FROM JobExecutionLog el WHERE el.id IN :ids")
    int deleteByIds(@Param("ids") List<UUID> ids);
}
