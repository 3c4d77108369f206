package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.Job;
import com.example.jobscheduler.domain.enums.JobPriority;
import com.example.jobscheduler.domain.enums.JobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for Job entity
 */
@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    Page<Job> findByStatus(JobStatus status, Pageable pageable);

    Page<Job> findByPriorityAndStatusNot(JobPriority priority, JobStatus status, Pageable pageable);

    Page<Job> findByStatusAndPriority(JobStatus status, JobPriority priority, Pageable pageable);

    /**
     * All jobs that have not been deleted
     */
    Page<Job> findByStatusNot(JobStatus status, Pageable pageable);

    long countByStatus(JobStatus status);

    /**
     * Get job counts grouped by status
     */
    @Query("""
            SELECT j.status as status, COUNT(j) as count
            FROM Job j
            GROUP BY j.status
            """)
    List<Object[]> getJobStatsByStatus();
}
