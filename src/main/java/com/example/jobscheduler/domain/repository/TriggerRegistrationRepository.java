package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.TriggerRegistration;
import com.example.jobscheduler.domain.enums.TriggerStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for the durable scheduler's trigger registrations.
 * <p>
 * Due registrations are claimed with FOR UPDATE SKIP LOCKED so concurrent
 * dispatchers never pick the same row.
 */
@Repository
public interface TriggerRegistrationRepository extends JpaRepository<TriggerRegistration, UUID> {

    /**
     * Find registrations whose next fire time has passed, earliest first
     */
    @Query(value = """
            SELECT t.* FROM trigger_registrations t
            WHERE t.status = 'ACTIVE'
              AND t.next_fire_time <= :now
            ORDER BY t.next_fire_time ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<TriggerRegistration> findDueForUpdate(@Param("now") Instant now, @Param("limit") int limit);

    long countByStatus(TriggerStatus status);
}
