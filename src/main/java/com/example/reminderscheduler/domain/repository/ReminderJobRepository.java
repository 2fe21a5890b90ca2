package com.example.reminderscheduler.domain.repository;

import com.example.reminderscheduler.domain.entity.ReminderJob;
import com.example.reminderscheduler.domain.enums.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ReminderJob entity.
 */
@Repository
public interface ReminderJobRepository extends JpaRepository<ReminderJob, String> {

    /**
     * Load a job holding a row lock (SELECT ... FOR UPDATE) until the transaction ends.
     * Serializes the scheduler loop and lifecycle operations on the same id.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM ReminderJob j WHERE j.id = :id")
    Optional<ReminderJob> findByIdForUpdate(@Param("id") String id);

    /**
     * Jobs that belong in the due set, earliest first
     */
    @Query("""
            SELECT j FROM ReminderJob j
            WHERE j.status = :status
              AND j.nextRunTime IS NOT NULL
            ORDER BY j.nextRunTime ASC, j.id ASC
            """)
    List<ReminderJob> findDueCandidates(@Param("status") JobStatus status);

    List<ReminderJob> findAllByOrderByIdAsc();

    Page<ReminderJob> findByTargetIdIn(Collection<String> targetIds, Pageable pageable);

    long countByStatus(JobStatus status);
}
