package com.example.reminderscheduler.service.store;

import com.example.reminderscheduler.domain.entity.ReminderJob;
import com.example.reminderscheduler.domain.enums.JobStatus;
import com.example.reminderscheduler.exception.DuplicateJobIdException;
import com.example.reminderscheduler.exception.JobNotFoundException;
import com.example.reminderscheduler.exception.JobStoreException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable keyed storage of reminder jobs.
 * <p>
 * Every operation is its own unit of work and returns detached copies; callers never
 * hold a live record. I/O failures surface as {@link JobStoreException}.
 */
public interface JobStore {

    /**
     * @throws DuplicateJobIdException if a job with the same id exists
     */
    ReminderJob create(ReminderJob job);

    /**
     * @throws JobNotFoundException if absent
     */
    ReminderJob read(String id);

    Optional<ReminderJob> find(String id);

    /**
     * Apply {@code mutator} to the current record while holding its per-id lock, then
     * persist it. A one-shot job the mutator marks completed is deleted instead
     * (see {@link ReminderJob#isDisposable()}). Exceptions thrown by the mutator abort the
     * update and propagate unchanged.
     *
     * @return the record as persisted (or as it was just before deletion)
     * @throws JobNotFoundException if absent
     */
    ReminderJob update(String id, Consumer<ReminderJob> mutator);

    /**
     * @throws JobNotFoundException if absent
     */
    void delete(String id);

    /**
     * Snapshot of all jobs ordered by id. Each call takes a fresh snapshot.
     */
    List<ReminderJob> list();

    Page<ReminderJob> list(Pageable pageable);

    Page<ReminderJob> listByTargets(Collection<String> targetIds, Pageable pageable);

    /**
     * Jobs that belong in the due set, ordered by next run time then id
     */
    List<ReminderJob> findScheduled();

    long countByStatus(JobStatus status);
}
