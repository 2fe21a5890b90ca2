package com.example.reminderscheduler.service.store;

import com.example.reminderscheduler.domain.entity.ReminderJob;
import com.example.reminderscheduler.domain.enums.JobStatus;
import com.example.reminderscheduler.domain.repository.ReminderJobRepository;
import com.example.reminderscheduler.exception.DuplicateJobIdException;
import com.example.reminderscheduler.exception.JobNotFoundException;
import com.example.reminderscheduler.exception.JobStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@link JobStore} over Spring Data JPA.
 * <p>
 * Updates lock the row with SELECT ... FOR UPDATE and are additionally guarded by the
 * entity's {@code @Version}. Writes are flushed inside the method so constraint and
 * locking failures are translated here rather than at commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    private final ReminderJobRepository repository;

    @Override
    @Transactional
    public ReminderJob create(ReminderJob job) {
        try {
            if (repository.existsById(job.getId())) {
                throw new DuplicateJobIdException(job.getId());
            }
            var saved = repository.saveAndFlush(job);
            log.debug("Stored reminder {}", saved.getId());
            return saved.copy();
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateJobIdException(job.getId(), e);
        } catch (DataAccessException e) {
            throw new JobStoreException("create", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public ReminderJob read(String id) {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ReminderJob> find(String id) {
        try {
            return repository.findById(id).map(ReminderJob::copy);
        } catch (DataAccessException e) {
            throw new JobStoreException("read", e);
        }
    }

    @Override
    @Transactional
    public ReminderJob update(String id, Consumer<ReminderJob> mutator) {
        try {
            var job = repository.findByIdForUpdate(id)
                    .orElseThrow(() -> new JobNotFoundException(id));
            mutator.accept(job);
            if (job.isDisposable()) {
                repository.delete(job);
                repository.flush();
                log.debug("Removed finished one-shot reminder {}", id);
                return job.copy();
            }
            return repository.saveAndFlush(job).copy();
        } catch (DataAccessException e) {
            throw new JobStoreException("update", e);
        }
    }

    @Override
    @Transactional
    public void delete(String id) {
        try {
            var job = repository.findByIdForUpdate(id)
                    .orElseThrow(() -> new JobNotFoundException(id));
            repository.delete(job);
            repository.flush();
        } catch (DataAccessException e) {
            throw new JobStoreException("delete", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReminderJob> list() {
        try {
            return repository.findAllByOrderByIdAsc().stream().map(ReminderJob::copy).toList();
        } catch (DataAccessException e) {
            throw new JobStoreException("list", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ReminderJob> list(Pageable pageable) {
        try {
            return repository.findAll(pageable).map(ReminderJob::copy);
        } catch (DataAccessException e) {
            throw new JobStoreException("list", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ReminderJob> listByTargets(Collection<String> targetIds, Pageable pageable) {
        try {
            return repository.findByTargetIdIn(targetIds, pageable).map(ReminderJob::copy);
        } catch (DataAccessException e) {
            throw new JobStoreException("list", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReminderJob> findScheduled() {
        try {
            return repository.findDueCandidates(JobStatus.SCHEDULED).stream().map(ReminderJob::copy).toList();
        } catch (DataAccessException e) {
            throw new JobStoreException("findScheduled", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countByStatus(JobStatus status) {
        try {
            return repository.countByStatus(status);
        } catch (DataAccessException e) {
            throw new JobStoreException("count", e);
        }
    }
}
