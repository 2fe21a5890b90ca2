package com.example.reminderscheduler.service.store;

import com.example.reminderscheduler.domain.entity.ReminderJob;
import com.example.reminderscheduler.domain.enums.JobStatus;
import com.example.reminderscheduler.domain.enums.TargetKind;
import com.example.reminderscheduler.domain.repository.ReminderJobRepository;
import com.example.reminderscheduler.domain.trigger.CronTrigger;
import com.example.reminderscheduler.domain.trigger.DateTrigger;
import com.example.reminderscheduler.domain.trigger.IntervalTrigger;
import com.example.reminderscheduler.domain.trigger.ReminderPayload;
import com.example.reminderscheduler.domain.trigger.Trigger;
import com.example.reminderscheduler.exception.DuplicateJobIdException;
import com.example.reminderscheduler.exception.JobNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import(JpaJobStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("JpaJobStore Tests")
class JpaJobStoreTest {

    private static final Instant T0 = Instant.parse("2030-01-01T00:00:00Z");

    @Autowired
    private JobStore jobStore;

    @Autowired
    private ReminderJobRepository repository;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    private static ReminderJob job(String id, Trigger trigger, Instant nextRunTime, String targetId) {
        var job = ReminderJob.builder()
                .id(id)
                .status(JobStatus.SCHEDULED)
                .nextRunTime(nextRunTime)
                .misfireGraceSeconds(60)
                .build();
        job.setTrigger(trigger);
        job.setPayload(ReminderPayload.builder()
                .targetKind(TargetKind.CHANNEL)
                .targetId(targetId)
                .message("message for " + id)
                .authorId("7")
                .build());
        return job;
    }

    private static DateTrigger at(Instant runDate) {
        return DateTrigger.builder().runDate(runDate).build();
    }

    @Nested
    @DisplayName("create and read Tests")
    class CreateReadTests {

        @Test
        @DisplayName("Should persist a job so its trigger reads back unchanged")
        void shouldRoundTripTrigger() {
            var trigger = CronTrigger.builder()
                    .month("jan-mar")
                    .dayOfWeek("mon,wed")
                    .hour("9")
                    .zone(ZoneId.of("America/New_York"))
                    .startDate(T0)
                    .jitterSeconds(15)
                    .build();

            jobStore.create(job("cron-1", trigger, T0, "42"));

            var stored = jobStore.read("cron-1");
            assertThat(stored.getTrigger()).isEqualTo(trigger);
            assertThat(stored.getPayload().getMessage()).isEqualTo("message for cron-1");
            assertThat(stored.getCreatedAt()).isNotNull();
            assertThat(stored.getRunCount()).isZero();
        }

        @Test
        @DisplayName("Should reject a duplicate id")
        void shouldRejectDuplicateId() {
            jobStore.create(job("dup", at(T0), T0, "42"));

            assertThatThrownBy(() -> jobStore.create(job("dup", at(T0), T0, "42")))
                    .isInstanceOf(DuplicateJobIdException.class);
        }

        @Test
        @DisplayName("Should report a missing job")
        void shouldReportMissingJob() {
            assertThat(jobStore.find("missing")).isEmpty();
            assertThatThrownBy(() -> jobStore.read("missing")).isInstanceOf(JobNotFoundException.class);
            assertThatThrownBy(() -> jobStore.delete("missing")).isInstanceOf(JobNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("update Tests")
    class UpdateTests {

        @Test
        @DisplayName("Should apply the mutator and persist the result")
        void shouldApplyMutator() {
            jobStore.create(job("interval-1", IntervalTrigger.builder().minutes(5).startDate(T0).build(), T0, "42"));

            var updated = jobStore.update("interval-1", job -> {
                job.recordRun(T0);
                job.setNextRunTime(T0.plusSeconds(300));
            });

            assertThat(updated.getRunCount()).isEqualTo(1);
            var stored = jobStore.read("interval-1");
            assertThat(stored.getNextRunTime()).isEqualTo(T0.plusSeconds(300));
            assertThat(stored.getLastRunAt()).isEqualTo(T0);
        }

        @Test
        @DisplayName("Should delete a one-shot job marked completed")
        void shouldDeleteCompletedOneShot() {
            jobStore.create(job("once", at(T0), T0, "42"));

            var last = jobStore.update("once", ReminderJob::markCompleted);

            assertThat(last.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(jobStore.find("once")).isEmpty();
        }

        @Test
        @DisplayName("Should keep a completed recurring job")
        void shouldKeepCompletedRecurringJob() {
            jobStore.create(job("recurring", IntervalTrigger.builder().minutes(5).build(), T0, "42"));

            jobStore.update("recurring", ReminderJob::markCompleted);

            assertThat(jobStore.read("recurring").getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(jobStore.countByStatus(JobStatus.COMPLETED)).isEqualTo(1);
        }

        @Test
        @DisplayName("Should leave the job untouched when the mutator throws")
        void shouldNotPersistFailedMutation() {
            jobStore.create(job("guarded", at(T0), T0, "42"));

            assertThatThrownBy(() -> jobStore.update("guarded", job -> {
                job.setMessage("half done");
                throw new IllegalStateException("rejected");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(jobStore.read("guarded").getMessage()).isEqualTo("message for guarded");
        }

        @Test
        @DisplayName("Should fail for a missing job")
        void shouldFailForMissingJob() {
            assertThatThrownBy(() -> jobStore.update("missing", job -> job.setMessage("x")))
                    .isInstanceOf(JobNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Query Tests")
    class QueryTests {

        @Test
        @DisplayName("Should list scheduled jobs by next run time then id")
        void shouldFindScheduledInOrder() {
            jobStore.create(job("b", at(T0), T0, "42"));
            jobStore.create(job("a", at(T0), T0, "42"));
            jobStore.create(job("early", at(T0.minusSeconds(60)), T0.minusSeconds(60), "42"));
            var paused = job("paused", at(T0), T0, "42");
            paused.setStatus(JobStatus.PAUSED);
            jobStore.create(paused);

            var scheduled = jobStore.findScheduled();

            assertThat(scheduled).extracting(ReminderJob::getId).containsExactly("early", "a", "b");
        }

        @Test
        @DisplayName("Should list all jobs ordered by id")
        void shouldListOrderedById() {
            jobStore.create(job("z", at(T0), T0, "1"));
            jobStore.create(job("m", at(T0), T0, "2"));

            assertThat(jobStore.list()).extracting(ReminderJob::getId).containsExactly("m", "z");
        }

        @Test
        @DisplayName("Should page through jobs of the given targets")
        void shouldListByTargets() {
            jobStore.create(job("a", at(T0), T0, "channel-1"));
            jobStore.create(job("b", at(T0), T0, "channel-2"));
            jobStore.create(job("c", at(T0), T0, "channel-1"));

            var page = jobStore.listByTargets(List.of("channel-1"), PageRequest.of(0, 10));

            assertThat(page.getTotalElements()).isEqualTo(2);
            assertThat(page.getContent()).extracting(ReminderJob::getTargetId).containsOnly("channel-1");
        }
    }
}
