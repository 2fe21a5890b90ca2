package com.example.reminderscheduler.service.scheduler;

import com.example.reminderscheduler.config.MetricsConfig;
import com.example.reminderscheduler.config.ReminderSchedulerProperties;
import com.example.reminderscheduler.domain.enums.JobStatus;
import com.example.reminderscheduler.domain.enums.TargetKind;
import com.example.reminderscheduler.domain.trigger.DateTrigger;
import com.example.reminderscheduler.domain.trigger.IntervalTrigger;
import com.example.reminderscheduler.domain.trigger.ReminderPayload;
import com.example.reminderscheduler.mapper.JobMapper;
import com.example.reminderscheduler.service.ReminderLifecycleService;
import com.example.reminderscheduler.service.alert.NotificationSink;
import com.example.reminderscheduler.service.dispatch.DeliveryResult;
import com.example.reminderscheduler.service.dispatch.MessageDispatcher;
import com.example.reminderscheduler.service.parse.IsoDateTimeParser;
import com.example.reminderscheduler.service.trigger.TriggerEvaluator;
import com.example.reminderscheduler.service.trigger.TriggerFactory;
import com.example.reminderscheduler.support.InMemoryJobStore;
import com.example.reminderscheduler.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchedulerLoop Tests")
class SchedulerLoopTest {

    private static final Instant NOW = Instant.parse("2029-12-31T23:00:00Z");

    @Mock
    private MessageDispatcher messageDispatcher;

    @Mock
    private NotificationSink notificationSink;

    private final InMemoryJobStore jobStore = new InMemoryJobStore();
    private final MutableClock clock = new MutableClock(NOW);
    private final ReminderSchedulerProperties properties = new ReminderSchedulerProperties();
    private final Queue<Runnable> pendingDeliveries = new ArrayDeque<>();

    private SchedulerLoop schedulerLoop;
    private ReminderLifecycleService lifecycleService;

    @BeforeEach
    void setUp() {
        properties.setStoreRetryMaxAttempts(2);
        properties.setStoreRetryInitialBackoffMs(1);
        lenient().when(messageDispatcher.deliver(any())).thenReturn(DeliveryResult.success("msg-1"));
        wire(Runnable::run);
    }

    private void wire(Executor dispatchExecutor) {
        var metricsConfig = new MetricsConfig(new SimpleMeterRegistry(), jobStore);
        var evaluator = new TriggerEvaluator();
        var parser = new IsoDateTimeParser();
        var fireService = new JobFireService(jobStore, evaluator, messageDispatcher, notificationSink,
                metricsConfig, properties, dispatchExecutor);
        schedulerLoop = new SchedulerLoop(jobStore, fireService, notificationSink, metricsConfig, properties, clock);
        lifecycleService = new ReminderLifecycleService(jobStore, evaluator, new TriggerFactory(parser, properties),
                parser, schedulerLoop, Mappers.getMapper(JobMapper.class), properties, clock);
    }

    private static ReminderPayload channelPayload(String message) {
        return ReminderPayload.builder()
                .targetKind(TargetKind.CHANNEL)
                .targetId("42")
                .message(message)
                .authorId("7")
                .build();
    }

    @Nested
    @DisplayName("One-shot Reminder Tests")
    class OneShotTests {

        @Test
        @DisplayName("Should fire once at its run date and then disappear")
        void shouldFireOnceAndDisappear() {
            // Given
            var trigger = DateTrigger.builder().runDate(Instant.parse("2030-01-01T00:00:00Z")).build();
            var created = lifecycleService.add(null, trigger, channelPayload("hi"), null);
            assertThat(lifecycleService.list()).hasSize(1);

            // When - not yet due
            clock.set(Instant.parse("2029-12-31T23:59:59Z"));
            assertThat(schedulerLoop.processDueJobs()).isZero();

            // When - due
            clock.set(Instant.parse("2030-01-01T00:00:00Z"));
            var started = schedulerLoop.processDueJobs();

            // Then
            assertThat(started).isEqualTo(1);
            verify(messageDispatcher, times(1)).deliver(channelPayload("hi"));
            assertThat(lifecycleService.list()).isEmpty();
            assertThat(schedulerLoop.dueTimeOf(created.getId())).isEmpty();

            clock.advance(Duration.ofHours(1));
            assertThat(schedulerLoop.processDueJobs()).isZero();
            verify(messageDispatcher, times(1)).deliver(any());
        }

        @Test
        @DisplayName("Should not fire a paused reminder")
        void shouldNotFirePausedReminder() {
            // Given
            var trigger = DateTrigger.builder().runDate(Instant.parse("2030-01-01T00:00:00Z")).build();
            var created = lifecycleService.add("paused-one", trigger, channelPayload("hi"), null);
            lifecycleService.pause(created.getId());

            // When
            clock.set(Instant.parse("2030-01-01T00:00:10Z"));
            schedulerLoop.processDueJobs();

            // Then
            verify(messageDispatcher, never()).deliver(any());
            assertThat(lifecycleService.get("paused-one").getStatus()).isEqualTo(JobStatus.PAUSED);
        }
    }

    @Nested
    @DisplayName("Recurring Reminder Tests")
    class RecurringTests {

        @Test
        @DisplayName("Should advance an interval reminder by its interval on each fire")
        void shouldAdvanceIntervalReminder() {
            // Given
            var created = lifecycleService.add("every-5", IntervalTrigger.builder().minutes(5).build(),
                    channelPayload("stand up"), null);
            assertThat(created.getNextRunTime()).isEqualTo(NOW);

            // When
            for (var i = 0; i < 3; i++) {
                clock.set(NOW.plus(Duration.ofMinutes(5L * i)));
                assertThat(schedulerLoop.processDueJobs()).isEqualTo(1);
            }

            // Then
            var job = lifecycleService.get("every-5");
            assertThat(job.getNextRunTime()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
            assertThat(job.getRunCount()).isEqualTo(3);
            assertThat(schedulerLoop.dueTimeOf("every-5")).contains(NOW.plus(Duration.ofMinutes(15)));
            verify(messageDispatcher, times(3)).deliver(any());
        }

        @Test
        @DisplayName("Should complete a reminder whose end date precedes its next fire")
        void shouldCompleteAtEndDate() {
            // Given
            var trigger = IntervalTrigger.builder()
                    .minutes(5)
                    .startDate(NOW)
                    .endDate(NOW.plus(Duration.ofMinutes(3)))
                    .build();
            lifecycleService.add("short-lived", trigger, channelPayload("once"), null);

            // When
            schedulerLoop.processDueJobs();
            clock.advance(Duration.ofMinutes(10));
            schedulerLoop.processDueJobs();

            // Then
            var job = lifecycleService.get("short-lived");
            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.getNextRunTime()).isNull();
            assertThat(job.getTriggerDisplay()).isEqualTo("Completed");
            verify(messageDispatcher, times(1)).deliver(any());
        }

        @Test
        @DisplayName("Should report a run missed beyond its grace time and move to the next future run")
        void shouldReportMissedRun() {
            // Given
            var start = NOW.plus(Duration.ofMinutes(10));
            var trigger = IntervalTrigger.builder().hours(1).startDate(start).build();
            lifecycleService.add("hourly", trigger, channelPayload("drink water"), 60);

            // When
            clock.set(start.plus(Duration.ofMinutes(5)));
            var started = schedulerLoop.processDueJobs();

            // Then
            assertThat(started).isZero();
            verify(notificationSink, times(1)).missed("hourly", start);
            verify(messageDispatcher, never()).deliver(any());
            var job = lifecycleService.get("hourly");
            assertThat(job.getNextRunTime()).isEqualTo(start.plus(Duration.ofHours(1)));
            assertThat(job.getRunCount()).isZero();
        }

        @Test
        @DisplayName("Should fire a late run that is still within grace")
        void shouldFireLateRunWithinGrace() {
            // Given
            lifecycleService.add("hourly", IntervalTrigger.builder().hours(1).startDate(NOW).build(),
                    channelPayload("drink water"), 60);

            // When
            clock.advance(Duration.ofSeconds(30));
            var started = schedulerLoop.processDueJobs();

            // Then
            assertThat(started).isEqualTo(1);
            verify(notificationSink, never()).missed(anyString(), any());
        }
    }

    @Nested
    @DisplayName("In-flight Delivery Tests")
    class InFlightTests {

        @BeforeEach
        void useQueuedExecutor() {
            wire(pendingDeliveries::add);
        }

        @Test
        @DisplayName("Should skip a run while the previous delivery is still running")
        void shouldSkipWhilePreviousDeliveryRuns() {
            // Given
            lifecycleService.add("chatty", IntervalTrigger.builder().seconds(10).startDate(NOW).build(),
                    channelPayload("ping"), 60);
            assertThat(schedulerLoop.processDueJobs()).isEqualTo(1);

            // When - next run comes due before the first delivery finished
            clock.advance(Duration.ofSeconds(10));
            var started = schedulerLoop.processDueJobs();

            // Then
            assertThat(started).isZero();
            verify(notificationSink).missed("chatty", NOW.plusSeconds(10));
            assertThat(lifecycleService.get("chatty").getNextRunTime()).isEqualTo(NOW.plusSeconds(20));

            // When - first delivery completes, the following run goes out again
            pendingDeliveries.poll().run();
            clock.advance(Duration.ofSeconds(10));

            // Then
            assertThat(schedulerLoop.processDueJobs()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not count time waiting in the dispatch queue against the timeout")
        void shouldStartTimeoutWhenDeliveryStarts() throws InterruptedException {
            // Given
            properties.setDispatchTimeoutSeconds(1);
            lifecycleService.add("queued", IntervalTrigger.builder().hours(1).startDate(NOW).build(),
                    channelPayload("wait for it"), null);
            assertThat(schedulerLoop.processDueJobs()).isEqualTo(1);

            // When - the delivery sits in the queue longer than the timeout
            Thread.sleep(1500);
            pendingDeliveries.poll().run();

            // Then
            verify(messageDispatcher).deliver(channelPayload("wait for it"));
            verify(notificationSink, never()).executionFailed(anyString(), anyString());
            assertThat(lifecycleService.get("queued").getLastError()).isNull();
        }
    }

    @Nested
    @DisplayName("Delivery Failure Tests")
    class DeliveryFailureTests {

        @Test
        @DisplayName("Should alert on a failed delivery and keep the schedule")
        void shouldAlertOnFailedDelivery() {
            // Given
            lenient().when(messageDispatcher.deliver(any()))
                    .thenReturn(DeliveryResult.failure("Target not found: 42", "TARGET_NOT_FOUND"));
            lifecycleService.add("broken", IntervalTrigger.builder().minutes(1).startDate(NOW).build(),
                    channelPayload("hello?"), null);

            // When
            schedulerLoop.processDueJobs();

            // Then
            verify(notificationSink).executionFailed("broken", "TARGET_NOT_FOUND: Target not found: 42");
            var job = lifecycleService.get("broken");
            assertThat(job.getLastError()).isEqualTo("TARGET_NOT_FOUND: Target not found: 42");
            assertThat(job.getNextRunTime()).isEqualTo(NOW.plus(Duration.ofMinutes(1)));
        }

        @Test
        @DisplayName("Should turn a dispatcher exception into a failed delivery")
        void shouldHandleDispatcherException() {
            // Given
            lenient().when(messageDispatcher.deliver(any())).thenThrow(new IllegalStateException("boom"));
            lifecycleService.add("throws", IntervalTrigger.builder().minutes(1).startDate(NOW).build(),
                    channelPayload("hello?"), null);

            // When
            var started = schedulerLoop.processDueJobs();

            // Then
            assertThat(started).isEqualTo(1);
            verify(notificationSink).executionFailed("throws", "IllegalStateException: boom");
            assertThat(schedulerLoop.dueTimeOf("throws")).contains(NOW.plus(Duration.ofMinutes(1)));
        }
    }

    @Nested
    @DisplayName("Store Failure Tests")
    class StoreFailureTests {

        @Test
        @DisplayName("Should retry a failed store update")
        void shouldRetryFailedStoreUpdate() {
            // Given
            lifecycleService.add("flaky", IntervalTrigger.builder().minutes(1).startDate(NOW).build(),
                    channelPayload("retry me"), null);
            jobStore.failNextUpdates(1);

            // When
            var started = schedulerLoop.processDueJobs();

            // Then
            assertThat(started).isEqualTo(1);
            verify(notificationSink, never()).storeFailure(anyString(), any());
        }

        @Test
        @DisplayName("Should alert and requeue after the sync period when retries are exhausted")
        void shouldAlertWhenRetriesExhausted() {
            // Given
            lifecycleService.add("down", IntervalTrigger.builder().minutes(1).startDate(NOW).build(),
                    channelPayload("retry me"), null);
            jobStore.failNextUpdates(2);

            // When
            var started = schedulerLoop.processDueJobs();

            // Then
            assertThat(started).isZero();
            verify(notificationSink).storeFailure(eq("fire down"), anyString());
            verify(messageDispatcher, never()).deliver(any());
            assertThat(schedulerLoop.dueTimeOf("down"))
                    .contains(NOW.plusMillis(properties.getSyncPeriodMs()));
        }

        @Test
        @DisplayName("Should report a failure outside the store as an execution failure")
        void shouldReportNonStoreFailureAsExecutionFailure() {
            // Given
            var fireService = mock(JobFireService.class);
            when(fireService.advance(any(), any())).thenThrow(new IllegalStateException("cannot evaluate trigger"));
            var loop = new SchedulerLoop(jobStore, fireService, notificationSink,
                    new MetricsConfig(new SimpleMeterRegistry(), jobStore), properties, clock);
            loop.jobScheduled("odd", NOW);

            // When
            var started = loop.processDueJobs();

            // Then
            assertThat(started).isZero();
            verify(fireService, times(1)).advance(any(), any());
            verify(notificationSink).executionFailed("odd", "IllegalStateException: cannot evaluate trigger");
            verify(notificationSink, never()).storeFailure(anyString(), any());
            assertThat(loop.dueTimeOf("odd")).contains(NOW.plusMillis(properties.getSyncPeriodMs()));
        }
    }

    @Nested
    @DisplayName("Store Synchronization Tests")
    class SynchronizationTests {

        @Test
        @DisplayName("Should rebuild the due set from the store")
        void shouldRebuildDueSetFromStore() {
            // Given
            lifecycleService.add("a", IntervalTrigger.builder().minutes(1).startDate(NOW).build(),
                    channelPayload("a"), null);
            lifecycleService.add("b", IntervalTrigger.builder().minutes(1).startDate(NOW).build(),
                    channelPayload("b"), null);
            schedulerLoop.jobUnscheduled("a");
            jobStore.delete("b");

            // When
            schedulerLoop.synchronizeWithStore();

            // Then
            assertThat(schedulerLoop.dueTimeOf("a")).contains(NOW);
            assertThat(schedulerLoop.dueTimeOf("b")).isEmpty();
            assertThat(schedulerLoop.dueCount()).isEqualTo(1);
            assertThat(schedulerLoop.nextDueTime()).contains(NOW);
        }
    }
}
