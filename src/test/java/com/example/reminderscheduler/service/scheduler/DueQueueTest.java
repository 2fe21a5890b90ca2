package com.example.reminderscheduler.service.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DueQueue Tests")
class DueQueueTest {

    private static final Instant T0 = Instant.parse("2030-01-01T00:00:00Z");

    private final DueQueue queue = new DueQueue();

    @Nested
    @DisplayName("Ordering Tests")
    class OrderingTests {

        @Test
        @DisplayName("Should poll due entries by time, then by id")
        void shouldPollInFiringOrder() {
            queue.upsert("b", T0);
            queue.upsert("c", T0.minusSeconds(5));
            queue.upsert("a", T0);
            queue.upsert("later", T0.plusSeconds(1));

            var due = queue.pollDue(T0);

            assertThat(due).extracting(DueEntry::getJobId).containsExactly("c", "a", "b");
            assertThat(queue.size()).isEqualTo(1);
            assertThat(queue.peekNextDueTime()).contains(T0.plusSeconds(1));
        }

        @Test
        @DisplayName("Should keep one entry per job")
        void shouldKeepOneEntryPerJob() {
            queue.upsert("a", T0);
            queue.upsert("a", T0.plusSeconds(60));

            assertThat(queue.size()).isEqualTo(1);
            assertThat(queue.dueTimeOf("a")).contains(T0.plusSeconds(60));
            assertThat(queue.pollDue(T0)).isEmpty();
        }

        @Test
        @DisplayName("Should report whether a removed job was queued")
        void shouldRemove() {
            queue.upsert("a", T0);

            assertThat(queue.remove("a")).isTrue();
            assertThat(queue.remove("a")).isFalse();
            assertThat(queue.peekNextDueTime()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Synchronization Tests")
    class SynchronizationTests {

        @Test
        @DisplayName("Should adopt the snapshot for untouched jobs")
        void shouldAdoptSnapshot() {
            queue.upsert("stale", T0);
            queue.upsert("moved", T0);
            var stamp = queue.stamp();

            queue.synchronize(List.of(new DueEntry("moved", T0.plusSeconds(30)), new DueEntry("new", T0)), stamp);

            assertThat(queue.dueTimeOf("stale")).isEmpty();
            assertThat(queue.dueTimeOf("moved")).contains(T0.plusSeconds(30));
            assertThat(queue.dueTimeOf("new")).contains(T0);
        }

        @Test
        @DisplayName("Should keep changes made after the snapshot was taken")
        void shouldKeepNewerChanges() {
            var stamp = queue.stamp();
            // lifecycle changes racing with the store read
            queue.upsert("added", T0.plusSeconds(10));
            queue.upsert("paused", T0);
            queue.remove("paused");

            queue.synchronize(List.of(new DueEntry("paused", T0)), stamp);

            assertThat(queue.dueTimeOf("added")).contains(T0.plusSeconds(10));
            assertThat(queue.dueTimeOf("paused")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Wait Tests")
    class WaitTests {

        @Test
        @DisplayName("Should return at once when the head is already due")
        void shouldNotWaitForDueHead() throws InterruptedException {
            var clock = Clock.fixed(T0, ZoneOffset.UTC);
            queue.upsert("a", T0.minusSeconds(1));
            queue.pollDue(T0.minusSeconds(2));
            queue.awaitNext(clock, Duration.ZERO);

            var started = System.nanoTime();
            queue.awaitNext(clock, Duration.ofSeconds(30));

            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("Should wake up a waiting loop when an earlier job arrives")
        void shouldWakeOnEarlierJob() throws Exception {
            var clock = Clock.fixed(T0, ZoneOffset.UTC);
            queue.upsert("far", T0.plusSeconds(3600));
            // consume the signal from the first upsert
            queue.awaitNext(clock, Duration.ZERO);

            var waiter = new Thread(() -> {
                try {
                    queue.awaitNext(clock, Duration.ofSeconds(30));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            waiter.start();
            Thread.sleep(100);
            queue.upsert("near", T0.plusSeconds(1));
            waiter.join(5000);

            assertThat(waiter.isAlive()).isFalse();
        }
    }
}
