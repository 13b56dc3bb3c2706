package com.warden.engine.infrastructure.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.warden.engine.domain.queue.QueueClass;
import com.warden.engine.domain.queue.QueueJob;
import com.warden.engine.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryJobQueue")
class InMemoryJobQueueTest {

    private MutableClock clock;
    private InMemoryJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        queue = new InMemoryJobQueue("email", QueueClass.SHORT, 2, clock);
    }

    @Test
    @DisplayName("should track jobs through their states")
    void shouldTrackStates() {
        queue.enqueue();
        queue.enqueue();
        queue.schedule();
        QueueJob first = queue.take();
        queue.complete(first.id());
        QueueJob second = queue.take();
        queue.fail(second.id(), "smtp timeout");

        assertThat(queue.waitingCount()).isZero();
        assertThat(queue.activeCount()).isZero();
        assertThat(queue.completedCount()).isEqualTo(1);
        assertThat(queue.failedCount()).isEqualTo(1);
        assertThat(queue.delayedCount()).isEqualTo(1);
        assertThat(queue.failureReason(second.id())).isEqualTo("smtp timeout");
    }

    @Test
    @DisplayName("should stamp active jobs with the time they started")
    void shouldStampActiveSince() {
        queue.enqueue();
        clock.advance(Duration.ofMinutes(3));

        QueueJob job = queue.take();

        assertThat(job.activeSince()).isEqualTo(MutableClock.START.plus(Duration.ofMinutes(3)));
        assertThat(queue.activeJobs()).extracting(QueueJob::id).containsExactly(job.id());
    }

    @Test
    @DisplayName("should retry a failed job back to waiting and treat a second retry as a no-op")
    void shouldRetryFailedJob() {
        queue.enqueue();
        QueueJob job = queue.take();
        job.moveToFailed("stuck");

        job.retry();
        job.retry();

        assertThat(queue.waitingCount()).isEqualTo(1);
        assertThat(queue.failedJobs()).isEmpty();
        assertThat(queue.failureReason(job.id())).isNull();
    }

    @Test
    @DisplayName("should refuse invalid transitions")
    void shouldRefuseInvalidTransitions() {
        String id = queue.enqueue();

        assertThatThrownBy(() -> queue.complete(id)).hasMessage("Job " + id + " is not active");
        assertThatThrownBy(() -> queue.take().retry()).hasMessage("Job " + id + " is not failed");
        assertThatThrownBy(() -> queue.take()).hasMessage("Queue email has no waiting job");
    }

    @Test
    @DisplayName("should clean only completed jobs older than the threshold")
    void shouldCleanOldCompletedJobs() {
        queue.enqueue();
        queue.enqueue();
        queue.complete(queue.take().id());
        clock.advance(Duration.ofHours(2));
        queue.complete(queue.take().id());

        int removed = queue.cleanCompleted(Duration.ofHours(1));

        assertThat(removed).isEqualTo(1);
        assertThat(queue.completedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should scale workers and reject a negative count")
    void shouldScaleWorkers() {
        queue.scaleWorkers(5);

        assertThat(queue.workerCount()).isEqualTo(5);
        assertThatThrownBy(() -> queue.scaleWorkers(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
