package com.umitunal.qcron.service;

import com.umitunal.qcron.core.JobStore;
import com.umitunal.qcron.core.ScheduledTask;
import com.umitunal.qcron.cron.CronUtilsFireTimeCalculator;
import com.umitunal.qcron.exception.DuplicateNameException;
import com.umitunal.qcron.exception.InvalidCronSpecException;
import com.umitunal.qcron.exception.InvalidIntervalException;
import com.umitunal.qcron.model.CronJob;
import com.umitunal.qcron.testing.CronFixture;
import com.umitunal.qcron.testing.DelegatingJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.umitunal.qcron.testing.CronFixture.TARGET;
import static org.assertj.core.api.Assertions.*;

class CronRegistrarTest {

    @TempDir
    Path tempDir;

    private CronFixture fixture;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new CronFixture(tempDir, 10_000);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    @DisplayName("Should reject intervals below one second")
    void testIntervalBelowMinimum() {
        assertThatThrownBy(() -> fixture.crons.scheduleInterval(999, TARGET, Map.of()))
                .isInstanceOf(InvalidIntervalException.class)
                .hasMessageContaining("1000");

        assertThat(fixture.crons.list()).isEmpty();
    }

    @Test
    @DisplayName("Should accept an interval of exactly one second and arm the first tick at now + ms")
    void testMinimumInterval() {
        // When
        String jobId = fixture.crons.scheduleInterval(1000, TARGET, Map.of("n", 1));

        // Then
        CronJob job = fixture.job(jobId);
        assertThat(job.getFunctionName()).isEqualTo(TARGET);
        assertThat(job.getArgs()).containsEntry("n", 1);
        assertThat(job.getSchedule().getIntervalMs()).isEqualTo(1000);
        assertThat(job.getLastDispatchTaskId()).isNull();
        assertThat(job.getPendingTickTaskId()).isNotNull();

        ScheduledTask tick = fixture.scheduler.getTask(job.getPendingTickTaskId()).orElseThrow();
        assertThat(tick.getScheduledTime()).isEqualTo(11_000);
        assertThat(tick.getFunctionName()).isEqualTo(Rescheduler.FUNCTION_NAME);
        assertThat(tick.getArgs()).containsEntry(Rescheduler.JOB_ID_ARG, jobId);
        assertThat(tick.getState()).isEqualTo(ScheduledTask.TaskState.PENDING);
    }

    @Test
    @DisplayName("Should reject malformed cron expressions")
    void testMalformedCron() {
        assertThatThrownBy(() -> fixture.crons.register("not a cron", TARGET, Map.of()))
                .isInstanceOf(InvalidCronSpecException.class)
                .hasMessageContaining("Invalid cronspec");
        assertThatThrownBy(() -> fixture.crons.register("61 * * * *", TARGET, Map.of()))
                .isInstanceOf(InvalidCronSpecException.class);
        assertThatThrownBy(() -> fixture.crons.register("", TARGET, Map.of()))
                .isInstanceOf(InvalidCronSpecException.class);

        assertThat(fixture.crons.list()).isEmpty();
        assertThat(fixture.scheduler.tasksFor(Rescheduler.FUNCTION_NAME)).isEmpty();
    }

    @Test
    @DisplayName("Should arm a cron job at the next fire time after registration")
    void testCronFirstFireTime() {
        // Given
        fixture.clock.set(Instant.parse("2024-01-01T12:00:00Z").toEpochMilli());

        // When
        String jobId = fixture.crons.register("0 0 * * *", TARGET, Map.of());

        // Then
        assertThat(fixture.nextTickTime(jobId))
                .isEqualTo(Instant.parse("2024-01-02T00:00:00Z").toEpochMilli());
    }

    @Test
    @DisplayName("Should reject a second job with the same name")
    void testDuplicateName() {
        // Given
        String first = fixture.crons.scheduleIntervalNamed("cleanup", 5000, TARGET, Map.of());

        // When/Then
        assertThatThrownBy(() -> fixture.crons.registerNamed("cleanup", "* * * * *", TARGET, Map.of()))
                .isInstanceOf(DuplicateNameException.class)
                .hasMessageContaining("\"cleanup\" already exists");

        assertThat(fixture.crons.list()).extracting(CronJob::getId).containsExactly(first);
        assertThat(fixture.scheduler.tasksFor(Rescheduler.FUNCTION_NAME)).hasSize(1);
    }

    @Test
    @DisplayName("Should never conflict between anonymous jobs")
    void testAnonymousJobs() {
        String a = fixture.crons.scheduleInterval(5000, TARGET, Map.of());
        String b = fixture.crons.scheduleInterval(5000, TARGET, Map.of());
        String c = fixture.crons.scheduleIntervalNamed("  ", 5000, TARGET, Map.of());

        assertThat(a).isNotEqualTo(b);
        assertThat(fixture.crons.list()).hasSize(3);
        assertThat(fixture.job(c).getName()).isNull();
    }

    @Test
    @DisplayName("Should require a function name")
    void testMissingFunctionName() {
        assertThatThrownBy(() -> fixture.crons.scheduleInterval(5000, " ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should report a duplicate name before looking at the interval")
    void testDuplicateNameCheckedBeforeInterval() {
        // Given
        fixture.crons.scheduleIntervalNamed("cleanup", 5000, TARGET, Map.of());

        // When/Then - the interval is invalid too, but the name wins
        assertThatThrownBy(() -> fixture.crons.scheduleIntervalNamed("cleanup", 999, TARGET, Map.of()))
                .isInstanceOf(DuplicateNameException.class);
        assertThatThrownBy(() -> fixture.crons.registerNamed("cleanup", "not a cron", TARGET, Map.of()))
                .isInstanceOf(DuplicateNameException.class);

        // And a fresh name still gets the interval error
        assertThatThrownBy(() -> fixture.crons.scheduleIntervalNamed("other", 999, TARGET, Map.of()))
                .isInstanceOf(InvalidIntervalException.class);
    }

    @Test
    @DisplayName("Should report a name taken by a concurrent registration as a duplicate")
    void testConcurrentSameNameRegistration() {
        // Given - another registration of the same name commits while our insert is still open
        AtomicBoolean raced = new AtomicBoolean();
        JobStore racing = new DelegatingJobStore(fixture.store) {
            @Override
            public <R> R inTransaction(TransactionWork<R> work) {
                return fixture.store.inTransaction(txn -> {
                    R result = work.execute(txn);
                    if (raced.compareAndSet(false, true)) {
                        fixture.crons.scheduleIntervalNamed("report", 5000, TARGET, Map.of("winner", true));
                    }
                    return result;
                });
            }
        };
        CronRegistrar registrar = new CronRegistrar(racing, fixture.scheduler,
                new CronUtilsFireTimeCalculator(), fixture.clock);

        // When/Then
        assertThatThrownBy(() -> registrar.registerInterval(5000, TARGET, Map.of(), "report"))
                .isInstanceOf(DuplicateNameException.class);

        assertThat(fixture.crons.list()).hasSize(1);
        assertThat(fixture.crons.getByName("report").orElseThrow().getArgs())
                .isEqualTo(Map.of("winner", true));
        assertThat(fixture.scheduler.tasksFor(Rescheduler.FUNCTION_NAME)).hasSize(1);
    }

    @Test
    @DisplayName("Should commit the record before reserving its first tick and release the tick once armed")
    void testFirstTickReleasedAfterArming() {
        // Given - look at the committed record whenever a tick is reserved
        AtomicReference<Optional<CronJob>> committedAtReserve = new AtomicReference<>();
        fixture.scheduler.onSchedule(task -> committedAtReserve.set(
                fixture.store.get(task.getArgs().get(Rescheduler.JOB_ID_ARG).toString())));

        // When
        String jobId = fixture.crons.scheduleInterval(1000, TARGET, Map.of());

        // Then - the record existed unarmed at reserve time, and the tick was released after arming
        assertThat(committedAtReserve.get()).isPresent();
        assertThat(committedAtReserve.get().get().getPendingTickTaskId()).isNull();
        String tick = fixture.job(jobId).getPendingTickTaskId();
        assertThat(fixture.scheduler.isReleased(tick)).isTrue();
    }

    @Test
    @DisplayName("Should keep the janitor's tick when it arms a new record first")
    void testJanitorArmsRecordFirst() {
        // Given - a sweep runs between the insert and the arming transaction
        AtomicInteger calls = new AtomicInteger();
        JobStore racing = new DelegatingJobStore(fixture.store) {
            @Override
            public <R> R inTransaction(TransactionWork<R> work) {
                if (calls.incrementAndGet() == 2) {
                    fixture.crons.sweepStalled();
                }
                return fixture.store.inTransaction(work);
            }
        };
        CronRegistrar registrar = new CronRegistrar(racing, fixture.scheduler,
                new CronUtilsFireTimeCalculator(), fixture.clock);

        // When
        String jobId = registrar.registerInterval(1000, TARGET, Map.of(), null);

        // Then - one live tick, the janitor's, and ours withdrawn
        List<ScheduledTask> outstanding = fixture.scheduler.outstandingTasksFor(Rescheduler.FUNCTION_NAME);
        assertThat(outstanding).extracting(ScheduledTask::getId)
                .containsExactly(fixture.job(jobId).getPendingTickTaskId());
        assertThat(fixture.scheduler.tasksFor(Rescheduler.FUNCTION_NAME)).hasSize(2);

        fixture.scheduler.advanceBy(1000);
        assertThat(fixture.targetCalls).hasSize(1);
    }
}
