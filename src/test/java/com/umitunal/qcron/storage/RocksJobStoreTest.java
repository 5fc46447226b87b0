package com.umitunal.qcron.storage;

import com.umitunal.qcron.config.StorageConfig;
import com.umitunal.qcron.cron.CronUtilsFireTimeCalculator;
import com.umitunal.qcron.exception.JobNotFoundException;
import com.umitunal.qcron.exception.WriteConflictException;
import com.umitunal.qcron.model.CronJob;
import com.umitunal.qcron.model.Schedule;
import com.umitunal.qcron.scheduler.FunctionRegistry;
import com.umitunal.qcron.service.CronRegistrar;
import com.umitunal.qcron.testing.ManualTaskScheduler;
import com.umitunal.qcron.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class RocksJobStoreTest {

    @TempDir
    Path tempDir;

    private RocksJobStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = open(StorageConfig.ArgsFormat.JSON);
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private RocksJobStore open(StorageConfig.ArgsFormat format) throws Exception {
        return new RocksJobStore(StorageConfig.newBuilder(tempDir.toString())
                .withArgsFormat(format)
                .build());
    }

    private CronJob insert(String name, Schedule schedule) {
        return store.inTransaction(txn -> txn.insert(name, "reports:daily", Map.of("n", 1), schedule));
    }

    @Test
    @DisplayName("Should insert and read back by id and by name")
    void testInsertAndGet() {
        // When
        CronJob job = insert("daily", Schedule.cron("0 0 * * *"));

        // Then
        assertThat(job.getId()).isNotBlank();
        assertThat(store.get(job.getId())).hasValueSatisfying(stored -> {
            assertThat(stored.getName()).isEqualTo("daily");
            assertThat(stored.getFunctionName()).isEqualTo("reports:daily");
            assertThat(stored.getArgs()).containsEntry("n", 1);
            assertThat(stored.getSchedule()).isEqualTo(Schedule.cron("0 0 * * *"));
        });
        assertThat(store.findByName("daily")).map(CronJob::getId).contains(job.getId());
        assertThat(store.get("missing")).isEmpty();
        assertThat(store.findByName("missing")).isEmpty();
    }

    @Test
    @DisplayName("Should not index anonymous jobs by name")
    void testAnonymousJob() {
        CronJob job = insert(null, Schedule.interval(1000));

        assertThat(store.get(job.getId())).isPresent();
        assertThat(store.list()).hasSize(1);
    }

    @Test
    @DisplayName("Should persist patched task pointers")
    void testPatch() {
        // Given
        CronJob job = insert(null, Schedule.interval(1000));

        // When
        store.inTransaction(txn -> {
            CronJob current = txn.get(job.getId()).orElseThrow();
            current.armTick("tick-7");
            current.recordDispatch("dispatch-3");
            txn.patch(current);
            return null;
        });

        // Then
        CronJob stored = store.get(job.getId()).orElseThrow();
        assertThat(stored.getPendingTickTaskId()).isEqualTo("tick-7");
        assertThat(stored.getLastDispatchTaskId()).isEqualTo("dispatch-3");
        assertThat(stored.getVersion()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should refuse to patch a record that no longer exists")
    void testPatchMissing() {
        CronJob ghost = new CronJob("ghost", null, "reports:daily", Map.of(), Schedule.interval(1000));

        assertThatThrownBy(() -> store.inTransaction(txn -> {
            txn.patch(ghost);
            return null;
        })).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Should delete the record and its name index")
    void testDelete() {
        // Given
        CronJob job = insert("nightly", Schedule.interval(1000));

        // When
        store.inTransaction(txn -> {
            txn.delete(job.getId());
            return null;
        });

        // Then
        assertThat(store.get(job.getId())).isEmpty();
        assertThat(store.findByName("nightly")).isEmpty();
        assertThat(store.list()).isEmpty();
    }

    @Test
    @DisplayName("Should list every stored job")
    void testList() {
        CronJob a = insert("a", Schedule.interval(1000));
        CronJob b = insert("b", Schedule.interval(2000));
        CronJob c = insert(null, Schedule.cron("*/5 * * * *"));

        assertThat(store.list()).extracting(CronJob::getId)
                .containsExactlyInAnyOrder(a.getId(), b.getId(), c.getId());
    }

    @Test
    @DisplayName("Should abort a transaction whose record changed after it was read")
    void testWriteConflict() {
        // Given
        CronJob job = insert(null, Schedule.interval(1000));

        // When - a second transaction commits a change between the first one's read and commit
        assertThatThrownBy(() -> store.inTransaction(outer -> {
            CronJob mine = outer.get(job.getId()).orElseThrow();
            store.inTransaction(inner -> {
                CronJob theirs = inner.get(job.getId()).orElseThrow();
                theirs.armTick("their-tick");
                inner.patch(theirs);
                return null;
            });
            mine.armTick("my-tick");
            outer.patch(mine);
            return null;
        })).isInstanceOf(WriteConflictException.class);

        // Then
        assertThat(store.get(job.getId()).orElseThrow().getPendingTickTaskId()).isEqualTo("their-tick");
        assertThat(store.getConflictCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should run after-commit actions once the commit succeeds and drop them on a conflict")
    void testAfterCommitActions() {
        // Given
        CronJob job = insert(null, Schedule.interval(1000));
        List<String> ran = new ArrayList<>();

        // When - one transaction commits, one loses a conflict
        store.inTransaction(txn -> {
            txn.afterCommit(() -> ran.add("committed"));
            assertThat(ran).isEmpty();
            return null;
        });
        assertThatThrownBy(() -> store.inTransaction(outer -> {
            CronJob mine = outer.get(job.getId()).orElseThrow();
            outer.afterCommit(() -> ran.add("aborted"));
            store.inTransaction(inner -> {
                inner.patch(inner.get(job.getId()).orElseThrow());
                return null;
            });
            outer.patch(mine);
            return null;
        })).isInstanceOf(WriteConflictException.class);

        // Then
        assertThat(ran).containsExactly("committed");
    }

    @Test
    @DisplayName("Should let only one of two racing registrations claim a name")
    void testNameRace() {
        // When
        assertThatThrownBy(() -> store.inTransaction(outer -> {
            Optional<CronJob> existing = outer.findByName("unique");
            assertThat(existing).isEmpty();
            store.inTransaction(inner -> {
                assertThat(inner.findByName("unique")).isEmpty();
                return inner.insert("unique", "a:first", Map.of(), Schedule.interval(1000));
            });
            return outer.insert("unique", "b:second", Map.of(), Schedule.interval(1000));
        })).isInstanceOf(WriteConflictException.class);

        // Then
        assertThat(store.findByName("unique")).map(CronJob::getFunctionName).contains("a:first");
        assertThat(store.list()).hasSize(1);
    }

    @Test
    @DisplayName("Should keep jobs across reopen")
    void testReopen() throws Exception {
        // Given
        CronJob job = insert("durable", Schedule.interval(5000));
        store.close();

        // When
        store = open(StorageConfig.ArgsFormat.JSON);

        // Then
        assertThat(store.findByName("durable")).map(CronJob::getId).contains(job.getId());
    }

    @Test
    @DisplayName("Should store args with the Kryo format")
    void testKryoFormat() throws Exception {
        // Given
        store.close();
        store = open(StorageConfig.ArgsFormat.KRYO);

        // When
        CronJob job = store.inTransaction(txn ->
                txn.insert(null, "cleanup:run", Map.of("dryRun", true, "limit", 50L), Schedule.interval(1000)));

        // Then
        assertThat(store.get(job.getId()).orElseThrow().getArgs())
                .containsEntry("dryRun", true)
                .containsEntry("limit", 50L);
    }

    @Test
    @DisplayName("Should register through the store with tracked reads of absent keys and list the result")
    void testRegisterThroughStore() {
        // Given - a registrar over this store; its name lookup reads a key that does not exist yet
        FunctionRegistry functions = new FunctionRegistry();
        ManualTaskScheduler scheduler = new ManualTaskScheduler(functions, new MutableClock(0));
        CronRegistrar registrar = new CronRegistrar(store, scheduler, new CronUtilsFireTimeCalculator(),
                new MutableClock(0));

        // When
        String named = registrar.registerInterval(1000, "reports:daily", Map.of(), "daily");
        String anonymous = registrar.registerCron("0 0 * * *", "reports:daily", Map.of(), null);

        // Then
        assertThat(store.list()).extracting(CronJob::getId).containsExactlyInAnyOrder(named, anonymous);
        assertThat(store.findByName("daily")).map(CronJob::getId).contains(named);
        assertThat(store.get(anonymous)).hasValueSatisfying(job -> assertThat(job.isScheduled()).isTrue());
    }
}
