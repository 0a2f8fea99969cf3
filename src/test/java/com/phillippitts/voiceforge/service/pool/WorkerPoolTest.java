package com.phillippitts.voiceforge.service.pool;

import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.domain.TaskErrorKind;
import com.phillippitts.voiceforge.domain.TaskPriority;
import com.phillippitts.voiceforge.domain.TaskResult;
import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.TaskFailedException;
import com.phillippitts.voiceforge.service.pool.WorkerTestDoubles.FakeProcessFactory;
import com.phillippitts.voiceforge.service.pool.WorkerTestDoubles.FakeWorkerProcess;
import com.phillippitts.voiceforge.service.pool.event.PoolDegradedEvent;
import com.phillippitts.voiceforge.service.pool.event.WorkerCrashedEvent;
import com.phillippitts.voiceforge.service.pool.event.WorkerRestartedEvent;
import com.phillippitts.voiceforge.testutil.EventCapturingPublisher;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;
import static org.awaitility.Awaitility.await;

class WorkerPoolTest {

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private WorkerPool pool;

    @AfterEach
    void tearDown() throws Exception {
        if (pool != null) {
            pool.shutdown(Duration.ZERO).get(10, TimeUnit.SECONDS);
        }
    }

    private WorkerPool startPool(WorkerPoolSettings settings, FakeProcessFactory factory) {
        pool = new WorkerPool(settings, factory, publisher);
        pool.start();
        await().atMost(Duration.ofSeconds(5))
                .until(() -> pool.snapshot().idle() == settings.size());
        return pool;
    }

    private static Task task(TaskType type, JSONObject payload, TaskPriority priority) {
        return Task.of(type, payload, priority);
    }

    private static Task sleeper(long delayMs) {
        return task(TaskType.GENERATE_REPLY, new JSONObject().put("text", "slow").put("delayMs", delayMs),
                TaskPriority.NORMAL);
    }

    private static TaskErrorKind failureKind(CompletableFuture<?> future) throws Exception {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(TaskFailedException.class);
            return ((TaskFailedException) e.getCause()).getKind();
        } catch (TimeoutException e) {
            fail("task was not resolved within 5s");
        }
        fail("task succeeded but a failure was expected");
        return null;
    }

    private static void assertSlotInvariant(PoolStatus status) {
        assertThat(status.idle() + status.busy() + status.unhealthy()).isEqualTo(status.total());
    }

    @Test
    void shouldStartEverySlotAndReportIdle() {
        FakeProcessFactory factory = new FakeProcessFactory(TaskType.GENERATE_REPLY);
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 3), factory);

        PoolStatus status = pool.snapshot();
        assertThat(status.total()).isEqualTo(3);
        assertThat(status.idle()).isEqualTo(3);
        assertThat(status.degraded()).isFalse();
        assertThat(factory.spawned()).hasSize(3);
        assertSlotInvariant(status);
    }

    @Test
    void shouldExecuteTaskAndReturnWorkerResult() throws Exception {
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 1),
                new FakeProcessFactory(TaskType.GENERATE_REPLY));

        Task t = task(TaskType.GENERATE_REPLY, new JSONObject().put("text", "hello"), TaskPriority.NORMAL);
        TaskResult result = pool.submit(t).get(5, TimeUnit.SECONDS);

        assertThat(result.id()).isEqualTo(t.id());
        assertThat(result.ok()).isTrue();
        assertThat(result.resultJson().getString("text")).isEqualTo("I received: hello");
        await().atMost(Duration.ofSeconds(2)).until(() -> pool.snapshot().completed() == 1);
    }

    @Test
    void shouldForwardChunksBeforeResolvingTask() throws Exception {
        startPool(WorkerTestDoubles.fastSettings(TaskType.TRANSCRIBE, 1),
                new FakeProcessFactory(TaskType.TRANSCRIBE));
        List<String> partials = Collections.synchronizedList(new ArrayList<>());

        Task t = task(TaskType.TRANSCRIBE, new JSONObject().put("text", "one two three"), TaskPriority.NORMAL);
        TaskResult result = pool.submit(t, (id, chunk) -> partials.add(chunk.getString("text")))
                .get(5, TimeUnit.SECONDS);

        assertThat(partials).containsExactly("one", "one two");
        assertThat(result.resultJson().getString("text")).isEqualTo("one two three");
    }

    @Test
    void shouldFailTaskOnWorkerReportedFaultWithoutCrashingSlot() throws Exception {
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 1),
                new FakeProcessFactory(TaskType.GENERATE_REPLY));

        Task t = task(TaskType.GENERATE_REPLY,
                new JSONObject().put("fail", true).put("failMessage", "model exploded"), TaskPriority.NORMAL);

        assertThat(failureKind(pool.submit(t))).isEqualTo(TaskErrorKind.TASK_FAILED);
        await().atMost(Duration.ofSeconds(2)).until(() -> pool.snapshot().idle() == 1);
        assertThat(pool.snapshot().crashes()).isZero();
        assertThat(publisher.eventsOf(WorkerCrashedEvent.class)).isEmpty();
    }

    @Test
    void shouldLetHighPriorityTaskOvertakeTenQueuedLowPriorityTasks() throws Exception {
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 1),
                new FakeProcessFactory(TaskType.GENERATE_REPLY));
        List<String> completionOrder = Collections.synchronizedList(new ArrayList<>());

        Task blocker = sleeper(400);
        CompletableFuture<TaskResult> blockerFuture = pool.submit(blocker);
        blockerFuture.thenRun(() -> completionOrder.add(blocker.id()));
        await().atMost(Duration.ofSeconds(2)).until(() -> pool.snapshot().busy() == 1);

        List<CompletableFuture<TaskResult>> all = new ArrayList<>();
        all.add(blockerFuture);
        for (int i = 0; i < 10; i++) {
            Task low = task(TaskType.GENERATE_REPLY, new JSONObject().put("text", "low" + i), TaskPriority.BATCH);
            CompletableFuture<TaskResult> f = pool.submit(low);
            f.thenRun(() -> completionOrder.add(low.id()));
            all.add(f);
        }
        Task high = task(TaskType.GENERATE_REPLY, new JSONObject().put("text", "urgent"), TaskPriority.INTERACTIVE);
        CompletableFuture<TaskResult> highFuture = pool.submit(high);
        highFuture.thenRun(() -> completionOrder.add(high.id()));
        all.add(highFuture);

        CompletableFuture.allOf(all.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertThat(completionOrder).hasSize(12);
        assertThat(completionOrder.get(0)).isEqualTo(blocker.id());
        assertThat(completionOrder.get(1)).isEqualTo(high.id());
    }

    @Test
    void shouldDispatchFiveEqualTasksInSubmissionOrderAcrossTwoWorkers() throws Exception {
        FakeProcessFactory factory = new FakeProcessFactory(TaskType.GENERATE_REPLY);
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 2), factory);

        List<Task> tasks = new ArrayList<>();
        List<CompletableFuture<TaskResult>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Task t = task(TaskType.GENERATE_REPLY, new JSONObject().put("text", "t" + i).put("delayMs", 100),
                    TaskPriority.NORMAL);
            tasks.add(t);
            futures.add(pool.submit(t));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertThat(factory.dispatchedTaskIds()).containsExactlyElementsOf(tasks.stream().map(Task::id).toList());
        assertThat(futures).allSatisfy(f -> assertThat(f.join().ok()).isTrue());
    }

    @Test
    void shouldFailInFlightTaskAndRestartKilledWorker() throws Exception {
        FakeProcessFactory factory = new FakeProcessFactory(TaskType.GENERATE_REPLY);
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 1), factory);

        CompletableFuture<TaskResult> inFlight = pool.submit(sleeper(5_000));
        await().atMost(Duration.ofSeconds(2)).until(() -> pool.snapshot().busy() == 1);
        long killedAt = System.nanoTime();
        factory.latest().kill();

        assertThat(failureKind(inFlight)).isEqualTo(TaskErrorKind.WORKER_CRASHED);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - killedAt))
                .isLessThan(pool.settings().healthCheckInterval().toMillis() + 1_000);

        await().atMost(Duration.ofSeconds(5)).until(() -> pool.snapshot().idle() == 1);
        assertThat(factory.spawned()).hasSize(2);
        assertThat(publisher.eventsOf(WorkerCrashedEvent.class)).hasSize(1);
        assertThat(publisher.eventsOf(WorkerCrashedEvent.class).get(0).taskId()).isNotNull();
        assertThat(publisher.eventsOf(WorkerRestartedEvent.class)).hasSize(1);
        assertThat(pool.snapshot().slots().get(0).restartCount()).isEqualTo(1);

        TaskResult afterRestart = pool.submit(task(TaskType.GENERATE_REPLY, new JSONObject().put("text", "again"),
                TaskPriority.NORMAL)).get(5, TimeUnit.SECONDS);
        assertThat(afterRestart.ok()).isTrue();
    }

    @Test
    void shouldFailQueuedTaskPastItsDeadlineWithQueueTimeout() throws Exception {
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 1),
                new FakeProcessFactory(TaskType.GENERATE_REPLY));

        CompletableFuture<TaskResult> blocker = pool.submit(sleeper(1_000));
        await().atMost(Duration.ofSeconds(2)).until(() -> pool.snapshot().busy() == 1);
        Task impatient = task(TaskType.GENERATE_REPLY, new JSONObject().put("text", "x"), TaskPriority.NORMAL)
                .withDeadline(Duration.ofMillis(200));

        assertThat(failureKind(pool.submit(impatient))).isEqualTo(TaskErrorKind.QUEUE_TIMEOUT);
        assertThat(blocker.get(5, TimeUnit.SECONDS).ok()).isTrue();
    }

    @Test
    void shouldFailTaskRunningPastItsDeadlineWithExecutionTimeoutAndReplaceSlot() throws Exception {
        FakeProcessFactory factory = new FakeProcessFactory(TaskType.GENERATE_REPLY);
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 1), factory);

        Task slow = sleeper(5_000).withDeadline(Duration.ofMillis(300));

        assertThat(failureKind(pool.submit(slow))).isEqualTo(TaskErrorKind.EXECUTION_TIMEOUT);
        await().atMost(Duration.ofSeconds(5)).until(() -> pool.snapshot().idle() == 1);
        assertThat(factory.spawned()).hasSize(2);
        assertThat(factory.spawned().get(0).isAlive()).isFalse();
    }

    @Test
    void shouldReplaceWorkerThatStopsAnsweringPings() {
        FakeProcessFactory factory = new FakeProcessFactory(TaskType.GENERATE_REPLY);
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 1), factory);
        FakeWorkerProcess stuck = factory.latest();

        stuck.hang();

        await().atMost(Duration.ofSeconds(5))
                .until(() -> !publisher.eventsOf(WorkerCrashedEvent.class).isEmpty());
        assertThat(publisher.eventsOf(WorkerCrashedEvent.class).get(0).reason()).contains("pong");
        await().atMost(Duration.ofSeconds(5))
                .until(() -> factory.spawned().size() == 2 && pool.snapshot().idle() == 1);
        assertThat(stuck.isAlive()).isFalse();
    }

    @Test
    void shouldLeaveSlotUnhealthyAndPoolDegradedAfterRepeatedFailures() {
        FakeProcessFactory factory = new FakeProcessFactory(TaskType.GENERATE_REPLY);
        WorkerPoolSettings settings = WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 2)
                .withRestartBudget(3, Duration.ofMinutes(10));
        startPool(settings, factory);

        // Slot 0 got the first process; every later process replaces slot 0.
        factory.spawned().get(0).kill();
        for (int restart = 1; restart <= 3; restart++) {
            int expectedSpawns = 2 + restart;
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> factory.spawned().size() == expectedSpawns && pool.snapshot().idle() == 2);
            factory.latest().kill();
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> pool.snapshot().degraded());
        PoolStatus status = pool.snapshot();
        assertThat(status.unhealthy()).isEqualTo(1);
        assertThat(status.idle()).isEqualTo(1);
        assertThat(status.available()).isEqualTo(1);
        assertThat(status.slots().get(0).state()).isEqualTo(SlotState.UNHEALTHY);
        assertThat(status.slots().get(0).restartCount()).isEqualTo(3);
        assertThat(factory.spawned()).hasSize(5);
        assertSlotInvariant(status);

        List<PoolDegradedEvent> degraded = publisher.eventsOf(PoolDegradedEvent.class);
        assertThat(degraded).hasSize(1);
        assertThat(degraded.get(0).degraded()).isTrue();
        assertThat(degraded.get(0).availableSlots()).isEqualTo(1);
    }

    @Test
    void shouldExhaustRestartBudgetWhenWorkerNeverReportsReady() {
        FakeProcessFactory factory = new FakeProcessFactory(TaskType.SYNTHESIZE).silent();
        WorkerPoolSettings settings = WorkerTestDoubles.fastSettings(TaskType.SYNTHESIZE, 1)
                .withStartupTimeout(Duration.ofMillis(200))
                .withRestartBudget(1, Duration.ofMinutes(10));
        pool = new WorkerPool(settings, factory, publisher);
        pool.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> pool.snapshot().degraded());
        assertThat(factory.spawned()).hasSize(2);
        assertThat(pool.snapshot().unhealthy()).isEqualTo(1);
        assertThat(publisher.eventsOf(WorkerCrashedEvent.class))
                .allSatisfy(e -> assertThat(e.reason()).contains("no ready"));
    }

    @Test
    void shouldCancelQueuedTaskButNotExecutingOne() throws Exception {
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 1),
                new FakeProcessFactory(TaskType.GENERATE_REPLY));

        Task running = sleeper(300);
        CompletableFuture<TaskResult> runningFuture = pool.submit(running);
        await().atMost(Duration.ofSeconds(2)).until(() -> pool.snapshot().busy() == 1);
        Task queued = task(TaskType.GENERATE_REPLY, new JSONObject().put("text", "later"), TaskPriority.NORMAL);
        CompletableFuture<TaskResult> queuedFuture = pool.submit(queued);

        assertThat(pool.cancel(queued.id()).get(2, TimeUnit.SECONDS)).isTrue();
        assertThat(failureKind(queuedFuture)).isEqualTo(TaskErrorKind.CANCELLED);

        assertThat(pool.cancel(running.id()).get(2, TimeUnit.SECONDS)).isFalse();
        assertThat(runningFuture.get(5, TimeUnit.SECONDS).ok()).isTrue();
    }

    @Test
    void shouldShutDownIdempotentlyRejectingQueuedTasksWhileBusyWorkerFinishes() throws Exception {
        FakeProcessFactory factory = new FakeProcessFactory(TaskType.GENERATE_REPLY);
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 1), factory);

        CompletableFuture<TaskResult> busy = pool.submit(sleeper(300));
        await().atMost(Duration.ofSeconds(2)).until(() -> pool.snapshot().busy() == 1);
        CompletableFuture<TaskResult> queued1 = pool.submit(sleeper(10));
        CompletableFuture<TaskResult> queued2 = pool.submit(sleeper(10));

        CompletableFuture<Void> first = pool.shutdown(Duration.ofSeconds(3));
        CompletableFuture<Void> second = pool.shutdown(Duration.ofSeconds(3));

        assertThat(second).isSameAs(first);
        assertThat(failureKind(queued1)).isEqualTo(TaskErrorKind.POOL_SHUTTING_DOWN);
        assertThat(failureKind(queued2)).isEqualTo(TaskErrorKind.POOL_SHUTTING_DOWN);
        assertThat(busy.get(5, TimeUnit.SECONDS).ok()).isTrue();
        assertThat(failureKind(pool.submit(sleeper(10)))).isEqualTo(TaskErrorKind.POOL_SHUTTING_DOWN);

        first.get(10, TimeUnit.SECONDS);
        assertThat(pool.isAccepting()).isFalse();
        assertThat(factory.spawned()).allSatisfy(p -> assertThat(p.isAlive()).isFalse());
        assertThat(pool.cancel("anything").get(1, TimeUnit.SECONDS)).isFalse();
    }

    @Test
    void shouldKeepSlotCountsAddingUpToPoolSize() throws Exception {
        FakeProcessFactory factory = new FakeProcessFactory(TaskType.GENERATE_REPLY);
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 3), factory);

        List<CompletableFuture<TaskResult>> futures = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            futures.add(pool.submit(sleeper(50)));
        }
        factory.spawned().get(1).kill();
        long until = System.currentTimeMillis() + 1_000;
        while (System.currentTimeMillis() < until) {
            assertSlotInvariant(pool.snapshot());
            Thread.sleep(5);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .handle((v, t) -> null)
                .get(10, TimeUnit.SECONDS);
        assertSlotInvariant(pool.snapshot());
    }

    @Test
    void shouldRejectTaskOfAnotherType() {
        startPool(WorkerTestDoubles.fastSettings(TaskType.GENERATE_REPLY, 1),
                new FakeProcessFactory(TaskType.GENERATE_REPLY));

        Task wrong = task(TaskType.SYNTHESIZE, new JSONObject(), TaskPriority.NORMAL);

        assertThatThrownBy(() -> pool.submit(wrong))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("synthesize");
    }
}
