package com.phillippitts.voiceforge.service.pool;

import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.domain.TaskPriority;
import com.phillippitts.voiceforge.domain.TaskResult;
import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.UnknownTaskTypeException;
import com.phillippitts.voiceforge.testutil.EventCapturingPublisher;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PoolRegistryTest {

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private PoolRegistry registry;

    @AfterEach
    void tearDown() {
        if (registry != null) {
            registry.close();
        }
    }

    private WorkerPool pool(TaskType type) {
        return new WorkerPool(WorkerTestDoubles.fastSettings(type, 1), new WorkerTestDoubles.FakeProcessFactory(type),
                publisher);
    }

    @Test
    void shouldRouteEachTaskToThePoolForItsType() throws Exception {
        registry = new PoolRegistry(Map.of(
                TaskType.TRANSCRIBE, pool(TaskType.TRANSCRIBE),
                TaskType.GENERATE_REPLY, pool(TaskType.GENERATE_REPLY)),
                List.of(TaskType.TRANSCRIBE, TaskType.GENERATE_REPLY));
        registry.start();

        TaskResult transcript = registry.route(Task.of(TaskType.TRANSCRIBE,
                new JSONObject().put("text", "hi there"), TaskPriority.INTERACTIVE)).get(5, TimeUnit.SECONDS);
        TaskResult reply = registry.route(Task.of(TaskType.GENERATE_REPLY,
                new JSONObject().put("text", "hi there"), TaskPriority.INTERACTIVE)).get(5, TimeUnit.SECONDS);

        assertThat(transcript.resultJson().getString("text")).isEqualTo("hi there");
        assertThat(reply.resultJson().getString("text")).isEqualTo("I received: hi there");
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
            assertThat(registry.describe().get(TaskType.TRANSCRIBE).completed()).isEqualTo(1);
            assertThat(registry.describe().get(TaskType.GENERATE_REPLY).completed()).isEqualTo(1);
        });
    }

    @Test
    void shouldRejectUnservedTypeWithUnknownTaskType() {
        registry = new PoolRegistry(Map.of(TaskType.TRANSCRIBE, pool(TaskType.TRANSCRIBE)), List.of());

        Task clone = Task.of(TaskType.CLONE_VOICE, new JSONObject(), TaskPriority.NORMAL);

        assertThatThrownBy(() -> registry.route(clone))
                .isInstanceOf(UnknownTaskTypeException.class)
                .hasMessageContaining("clone-voice");
        assertThat(registry.supports(TaskType.CLONE_VOICE)).isFalse();
        assertThat(registry.describe()).containsOnlyKeys(TaskType.TRANSCRIBE);
    }

    @Test
    void shouldFailConstructionWhenRequiredTypeIsMissing() {
        Map<TaskType, WorkerPool> pools = Map.of(TaskType.TRANSCRIBE, pool(TaskType.TRANSCRIBE));

        assertThatThrownBy(() -> new PoolRegistry(pools, List.of(TaskType.SYNTHESIZE)))
                .isInstanceOf(UnknownTaskTypeException.class)
                .hasMessageContaining("synthesize");
    }

    @Test
    void shouldRejectPoolRegisteredUnderWrongType() {
        Map<TaskType, WorkerPool> pools = Map.of(TaskType.SYNTHESIZE, pool(TaskType.TRANSCRIBE));

        assertThatThrownBy(() -> new PoolRegistry(pools, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldStopEveryPoolOnShutdown() throws Exception {
        WorkerPool transcribe = pool(TaskType.TRANSCRIBE);
        WorkerPool synthesize = pool(TaskType.SYNTHESIZE);
        registry = new PoolRegistry(Map.of(TaskType.TRANSCRIBE, transcribe, TaskType.SYNTHESIZE, synthesize),
                List.of());
        registry.start();

        registry.shutdown(Duration.ofSeconds(1)).get(10, TimeUnit.SECONDS);

        assertThat(transcribe.isAccepting()).isFalse();
        assertThat(synthesize.isAccepting()).isFalse();
    }
}
