package com.phillippitts.voiceforge.presentation.controller;

import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.domain.TaskErrorKind;
import com.phillippitts.voiceforge.domain.TaskPriority;
import com.phillippitts.voiceforge.domain.TaskResult;
import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.TaskFailedException;
import com.phillippitts.voiceforge.service.pool.TaskRouter;
import org.json.JSONException;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TaskControllerTest {

    private TaskRouter router;
    private TaskController controller;

    @BeforeEach
    void setUp() {
        router = mock(TaskRouter.class);
        controller = new TaskController(router);
    }

    @Test
    void shouldRouteParsedTaskAndReturnResult() throws Exception {
        when(router.route(any(Task.class))).thenAnswer(invocation -> {
            Task task = invocation.getArgument(0);
            return CompletableFuture.completedFuture(
                    TaskResult.success(task.id(), new JSONObject().put("text", "hello")));
        });

        ResponseEntity<Map<String, Object>> response = controller.submit(
                "{\"id\":\"t-7\",\"type\":\"transcribe\",\"payload\":{\"audio\":\"\"},"
                        + "\"priority\":100,\"deadlineMs\":1500}").get();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("id", "t-7").containsEntry("ok", true);
        assertThat(response.getBody().get("result")).isEqualTo(Map.of("text", "hello"));

        ArgumentCaptor<Task> captor = ArgumentCaptor.forClass(Task.class);
        verify(router).route(captor.capture());
        Task routed = captor.getValue();
        assertThat(routed.type()).isEqualTo(TaskType.TRANSCRIBE);
        assertThat(routed.priority()).isEqualTo(TaskPriority.INTERACTIVE);
        assertThat(routed.deadline()).isEqualTo(Duration.ofMillis(1500));
        assertThat(routed.payloadJson().has("audio")).isTrue();
    }

    @Test
    void shouldPropagateTaskFailureToExceptionHandler() {
        when(router.route(any(Task.class))).thenReturn(CompletableFuture.failedFuture(
                new TaskFailedException(TaskErrorKind.WORKER_CRASHED, "t-8", TaskType.SYNTHESIZE,
                        "worker process exited")));

        CompletableFuture<ResponseEntity<Map<String, Object>>> future =
                controller.submit("{\"id\":\"t-8\",\"type\":\"synthesize\",\"payload\":{\"text\":\"hi\"}}");

        assertThatThrownBy(future::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TaskFailedException.class);
    }

    @Test
    void shouldRejectUnknownTypeBeforeRouting() {
        assertThatThrownBy(() -> controller.submit("{\"type\":\"teleport\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("teleport");
        verifyNoInteractions(router);
    }

    @Test
    void shouldRejectMalformedBody() {
        assertThatThrownBy(() -> controller.submit("not json"))
                .isInstanceOf(JSONException.class);
        verifyNoInteractions(router);
    }
}
