package com.phillippitts.voiceforge.presentation.controller;

import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.service.pool.TaskRouter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Direct task submission: {@code {id, type, payload, priority, deadlineMs?}} in,
 * {@code {id, ok, result}} out. Failed tasks are answered by the exception handler.
 */
@RestController
@RequestMapping("/api/tasks")
class TaskController {

    private static final Logger LOG = LogManager.getLogger(TaskController.class);

    private final TaskRouter router;

    TaskController(TaskRouter router) {
        this.router = router;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    CompletableFuture<ResponseEntity<Map<String, Object>>> submit(@RequestBody String body) {
        Task task = Task.fromJson(new JSONObject(body));
        LOG.info("Task id={} type={} priority={} submitted over HTTP", task.id(), task.type(), task.priority());
        return router.route(task).thenApply(result -> ResponseEntity.ok(result.toJson().toMap()));
    }
}
