package com.phillippitts.voiceforge.presentation.controller;

import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.exception.UnknownTaskTypeException;
import com.phillippitts.voiceforge.service.pool.PoolStatus;
import com.phillippitts.voiceforge.service.pool.TaskRouter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Capacity report of the worker pools.
 */
@RestController
@RequestMapping("/api/pools")
class PoolController {

    private final TaskRouter router;

    PoolController(TaskRouter router) {
        this.router = router;
    }

    @GetMapping
    ResponseEntity<Map<String, Object>> describe() {
        Map<String, Object> body = new LinkedHashMap<>();
        router.describe().forEach((type, status) -> body.put(type.wireName(), status.toJson().toMap()));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{type}")
    ResponseEntity<Map<String, Object>> describe(@PathVariable("type") String type) {
        TaskType taskType = TaskType.fromWire(type).orElseThrow(() -> new UnknownTaskTypeException(type));
        PoolStatus status = router.describe().get(taskType);
        if (status == null) {
            throw new UnknownTaskTypeException(type);
        }
        return ResponseEntity.ok(status.toJson().toMap());
    }
}
