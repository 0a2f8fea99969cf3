package com.phillippitts.voiceforge.presentation.controller;

import com.phillippitts.voiceforge.domain.TurnRecord;
import com.phillippitts.voiceforge.service.metrics.TurnMetricsAggregator;
import org.json.JSONObject;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Per-turn latency summary and raw export.
 */
@RestController
@RequestMapping("/api/metrics/turns")
class TurnMetricsController {

    private final TurnMetricsAggregator aggregator;

    TurnMetricsController(TurnMetricsAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @GetMapping
    ResponseEntity<Map<String, Object>> summary() {
        return ResponseEntity.ok(aggregator.summary().toJson().toMap());
    }

    /** Records oldest first, as far back as the ring buffer reaches. */
    @GetMapping("/export")
    ResponseEntity<List<Map<String, Object>>> export() {
        List<Map<String, Object>> records = aggregator.export().stream()
                .map(TurnRecord::toJson)
                .map(JSONObject::toMap)
                .toList();
        return ResponseEntity.ok(records);
    }
}
