package com.example.investigator.controller;

import com.example.investigator.service.EmbeddedLogIndex;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Chaos switch for demos and evaluation runs: reseeds the embedded log index.
 *
 * <p>POST /api/v1/simulation/logs?scenario=pod-crashloop
 */
@RestController
@RequestMapping("/api/v1/simulation")
public class SimulationController {

    private final EmbeddedLogIndex logIndex;

    public SimulationController(EmbeddedLogIndex logIndex) {
        this.logIndex = logIndex;
    }

    @PostMapping("/logs")
    public Map<String, String> loadLogs(@RequestParam String scenario) {
        logIndex.loadScenario(scenario);
        return Map.of("scenario", logIndex.currentScenario());
    }

    /** Unknown scenario names are the caller's mistake. */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleUnknownScenario(IllegalArgumentException e) {
        return GlobalExceptionHandler.badRequest(
                e.getMessage() == null ? "invalid scenario" : e.getMessage());
    }
}
