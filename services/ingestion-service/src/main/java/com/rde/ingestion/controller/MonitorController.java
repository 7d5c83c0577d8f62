package com.rde.ingestion.controller;

import com.rde.ingestion.domain.MonitorStatus;
import com.rde.ingestion.service.MonitorService;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MonitorController {

    private final MonitorService monitorService;

    public MonitorController(MonitorService monitorService) {
        this.monitorService = monitorService;
    }

    @PostMapping("/v1/monitor/start")
    public ResponseEntity<MonitorStatus> start() {
        monitorService.start();
        return ResponseEntity.accepted().body(monitorService.status());
    }

    @PostMapping("/v1/monitor/stop")
    public MonitorStatus stop() {
        monitorService.stop();
        return monitorService.status();
    }

    @GetMapping("/v1/monitor/status")
    public MonitorStatus status() {
        return monitorService.status();
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
            "status", "UP",
            "monitorRunning", monitorService.isRunning()
        );
    }
}
