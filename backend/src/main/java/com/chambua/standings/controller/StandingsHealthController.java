package com.chambua.standings.controller;

import com.chambua.standings.dto.HealthReport;
import com.chambua.standings.service.StandingsHealthReporter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/standings")
@CrossOrigin(origins = "*")
public class StandingsHealthController {

    private final StandingsHealthReporter healthReporter;

    public StandingsHealthController(StandingsHealthReporter healthReporter) {
        this.healthReporter = healthReporter;
    }

    /** 200 while healthy or degraded, 503 when unhealthy. */
    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = healthReporter.report();
        HttpStatus status = report.getStatus() == HealthReport.Status.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }
}
