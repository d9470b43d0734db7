package com.timemultiplier.api.controller;

import com.timemultiplier.api.model.DashboardStats;
import com.timemultiplier.api.service.DashboardStatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Dashboard", description = "Summary statistics and liveness")
public class DashboardController {

  private final DashboardStatsService dashboardStatsService;
  private final Clock clock;

  @GetMapping("/stats")
  @Operation(summary = "Employee counts, last/next run and hours added")
  public ResponseEntity<DashboardStats> getStats() {
    return ResponseEntity.ok(dashboardStatsService.getStats());
  }

  // Unauthenticated.
  @GetMapping("/health")
  @Operation(summary = "Liveness probe")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "healthy");
    body.put("timestamp", LocalDateTime.now(clock));
    return ResponseEntity.ok(body);
  }
}
