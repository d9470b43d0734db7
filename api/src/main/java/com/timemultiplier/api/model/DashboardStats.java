package com.timemultiplier.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDateTime;
import lombok.Builder;

@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DashboardStats(
    long totalEmployees,
    long activeEmployees,
    LocalDateTime lastRun,
    LocalDateTime nextRun,
    double totalHoursAddedThisWeek,
    double totalHoursAddedThisMonth) {}
