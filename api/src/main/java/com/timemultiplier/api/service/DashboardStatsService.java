package com.timemultiplier.api.service;

import com.timemultiplier.api.entity.OperationLog;
import com.timemultiplier.api.entity.RunConfiguration;
import com.timemultiplier.api.model.DashboardStats;
import com.timemultiplier.api.repository.OperationLogRepository;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Summary figures for the dashboard header, derived on every request. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DashboardStatsService {
  private final EmployeeService employeeService;
  private final RunConfigurationService runConfigurationService;
  private final OperationLogRepository operationLogRepository;
  private final Clock clock;

  @Transactional(readOnly = true)
  public DashboardStats getStats() {
    LocalDateTime now = LocalDateTime.now(clock);
    RunConfiguration config = runConfigurationService.getConfiguration();

    DashboardStats stats =
        DashboardStats.builder()
            .totalEmployees(employeeService.countEmployees())
            .activeEmployees(employeeService.countActiveEmployees())
            .lastRun(
                operationLogRepository
                    .findLastCreatedAtByStatus(OperationLog.STATUS_SUCCESS)
                    .orElse(null))
            .nextRun(computeNextRun(now, config.getRunHour(), config.getRunMinute()))
            .totalHoursAddedThisWeek(hoursAddedSince(startOfWeek(now), now))
            .totalHoursAddedThisMonth(hoursAddedSince(startOfMonth(now), now))
            .build();
    log.debug("Computed dashboard stats: {}", stats);
    return stats;
  }

  /** Today at {@code hour:minute:00} if that is still ahead of {@code now}, otherwise tomorrow. */
  public static LocalDateTime computeNextRun(LocalDateTime now, int hour, int minute) {
    LocalDateTime candidate = now.toLocalDate().atTime(hour, minute);
    return candidate.isAfter(now) ? candidate : candidate.plusDays(1);
  }

  static LocalDateTime startOfWeek(LocalDateTime now) {
    return now.toLocalDate()
        .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
        .atStartOfDay();
  }

  static LocalDateTime startOfMonth(LocalDateTime now) {
    return now.toLocalDate().withDayOfMonth(1).atTime(LocalTime.MIDNIGHT);
  }

  private double hoursAddedSince(LocalDateTime from, LocalDateTime to) {
    Double sum = operationLogRepository.sumHoursAdded(OperationLog.STATUS_SUCCESS, from, to);
    return sum == null ? 0.0 : sum;
  }
}
