package com.timemultiplier.api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

import com.timemultiplier.api.entity.OperationLog;
import com.timemultiplier.api.entity.RunConfiguration;
import com.timemultiplier.api.model.DashboardStats;
import com.timemultiplier.api.repository.OperationLogRepository;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DashboardStatsServiceTest {
  // A Thursday.
  private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 15, 10, 30);

  @Mock EmployeeService employeeService;

  @Mock RunConfigurationService runConfigurationService;

  @Mock OperationLogRepository operationLogRepository;

  MutableClock clock;

  DashboardStatsService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    service =
        new DashboardStatsService(
            employeeService, runConfigurationService, operationLogRepository, clock);
  }

  @Test
  void computeNextRun_laterToday() {
    assertThat(DashboardStatsService.computeNextRun(NOW, 11, 0))
        .isEqualTo(LocalDateTime.of(2026, 10, 15, 11, 0));
  }

  @Test
  void computeNextRun_alreadyPassed_movesToTomorrow() {
    assertThat(DashboardStatsService.computeNextRun(NOW, 1, 0))
        .isEqualTo(LocalDateTime.of(2026, 10, 16, 1, 0));
  }

  @Test
  void computeNextRun_exactlyNow_movesToTomorrow() {
    assertThat(DashboardStatsService.computeNextRun(NOW, 10, 30))
        .isEqualTo(LocalDateTime.of(2026, 10, 16, 10, 30));
  }

  @Test
  void computeNextRun_isAlwaysAheadAndWithinADay() {
    LocalDateTime[] instants = {
      NOW, NOW.withHour(0).withMinute(0), NOW.withHour(23).withMinute(59).withSecond(59)
    };
    for (LocalDateTime now : instants) {
      for (int hour = 0; hour < 24; hour++) {
        for (int minute = 0; minute < 60; minute += 7) {
          LocalDateTime next = DashboardStatsService.computeNextRun(now, hour, minute);
          assertThat(next).isAfter(now);
          assertThat(Duration.between(now, next)).isLessThanOrEqualTo(Duration.ofHours(24));
          assertThat(next.getSecond()).isZero();
        }
      }
    }
  }

  @Test
  void windowStarts_areMondayAndFirstOfMonthAtMidnight() {
    assertThat(DashboardStatsService.startOfWeek(NOW))
        .isEqualTo(LocalDateTime.of(2026, 10, 12, 0, 0));
    assertThat(DashboardStatsService.startOfWeek(LocalDateTime.of(2026, 10, 12, 0, 0)))
        .isEqualTo(LocalDateTime.of(2026, 10, 12, 0, 0));
    assertThat(DashboardStatsService.startOfWeek(LocalDateTime.of(2026, 10, 18, 23, 59)))
        .isEqualTo(LocalDateTime.of(2026, 10, 12, 0, 0));
    assertThat(DashboardStatsService.startOfMonth(NOW))
        .isEqualTo(LocalDateTime.of(2026, 10, 1, 0, 0));
  }

  @Test
  void getStats_aggregatesCountsRunsAndWindows() {
    when(employeeService.countEmployees()).thenReturn(3L);
    when(employeeService.countActiveEmployees()).thenReturn(2L);
    when(runConfigurationService.getConfiguration())
        .thenReturn(
            RunConfiguration.builder()
                .id(1)
                .runHour(1)
                .runMinute(0)
                .defaultMultiplier(1.5)
                .dryRun(true)
                .build());
    LocalDateTime lastRun = LocalDateTime.of(2026, 10, 15, 1, 0, 5);
    when(operationLogRepository.findLastCreatedAtByStatus(OperationLog.STATUS_SUCCESS))
        .thenReturn(Optional.of(lastRun));
    when(operationLogRepository.sumHoursAdded(
            OperationLog.STATUS_SUCCESS, LocalDateTime.of(2026, 10, 12, 0, 0), NOW))
        .thenReturn(6.5);
    when(operationLogRepository.sumHoursAdded(
            OperationLog.STATUS_SUCCESS, LocalDateTime.of(2026, 10, 1, 0, 0), NOW))
        .thenReturn(20.0);

    DashboardStats stats = service.getStats();

    assertThat(stats.totalEmployees()).isEqualTo(3);
    assertThat(stats.activeEmployees()).isEqualTo(2);
    assertThat(stats.lastRun()).isEqualTo(lastRun);
    assertThat(stats.nextRun()).isEqualTo(LocalDateTime.of(2026, 10, 16, 1, 0));
    assertThat(stats.totalHoursAddedThisWeek()).isEqualTo(6.5);
    assertThat(stats.totalHoursAddedThisMonth()).isEqualTo(20.0);
  }

  @Test
  void getStats_withoutSuccessfulRuns_reportsZeroAndNoLastRun() {
    when(runConfigurationService.getConfiguration())
        .thenReturn(
            RunConfiguration.builder()
                .id(1)
                .runHour(23)
                .runMinute(0)
                .defaultMultiplier(1.5)
                .dryRun(true)
                .build());
    when(operationLogRepository.findLastCreatedAtByStatus(OperationLog.STATUS_SUCCESS))
        .thenReturn(Optional.empty());

    DashboardStats stats = service.getStats();

    assertThat(stats.lastRun()).isNull();
    assertThat(stats.nextRun()).isEqualTo(LocalDateTime.of(2026, 10, 15, 23, 0));
    assertThat(stats.totalHoursAddedThisWeek()).isZero();
    assertThat(stats.totalHoursAddedThisMonth()).isZero();
  }

  @Test
  void getStats_nextRunRollsOverOnceScheduledTimePasses() {
    when(runConfigurationService.getConfiguration())
        .thenReturn(
            RunConfiguration.builder()
                .id(1)
                .runHour(11)
                .runMinute(0)
                .defaultMultiplier(1.5)
                .dryRun(false)
                .build());

    assertThat(service.getStats().nextRun()).isEqualTo(LocalDateTime.of(2026, 10, 15, 11, 0));

    clock.advance(Duration.ofMinutes(30));

    assertThat(service.getStats().nextRun()).isEqualTo(LocalDateTime.of(2026, 10, 16, 11, 0));
  }
}
