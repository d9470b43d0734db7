package com.timemultiplier.api.service;

import com.timemultiplier.api.entity.Employee;
import com.timemultiplier.api.entity.OperationLog;
import com.timemultiplier.api.model.OperationLogInput;
import com.timemultiplier.api.model.TriggerReceipt;
import com.timemultiplier.api.repository.OperationLogRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** The append-only ledger of update attempts. Entries are never modified once written. */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperationLogService {
  static final int DEFAULT_LIMIT = 100;

  private final OperationLogRepository operationLogRepository;
  private final EmployeeService employeeService;
  private final Clock clock;

  @Transactional(readOnly = true)
  public List<OperationLog> getLogs(Integer limit, Integer offset, String employeeId) {
    int pageSize = limit == null ? DEFAULT_LIMIT : limit;
    int start = offset == null ? 0 : offset;
    if (pageSize < 0) {
      throw new IllegalArgumentException("limit must not be negative");
    }
    if (start < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
    String filter = employeeId == null || employeeId.isBlank() ? null : employeeId;
    return operationLogRepository.findPage(filter, pageSize, start);
  }

  /**
   * Appends a worker report. A date that is not {@code YYYY-MM-DD} does not reject the entry: it is
   * stored under today's date with {@code date_parse_failed} set.
   */
  @Transactional
  public OperationLog recordLog(OperationLogInput input) {
    ParsedDate parsed = parseLenient(input.getDate());
    if (parsed.failed()) {
      log.warn(
          "Unparseable date '{}' in log for employee {}, storing {} instead",
          input.getDate(),
          input.getEmployeeId(),
          parsed.date());
    }

    OperationLog entry =
        operationLogRepository.save(
            OperationLog.builder()
                .employeeId(input.getEmployeeId())
                .employeeName(input.getEmployeeName())
                .date(parsed.date())
                .originalHours(input.getOriginalHours())
                .updatedHours(input.getUpdatedHours())
                .status(input.getStatus())
                .dateParseFailed(parsed.failed())
                .createdAt(LocalDateTime.now(clock))
                .build());
    log.info(
        "Recorded {} for employee {} on {}: {} -> {}",
        entry.getStatus(),
        entry.getEmployeeId(),
        entry.getDate(),
        entry.getOriginalHours(),
        entry.getUpdatedHours());
    return entry;
  }

  /**
   * Writes a zero-delta {@code manual_trigger} marker. Nothing is executed here; the worker picks
   * the request up on its own schedule.
   */
  @Transactional
  public TriggerReceipt recordManualTrigger(String employeeId, String date) {
    ParsedDate parsed = parseLenient(date);
    if (parsed.failed()) {
      log.warn("Unparseable trigger date '{}', using {}", date, parsed.date());
    }
    String targetId = employeeId == null || employeeId.isBlank() ? null : employeeId;
    String name = employeeService.findEmployee(targetId).map(Employee::getName).orElse(null);

    OperationLog marker =
        operationLogRepository.save(
            OperationLog.builder()
                .employeeId(targetId)
                .employeeName(name)
                .date(parsed.date())
                .originalHours(0.0)
                .updatedHours(0.0)
                .status(OperationLog.STATUS_MANUAL_TRIGGER)
                .dateParseFailed(parsed.failed())
                .createdAt(LocalDateTime.now(clock))
                .build());
    log.info(
        "Manual update requested for {} on {}",
        Optional.ofNullable(targetId).orElse("all employees"),
        parsed.date());
    return new TriggerReceipt(marker.getId(), targetId, marker.getDate());
  }

  private ParsedDate parseLenient(String raw) {
    LocalDate today = LocalDate.now(clock);
    if (raw == null || raw.isBlank()) {
      return new ParsedDate(today, false);
    }
    try {
      return new ParsedDate(LocalDate.parse(raw.trim()), false);
    } catch (DateTimeParseException e) {
      return new ParsedDate(today, true);
    }
  }

  private record ParsedDate(LocalDate date, boolean failed) {}
}
