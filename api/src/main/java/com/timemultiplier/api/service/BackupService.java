package com.timemultiplier.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timemultiplier.api.entity.Backup;
import com.timemultiplier.api.exception.CorruptDataException;
import com.timemultiplier.api.model.BackupDetail;
import com.timemultiplier.api.model.BackupInput;
import com.timemultiplier.api.model.BackupSummary;
import com.timemultiplier.api.repository.BackupRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.NoSuchElementException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BackupService {
  static final int DEFAULT_LIMIT = 50;

  private final BackupRepository backupRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Stores a snapshot. A JSON string in {@code data} is kept verbatim as the document text; any
   * other JSON value is stored in its serialized form.
   */
  @Transactional
  public BackupSummary saveBackup(BackupInput input) {
    LocalDate date = parseStrict(input.getDate());
    if (input.getData() == null || input.getData().isNull()) {
      throw new IllegalArgumentException("data is required");
    }

    Backup saved =
        backupRepository.save(
            Backup.builder()
                .userId(input.getUserId())
                .date(date)
                .filename(input.getFilename())
                .data(toText(input.getData()))
                .createdAt(LocalDateTime.now(clock))
                .build());
    log.info(
        "Stored backup {} for user {} on {} ({})",
        saved.getId(),
        saved.getUserId(),
        date,
        saved.getFilename());
    return toSummary(saved);
  }

  @Transactional(readOnly = true)
  public List<BackupSummary> getBackups(String userId, String date, Integer limit) {
    int pageSize = limit == null ? DEFAULT_LIMIT : limit;
    if (pageSize < 0) {
      throw new IllegalArgumentException("limit must not be negative");
    }
    String userFilter = userId == null || userId.isBlank() ? null : userId;
    LocalDate dateFilter = date == null || date.isBlank() ? null : parseStrict(date);
    return backupRepository.findSummaries(userFilter, dateFilter, pageSize);
  }

  /**
   * @throws CorruptDataException when the stored text is no longer valid JSON
   */
  @Transactional(readOnly = true)
  public BackupDetail getBackup(Long id) {
    Backup backup =
        backupRepository
            .findById(id)
            .orElseThrow(() -> new NoSuchElementException("Backup not found: " + id));

    JsonNode data;
    try {
      data = objectMapper.readTree(backup.getData());
    } catch (JsonProcessingException e) {
      log.error("Backup {} holds unreadable data: {}", id, e.getOriginalMessage());
      throw new CorruptDataException("Backup " + id + " data is not valid JSON", e);
    }
    if (data == null || data.isMissingNode()) {
      log.error("Backup {} holds empty data", id);
      throw new CorruptDataException("Backup " + id + " data is empty", null);
    }

    return new BackupDetail(
        backup.getId(),
        backup.getUserId(),
        backup.getDate(),
        backup.getFilename(),
        data,
        backup.getCreatedAt());
  }

  private String toText(JsonNode data) {
    if (data.isTextual()) {
      return data.textValue();
    }
    try {
      return objectMapper.writeValueAsString(data);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("data cannot be serialized", e);
    }
  }

  private static LocalDate parseStrict(String raw) {
    try {
      return LocalDate.parse(raw == null ? "" : raw.trim());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid date '" + raw + "', expected YYYY-MM-DD", e);
    }
  }

  private static BackupSummary toSummary(Backup backup) {
    return new BackupSummary(
        backup.getId(),
        backup.getUserId(),
        backup.getDate(),
        backup.getFilename(),
        backup.getCreatedAt());
  }
}
