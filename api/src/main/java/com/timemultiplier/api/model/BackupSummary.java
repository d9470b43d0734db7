package com.timemultiplier.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.time.LocalDateTime;

/** Backup metadata without the stored document. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BackupSummary(
    Long id, String userId, LocalDate date, String filename, LocalDateTime createdAt) {}
