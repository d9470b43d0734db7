package com.timemultiplier.api.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.time.LocalDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BackupDetail(
    Long id,
    String userId,
    LocalDate date,
    String filename,
    JsonNode data,
    LocalDateTime createdAt) {}
