package com.timemultiplier.api.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One update attempt reported by the worker, or a manual trigger marker. Immutable after insert:
 * there are no setters and the ledger never issues updates or deletes.
 *
 * <p>{@code employeeName} is a snapshot taken when the entry was written, so entries stay readable
 * after the employee is removed from the registry.
 */
@Entity
@Table(name = "operation_logs")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OperationLog {

  public static final String STATUS_SUCCESS = "success";
  public static final String STATUS_FAILURE = "failure";
  public static final String STATUS_MANUAL_TRIGGER = "manual_trigger";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "employee_id", length = 50, updatable = false)
  private String employeeId;

  @Column(name = "employee_name", updatable = false)
  private String employeeName;

  @Column(name = "date", updatable = false)
  private LocalDate date;

  @Column(name = "original_hours", updatable = false)
  private Double originalHours;

  @Column(name = "updated_hours", updatable = false)
  private Double updatedHours;

  @Column(length = 50, updatable = false)
  private String status;

  @Column(name = "date_parse_failed", nullable = false, updatable = false)
  private boolean dateParseFailed;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  public void prePersist() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }
}
