package com.timemultiplier.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ledger entry as reported by the worker. {@code date} is kept as raw text: an unparseable value
 * must not reject the entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OperationLogInput {

  @NotBlank private String employeeId;

  @NotNull private String employeeName;

  private String date;

  @NotNull @PositiveOrZero private Double originalHours;

  @NotNull @PositiveOrZero private Double updatedHours;

  @NotBlank private String status;
}
