package com.timemultiplier.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial update: only non-null fields are applied. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateEmployeeInput {

  @PositiveOrZero private Double multiplier;

  private Boolean active;

  @JsonIgnore
  public boolean isEmpty() {
    return multiplier == null && active == null;
  }
}
