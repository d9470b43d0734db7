package com.timemultiplier.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Full replacement of the run configuration. Every field is required. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunConfigurationInput {

  @NotNull
  @Min(0)
  @Max(23)
  private Integer runHour;

  @NotNull
  @Min(0)
  @Max(59)
  private Integer runMinute;

  @NotNull private Boolean dryRun;

  @NotNull @PositiveOrZero private Double defaultMultiplier;
}
