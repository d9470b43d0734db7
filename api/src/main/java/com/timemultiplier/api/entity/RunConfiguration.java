package com.timemultiplier.api.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Schedule and dry-run switch read by the worker. Exactly one row exists, keyed by {@link
 * #SINGLETON_ID}; the table's check constraint rejects any other id.
 */
@Entity
@Table(name = "system_config")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunConfiguration {

  public static final int SINGLETON_ID = 1;

  @Id @JsonIgnore private Integer id;

  @Column(name = "run_hour", nullable = false)
  private Integer runHour;

  @Column(name = "run_minute", nullable = false)
  private Integer runMinute;

  @Column(name = "default_multiplier", nullable = false)
  private Double defaultMultiplier;

  @Column(name = "dry_run", nullable = false)
  private Boolean dryRun;

  @Column(name = "updated_at")
  private LocalDateTime updatedAt;
}
