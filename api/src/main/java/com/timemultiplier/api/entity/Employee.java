package com.timemultiplier.api.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.domain.Persistable;

/**
 * An employee whose hours the worker multiplies. The id is the time-tracking provider's user id,
 * never a locally generated value.
 */
@Entity
@Table(name = "employees")
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Employee implements Persistable<String> {

  public static final double DEFAULT_MULTIPLIER = 1.5;

  @Id
  @Column(length = 50)
  private String id;

  @Column(nullable = false)
  private String name;

  private String email;

  @Column(nullable = false)
  private Double multiplier;

  @Column(nullable = false)
  private Boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  // Rows are only ever inserted once; an unset created_at marks an entity that must be persisted,
  // so a duplicate id fails on the primary key instead of being merged over the existing row.
  @Override
  @JsonIgnore
  public boolean isNew() {
    return createdAt == null;
  }

  @PrePersist
  public void prePersist() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }
}
