package com.timemultiplier.api.entity;

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

/** Snapshot of a user's time entries taken by the worker before it rewrites them. */
@Entity
@Table(name = "backups")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Backup {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false, length = 50, updatable = false)
  private String userId;

  @Column(name = "date", nullable = false, updatable = false)
  private LocalDate date;

  @Column(nullable = false, updatable = false)
  private String filename;

  // Opaque JSON text, parsed only when a single backup is fetched.
  @Column(name = "data", nullable = false, updatable = false)
  private String data;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  public void prePersist() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }
}
