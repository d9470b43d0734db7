package com.timemultiplier.api.repository;

import com.timemultiplier.api.entity.OperationLog;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OperationLogRepository
    extends JpaRepository<OperationLog, Long>, OperationLogRepositoryCustom {

  /** Sum of {@code updated_hours - original_hours}, null when no row matches. */
  @Query(
      "SELECT SUM(l.updatedHours - l.originalHours) FROM OperationLog l"
          + " WHERE l.status = :status AND l.createdAt >= :from AND l.createdAt <= :to")
  Double sumHoursAdded(
      @Param("status") String status,
      @Param("from") LocalDateTime from,
      @Param("to") LocalDateTime to);

  @Query("SELECT MAX(l.createdAt) FROM OperationLog l WHERE l.status = :status")
  Optional<LocalDateTime> findLastCreatedAtByStatus(@Param("status") String status);
}
