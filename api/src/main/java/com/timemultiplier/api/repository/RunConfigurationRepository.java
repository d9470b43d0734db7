package com.timemultiplier.api.repository;

import com.timemultiplier.api.entity.RunConfiguration;
import java.time.LocalDateTime;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RunConfigurationRepository extends JpaRepository<RunConfiguration, Integer> {

  /** Overwrites every field of the singleton row in one statement. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE RunConfiguration c SET c.runHour = :runHour, c.runMinute = :runMinute,"
          + " c.defaultMultiplier = :defaultMultiplier, c.dryRun = :dryRun,"
          + " c.updatedAt = :updatedAt WHERE c.id = :id")
  int replace(
      @Param("id") int id,
      @Param("runHour") int runHour,
      @Param("runMinute") int runMinute,
      @Param("defaultMultiplier") double defaultMultiplier,
      @Param("dryRun") boolean dryRun,
      @Param("updatedAt") LocalDateTime updatedAt);
}
