package com.timemultiplier.api.service;

import com.timemultiplier.api.entity.RunConfiguration;
import com.timemultiplier.api.model.RunConfigurationInput;
import com.timemultiplier.api.repository.RunConfigurationRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RunConfigurationService {
  private final RunConfigurationRepository repository;
  private final Clock clock;

  @Transactional(readOnly = true)
  public RunConfiguration getConfiguration() {
    return repository
        .findById(RunConfiguration.SINGLETON_ID)
        .orElseThrow(() -> new IllegalStateException("Run configuration row is missing"));
  }

  /** Overwrites the whole row in a single update statement. */
  @Transactional
  public RunConfiguration replaceConfiguration(RunConfigurationInput input) {
    checkRange("run_hour", input.getRunHour(), 23);
    checkRange("run_minute", input.getRunMinute(), 59);
    if (input.getDryRun() == null) {
      throw new IllegalArgumentException("dry_run is required");
    }
    Double defaultMultiplier = input.getDefaultMultiplier();
    if (defaultMultiplier == null || defaultMultiplier < 0) {
      throw new IllegalArgumentException("default_multiplier must be zero or greater");
    }

    int updated =
        repository.replace(
            RunConfiguration.SINGLETON_ID,
            input.getRunHour(),
            input.getRunMinute(),
            defaultMultiplier,
            input.getDryRun(),
            LocalDateTime.now(clock));
    if (updated == 0) {
      throw new IllegalStateException("Run configuration row is missing");
    }

    log.info(
        "Run configuration replaced: {}:{} dry_run={} default_multiplier={}",
        String.format("%02d", input.getRunHour()),
        String.format("%02d", input.getRunMinute()),
        input.getDryRun(),
        defaultMultiplier);
    return getConfiguration();
  }

  private static void checkRange(String field, Integer value, int max) {
    if (value == null || value < 0 || value > max) {
      throw new IllegalArgumentException(field + " must be between 0 and " + max);
    }
  }
}
