package com.timemultiplier.api.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Creates the four tables on startup and seeds the configuration row. Every statement is
 * idempotent, so it is safe against an existing database. A failure here aborts startup.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {
  private final JdbcTemplate jdbc;

  @PostConstruct
  public void ensureTables() {
    jdbc.execute(
        "CREATE TABLE IF NOT EXISTS employees ("
            + "id VARCHAR(50) NOT NULL, "
            + "name VARCHAR(255) NOT NULL, "
            + "email VARCHAR(255), "
            + "multiplier DOUBLE PRECISION DEFAULT 1.5 NOT NULL, "
            + "active BOOLEAN DEFAULT TRUE NOT NULL, "
            + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL, "
            + "PRIMARY KEY (id), "
            + "CONSTRAINT chk_employees_multiplier CHECK (multiplier >= 0)"
            + ")");

    // Singleton: the check constraint pins the only legal id to 1.
    jdbc.execute(
        "CREATE TABLE IF NOT EXISTS system_config ("
            + "id INTEGER DEFAULT 1 NOT NULL, "
            + "run_hour INTEGER DEFAULT 1 NOT NULL, "
            + "run_minute INTEGER DEFAULT 0 NOT NULL, "
            + "default_multiplier DOUBLE PRECISION DEFAULT 1.5 NOT NULL, "
            + "dry_run BOOLEAN DEFAULT TRUE NOT NULL, "
            + "updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
            + "PRIMARY KEY (id), "
            + "CONSTRAINT chk_system_config_singleton CHECK (id = 1), "
            + "CONSTRAINT chk_system_config_hour CHECK (run_hour BETWEEN 0 AND 23), "
            + "CONSTRAINT chk_system_config_minute CHECK (run_minute BETWEEN 0 AND 59)"
            + ")");

    jdbc.execute(
        "CREATE TABLE IF NOT EXISTS operation_logs ("
            + "id BIGINT GENERATED BY DEFAULT AS IDENTITY, "
            + "employee_id VARCHAR(50), "
            + "employee_name VARCHAR(255), "
            + "date DATE, "
            + "original_hours DOUBLE PRECISION, "
            + "updated_hours DOUBLE PRECISION, "
            + "status VARCHAR(50), "
            + "date_parse_failed BOOLEAN DEFAULT FALSE NOT NULL, "
            + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL, "
            + "PRIMARY KEY (id)"
            + ")");
    // Databases created before the parse-failure flag existed.
    jdbc.execute(
        "ALTER TABLE operation_logs ADD COLUMN IF NOT EXISTS "
            + "date_parse_failed BOOLEAN DEFAULT FALSE NOT NULL");
    jdbc.execute(
        "CREATE INDEX IF NOT EXISTS idx_operation_logs_created_at ON operation_logs (created_at)");
    jdbc.execute(
        "CREATE INDEX IF NOT EXISTS idx_operation_logs_employee ON operation_logs (employee_id)");

    jdbc.execute(
        "CREATE TABLE IF NOT EXISTS backups ("
            + "id BIGINT GENERATED BY DEFAULT AS IDENTITY, "
            + "user_id VARCHAR(50) NOT NULL, "
            + "date DATE NOT NULL, "
            + "filename VARCHAR(255) NOT NULL, "
            + "data TEXT NOT NULL, "
            + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP NOT NULL, "
            + "PRIMARY KEY (id)"
            + ")");
    jdbc.execute(
        "CREATE INDEX IF NOT EXISTS idx_backups_user_date ON backups (user_id, date)");

    int seeded =
        jdbc.update(
            "INSERT INTO system_config (id, run_hour, run_minute, default_multiplier, dry_run) "
                + "SELECT 1, 1, 0, 1.5, TRUE "
                + "WHERE NOT EXISTS (SELECT 1 FROM system_config WHERE id = 1)");
    if (seeded > 0) {
      log.info("Seeded default run configuration (01:00, dry run)");
    }

    log.info("Schema checked/initialized: employees, system_config, operation_logs, backups");
  }
}
