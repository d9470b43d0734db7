package com.timemultiplier.api.repository;

import com.timemultiplier.api.model.BackupSummary;
import java.time.LocalDate;
import java.util.List;

public interface BackupRepositoryCustom {

  /** Metadata only; the stored document is never loaded. Null filters are ignored. */
  List<BackupSummary> findSummaries(String userId, LocalDate date, int limit);
}
