package com.timemultiplier.api.repository;

import com.timemultiplier.api.entity.OperationLog;
import java.util.List;

public interface OperationLogRepositoryCustom {

  /**
   * Newest entries first (ties broken by id), optionally restricted to one employee. Offset based,
   * unlike Spring Data's page-number pagination.
   */
  List<OperationLog> findPage(String employeeId, int limit, int offset);
}
