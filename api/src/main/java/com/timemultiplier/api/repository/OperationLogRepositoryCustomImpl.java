package com.timemultiplier.api.repository;

import com.timemultiplier.api.entity.OperationLog;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import java.util.List;

class OperationLogRepositoryCustomImpl implements OperationLogRepositoryCustom {

  @PersistenceContext private EntityManager entityManager;

  @Override
  public List<OperationLog> findPage(String employeeId, int limit, int offset) {
    String jpql =
        employeeId == null
            ? "SELECT l FROM OperationLog l ORDER BY l.createdAt DESC, l.id DESC"
            : "SELECT l FROM OperationLog l WHERE l.employeeId = :employeeId"
                + " ORDER BY l.createdAt DESC, l.id DESC";

    TypedQuery<OperationLog> query = entityManager.createQuery(jpql, OperationLog.class);
    if (employeeId != null) {
      query.setParameter("employeeId", employeeId);
    }
    return query.setFirstResult(offset).setMaxResults(limit).getResultList();
  }
}
