package com.timemultiplier.api.repository;

import com.timemultiplier.api.entity.Backup;
import com.timemultiplier.api.model.BackupSummary;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

class BackupRepositoryCustomImpl implements BackupRepositoryCustom {

  @PersistenceContext private EntityManager entityManager;

  @Override
  public List<BackupSummary> findSummaries(String userId, LocalDate date, int limit) {
    CriteriaBuilder cb = entityManager.getCriteriaBuilder();
    CriteriaQuery<BackupSummary> query = cb.createQuery(BackupSummary.class);
    Root<Backup> backup = query.from(Backup.class);

    query.select(
        cb.construct(
            BackupSummary.class,
            backup.get("id"),
            backup.get("userId"),
            backup.get("date"),
            backup.get("filename"),
            backup.get("createdAt")));

    List<Predicate> filters = new ArrayList<>();
    if (userId != null) {
      filters.add(cb.equal(backup.get("userId"), userId));
    }
    if (date != null) {
      filters.add(cb.equal(backup.get("date"), date));
    }
    query.where(filters.toArray(new Predicate[0]));
    query.orderBy(cb.desc(backup.get("createdAt")), cb.desc(backup.get("id")));

    return entityManager.createQuery(query).setMaxResults(limit).getResultList();
  }
}
