package com.timemultiplier.api.repository;

import com.timemultiplier.api.entity.Employee;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmployeeRepository extends JpaRepository<Employee, String> {

  List<Employee> findAllByOrderByNameAsc();

  long countByActiveTrue();

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE Employee e SET e.multiplier = :multiplier WHERE e.id = :id")
  int updateMultiplier(@Param("id") String id, @Param("multiplier") double multiplier);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE Employee e SET e.active = :active WHERE e.id = :id")
  int updateActive(@Param("id") String id, @Param("active") boolean active);

  /** Returns the number of rows removed, 0 when the id is unknown. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM Employee e WHERE e.id = :id")
  int deleteEmployeeById(@Param("id") String id);
}
