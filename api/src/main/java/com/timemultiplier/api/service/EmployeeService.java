package com.timemultiplier.api.service;

import com.timemultiplier.api.client.EverhourClient;
import com.timemultiplier.api.entity.Employee;
import com.timemultiplier.api.exception.EmployeeAlreadyExistsException;
import com.timemultiplier.api.model.EverhourUser;
import com.timemultiplier.api.model.UpdateEmployeeInput;
import com.timemultiplier.api.repository.EmployeeRepository;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmployeeService {
  static final String UNKNOWN_NAME = "Unknown";

  private final EmployeeRepository employeeRepository;
  private final EverhourClient everhourClient;

  @Transactional(readOnly = true)
  public List<Employee> getAllEmployees() {
    return employeeRepository.findAllByOrderByNameAsc();
  }

  @Transactional(readOnly = true)
  public Optional<Employee> findEmployee(String employeeId) {
    if (employeeId == null || employeeId.isBlank()) {
      return Optional.empty();
    }
    return employeeRepository.findById(employeeId);
  }

  /**
   * Registers an Everhour user with {@link Employee#DEFAULT_MULTIPLIER}. The provider is asked
   * first, so an unknown id is reported as not found even when it happens to be registered locally.
   * The lookup runs outside any transaction; the exists check and the insert each use the
   * repository's own.
   */
  public Employee addEmployee(String employeeId) {
    if (employeeId == null || employeeId.isBlank()) {
      throw new IllegalArgumentException("employee_id is required");
    }

    EverhourUser user =
        everhourClient
            .getUserById(employeeId)
            .orElseThrow(
                () -> new NoSuchElementException("Employee not found in Everhour: " + employeeId));

    if (employeeRepository.existsById(employeeId)) {
      throw new EmployeeAlreadyExistsException(employeeId);
    }

    String name =
        user.getName() == null || user.getName().isBlank() ? UNKNOWN_NAME : user.getName();
    Employee employee =
        Employee.builder()
            .id(employeeId)
            .name(name)
            .email(user.getEmail())
            .multiplier(Employee.DEFAULT_MULTIPLIER)
            .active(true)
            .build();

    Employee saved = employeeRepository.save(employee);
    log.info(
        "Registered employee {} ({}) with multiplier {}",
        saved.getId(),
        name,
        saved.getMultiplier());
    return saved;
  }

  /** Applies the supplied fields only; each one is written by its own update statement. */
  @Transactional
  public Employee updateEmployee(String employeeId, UpdateEmployeeInput input) {
    if (input == null || input.isEmpty()) {
      throw new IllegalArgumentException("No fields to update");
    }

    if (input.getMultiplier() != null) {
      if (input.getMultiplier() < 0) {
        throw new IllegalArgumentException("multiplier must not be negative");
      }
      requireUpdated(
          employeeRepository.updateMultiplier(employeeId, input.getMultiplier()), employeeId);
    }
    if (input.getActive() != null) {
      requireUpdated(employeeRepository.updateActive(employeeId, input.getActive()), employeeId);
    }

    log.info("Updated employee {}: {}", employeeId, input);
    return employeeRepository
        .findById(employeeId)
        .orElseThrow(() -> new NoSuchElementException("Employee not found: " + employeeId));
  }

  /** Removes the employee. Ledger entries keep their snapshot of the name. */
  @Transactional
  public void deleteEmployee(String employeeId) {
    if (employeeRepository.deleteEmployeeById(employeeId) == 0) {
      throw new NoSuchElementException("Employee not found: " + employeeId);
    }
    log.info("Deleted employee {}", employeeId);
  }

  @Transactional(readOnly = true)
  public long countEmployees() {
    return employeeRepository.count();
  }

  @Transactional(readOnly = true)
  public long countActiveEmployees() {
    return employeeRepository.countByActiveTrue();
  }

  private static void requireUpdated(int rows, String employeeId) {
    if (rows == 0) {
      throw new NoSuchElementException("Employee not found: " + employeeId);
    }
  }
}
