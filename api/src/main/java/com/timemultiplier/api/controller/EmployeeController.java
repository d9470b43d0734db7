package com.timemultiplier.api.controller;

import com.timemultiplier.api.entity.Employee;
import com.timemultiplier.api.model.AddEmployeeInput;
import com.timemultiplier.api.model.ApiResponse;
import com.timemultiplier.api.model.UpdateEmployeeInput;
import com.timemultiplier.api.service.EmployeeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/employees")
@Tag(name = "Employees", description = "Registry of employees whose hours are multiplied")
public class EmployeeController {

  private final EmployeeService employeeService;

  @GetMapping
  @Operation(summary = "List employees ordered by name")
  public ResponseEntity<List<Employee>> getAllEmployees() {
    return ResponseEntity.ok(employeeService.getAllEmployees());
  }

  @PostMapping
  @Operation(summary = "Register an Everhour user as employee")
  public ResponseEntity<Employee> addEmployee(
      @Parameter(description = "Everhour user id")
          @RequestParam(name = "employee_id", required = false)
          String employeeId,
      @RequestBody(required = false) AddEmployeeInput input) {
    String id = employeeId != null ? employeeId : input != null ? input.getEmployeeId() : null;
    return ResponseEntity.status(HttpStatus.CREATED).body(employeeService.addEmployee(id));
  }

  @PatchMapping("/{id}")
  @Operation(summary = "Update multiplier and/or active flag")
  public ResponseEntity<Employee> updateEmployee(
      @Parameter(description = "Employee ID", required = true) @PathVariable String id,
      @RequestBody @Valid UpdateEmployeeInput input) {
    return ResponseEntity.ok(employeeService.updateEmployee(id, input));
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Remove employee; ledger entries are kept")
  public ResponseEntity<ApiResponse<Void>> deleteEmployee(
      @Parameter(description = "Employee ID", required = true) @PathVariable String id) {
    employeeService.deleteEmployee(id);
    return ResponseEntity.ok(ApiResponse.message("Employee deleted"));
  }
}
