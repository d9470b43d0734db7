package com.timemultiplier.api.controller;

import com.timemultiplier.api.entity.OperationLog;
import com.timemultiplier.api.model.ApiResponse;
import com.timemultiplier.api.model.OperationLogInput;
import com.timemultiplier.api.model.TriggerReceipt;
import com.timemultiplier.api.service.OperationLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Operation log", description = "Ledger of update attempts and manual triggers")
public class OperationLogController {

  private final OperationLogService operationLogService;

  @GetMapping("/logs")
  @Operation(summary = "Read the ledger, newest first")
  public ResponseEntity<List<OperationLog>> getLogs(
      @Parameter(description = "Page size, default 100") @RequestParam(required = false)
          Integer limit,
      @Parameter(description = "Entries to skip, default 0") @RequestParam(required = false)
          Integer offset,
      @Parameter(description = "Only entries of this employee")
          @RequestParam(name = "employee_id", required = false)
          String employeeId) {
    return ResponseEntity.ok(operationLogService.getLogs(limit, offset, employeeId));
  }

  @PostMapping("/logs/record")
  @Operation(summary = "Worker callback: append a ledger entry")
  public ResponseEntity<ApiResponse<OperationLog>> recordLog(
      @RequestBody @Valid OperationLogInput input) {
    return ResponseEntity.ok(
        ApiResponse.message("Log recorded", operationLogService.recordLog(input)));
  }

  @PostMapping("/trigger-update")
  @Operation(summary = "Record a manual update request for the worker")
  public ResponseEntity<ApiResponse<TriggerReceipt>> triggerUpdate(
      @RequestParam(name = "employee_id", required = false) String employeeId,
      @Parameter(description = "YYYY-MM-DD, default today") @RequestParam(required = false)
          String date) {
    return ResponseEntity.ok(
        ApiResponse.message(
            "Update triggered", operationLogService.recordManualTrigger(employeeId, date)));
  }
}
