package com.timemultiplier.api.controller;

import com.timemultiplier.api.model.ApiResponse;
import com.timemultiplier.api.model.BackupDetail;
import com.timemultiplier.api.model.BackupInput;
import com.timemultiplier.api.model.BackupSummary;
import com.timemultiplier.api.service.BackupService;
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
@RequestMapping("/api/backups")
@Tag(name = "Backups", description = "Snapshots taken by the worker before rewriting entries")
public class BackupController {

  private final BackupService backupService;

  @PostMapping
  @Operation(summary = "Worker callback: store a backup")
  public ResponseEntity<ApiResponse<BackupSummary>> saveBackup(
      @RequestBody @Valid BackupInput input) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ApiResponse.message("Backup saved", backupService.saveBackup(input)));
  }

  @GetMapping
  @Operation(summary = "List backup metadata, newest first")
  public ResponseEntity<List<BackupSummary>> getBackups(
      @RequestParam(name = "user_id", required = false) String userId,
      @Parameter(description = "YYYY-MM-DD") @RequestParam(required = false) String date,
      @Parameter(description = "Page size, default 50") @RequestParam(required = false)
          Integer limit) {
    return ResponseEntity.ok(backupService.getBackups(userId, date, limit));
  }

  @GetMapping("/{id}")
  @Operation(summary = "Fetch one backup including its data")
  public ResponseEntity<BackupDetail> getBackup(
      @Parameter(description = "Backup ID", required = true) @PathVariable Long id) {
    return ResponseEntity.ok(backupService.getBackup(id));
  }
}
