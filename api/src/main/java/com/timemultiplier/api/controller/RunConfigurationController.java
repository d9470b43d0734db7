package com.timemultiplier.api.controller;

import com.timemultiplier.api.entity.RunConfiguration;
import com.timemultiplier.api.model.RunConfigurationInput;
import com.timemultiplier.api.service.RunConfigurationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/config")
@Tag(name = "Run configuration", description = "Worker schedule and dry-run switch")
public class RunConfigurationController {

  private final RunConfigurationService runConfigurationService;

  @GetMapping
  @Operation(summary = "Read the run configuration")
  public ResponseEntity<RunConfiguration> getConfiguration() {
    return ResponseEntity.ok(runConfigurationService.getConfiguration());
  }

  @PutMapping
  @Operation(summary = "Replace the run configuration")
  public ResponseEntity<RunConfiguration> replaceConfiguration(
      @RequestBody @Valid RunConfigurationInput input) {
    return ResponseEntity.ok(runConfigurationService.replaceConfiguration(input));
  }
}
