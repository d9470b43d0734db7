package com.timemultiplier.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;

/** Echo of a recorded manual trigger. The marker does not mean the worker has run. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TriggerReceipt(Long logId, String employeeId, LocalDate date) {}
