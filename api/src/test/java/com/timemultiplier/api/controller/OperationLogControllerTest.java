package com.timemultiplier.api.controller;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.timemultiplier.api.entity.OperationLog;
import com.timemultiplier.api.model.OperationLogInput;
import com.timemultiplier.api.model.TriggerReceipt;
import com.timemultiplier.api.service.OperationLogService;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = OperationLogController.class)
class OperationLogControllerTest {
  private static final String AUTH = "Bearer test-secret";

  @Autowired private MockMvc mockMvc;

  @MockBean private OperationLogService operationLogService;

  private static OperationLog entry(long id) {
    return OperationLog.builder()
        .id(id)
        .employeeId("u1")
        .employeeName("Alice")
        .date(LocalDate.of(2026, 10, 14))
        .originalHours(8.0)
        .updatedHours(12.0)
        .status(OperationLog.STATUS_SUCCESS)
        .createdAt(LocalDateTime.of(2026, 10, 15, 1, 0))
        .build();
  }

  @Test
  void getLogs_ShouldPassPagingAndFilter() throws Exception {
    Mockito.when(operationLogService.getLogs(10, 5, "u1")).thenReturn(List.of(entry(7)));

    mockMvc
        .perform(
            get("/api/logs")
                .param("limit", "10")
                .param("offset", "5")
                .param("employee_id", "u1")
                .header(HttpHeaders.AUTHORIZATION, AUTH))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].employee_name", is("Alice")))
        .andExpect(jsonPath("$[0].date", is("2026-10-14")))
        .andExpect(jsonPath("$[0].original_hours", is(8.0)))
        .andExpect(jsonPath("$[0].date_parse_failed", is(false)));
  }

  @Test
  void getLogs_ShouldLeaveDefaultsToService() throws Exception {
    Mockito.when(operationLogService.getLogs(null, null, null)).thenReturn(List.of());

    mockMvc
        .perform(get("/api/logs").header(HttpHeaders.AUTHORIZATION, AUTH))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void getLogs_ShouldReturn400_ForNonNumericLimit() throws Exception {
    mockMvc
        .perform(get("/api/logs").param("limit", "ten").header(HttpHeaders.AUTHORIZATION, AUTH))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error", containsString("limit")));
  }

  @Test
  void recordLog_ShouldAcknowledge() throws Exception {
    Mockito.when(operationLogService.recordLog(any(OperationLogInput.class)))
        .thenReturn(entry(8));

    mockMvc
        .perform(
            post("/api/logs/record")
                .header(HttpHeaders.AUTHORIZATION, AUTH)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "employee_id": "u1",
                      "employee_name": "Alice",
                      "date": "2026-10-14",
                      "original_hours": 8,
                      "updated_hours": 12,
                      "status": "success"
                    }
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message", is("Log recorded")))
        .andExpect(jsonPath("$.data.id", is(8)));
  }

  @Test
  void recordLog_ShouldReturn400_WhenHoursMissing() throws Exception {
    mockMvc
        .perform(
            post("/api/logs/record")
                .header(HttpHeaders.AUTHORIZATION, AUTH)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"employee_id\": \"u1\", \"employee_name\": \"A\", \"status\": \"x\"}"))
        .andExpect(status().isBadRequest());

    Mockito.verifyNoInteractions(operationLogService);
  }

  @Test
  void triggerUpdate_ShouldEchoMarker() throws Exception {
    Mockito.when(operationLogService.recordManualTrigger("u1", "2026-10-14"))
        .thenReturn(new TriggerReceipt(9L, "u1", LocalDate.of(2026, 10, 14)));

    mockMvc
        .perform(
            post("/api/trigger-update")
                .param("employee_id", "u1")
                .param("date", "2026-10-14")
                .header(HttpHeaders.AUTHORIZATION, AUTH))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message", is("Update triggered")))
        .andExpect(jsonPath("$.data.log_id", is(9)))
        .andExpect(jsonPath("$.data.employee_id", is("u1")))
        .andExpect(jsonPath("$.data.date", is("2026-10-14")));
  }
}
