package com.soundbox.relay.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.soundbox.relay.model.DeviceReport;
import com.soundbox.relay.model.TransactionRecord;
import com.soundbox.relay.service.TransactionClaimService;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DeviceController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class DeviceControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TransactionClaimService claimService;

  @Test
  void returnsClaimedTransaction() throws Exception {
    when(claimService.claimNext(eq("S1"), eq("tok123"), any()))
        .thenReturn(
            Optional.of(
                new TransactionRecord(
                    1L, "tx-1", "S1", 15000L, false, Instant.parse("2026-03-01T00:00:00Z"))));

    mockMvc
        .perform(
            get("/next-transaction")
                .param("store_id", "S1")
                .header(DeviceController.HEADER_DEVICE_TOKEN, "tok123"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.available").value(true))
        .andExpect(jsonPath("$.transaction_id").value("tx-1"))
        .andExpect(jsonPath("$.amount").value(15000))
        .andExpect(jsonPath("$.store_id").value("S1"));
  }

  @Test
  void emptyQueueReturnsOnlyAvailableFalse() throws Exception {
    when(claimService.claimNext(eq("S1"), eq("tok123"), any())).thenReturn(Optional.empty());

    mockMvc
        .perform(
            get("/next-transaction")
                .param("store_id", "S1")
                .header(DeviceController.HEADER_DEVICE_TOKEN, "tok123"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.available").value(false))
        .andExpect(jsonPath("$.transaction_id").doesNotExist())
        .andExpect(jsonPath("$.amount").doesNotExist());
  }

  @Test
  void passesClientOriginAndFirmwareToClaim() throws Exception {
    when(claimService.claimNext(eq("S1"), eq("tok123"), any())).thenReturn(Optional.empty());

    mockMvc
        .perform(
            get("/next-transaction")
                .param("store_id", "S1")
                .header(DeviceController.HEADER_DEVICE_TOKEN, "tok123")
                .header(DeviceController.HEADER_FIRMWARE_VERSION, "2.4.1")
                .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1"))
        .andExpect(status().isOk());

    final ArgumentCaptor<DeviceReport> report = ArgumentCaptor.forClass(DeviceReport.class);
    verify(claimService).claimNext(eq("S1"), eq("tok123"), report.capture());
    assertThat(report.getValue()).isEqualTo(new DeviceReport("203.0.113.9", "2.4.1"));
  }

  @Test
  void credentialMismatchIs401() throws Exception {
    when(claimService.claimNext(eq("S1"), eq("bad"), any()))
        .thenThrow(new DeviceUnauthorizedException());

    mockMvc
        .perform(
            get("/next-transaction")
                .param("store_id", "S1")
                .header(DeviceController.HEADER_DEVICE_TOKEN, "bad"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
  }

  @Test
  void disabledStoreIs403() throws Exception {
    when(claimService.claimNext(eq("S1"), eq("tok123"), any()))
        .thenThrow(new StoreUnavailableException("S1"));

    mockMvc
        .perform(
            get("/next-transaction")
                .param("store_id", "S1")
                .header(DeviceController.HEADER_DEVICE_TOKEN, "tok123"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
  }

  @Test
  void missingStoreIdIs400() throws Exception {
    mockMvc
        .perform(get("/next-transaction").header(DeviceController.HEADER_DEVICE_TOKEN, "tok123"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void storageFailureIs500() throws Exception {
    when(claimService.claimNext(eq("S1"), eq("tok123"), any()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    mockMvc
        .perform(
            get("/next-transaction")
                .param("store_id", "S1")
                .header(DeviceController.HEADER_DEVICE_TOKEN, "tok123"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("STORAGE_FAILURE"));
  }
}
