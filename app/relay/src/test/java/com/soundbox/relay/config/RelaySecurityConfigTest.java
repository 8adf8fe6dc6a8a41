/*
 * Where: Relay security tests
 * What: API key, admin key and open device routes through the real filter chain
 */
package com.soundbox.relay.config;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.soundbox.relay.api.AdminDeviceController;
import com.soundbox.relay.api.AdminStoreController;
import com.soundbox.relay.api.AdminTransactionController;
import com.soundbox.relay.api.CashierController;
import com.soundbox.relay.api.DeviceController;
import com.soundbox.relay.api.StatusController;
import com.soundbox.relay.service.DeviceStatusService;
import com.soundbox.relay.service.StoreAdminService;
import com.soundbox.relay.service.TransactionAdminService;
import com.soundbox.relay.service.TransactionClaimService;
import com.soundbox.relay.service.TransactionService;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({
  CashierController.class,
  DeviceController.class,
  AdminStoreController.class,
  AdminTransactionController.class,
  AdminDeviceController.class,
  StatusController.class
})
@AutoConfigureMockMvc
@Import(RelaySecurityConfig.class)
@TestPropertySource(
    properties = {"soundbox.api.api-key=test-api-key", "soundbox.api.admin-key=test-admin-key"})
class RelaySecurityConfigTest {

  private static final String QRIS_BODY = "{\"store_id\":\"S1\",\"amount\":15000}";

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TransactionService transactionService;
  @MockitoBean private TransactionClaimService claimService;
  @MockitoBean private StoreAdminService storeAdminService;
  @MockitoBean private TransactionAdminService transactionAdminService;
  @MockitoBean private DeviceStatusService deviceStatusService;

  @Test
  void qrisRejectsMissingApiKey() throws Exception {
    mockMvc
        .perform(post("/qris").contentType(MediaType.APPLICATION_JSON).content(QRIS_BODY))
        .andExpect(status().isUnauthorized());
    verify(transactionService, never()).create(anyString(), anyLong());
  }

  @Test
  void qrisRejectsWrongApiKeyAndAdminKey() throws Exception {
    mockMvc
        .perform(
            post("/qris")
                .header("X-Api-Key", "wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .content(QRIS_BODY))
        .andExpect(status().isUnauthorized());
    mockMvc
        .perform(
            post("/qris")
                .header("X-Admin-Key", "test-admin-key")
                .contentType(MediaType.APPLICATION_JSON)
                .content(QRIS_BODY))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void qrisAcceptsValidApiKey() throws Exception {
    when(transactionService.create("S1", 15000L)).thenReturn("tx-1");

    mockMvc
        .perform(
            post("/qris")
                .header("X-Api-Key", "test-api-key")
                .contentType(MediaType.APPLICATION_JSON)
                .content(QRIS_BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.transaction_id").value("tx-1"));
  }

  @Test
  void devicePollNeedsNoApiKey() throws Exception {
    when(claimService.claimNext(eq("S1"), eq("tok123"), any())).thenReturn(Optional.empty());

    mockMvc
        .perform(
            get("/next-transaction").param("store_id", "S1").header("X-Device-Token", "tok123"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.available").value(false));
  }

  @Test
  void adminRoutesRequireAdminKey() throws Exception {
    mockMvc.perform(get("/admin/stores")).andExpect(status().isUnauthorized());
    mockMvc
        .perform(get("/admin/stores").header("X-Api-Key", "test-api-key"))
        .andExpect(status().isUnauthorized());
    mockMvc
        .perform(get("/admin/devices").header("X-Admin-Key", "wrong"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void adminRoutesAcceptAdminKey() throws Exception {
    when(storeAdminService.listStores()).thenReturn(List.of());

    mockMvc
        .perform(get("/admin/stores").header("X-Admin-Key", "test-admin-key"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.stores").isArray());
  }

  @Test
  void statusRootIsPublic() throws Exception {
    mockMvc.perform(get("/")).andExpect(status().isOk());
  }

  @Test
  void unknownRouteIsDenied() throws Exception {
    mockMvc
        .perform(get("/internal").header("X-Admin-Key", "test-admin-key"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void corsPreflightAllowsDeviceHeaders() throws Exception {
    mockMvc
        .perform(
            options("/next-transaction")
                .header("Origin", "http://dashboard.test")
                .header("Access-Control-Request-Method", "GET")
                .header("Access-Control-Request-Headers", "X-Device-Token"))
        .andExpect(status().isOk())
        .andExpect(header().string("Access-Control-Allow-Origin", "*"));
  }
}
