/*
 * Where: Relay API
 * What: Poll endpoint of the soundbox devices
 * Why: Devices authenticate with their store token and claim at most one transaction per poll
 */
package com.soundbox.relay.api;

import com.soundbox.relay.api.response.NextTransactionResponse;
import com.soundbox.relay.config.ClientIpResolver;
import com.soundbox.relay.model.DeviceReport;
import com.soundbox.relay.service.TransactionClaimService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class DeviceController {

  public static final String HEADER_DEVICE_TOKEN = "X-Device-Token";
  public static final String HEADER_FIRMWARE_VERSION = "X-Firmware-Version";

  private final TransactionClaimService claimService;

  @GetMapping("/next-transaction")
  public ResponseEntity<NextTransactionResponse> nextTransaction(
      @RequestParam("store_id") String storeId,
      @RequestHeader(value = HEADER_DEVICE_TOKEN, required = false) String deviceToken,
      @RequestHeader(value = HEADER_FIRMWARE_VERSION, required = false) String firmwareVersion,
      HttpServletRequest request) {
    if (storeId.isBlank()) {
      throw new IllegalArgumentException("store_id is required");
    }
    final DeviceReport report =
        new DeviceReport(ClientIpResolver.resolve(request), blankToNull(firmwareVersion));
    final NextTransactionResponse response =
        claimService
            .claimNext(storeId.trim(), deviceToken, report)
            .map(NextTransactionResponse::from)
            .orElseGet(NextTransactionResponse::unavailable);
    return ResponseEntity.ok(response);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
