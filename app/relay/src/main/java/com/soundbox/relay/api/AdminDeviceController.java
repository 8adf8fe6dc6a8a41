/*
 * Where: Relay admin API
 * What: Device liveness listing for operators
 */
package com.soundbox.relay.api;

import com.soundbox.relay.api.response.DeviceStatusResponse;
import com.soundbox.relay.api.response.DevicesResponse;
import com.soundbox.relay.service.DeviceStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AdminDeviceController {

  private final DeviceStatusService deviceStatusService;

  @GetMapping("/admin/devices")
  public ResponseEntity<DevicesResponse> listDevices() {
    return ResponseEntity.ok(
        new DevicesResponse(
            deviceStatusService.listDevices().stream().map(DeviceStatusResponse::from).toList()));
  }
}
