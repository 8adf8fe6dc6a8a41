/*
 * Where: Relay service layer
 * What: Lists every store with the liveness its heartbeat row reports
 */
package com.soundbox.relay.service;

import com.soundbox.relay.model.DeviceStatusRecord;
import com.soundbox.relay.repository.HeartbeatRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeviceStatusService {

  private final HeartbeatSchemaCache schemaCache;
  private final HeartbeatRepository heartbeatRepository;

  public List<DeviceStatusRecord> listDevices() {
    return heartbeatRepository.findDeviceStatuses(schemaCache.get());
  }
}
