/*
 * Where: Relay API response
 * What: Device listing
 */
package com.soundbox.relay.api.response;

import java.util.List;

public record DevicesResponse(List<DeviceStatusResponse> devices) {}
