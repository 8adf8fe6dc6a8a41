/*
 * Where: Relay API response
 * What: Store listing
 */
package com.soundbox.relay.api.response;

import java.util.List;

public record StoresResponse(List<StoreResponse> stores) {}
