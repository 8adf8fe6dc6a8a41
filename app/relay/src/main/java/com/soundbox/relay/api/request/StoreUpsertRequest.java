/*
 * Where: Relay admin API request
 * What: Registers a store or renames it and rotates its device token
 */
package com.soundbox.relay.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StoreUpsertRequest(
    @NotBlank(message = "store_id and name required")
        @Pattern(regexp = "\\s*[A-Za-z0-9._-]+\\s*", message = "store_id has invalid characters")
        String storeId,
    @NotBlank(message = "store_id and name required") String name,
    String deviceToken) {}
