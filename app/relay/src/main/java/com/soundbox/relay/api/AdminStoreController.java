/*
 * Where: Relay admin API
 * What: Operator management of stores and their device tokens
 */
package com.soundbox.relay.api;

import com.soundbox.relay.api.request.StoreIdRequest;
import com.soundbox.relay.api.request.StoreUpsertRequest;
import com.soundbox.relay.api.response.StoreActionResponse;
import com.soundbox.relay.api.response.StoreResponse;
import com.soundbox.relay.api.response.StoresResponse;
import com.soundbox.relay.service.StoreAdminService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/stores")
@RequiredArgsConstructor
public class AdminStoreController {

  private final StoreAdminService storeAdminService;

  @GetMapping
  public ResponseEntity<StoresResponse> listStores() {
    return ResponseEntity.ok(
        new StoresResponse(
            storeAdminService.listStores().stream().map(StoreResponse::from).toList()));
  }

  /** Creates or updates a store; the response carries the effective device token. */
  @PostMapping
  public ResponseEntity<StoreResponse> upsertStore(@Valid @RequestBody StoreUpsertRequest request) {
    return ResponseEntity.ok(
        StoreResponse.from(
            storeAdminService.upsert(request.storeId(), request.name(), request.deviceToken())));
  }

  @PostMapping("/enable")
  public ResponseEntity<StoreActionResponse> enableStore(
      @Valid @RequestBody StoreIdRequest request) {
    storeAdminService.enable(request.storeId());
    return ResponseEntity.ok(new StoreActionResponse(request.storeId().trim(), true));
  }

  @PostMapping("/disable")
  public ResponseEntity<StoreActionResponse> disableStore(
      @Valid @RequestBody StoreIdRequest request) {
    storeAdminService.disable(request.storeId());
    return ResponseEntity.ok(new StoreActionResponse(request.storeId().trim(), true));
  }

  @PostMapping("/delete")
  public ResponseEntity<StoreActionResponse> deleteStore(
      @Valid @RequestBody StoreIdRequest request) {
    storeAdminService.delete(request.storeId());
    return ResponseEntity.ok(new StoreActionResponse(request.storeId().trim(), true));
  }
}
