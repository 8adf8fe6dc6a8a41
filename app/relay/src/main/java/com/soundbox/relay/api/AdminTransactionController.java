/*
 * Where: Relay admin API
 * What: Operator view and cleanup of transaction queues
 */
package com.soundbox.relay.api;

import com.soundbox.relay.api.request.StoreIdRequest;
import com.soundbox.relay.api.response.TransactionSummary;
import com.soundbox.relay.api.response.TransactionsClearedResponse;
import com.soundbox.relay.api.response.TransactionsResponse;
import com.soundbox.relay.service.TransactionAdminService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/transactions")
@RequiredArgsConstructor
public class AdminTransactionController {

  private final TransactionAdminService transactionAdminService;

  /** Filters are taken as raw strings so malformed values degrade to defaults instead of 400. */
  @GetMapping
  public ResponseEntity<TransactionsResponse> listTransactions(
      @RequestParam(value = "store_id", required = false) String storeId,
      @RequestParam(value = "played", required = false) String played,
      @RequestParam(value = "limit", required = false) String limit) {
    return ResponseEntity.ok(
        new TransactionsResponse(
            transactionAdminService.listRecent(storeId, played, limit).stream()
                .map(TransactionSummary::from)
                .toList()));
  }

  @PostMapping("/clear")
  public ResponseEntity<TransactionsClearedResponse> clearTransactions(
      @Valid @RequestBody StoreIdRequest request) {
    final int deleted = transactionAdminService.clear(request.storeId());
    return ResponseEntity.ok(new TransactionsClearedResponse(request.storeId().trim(), deleted));
  }
}
