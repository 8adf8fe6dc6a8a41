/*
 * Where: Relay API
 * What: Entry point of the cashier integration
 * Why: A confirmed QRIS payment becomes a pending transaction for the store's soundbox
 */
package com.soundbox.relay.api;

import com.soundbox.relay.api.request.CreateTransactionRequest;
import com.soundbox.relay.api.response.CreateTransactionResponse;
import com.soundbox.relay.service.TransactionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class CashierController {

  private final TransactionService transactionService;

  /** Authorization by API key is enforced in the security filter chain. */
  @PostMapping("/qris")
  public ResponseEntity<CreateTransactionResponse> createTransaction(
      @Valid @RequestBody CreateTransactionRequest request) {
    final String transactionId =
        transactionService.create(request.storeId().trim(), request.amount());
    return ResponseEntity.ok(new CreateTransactionResponse(transactionId));
  }
}
