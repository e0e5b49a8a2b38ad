package com.flagship.player_progression.ledger;

import com.flagship.player_progression.ledger.dto.BalanceResponse;
import com.flagship.player_progression.ledger.dto.CurrencyGrantRequest;
import com.flagship.player_progression.ledger.dto.TransactionResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Validated
@RequiredArgsConstructor
@Slf4j
public class CurrencyController {

    private final CurrencyLedgerService ledgerService;

    @GetMapping("/players/{playerId}/currency")
    public BalanceResponse getBalance(@PathVariable("playerId") @Positive Long playerId) {
        return new BalanceResponse(playerId, ledgerService.getBalance(playerId));
    }

    @GetMapping("/players/{playerId}/currency/transactions")
    public List<TransactionResponse> getTransactions(@PathVariable("playerId") @Positive Long playerId) {
        return ledgerService.getTransactions(playerId).stream()
                .map(TransactionResponse::from)
                .toList();
    }

    /**
     * 201 with the new ledger row, or 204 for a zero amount (nothing recorded).
     */
    @PostMapping("/admin/players/{playerId}/currency")
    public ResponseEntity<TransactionResponse> grantCurrency(@PathVariable("playerId") @Positive Long playerId,
                                                             @Valid @RequestBody CurrencyGrantRequest request) {
        log.info("Manual currency adjustment requested: playerId={}, amount={}, type={}",
                playerId, request.getAmount(), request.getTransactionType());
        return ledgerService.adjustBalance(playerId, request.getAmount(),
                        request.getTransactionType(), request.getReferenceId())
                .map(transaction -> ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
