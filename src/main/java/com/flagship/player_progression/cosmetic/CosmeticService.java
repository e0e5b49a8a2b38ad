package com.flagship.player_progression.cosmetic;

import com.flagship.player_progression.event.CosmeticUnlockedEvent;
import com.flagship.player_progression.ledger.CurrencyLedgerService;
import com.flagship.player_progression.ledger.CurrencyTransaction;
import com.flagship.player_progression.ledger.InsufficientCurrencyException;
import com.flagship.player_progression.ledger.TransactionKind;
import com.flagship.player_progression.observability.CorrelationContext;
import com.flagship.player_progression.observability.ProgressionMetrics;
import com.flagship.player_progression.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Catalog reads, ownership listing and purchases.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CosmeticService {

    private final CosmeticCatalog catalog;
    private final CosmeticOwnershipStore ownershipStore;
    private final CurrencyLedgerService ledgerService;
    private final OutboxService outboxService;
    private final ProgressionMetrics metrics;

    public List<CosmeticItem> getCatalog() {
        return catalog.findAll();
    }

    public List<OwnedCosmetic> getOwnedCosmetics(Long playerId) {
        return ownershipStore.findOwned(playerId);
    }

    /**
     * Debits the cosmetic's cost and grants it, atomically.
     *
     * Ownership is checked up front and again by the primary key at grant time,
     * so two racing purchases of the same item charge the player once.
     *
     * @throws CosmeticNotFoundException      unknown cosmetic
     * @throws CosmeticAlreadyOwnedException  the player owns it already
     * @throws InsufficientCurrencyException  balance below the cost
     */
    @Transactional
    public PurchaseResult purchaseCosmetic(Long playerId, Long cosmeticId) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.enterPlayerScope(playerId, "purchase");
        try {
            CosmeticItem item = catalog.findById(cosmeticId)
                    .orElseThrow(() -> new CosmeticNotFoundException(cosmeticId));

            if (ownershipStore.owns(playerId, cosmeticId)) {
                throw new CosmeticAlreadyOwnedException(playerId, cosmeticId);
            }

            Optional<CurrencyTransaction> debit = ledgerService.applyCurrencyDelta(
                    playerId, -item.getDataCost(), TransactionKind.PURCHASE, String.valueOf(cosmeticId));

            try {
                ownershipStore.grant(playerId, cosmeticId, UnlockMethod.PURCHASE);
            } catch (DuplicateKeyException e) {
                throw new CosmeticAlreadyOwnedException(playerId, cosmeticId);
            }

            outboxService.saveEvent(CosmeticUnlockedEvent.of(
                    playerId, cosmeticId, UnlockMethod.PURCHASE.getDbValue()));

            long balance = debit.map(CurrencyTransaction::getBalanceAfter)
                    .orElseGet(() -> ledgerService.getBalance(playerId));

            metrics.recordPurchase("success");
            metrics.recordLatency("purchase", System.currentTimeMillis() - startTime);
            log.info("Cosmetic purchased: playerId={}, cosmeticId={}, cost={}, balance={}",
                    playerId, cosmeticId, item.getDataCost(), balance);

            return new PurchaseResult(item, balance);

        } catch (RuntimeException e) {
            metrics.recordPurchase(e.getClass().getSimpleName());
            throw e;
        }
    }
}
