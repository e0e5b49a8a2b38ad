package com.flagship.player_progression.cosmetic;

import com.flagship.player_progression.config.ProgressionProperties;
import com.flagship.player_progression.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Equipping cosmetics and managing a player's loadouts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoadoutService {

    private final LoadoutStore loadoutStore;
    private final CosmeticCatalog catalog;
    private final CosmeticOwnershipStore ownershipStore;
    private final ProgressionProperties properties;

    /**
     * Equips an owned cosmetic into its slot on the active loadout, creating
     * the default loadout on first use. The slot's previous occupant is replaced.
     *
     * @throws CosmeticNotFoundException unknown cosmetic
     * @throws CosmeticNotOwnedException the player does not own it
     */
    @Transactional
    public Loadout equipCosmetic(Long playerId, Long cosmeticId) {
        CorrelationContext.enterPlayerScope(playerId, "equip");
        CosmeticItem item = catalog.findById(cosmeticId)
                .orElseThrow(() -> new CosmeticNotFoundException(cosmeticId));

        if (!ownershipStore.owns(playerId, cosmeticId)) {
            throw new CosmeticNotOwnedException(playerId, cosmeticId);
        }

        Loadout active = resolveActiveLoadout(playerId);
        loadoutStore.assignSlot(active.getLoadoutId(), item.getSlot(), cosmeticId);

        log.info("Cosmetic equipped: playerId={}, cosmeticId={}, slot={}, loadoutId={}",
                playerId, cosmeticId, item.getSlot().getDbValue(), active.getLoadoutId());
        return withAssignments(active);
    }

    public Optional<Loadout> getActiveLoadout(Long playerId) {
        return loadoutStore.findActive(playerId).map(this::withAssignments);
    }

    public List<Loadout> listLoadouts(Long playerId) {
        return loadoutStore.findByPlayer(playerId).stream()
                .map(this::withAssignments)
                .toList();
    }

    /**
     * Creates an empty loadout. It becomes active only if the player has none yet.
     *
     * @throws LoadoutNameTakenException if the player already has a loadout with this name
     */
    @Transactional
    public Loadout createLoadout(Long playerId, String name) {
        boolean makeActive = !loadoutStore.hasActive(playerId);
        try {
            Long loadoutId = loadoutStore.create(playerId, name, makeActive);
            log.info("Loadout created: playerId={}, loadoutId={}, name={}, active={}",
                    playerId, loadoutId, name, makeActive);
            return loadoutStore.findById(loadoutId).map(this::withAssignments)
                    .orElseThrow(() -> new LoadoutNotFoundException(loadoutId));
        } catch (DuplicateKeyException e) {
            throw new LoadoutNameTakenException(playerId, name);
        }
    }

    /**
     * @throws LoadoutNotFoundException if the loadout does not exist or belongs to another player
     */
    @Transactional
    public Loadout activateLoadout(Long playerId, Long loadoutId) {
        Loadout loadout = loadoutStore.findById(loadoutId)
                .filter(candidate -> candidate.getPlayerId().equals(playerId))
                .orElseThrow(() -> new LoadoutNotFoundException(loadoutId));

        if (!loadout.isActive()) {
            loadoutStore.activate(playerId, loadoutId);
            log.info("Loadout activated: playerId={}, loadoutId={}", playerId, loadoutId);
        }
        return loadoutStore.findById(loadoutId).map(this::withAssignments)
                .orElseThrow(() -> new LoadoutNotFoundException(loadoutId));
    }

    private Loadout resolveActiveLoadout(Long playerId) {
        Optional<Loadout> active = loadoutStore.findActive(playerId);
        if (active.isPresent()) {
            return active.get();
        }
        loadoutStore.createActiveIfAbsent(playerId, properties.getLoadout().getDefaultName());
        return loadoutStore.findActive(playerId)
                .orElseThrow(() -> new IllegalStateException(
                        "Player " + playerId + " has no active loadout and the default could not be created"));
    }

    private Loadout withAssignments(Loadout loadout) {
        return loadout.withAssignments(loadoutStore.findAssignments(loadout.getLoadoutId()));
    }
}
