package com.flagship.player_progression.cosmetic;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * JDBC access to player_cosmetics. Ownership is binary and never revoked;
 * the (player_id, cosmetic_id) primary key is the final arbiter.
 */
@Repository
public class CosmeticOwnershipStore {

    private final JdbcTemplate jdbcTemplate;

    public CosmeticOwnershipStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean owns(Long playerId, Long cosmeticId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM player_cosmetics WHERE player_id = ? AND cosmetic_id = ?",
            Integer.class,
            playerId, cosmeticId
        );
        return count != null && count > 0;
    }

    /**
     * Idempotent grant used by loot drops, level-ups and prestige. A duplicate
     * is a no-op and does not abort the transaction.
     *
     * @return true if ownership was created by this call
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean grantIfAbsent(Long playerId, Long cosmeticId, UnlockMethod method) {
        return jdbcTemplate.update(
            "INSERT INTO player_cosmetics (player_id, cosmetic_id, unlocked_via) VALUES (?, ?, ?) " +
            "ON CONFLICT (player_id, cosmetic_id) DO NOTHING",
            playerId, cosmeticId, method.getDbValue()
        ) == 1;
    }

    /**
     * Strict grant used by purchases. A concurrent duplicate surfaces as
     * {@link org.springframework.dao.DuplicateKeyException}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void grant(Long playerId, Long cosmeticId, UnlockMethod method) {
        jdbcTemplate.update(
            "INSERT INTO player_cosmetics (player_id, cosmetic_id, unlocked_via) VALUES (?, ?, ?)",
            playerId, cosmeticId, method.getDbValue()
        );
    }

    /**
     * Newest unlocks first.
     */
    public List<OwnedCosmetic> findOwned(Long playerId) {
        return jdbcTemplate.query(
            "SELECT c.cosmetic_id, c.name, c.description, c.slot, c.category, c.rarity, " +
            "c.unlock_level, c.data_cost, c.is_prestige_only, c.created_at, pc.unlocked_at, pc.unlocked_via " +
            "FROM player_cosmetics pc JOIN cosmetic_items c ON c.cosmetic_id = pc.cosmetic_id " +
            "WHERE pc.player_id = ? ORDER BY pc.unlocked_at DESC, c.cosmetic_id DESC",
            (rs, rowNum) -> new OwnedCosmetic(
                CosmeticCatalog.mapCosmetic(rs),
                rs.getTimestamp("unlocked_at").toInstant(),
                UnlockMethod.fromDbValue(rs.getString("unlocked_via"))
            ),
            playerId
        );
    }
}
