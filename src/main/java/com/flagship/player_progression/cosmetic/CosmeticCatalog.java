package com.flagship.player_progression.cosmetic;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over cosmetic_items.
 */
@Repository
public class CosmeticCatalog {

    private static final String SELECT_COLUMNS =
        "SELECT c.cosmetic_id, c.name, c.description, c.slot, c.category, c.rarity, " +
        "c.unlock_level, c.data_cost, c.is_prestige_only, c.created_at FROM cosmetic_items c ";

    private final JdbcTemplate jdbcTemplate;

    public CosmeticCatalog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<CosmeticItem> findById(Long cosmeticId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE c.cosmetic_id = ?",
            cosmeticRowMapper(),
            cosmeticId
        ).stream().findFirst();
    }

    public boolean exists(Long cosmeticId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM cosmetic_items WHERE cosmetic_id = ?",
            Integer.class,
            cosmeticId
        );
        return count != null && count > 0;
    }

    public List<CosmeticItem> findAll() {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "ORDER BY c.slot, c.unlock_level, c.cosmetic_id",
            cosmeticRowMapper()
        );
    }

    /**
     * Prestige-exclusive items for the given tier that the player does not own yet.
     */
    public List<CosmeticItem> findUnownedPrestigeRewards(Long playerId, int prestigeLevel) {
        return jdbcTemplate.query(
            SELECT_COLUMNS +
            "WHERE c.is_prestige_only = TRUE AND c.unlock_level = ? " +
            "AND NOT EXISTS (SELECT 1 FROM player_cosmetics pc " +
            "                WHERE pc.player_id = ? AND pc.cosmetic_id = c.cosmetic_id) " +
            "ORDER BY c.cosmetic_id",
            cosmeticRowMapper(),
            prestigeLevel, playerId
        );
    }

    /**
     * Free, non-prestige items whose unlock level lies in (fromLevel, toLevel]
     * and that the player does not own yet.
     */
    public List<CosmeticItem> findUnownedLevelRewards(Long playerId, int fromLevelExclusive, int toLevelInclusive) {
        return jdbcTemplate.query(
            SELECT_COLUMNS +
            "WHERE c.is_prestige_only = FALSE AND c.data_cost = 0 " +
            "AND c.unlock_level > ? AND c.unlock_level <= ? " +
            "AND NOT EXISTS (SELECT 1 FROM player_cosmetics pc " +
            "                WHERE pc.player_id = ? AND pc.cosmetic_id = c.cosmetic_id) " +
            "ORDER BY c.unlock_level, c.cosmetic_id",
            cosmeticRowMapper(),
            fromLevelExclusive, toLevelInclusive, playerId
        );
    }

    RowMapper<CosmeticItem> cosmeticRowMapper() {
        return (rs, rowNum) -> mapCosmetic(rs);
    }

    static CosmeticItem mapCosmetic(ResultSet rs) throws SQLException {
        return new CosmeticItem(
            rs.getLong("cosmetic_id"),
            rs.getString("name"),
            rs.getString("description"),
            CosmeticSlot.fromDbValue(rs.getString("slot")),
            rs.getString("category"),
            Rarity.fromDbValue(rs.getString("rarity")),
            rs.getInt("unlock_level"),
            rs.getLong("data_cost"),
            rs.getBoolean("is_prestige_only"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
