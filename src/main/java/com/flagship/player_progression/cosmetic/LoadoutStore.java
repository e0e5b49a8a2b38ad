package com.flagship.player_progression.cosmetic;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to loadouts and loadout_slots.
 *
 * The partial unique index on loadouts(player_id) WHERE is_active keeps one
 * active loadout per player; the (loadout_id, slot) primary key keeps one
 * cosmetic per slot.
 */
@Repository
public class LoadoutStore {

    private static final String SELECT_LOADOUT =
        "SELECT loadout_id, player_id, name, is_active, created_at FROM loadouts ";

    private final JdbcTemplate jdbcTemplate;

    public LoadoutStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Loadout> findActive(Long playerId) {
        return jdbcTemplate.query(
            SELECT_LOADOUT + "WHERE player_id = ? AND is_active",
            loadoutRowMapper(),
            playerId
        ).stream().findFirst();
    }

    public Optional<Loadout> findById(Long loadoutId) {
        return jdbcTemplate.query(
            SELECT_LOADOUT + "WHERE loadout_id = ?",
            loadoutRowMapper(),
            loadoutId
        ).stream().findFirst();
    }

    public List<Loadout> findByPlayer(Long playerId) {
        return jdbcTemplate.query(
            SELECT_LOADOUT + "WHERE player_id = ? ORDER BY loadout_id",
            loadoutRowMapper(),
            playerId
        );
    }

    public boolean hasActive(Long playerId) {
        return findActive(playerId).isPresent();
    }

    /**
     * Creates an active loadout unless the player already has one. Concurrent
     * callers serialize on the unique index and the loser inserts nothing.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void createActiveIfAbsent(Long playerId, String name) {
        jdbcTemplate.update(
            "INSERT INTO loadouts (player_id, name, is_active) VALUES (?, ?, TRUE) ON CONFLICT DO NOTHING",
            playerId, name
        );
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the name is taken
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Long create(Long playerId, String name, boolean active) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO loadouts (player_id, name, is_active) VALUES (?, ?, ?) RETURNING loadout_id",
            Long.class,
            playerId, name, active
        );
    }

    /**
     * Deactivates the player's current loadout, then activates the given one.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void activate(Long playerId, Long loadoutId) {
        jdbcTemplate.update(
            "UPDATE loadouts SET is_active = FALSE WHERE player_id = ? AND is_active AND loadout_id <> ?",
            playerId, loadoutId
        );
        jdbcTemplate.update(
            "UPDATE loadouts SET is_active = TRUE WHERE player_id = ? AND loadout_id = ?",
            playerId, loadoutId
        );
    }

    /**
     * Puts the cosmetic into its slot, replacing any previous occupant in the
     * same statement.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void assignSlot(Long loadoutId, CosmeticSlot slot, Long cosmeticId) {
        jdbcTemplate.update(
            "INSERT INTO loadout_slots (loadout_id, slot, cosmetic_id) VALUES (?, ?, ?) " +
            "ON CONFLICT (loadout_id, slot) DO UPDATE " +
            "SET cosmetic_id = EXCLUDED.cosmetic_id, assigned_at = CURRENT_TIMESTAMP",
            loadoutId, slot.getDbValue(), cosmeticId
        );
    }

    public List<Loadout.SlotAssignment> findAssignments(Long loadoutId) {
        return jdbcTemplate.query(
            "SELECT slot, cosmetic_id, assigned_at FROM loadout_slots WHERE loadout_id = ? ORDER BY slot",
            (rs, rowNum) -> new Loadout.SlotAssignment(
                CosmeticSlot.fromDbValue(rs.getString("slot")),
                rs.getLong("cosmetic_id"),
                rs.getTimestamp("assigned_at").toInstant()
            ),
            loadoutId
        );
    }

    private RowMapper<Loadout> loadoutRowMapper() {
        return (rs, rowNum) -> new Loadout(
            rs.getLong("loadout_id"),
            rs.getLong("player_id"),
            rs.getString("name"),
            rs.getBoolean("is_active"),
            rs.getTimestamp("created_at").toInstant(),
            Collections.emptyList()
        );
    }
}
