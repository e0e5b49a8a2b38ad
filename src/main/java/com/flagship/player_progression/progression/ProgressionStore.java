package com.flagship.player_progression.progression;

import lombok.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * JDBC access to player_progression.
 *
 * Every mutation is a single atomic statement (increment in place, or
 * conditional update with RETURNING), so concurrent writers to the same player
 * never lose updates. Mutators require the caller's transaction and fail with
 * IllegalTransactionStateException when there is none.
 */
@Repository
public class ProgressionStore {

    private static final String SELECT_COLUMNS =
        "SELECT player_id, level, experience, prestige_level, currency_balance, " +
        "total_matches_played, total_kills, total_deaths, total_waves_survived, " +
        "total_scrap_earned, total_currency_earned, updated_at FROM player_progression ";

    private final JdbcTemplate jdbcTemplate;

    public ProgressionStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<PlayerProgression> find(Long playerId) {
        List<PlayerProgression> rows = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE player_id = ?",
            progressionRowMapper(),
            playerId
        );
        return rows.stream().findFirst();
    }

    /**
     * Creates the row with level 1, no experience and an empty balance if it
     * does not exist yet. Safe under concurrent first access.
     *
     * @return true if this call created the row
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean ensureExists(Long playerId) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO player_progression (player_id) VALUES (?) ON CONFLICT (player_id) DO NOTHING",
            playerId
        );
        return inserted == 1;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void incrementMatchStats(Long playerId, long kills, long deaths, long wavesSurvived,
                                    long scrapEarned, long currencyEarned) {
        int updated = jdbcTemplate.update(
            "UPDATE player_progression SET " +
            "total_matches_played = total_matches_played + 1, " +
            "total_kills = total_kills + ?, " +
            "total_deaths = total_deaths + ?, " +
            "total_waves_survived = total_waves_survived + ?, " +
            "total_scrap_earned = total_scrap_earned + ?, " +
            "total_currency_earned = total_currency_earned + ?, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE player_id = ?",
            kills, deaths, wavesSurvived, scrapEarned, currencyEarned, playerId
        );
        requireRow(updated, playerId);
    }

    /**
     * Adds experience in place. The returned level is the stored level before
     * any recalculation; the row stays locked until the transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ExperienceUpdate addExperience(Long playerId, long experience) {
        List<ExperienceUpdate> rows = jdbcTemplate.query(
            "UPDATE player_progression SET experience = experience + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE player_id = ? RETURNING experience, level",
            (rs, rowNum) -> new ExperienceUpdate(rs.getLong("experience"), rs.getInt("level")),
            experience, playerId
        );
        if (rows.isEmpty()) {
            throw new IllegalStateException("No progression row for player " + playerId);
        }
        return rows.get(0);
    }

    /**
     * Raises the stored level; never lowers it.
     *
     * @return true if the level changed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean raiseLevel(Long playerId, int level) {
        return jdbcTemplate.update(
            "UPDATE player_progression SET level = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE player_id = ? AND level < ?",
            level, playerId, level
        ) == 1;
    }

    /**
     * Resets level and experience and advances the prestige tier in one statement.
     *
     * @return the new prestige tier
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int resetForPrestige(Long playerId) {
        List<Integer> rows = jdbcTemplate.query(
            "UPDATE player_progression SET level = 1, experience = 0, " +
            "prestige_level = prestige_level + 1, updated_at = CURRENT_TIMESTAMP " +
            "WHERE player_id = ? RETURNING prestige_level",
            (rs, rowNum) -> rs.getInt("prestige_level"),
            playerId
        );
        if (rows.isEmpty()) {
            throw new IllegalStateException("No progression row for player " + playerId);
        }
        return rows.get(0);
    }

    private void requireRow(int updated, Long playerId) {
        if (updated != 1) {
            throw new IllegalStateException("No progression row for player " + playerId);
        }
    }

    private RowMapper<PlayerProgression> progressionRowMapper() {
        return (rs, rowNum) -> new PlayerProgression(
            rs.getLong("player_id"),
            rs.getInt("level"),
            rs.getLong("experience"),
            rs.getInt("prestige_level"),
            rs.getLong("currency_balance"),
            rs.getLong("total_matches_played"),
            rs.getLong("total_kills"),
            rs.getLong("total_deaths"),
            rs.getLong("total_waves_survived"),
            rs.getLong("total_scrap_earned"),
            rs.getLong("total_currency_earned"),
            rs.getTimestamp("updated_at").toInstant()
        );
    }

    /**
     * Result of an in-place experience increment.
     */
    @Value
    public static class ExperienceUpdate {
        long experience;
        int storedLevel;
    }
}
