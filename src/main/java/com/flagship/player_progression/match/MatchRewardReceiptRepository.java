package com.flagship.player_progression.match;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MatchRewardReceiptRepository extends JpaRepository<MatchRewardReceiptEntity, UUID> {

    boolean existsByMatchId(String matchId);

    Optional<MatchRewardReceiptEntity> findByMatchId(String matchId);

    /**
     * Inserts the receipt unless the match already has one.
     *
     * @return 1 if this call claimed the match, 0 if it was already claimed
     */
    @Modifying
    @Transactional(propagation = Propagation.MANDATORY)
    @Query(value = """
        INSERT INTO match_reward_receipts (receipt_id, match_id, server_id, player_count, awarded_at)
        VALUES (:receiptId, :matchId, :serverId, :playerCount, CURRENT_TIMESTAMP)
        ON CONFLICT (match_id) DO NOTHING
        """, nativeQuery = true)
    int claim(@Param("receiptId") UUID receiptId,
              @Param("matchId") String matchId,
              @Param("serverId") String serverId,
              @Param("playerCount") int playerCount);
}
