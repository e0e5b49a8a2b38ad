package com.flagship.player_progression.match;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row in match_reward_receipts: proof that a match has been paid out.
 * Rows are written by {@link MatchRewardReceiptRepository#claim} only.
 */
@Entity
@Table(name = "match_reward_receipts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MatchRewardReceiptEntity {

    @Id
    @Column(name = "receipt_id", nullable = false, updatable = false)
    private UUID receiptId;

    @Column(name = "match_id", nullable = false, updatable = false, length = 64)
    private String matchId;

    @Column(name = "server_id", updatable = false, length = 64)
    private String serverId;

    @Column(name = "player_count", nullable = false, updatable = false)
    private int playerCount;

    @Column(name = "awarded_at", nullable = false, updatable = false)
    private Instant awardedAt;
}
