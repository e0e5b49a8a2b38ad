package com.flagship.player_progression.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Reason recorded on every currency transaction.
 */
public enum TransactionKind {
    MATCH_REWARD("match_reward"),
    PURCHASE("purchase"),
    PRESTIGE_REWARD("prestige_reward"),
    ADMIN_GRANT("admin_grant"),
    REFUND("refund"),
    OTHER("other");

    /**
     * Kinds an operator may post by hand. The rest are only written by the engine.
     */
    public static final Set<TransactionKind> MANUAL_KINDS = EnumSet.of(ADMIN_GRANT, REFUND, OTHER);

    private final String dbValue;

    TransactionKind(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String getDbValue() {
        return dbValue;
    }

    @JsonCreator
    public static TransactionKind fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.dbValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction type: " + value));
    }
}
