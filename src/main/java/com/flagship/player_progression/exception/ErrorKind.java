package com.flagship.player_progression.exception;

/**
 * Business failure categories. The web layer maps each kind to a status code.
 */
public enum ErrorKind {
    NOT_FOUND,
    ALREADY_OWNED,
    NOT_OWNED,
    INSUFFICIENT_CURRENCY,
    INVALID_STATS,
    CONFLICT,
    LOOT_CONFIGURATION
}
