package com.flagship.player_progression.match;

import com.flagship.player_progression.exception.ErrorKind;
import com.flagship.player_progression.exception.ProgressionException;

public class InvalidMatchStatsException extends ProgressionException {

    public InvalidMatchStatsException(String message) {
        super(ErrorKind.INVALID_STATS, message);
    }
}
