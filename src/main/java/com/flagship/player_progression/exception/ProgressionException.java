package com.flagship.player_progression.exception;

import lombok.Getter;

/**
 * Base type for business rule failures raised by the progression engine.
 *
 * These are returned to callers unmodified. Storage failures are not modelled
 * here; they surface as Spring's {@link org.springframework.dao.DataAccessException}.
 */
@Getter
public abstract class ProgressionException extends RuntimeException {

    private final ErrorKind kind;

    protected ProgressionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
