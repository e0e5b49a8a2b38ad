package com.flagship.player_progression.transaction;

import com.flagship.player_progression.observability.ProgressionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.stereotype.Component;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.function.Supplier;

/**
 * Runs best-effort follow-up effects after a primary mutation.
 *
 * Each effect runs behind a JDBC savepoint on the transaction's connection.
 * When an effect throws, only its savepoint is rolled back: the failure is
 * logged with the player id and effect name, counted, and the surrounding
 * unit of work carries on. Without the savepoint a failed statement would
 * abort the whole PostgreSQL transaction.
 *
 * Effects must do their work through JdbcTemplate. JPA writes are flushed
 * lazily and would escape the savepoint.
 */
@Component
@Slf4j
public class FollowUpEffects {

    private final DataSource dataSource;
    private final ProgressionMetrics metrics;

    public FollowUpEffects(DataSource dataSource, ProgressionMetrics metrics) {
        this.dataSource = dataSource;
        this.metrics = metrics;
    }

    /**
     * Runs one effect. Returns true when it completed.
     */
    public boolean run(String effect, Long playerId, Runnable action) {
        return call(effect, playerId, () -> {
            action.run();
            return Boolean.TRUE;
        }) != null;
    }

    /**
     * Runs one effect that produces a value. Returns null when it failed.
     */
    public <T> T call(String effect, Long playerId, Supplier<T> action) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalTransactionStateException(
                    "Follow-up effect '" + effect + "' requires an active transaction");
        }

        Connection connection = DataSourceUtils.getConnection(dataSource);
        try {
            Savepoint savepoint = setSavepoint(connection, effect);
            try {
                T result = action.get();
                connection.releaseSavepoint(savepoint);
                return result;
            } catch (RuntimeException e) {
                rollbackTo(connection, savepoint, effect);
                log.warn("Follow-up effect failed and was rolled back: effect={}, playerId={}, error={}",
                        effect, playerId, e.getMessage());
                metrics.recordFollowUpFailure(effect);
                return null;
            }
        } catch (SQLException e) {
            throw new TransactionSystemException("Could not release savepoint for effect " + effect, e);
        } finally {
            DataSourceUtils.releaseConnection(connection, dataSource);
        }
    }

    private Savepoint setSavepoint(Connection connection, String effect) {
        try {
            return connection.setSavepoint();
        } catch (SQLException e) {
            throw new TransactionSystemException("Could not create savepoint for effect " + effect, e);
        }
    }

    /**
     * A savepoint that cannot be restored leaves the transaction unusable, so
     * this failure is propagated rather than logged.
     */
    private void rollbackTo(Connection connection, Savepoint savepoint, String effect) {
        try {
            connection.rollback(savepoint);
        } catch (SQLException e) {
            throw new TransactionSystemException("Could not roll back savepoint for effect " + effect, e);
        }
    }
}
