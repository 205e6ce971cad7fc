package com.dockerlab.service;

import com.dockerlab.repository.StoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.retry.support.RetrySynchronizationManager;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Establishes connectivity to the store once, at startup.
 * <p>
 * Retry Configuration:
 * - Max Attempts: {@code app.store.connect-retry.max-attempts}
 * - Fixed Delay: {@code app.store.connect-retry.delay-ms}
 * <p>
 * Exhausting the attempts is not fatal: the service keeps running and
 * {@code /health} reports the store as disconnected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoreConnector {

    private final StoreRepository storeRepository;

    // outcome of the last startup connection attempt
    private final AtomicBoolean connected = new AtomicBoolean(false);

    @Retryable(
        retryFor = DataAccessException.class,
        maxAttemptsExpression = "${app.store.connect-retry.max-attempts:5}",
        backoff = @Backoff(delayExpression = "${app.store.connect-retry.delay-ms:3000}")
    )
    public boolean connect() {
        int attempt = currentAttempt();
        log.info("Connecting to PostgreSQL (attempt {})", attempt);

        try {
            storeRepository.ping();
        } catch (DataAccessException e) {
            log.warn("PostgreSQL not reachable on attempt {}: {}", attempt, e.getMessage());
            throw e;
        }

        log.info("Connected to PostgreSQL");
        connected.set(true);
        return true;
    }

    @Recover
    public boolean connectFailed(DataAccessException e) {
        RetryContext context = RetrySynchronizationManager.getContext();
        int attempts = context == null ? 1 : context.getRetryCount();
        log.error("Giving up on PostgreSQL after {} attempts, serving in degraded mode: {}",
            attempts, e.getMessage());
        connected.set(false);
        return false;
    }

    public boolean isConnected() {
        return connected.get();
    }

    private static int currentAttempt() {
        RetryContext context = RetrySynchronizationManager.getContext();
        return context == null ? 1 : context.getRetryCount() + 1;
    }
}
