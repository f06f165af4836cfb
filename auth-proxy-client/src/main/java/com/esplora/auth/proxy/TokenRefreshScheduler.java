package com.esplora.auth.proxy;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Future;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class TokenRefreshScheduler implements AutoCloseable {

    private final TokenCache cache;
    private final RefreshTimer timer;
    private final Clock clock;
    private final Duration refreshAhead;
    private final Duration retryBackoff;

    // guarded by this
    private Future<?> pending;
    private boolean closed;

    public TokenRefreshScheduler(TokenCache cache, OAuthClientConfig config) {
        this(cache, new ExecutorRefreshTimer(), Clock.systemUTC(), config.refreshAhead(), config.retryBackoff());
    }

    public TokenRefreshScheduler(TokenCache cache, RefreshTimer timer, Clock clock,
                                 Duration refreshAhead, Duration retryBackoff) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.refreshAhead = Objects.requireNonNull(refreshAhead, "refreshAhead");
        this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff");
        cache.addRefreshListener(this::onTokenRefreshed);
    }

    public void start() {
        reschedule(Duration.ZERO);
    }

    void refreshNow() {
        try {
            cache.forceRefresh();
        } catch (FetchException e) {
            log.warn("Background token refresh failed ({}), retrying in {}s", e.getKind(), retryBackoff.toSeconds());
            reschedule(retryBackoff);
        }
    }

    void onTokenRefreshed(AccessToken token) {
        Duration delay = Duration.between(clock.instant(), token.expiresAt()).minus(refreshAhead);
        if (delay.compareTo(retryBackoff) < 0) {
            delay = retryBackoff;
        }
        log.debug("Next background token refresh in {}s", delay.toSeconds());
        reschedule(delay);
    }

    private synchronized void reschedule(Duration delay) {
        if (closed) {
            return;
        }
        if (pending != null) {
            pending.cancel(false);
        }
        pending = timer.schedule(this::refreshNow, delay);
    }

    @Override
    public void close() {
        synchronized (this) {
            closed = true;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        timer.close();
    }

}
