package com.esplora.auth.proxy;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds the current bearer token and collapses concurrent refreshes into a single fetch.
 * <p>
 * Fetches run on a dedicated executor, so a caller that gives up waiting (interrupt) never
 * cancels the fetch other callers are waiting on.
 */
@Slf4j
public class TokenCache implements AccessTokenSource, AutoCloseable {

    private final TokenFetcher fetcher;
    private final Clock clock;
    private final Executor fetchExecutor;
    private final ExecutorService ownedExecutor;
    private final List<Consumer<AccessToken>> listeners = new CopyOnWriteArrayList<>();

    private volatile AccessToken current;
    // guarded by this
    private CompletableFuture<AccessToken> inFlight;

    public TokenCache(TokenFetcher fetcher) {
        this(fetcher, Clock.systemUTC(), Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "token-fetch");
            t.setDaemon(true);
            return t;
        }), true);
    }

    public TokenCache(TokenFetcher fetcher, Clock clock, Executor fetchExecutor) {
        this(fetcher, clock, fetchExecutor, false);
    }

    private TokenCache(TokenFetcher fetcher, Clock clock, Executor fetchExecutor, boolean ownsExecutor) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
        this.ownedExecutor = ownsExecutor ? (ExecutorService) fetchExecutor : null;
    }

    @Override
    public AccessToken getValid() {
        var token = current;
        if (token != null && token.isValidAt(clock.instant())) {
            return token;
        }
        return await(fetchIfStale());
    }

    @Override
    public AccessToken forceRefresh() {
        return await(joinOrStartFetch());
    }

    /**
     * Registers a callback invoked after every successful fetch, whoever triggered it.
     */
    public void addRefreshListener(Consumer<AccessToken> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** Cached token, possibly expired; {@code null} before the first successful fetch. */
    public AccessToken peek() {
        return current;
    }

    private synchronized CompletableFuture<AccessToken> fetchIfStale() {
        var token = current;
        if (token != null && token.isValidAt(clock.instant())) {
            return CompletableFuture.completedFuture(token);
        }
        return joinOrStartFetch();
    }

    private synchronized CompletableFuture<AccessToken> joinOrStartFetch() {
        CompletableFuture<AccessToken> f = inFlight;
        if (f == null) {
            f = CompletableFuture.supplyAsync(this::fetchAndPublish, fetchExecutor);
            inFlight = f;
            CompletableFuture<AccessToken> started = f;
            f.whenComplete((token, error) -> onFetchComplete(started, token, error));
        }
        return f;
    }

    // runs before the fetch future completes, so no waiter can observe the previous token afterwards
    private AccessToken fetchAndPublish() {
        AccessToken token = fetcher.fetch();
        synchronized (this) {
            current = token;
        }
        return token;
    }

    private void onFetchComplete(CompletableFuture<AccessToken> fetch, AccessToken token, Throwable error) {
        synchronized (this) {
            if (inFlight == fetch) {
                inFlight = null;
            }
        }
        if (token == null) {
            Throwable cause = unwrap(error);
            if (cause instanceof FetchException fe) {
                log.warn("Token fetch failed ({}): {}", fe.getKind(), fe.getMessage());
            } else {
                log.warn("Token fetch failed", cause);
            }
            return;
        }
        log.info("Obtained access token, expires at {}", token.expiresAt());
        for (Consumer<AccessToken> listener : listeners) {
            try {
                listener.accept(token);
            } catch (RuntimeException e) {
                log.warn("Token refresh listener failed", e);
            }
        }
    }

    private static AccessToken await(CompletableFuture<AccessToken> fetch) {
        try {
            return fetch.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchException.Kind.NETWORK, "Interrupted while waiting for token", ie);
        } catch (ExecutionException ee) {
            Throwable cause = unwrap(ee);
            if (cause instanceof FetchException fe) {
                throw fe;
            }
            throw new FetchException(FetchException.Kind.NETWORK, "Token fetch failed", cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }
}
