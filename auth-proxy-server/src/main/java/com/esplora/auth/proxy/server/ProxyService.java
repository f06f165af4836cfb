package com.esplora.auth.proxy.server;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

import com.esplora.auth.proxy.FetchException;
import com.esplora.auth.proxy.OAuthTokenFetcher;
import com.esplora.auth.proxy.TokenCache;
import com.esplora.auth.proxy.TokenRefreshScheduler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Wires the token cache, its background refresher and the forwarder, and turns proxy-side failures
 * into generic 502/503 answers. Error bodies never echo exception text.
 */
@Slf4j
public class ProxyService implements AutoCloseable {

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public record ErrorBody(String error, String message) {}

    private final RequestForwarder forwarder;
    private final TokenCache tokenCache;
    private final TokenRefreshScheduler scheduler;
    private final ObjectMapper mapper = new ObjectMapper();

    public ProxyService(RequestForwarder forwarder, TokenCache tokenCache, TokenRefreshScheduler scheduler) {
        this.forwarder = Objects.requireNonNull(forwarder, "forwarder");
        this.tokenCache = Objects.requireNonNull(tokenCache, "tokenCache");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public static ProxyService create(ProxyConfig config) {
        HttpClient http = HttpClient.newBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
        TokenCache cache = new TokenCache(new OAuthTokenFetcher(http, config.getOauth()));
        TokenRefreshScheduler scheduler = new TokenRefreshScheduler(cache, config.getOauth());
        RequestForwarder forwarder = new RequestForwarder(http, cache, config.upstreamTarget(),
            config.getResponseDumpBytes());
        return new ProxyService(forwarder, cache, scheduler);
    }

    public void start() {
        scheduler.start();
    }

    public ProxyResponse handle(ProxyRequest request) {
        try {
            return forwarder.forward(request);
        } catch (FetchException e) {
            log.warn("No upstream token for {} {} ({}): {}", request.method(), request.rawPath(), e.getKind(),
                e.getMessage());
            return error(503, "token_unavailable", "Upstream credentials are currently unavailable");
        } catch (UpstreamException e) {
            log.warn("Upstream call failed for {} {} ({}): {}", request.method(), request.rawPath(), e.getKind(),
                e.getMessage());
            return error(502, "bad_gateway", "Upstream request failed");
        } catch (RuntimeException e) {
            log.error("Unexpected failure proxying {} {}", request.method(), request.rawPath(), e);
            return error(502, "bad_gateway", "Upstream request failed");
        }
    }

    ProxyResponse error(int status, String code, String message) {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(new ErrorBody(code, message));
        } catch (JsonProcessingException e) {
            body = code.getBytes(StandardCharsets.UTF_8);
        }
        return ProxyResponse.of(status, "application/json", body);
    }

    @Override
    public void close() {
        scheduler.close();
        tokenCache.close();
    }
}
