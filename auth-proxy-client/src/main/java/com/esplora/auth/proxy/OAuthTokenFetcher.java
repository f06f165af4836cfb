package com.esplora.auth.proxy;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Client-credentials grant against an OAuth2/OIDC token endpoint.
 * The secret travels in the form body and is never logged or rendered by {@link #toString()}.
 */
@Slf4j
public record OAuthTokenFetcher(HttpClient http, URI tokenUrl, String clientId, String clientSecret, String scope,
                                Duration leeway, Clock clock, ObjectMapper mapper) implements TokenFetcher {

    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    public OAuthTokenFetcher(HttpClient http, OAuthClientConfig config) {
        this(http, config.getTokenUrl(), config.getClientId(), config.getClientSecret(), config.scopeOrNull(),
            config.leeway(), Clock.systemUTC(),
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public OAuthTokenFetcher(HttpClient http,
                             URI tokenUrl,
                             String clientId,
                             String clientSecret,
                             String scope,
                             Duration leeway,
                             Clock clock,
                             ObjectMapper mapper) {
        this.http = Objects.requireNonNull(http, "http");
        this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret");
        this.scope = (scope == null || scope.isBlank()) ? null : scope;
        this.leeway = (leeway == null || leeway.isNegative()) ? Duration.ZERO : leeway;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    static final class TokenResponse {
        @JsonProperty("access_token")
        String accessToken;

        @JsonProperty("expires_in")
        Long expiresIn;

        @JsonProperty("token_type")
        String tokenType;

        @JsonProperty("scope")
        String scope;
    }

    @Override
    public AccessToken fetch() {
        HttpRequest req = HttpRequest.newBuilder(tokenUrl)
            .timeout(REQUEST_TIMEOUT)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(formBody()))
            .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchException.Kind.NETWORK, "Interrupted while fetching token", ie);
        } catch (IOException e) {
            throw new FetchException(FetchException.Kind.NETWORK,
                "Token endpoint " + tokenUrl + " unreachable: " + e.getClass().getSimpleName(), e);
        }

        int sc = resp.statusCode();
        if (sc == 401 || sc == 403) {
            throw new FetchException(FetchException.Kind.UNAUTHORIZED,
                "Token endpoint rejected client '" + clientId + "': HTTP " + sc);
        }
        if (sc < 200 || sc >= 300) {
            throw new FetchException(FetchException.Kind.NETWORK, "Token endpoint returned HTTP " + sc);
        }
        return toAccessToken(parse(resp.body()));
    }

    String formBody() {
        StringBuilder form = new StringBuilder("grant_type=client_credentials")
            .append("&client_id=").append(URLEncoder.encode(clientId, StandardCharsets.UTF_8))
            .append("&client_secret=").append(URLEncoder.encode(clientSecret, StandardCharsets.UTF_8));
        if (scope != null) {
            form.append("&scope=").append(URLEncoder.encode(scope, StandardCharsets.UTF_8));
        }
        return form.toString();
    }

    private TokenResponse parse(String body) {
        TokenResponse tr;
        try {
            tr = body == null || body.isBlank() ? null : mapper.readValue(body, TokenResponse.class);
        } catch (JsonProcessingException e) {
            // the exception message may quote the body, so it is not chained
            throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE, "Token response is not valid JSON");
        }
        if (tr == null || tr.accessToken == null || tr.accessToken.isBlank() || tr.expiresIn == null) {
            throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE,
                "Invalid token response: missing access_token or expires_in");
        }
        return tr;
    }

    private AccessToken toAccessToken(TokenResponse tr) {
        Instant obtainedAt = clock.instant();
        long ttl = tr.expiresIn;
        if (ttl <= 0) {
            // already expired: handed to the current waiters, never served from cache
            log.warn("Token endpoint reported non-positive expires_in={}", ttl);
            return new AccessToken(tr.accessToken, obtainedAt);
        }
        long margin = Math.min(leeway.getSeconds(), ttl / 2);
        return new AccessToken(tr.accessToken, obtainedAt.plusSeconds(ttl - margin));
    }

    @Override
    public String toString() {
        return "OAuthTokenFetcher[tokenUrl=" + tokenUrl + ", clientId=" + clientId + ", scope=" + scope + "]";
    }
}
