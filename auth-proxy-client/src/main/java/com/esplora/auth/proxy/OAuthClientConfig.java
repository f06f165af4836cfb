package com.esplora.auth.proxy;

import java.net.URI;
import java.time.Duration;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class OAuthClientConfig {

    public static final URI DEFAULT_TOKEN_URL = URI.create(
        "https://login.blockstream.com/realms/blockstream-public/protocol/openid-connect/token");

    private URI tokenUrl = DEFAULT_TOKEN_URL;
    private String clientId;
    private String clientSecret;
    private String scope = "openid";
    private long leewaySeconds = 20;
    private long refreshAheadSeconds = 30;
    private long retryBackoffSeconds = 5;

    public Duration leeway() {
        return Duration.ofSeconds(leewaySeconds);
    }

    public Duration refreshAhead() {
        return Duration.ofSeconds(refreshAheadSeconds);
    }

    public Duration retryBackoff() {
        return Duration.ofSeconds(retryBackoffSeconds);
    }

    public String scopeOrNull() {
        return (scope == null || scope.isBlank()) ? null : scope.trim();
    }

}
