package com.esplora.auth.proxy;

import java.net.http.HttpRequest;

/**
 * Builds the {@code Authorization: Bearer} header and its redacted form for diagnostics.
 */
public record BearerAuthHeader(String headerName) {

    public static final String AUTHORIZATION = "Authorization";
    public static final String REDACTED = "Bearer ***";

    public BearerAuthHeader(String headerName) {
        this.headerName = (headerName == null || headerName.isBlank())
            ? AUTHORIZATION
            : headerName;
    }

    public BearerAuthHeader() {
        this(AUTHORIZATION);
    }

    public HttpRequest.Builder add(HttpRequest.Builder builder, AccessToken token) {
        return builder.header(headerName, value(token));
    }

    public String value(AccessToken token) {
        return "Bearer " + token.value();
    }

    public boolean matches(String name) {
        return headerName.equalsIgnoreCase(name);
    }

}
