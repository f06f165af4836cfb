package com.esplora.auth.proxy.server;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Base URL of the upstream API. Inbound paths are resolved against it, dropping path segments
 * that the base already ends with, so {@code https://x/api} + {@code /api/blocks} stays
 * {@code https://x/api/blocks}.
 */
public record UpstreamTarget(URI baseUrl) {

    public UpstreamTarget {
        Objects.requireNonNull(baseUrl, "baseUrl");
        String scheme = baseUrl.getScheme() == null ? "" : baseUrl.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Upstream URL must be http(s): " + baseUrl);
        }
        if (baseUrl.getHost() == null) {
            throw new IllegalArgumentException("Upstream URL has no host: " + baseUrl);
        }
        if (baseUrl.getRawQuery() != null || baseUrl.getRawFragment() != null) {
            throw new IllegalArgumentException("Upstream URL must not carry a query or fragment: " + baseUrl);
        }
    }

    public static UpstreamTarget of(String url) {
        return new UpstreamTarget(URI.create(url.trim()));
    }

    public String host() {
        return baseUrl.getHost();
    }

    /** Value the upstream sees in its {@code Host} header. */
    public String hostHeader() {
        int port = baseUrl.getPort();
        boolean defaultPort = port == -1
            || (port == 80 && "http".equalsIgnoreCase(baseUrl.getScheme()))
            || (port == 443 && "https".equalsIgnoreCase(baseUrl.getScheme()));
        return defaultPort ? host() : host() + ":" + port;
    }

    /** Raw base path without trailing slashes; empty when the base URL has no path. */
    public String basePath() {
        String path = baseUrl.getRawPath();
        if (path == null) {
            return "";
        }
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end);
    }

    public URI resolve(String rawPath, String rawQuery) {
        StringBuilder target = new StringBuilder()
            .append(baseUrl.getScheme()).append("://").append(baseUrl.getRawAuthority())
            .append(joinPaths(basePath(), rawPath));
        if (rawQuery != null && !rawQuery.isEmpty()) {
            target.append('?').append(rawQuery);
        }
        return URI.create(target.toString());
    }

    static String joinPaths(String basePath, String rawPath) {
        String inbound = (rawPath == null || rawPath.isEmpty()) ? "/" : rawPath;
        if (!inbound.startsWith("/")) {
            inbound = "/" + inbound;
        }
        if (basePath.isEmpty()) {
            return inbound;
        }
        List<String> base = segments(basePath);
        List<String> in = segments(inbound);
        for (int k = Math.min(base.size(), in.size()); k > 0; k--) {
            if (base.subList(base.size() - k, base.size()).equals(in.subList(0, k))) {
                String shared = "/" + String.join("/", in.subList(0, k));
                return basePath + inbound.substring(shared.length());
            }
        }
        return basePath + inbound;
    }

    private static List<String> segments(String path) {
        return Arrays.asList(path.substring(1).split("/", -1));
    }
}
