package com.esplora.auth.proxy.server;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Header rules applied when relaying between the inbound client and the upstream.
 */
public final class ForwardedHeaders {

    static final Set<String> HOP_BY_HOP = Set.of(
        "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
        "te", "trailer", "transfer-encoding", "upgrade");

    // the outbound client derives these itself; Host always comes from the upstream URL
    static final Set<String> CLIENT_COMPUTED = Set.of("host", "content-length", "expect");

    static final String AUTHORIZATION = "authorization";

    private ForwardedHeaders() {}

    /**
     * Inbound headers that may be copied onto the upstream request.
     * Drops hop-by-hop headers, headers named by {@code Connection}, {@code Host} and the client's own credentials.
     */
    public static Map<String, List<String>> forRequest(Map<String, List<String>> inbound) {
        Set<String> dropped = new HashSet<>(HOP_BY_HOP);
        dropped.addAll(CLIENT_COMPUTED);
        dropped.add(AUTHORIZATION);
        return filter(inbound, dropped);
    }

    /**
     * Upstream headers relayed to the caller. {@code Content-Length} is dropped because the listener sets framing itself.
     */
    public static Map<String, List<String>> forResponse(Map<String, List<String>> upstream) {
        Set<String> dropped = new HashSet<>(HOP_BY_HOP);
        dropped.add("content-length");
        dropped.add(AUTHORIZATION);
        return filter(upstream, dropped);
    }

    private static Map<String, List<String>> filter(Map<String, List<String>> headers, Set<String> dropped) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Set<String> skip = new HashSet<>(dropped);
        headers.forEach((name, values) -> {
            if (name != null && name.equalsIgnoreCase("connection") && values != null) {
                values.forEach(v -> {
                    for (String token : v.split(",")) {
                        if (!token.isBlank()) {
                            skip.add(token.trim().toLowerCase(Locale.ROOT));
                        }
                    }
                });
            }
        });
        Map<String, List<String>> result = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (name == null || name.startsWith(":") || skip.contains(name.toLowerCase(Locale.ROOT)) || values == null) {
                return;
            }
            result.computeIfAbsent(name, k -> new ArrayList<>()).addAll(values);
        });
        return result;
    }
}
