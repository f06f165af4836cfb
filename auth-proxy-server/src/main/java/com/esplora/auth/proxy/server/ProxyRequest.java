package com.esplora.auth.proxy.server;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Inbound request as received by the listener. The body is buffered so it can be replayed once
 * after an upstream 401/403.
 */
public record ProxyRequest(String method, String rawPath, String rawQuery,
                           Map<String, List<String>> headers, byte[] body) {

    public ProxyRequest {
        method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        headers = headers == null ? Map.of() : headers;
        body = body == null ? new byte[0] : body;
    }

    public boolean hasBody() {
        return body.length > 0 && !method.equals("GET") && !method.equals("HEAD");
    }

    public String target() {
        return rawQuery == null || rawQuery.isEmpty() ? rawPath : rawPath + "?" + rawQuery;
    }
}
