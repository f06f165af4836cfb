package com.esplora.auth.proxy.server;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Adapts the JDK listener's exchanges to {@link ProxyService}: every path and method is forwarded.
 */
@Slf4j
@AllArgsConstructor
public class ProxyHttpHandler implements HttpHandler {

    private final ProxyService service;

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            ProxyRequest request;
            try {
                request = toRequest(exchange);
            } catch (IOException e) {
                log.debug("Could not read inbound request body: {}", e.toString());
                exchange.sendResponseHeaders(400, -1);
                return;
            }
            try (ProxyResponse response = service.handle(request)) {
                write(exchange, request, response);
            }
        } finally {
            exchange.close();
        }
    }

    static ProxyRequest toRequest(HttpExchange exchange) throws IOException {
        byte[] body = exchange.getRequestBody().readAllBytes();
        return new ProxyRequest(
            exchange.getRequestMethod(),
            exchange.getRequestURI().getRawPath(),
            exchange.getRequestURI().getRawQuery(),
            Map.copyOf(exchange.getRequestHeaders()),
            body);
    }

    private void write(HttpExchange exchange, ProxyRequest request, ProxyResponse response) throws IOException {
        Headers out = exchange.getResponseHeaders();
        response.headers().forEach((name, values) -> out.put(name, new ArrayList<>(values)));
        boolean head = request.method().equals("HEAD");
        if (head && response.contentLength() >= 0) {
            out.put("Content-Length", List.of(Long.toString(response.contentLength())));
        }
        long length = responseLength(head, response);
        exchange.sendResponseHeaders(response.status(), length);
        if (length == -1) {
            return;
        }
        try (OutputStream os = exchange.getResponseBody()) {
            response.transferTo(os);
        } catch (UpstreamException e) {
            log.warn("Aborted relaying {} {}: {}", request.method(), request.rawPath(), e.getMessage());
        } catch (IOException e) {
            log.debug("Caller went away during {} {}: {}", request.method(), request.rawPath(), e.toString());
        }
    }

    // JDK listener framing: -1 = no body, 0 = chunked, n = fixed length
    static long responseLength(boolean head, ProxyResponse response) {
        int status = response.status();
        if (head || status == 204 || status == 304 || status < 200 || response.contentLength() == 0) {
            return -1;
        }
        return response.contentLength() > 0 ? response.contentLength() : 0;
    }
}
