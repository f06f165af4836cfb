package com.esplora.auth.proxy.server;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * Loopback HTTP server standing in for the identity provider or the upstream API.
 * Records every request and answers from a queue of canned replies.
 */
final class StubHttpEndpoint implements AutoCloseable {

    record Recorded(String method, String target, Headers headers, String body) {
        String header(String name) {
            return headers.getFirst(name);
        }
    }

    record Reply(int status, Map<String, String> headers, String body, boolean chunked) {}

    final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private final Queue<Reply> replies = new ConcurrentLinkedQueue<>();
    private final HttpServer server;
    private volatile Reply fallback = new Reply(200, Map.of(), "", false);

    StubHttpEndpoint() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    StubHttpEndpoint reply(int status, String body) {
        return reply(status, Map.of(), body);
    }

    StubHttpEndpoint reply(int status, Map<String, String> headers, String body) {
        replies.add(new Reply(status, headers, body, false));
        return this;
    }

    /** Queues a reply sent with chunked transfer encoding and no declared length. */
    StubHttpEndpoint replyChunked(int status, String body) {
        replies.add(new Reply(status, Map.of(), body, true));
        return this;
    }

    StubHttpEndpoint otherwise(int status, String body) {
        fallback = new Reply(status, Map.of(), body, false);
        return this;
    }

    int port() {
        return server.getAddress().getPort();
    }

    String baseUrl() {
        return "http://127.0.0.1:" + port();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            Headers copy = new Headers();
            copy.putAll(exchange.getRequestHeaders());
            requests.add(new Recorded(exchange.getRequestMethod(), exchange.getRequestURI().toString(), copy, body));

            Reply reply = replies.poll();
            if (reply == null) {
                reply = fallback;
            }
            reply.headers().forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
            byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
            boolean noBody = bytes.length == 0 || exchange.getRequestMethod().equals("HEAD");
            exchange.sendResponseHeaders(reply.status(), noBody ? -1 : reply.chunked() ? 0 : bytes.length);
            if (!noBody) {
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            }
        } finally {
            exchange.close();
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
