package com.esplora.auth.proxy.server;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import com.esplora.auth.proxy.AccessToken;
import com.esplora.auth.proxy.AccessTokenSource;
import com.esplora.auth.proxy.BearerAuthHeader;

import lombok.extern.slf4j.Slf4j;

/**
 * Relays one inbound request to the upstream with a bearer token attached.
 * <p>
 * Flow: first attempt with {@link AccessTokenSource#getValid()}; on 401/403 the token is force-refreshed
 * and the request is sent exactly once more, whatever that second answer is.
 */
@Slf4j
public class RequestForwarder {

    private final HttpClient http;
    private final AccessTokenSource tokens;
    private final UpstreamTarget upstream;
    private final BearerAuthHeader bearer = new BearerAuthHeader();
    private final int previewBytes;

    public RequestForwarder(HttpClient http, AccessTokenSource tokens, UpstreamTarget upstream, int previewBytes) {
        this.http = Objects.requireNonNull(http, "http");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.previewBytes = Math.max(0, previewBytes);
    }

    public ProxyResponse forward(ProxyRequest inbound) {
        URI target = upstream.resolve(inbound.rawPath(), inbound.rawQuery());
        HttpRequest.Builder outbound = newRequest(inbound, target);

        HttpResponse<InputStream> first = send(outbound.copy(), tokens.getValid());
        if (!isTokenRejected(first.statusCode())) {
            return relay(inbound, target, first);
        }

        discard(first);
        log.info("Upstream answered HTTP {} for {} {}, refreshing token and retrying once",
            first.statusCode(), inbound.method(), target.getRawPath());
        AccessToken refreshed = tokens.forceRefresh();
        HttpResponse<InputStream> second = send(outbound.copy(), refreshed);
        return relay(inbound, target, second);
    }

    static boolean isTokenRejected(int status) {
        return status == 401 || status == 403;
    }

    private HttpRequest.Builder newRequest(ProxyRequest inbound, URI target) {
        HttpRequest.BodyPublisher body = inbound.hasBody()
            ? HttpRequest.BodyPublishers.ofByteArray(inbound.body())
            : HttpRequest.BodyPublishers.noBody();
        HttpRequest.Builder builder = HttpRequest.newBuilder(target).method(inbound.method(), body);
        ForwardedHeaders.forRequest(inbound.headers())
            .forEach((name, values) -> values.forEach(v -> builder.header(name, v)));
        return builder;
    }

    private HttpResponse<InputStream> send(HttpRequest.Builder builder, AccessToken token) {
        HttpRequest request = bearer.add(builder, token).build();
        if (log.isDebugEnabled()) {
            log.debug("-> {} {} (Host: {}) headers={}", request.method(), request.uri(), upstream.hostHeader(),
                redacted(request.headers().map()));
        }
        CompletableFuture<HttpResponse<InputStream>> call =
            http.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream());
        try {
            return call.get();
        } catch (InterruptedException ie) {
            // caller abandoned the request: abort the upstream exchange too
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new UpstreamException(UpstreamException.Kind.NETWORK, "Interrupted while calling upstream", ie);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new UpstreamException(UpstreamException.Kind.NETWORK,
                "Upstream " + upstream.hostHeader() + " unreachable: " + cause.getClass().getSimpleName(), cause);
        }
    }

    private ProxyResponse relay(ProxyRequest inbound, URI target, HttpResponse<InputStream> response) {
        log.debug("<- {} {} {}", response.statusCode(), inbound.method(), target.getRawPath());
        long contentLength = response.headers().firstValueAsLong("content-length").orElse(-1L);
        InputStream body = response.body();
        if (previewBytes > 0) {
            body = new ResponseBodyPreview(body, previewBytes,
                inbound.method() + " " + target.getRawPath() + " -> " + response.statusCode());
        }
        return new ProxyResponse(response.statusCode(), ForwardedHeaders.forResponse(response.headers().map()),
            contentLength, body);
    }

    private void discard(HttpResponse<InputStream> response) {
        try (InputStream body = response.body()) {
            body.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            log.debug("Failed to drain rejected upstream response: {}", e.toString());
        }
    }

    private Map<String, List<String>> redacted(Map<String, List<String>> headers) {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, values) ->
            copy.put(name, bearer.matches(name) ? List.of(BearerAuthHeader.REDACTED) : values));
        return copy;
    }
}
