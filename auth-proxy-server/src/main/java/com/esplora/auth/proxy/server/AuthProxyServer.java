package com.esplora.auth.proxy.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import com.sun.net.httpserver.HttpServer;

import lombok.extern.slf4j.Slf4j;

/**
 * Local HTTP listener in front of {@link ProxyService}, served by a fixed worker pool.
 */
@Slf4j
public class AuthProxyServer implements AutoCloseable {

    private final HttpServer server;
    private final ExecutorService workers;
    private final ProxyService service;

    private AuthProxyServer(HttpServer server, ExecutorService workers, ProxyService service) {
        this.server = server;
        this.workers = workers;
        this.service = service;
    }

    public static AuthProxyServer bind(InetSocketAddress address, ProxyService service, int workerThreads)
        throws IOException {
        HttpServer server = HttpServer.create(address, 0);
        AtomicInteger seq = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(Math.max(1, workerThreads),
            r -> new Thread(r, "proxy-worker-" + seq.incrementAndGet()));
        server.setExecutor(workers);
        server.createContext("/", new ProxyHttpHandler(service));
        return new AuthProxyServer(server, workers, service);
    }

    public void start() {
        service.start();
        server.start();
        InetSocketAddress address = address();
        log.info("Auth proxy listening on http://{}:{}", address.getHostString(), address.getPort());
    }

    public InetSocketAddress address() {
        return server.getAddress();
    }

    @Override
    public void close() {
        log.info("Auth proxy shutting down");
        server.stop(1);
        workers.shutdownNow();
        service.close();
    }
}
