package com.esplora.auth.proxy.server;

import java.io.IOException;

import lombok.extern.slf4j.Slf4j;

/**
 * Process entry point. Exit code 2 on configuration errors, 1 when the listener cannot bind.
 */
@Slf4j
public final class AuthProxyApplication {

    static final int EXIT_BIND_FAILURE = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    private AuthProxyApplication() {}

    public static void main(String[] args) {
        ProxyConfig config;
        try {
            config = ProxyConfigLoader.fromEnvironment();
        } catch (ProxyConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(EXIT_CONFIG_ERROR);
            return;
        }

        ProxyService service = ProxyService.create(config);
        AuthProxyServer server;
        try {
            server = AuthProxyServer.bind(config.getBind(), service, config.getWorkerThreads());
        } catch (IOException e) {
            log.error("Cannot bind {}: {}", config.getBind(), e.getMessage());
            service.close();
            System.exit(EXIT_BIND_FAILURE);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "auth-proxy-shutdown"));
        server.start();
    }
}
