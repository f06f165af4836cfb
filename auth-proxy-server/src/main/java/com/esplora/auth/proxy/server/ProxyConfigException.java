package com.esplora.auth.proxy.server;

/**
 * Missing or invalid startup setting.
 */
public class ProxyConfigException extends RuntimeException {

    public ProxyConfigException(String message) {
        super(message);
    }

    public ProxyConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
