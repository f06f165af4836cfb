package com.esplora.auth.proxy.server;

import lombok.Getter;

/**
 * Proxy-side failure talking to the upstream. Non-2xx upstream answers are relayed, not raised.
 */
@Getter
public class UpstreamException extends RuntimeException {

    public enum Kind {
        NETWORK,
        BODY_STREAM_FAILURE
    }

    private final Kind kind;

    public UpstreamException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
