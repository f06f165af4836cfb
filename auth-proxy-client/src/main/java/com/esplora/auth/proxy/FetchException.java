package com.esplora.auth.proxy;

import lombok.Getter;

/**
 * Failure of a client-credentials exchange. Messages never carry credentials or token values.
 */
@Getter
public class FetchException extends RuntimeException {

    public enum Kind {
        /** Transport failure, interruption, or an unexpected identity provider status. */
        NETWORK,
        /** The identity provider rejected the client credentials (401/403). */
        UNAUTHORIZED,
        /** The token response could not be parsed or lacked required fields. */
        MALFORMED_RESPONSE
    }

    private final Kind kind;

    public FetchException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FetchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
