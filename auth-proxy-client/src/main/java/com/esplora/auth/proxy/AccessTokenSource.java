package com.esplora.auth.proxy;

/**
 * Hands out bearer tokens to request-path callers.
 */
public interface AccessTokenSource {

    /**
     * Returns a token whose expiry lies in the future, fetching one if none is cached.
     *
     * @throws FetchException if a new token was needed and could not be obtained
     */
    AccessToken getValid();

    /**
     * Fetches a new token regardless of the cached one, e.g. after the upstream rejected it.
     * On failure the cached token is left untouched.
     *
     * @throws FetchException if the token could not be obtained
     */
    AccessToken forceRefresh();
}
