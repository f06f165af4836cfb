package com.esplora.auth.proxy;

@FunctionalInterface
public interface TokenFetcher {

    AccessToken fetch();
}
