package com.esplora.auth.proxy.server;

import java.net.InetSocketAddress;
import java.net.URI;

import com.esplora.auth.proxy.OAuthClientConfig;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ProxyConfig {

    public static final URI DEFAULT_UPSTREAM = URI.create("https://enterprise.blockstream.info/api");

    private URI upstream = DEFAULT_UPSTREAM;
    private InetSocketAddress bind = new InetSocketAddress("127.0.0.1", 3002);
    private int responseDumpBytes = 0;
    private int workerThreads = 32;
    private OAuthClientConfig oauth = new OAuthClientConfig();

    public UpstreamTarget upstreamTarget() {
        return new UpstreamTarget(upstream);
    }

}
