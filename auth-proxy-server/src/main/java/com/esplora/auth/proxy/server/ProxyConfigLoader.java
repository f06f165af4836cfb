package com.esplora.auth.proxy.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.esplora.auth.proxy.OAuthClientConfig;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds {@link ProxyConfig} from environment variables, optionally completed by a {@code .env} file.
 * Keys from the file never override variables that are already set.
 */
@Slf4j
public final class ProxyConfigLoader {

    public static final String ENV_FILE = "AUTH_PROXY_ENV_FILE";
    public static final String UPSTREAM = "ESPLORA_UPSTREAM";
    public static final String TOKEN_URL = "OIDC_TOKEN_URL";
    public static final String CLIENT_ID = "ESPLORA_CLIENT_ID";
    public static final String CLIENT_SECRET = "ESPLORA_CLIENT_SECRET";
    public static final String SCOPE = "OIDC_SCOPE";
    public static final String BIND = "BIND";
    public static final String LEEWAY_SECONDS = "TOKEN_LEEWAY_SECONDS";
    public static final String REFRESH_AHEAD_SECONDS = "REFRESH_AHEAD_SECONDS";
    public static final String RETRY_SECONDS = "REFRESH_RETRY_SECONDS";
    public static final String RESPONSE_DUMP_BYTES = "RESPONSE_DUMP_BYTES";
    public static final String WORKER_THREADS = "WORKER_THREADS";

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    private ProxyConfigLoader() {}

    public static ProxyConfig fromEnvironment() {
        Map<String, String> env = System.getenv();
        Path envFile = Path.of(env.getOrDefault(ENV_FILE, ".env"));
        return load(withEnvFile(env, envFile));
    }

    static Map<String, String> withEnvFile(Map<String, String> env, Path path) {
        if (!Files.isRegularFile(path)) {
            log.debug("No .env file at {} (optional)", path);
            return env;
        }
        Map<String, String> merged = new HashMap<>(env);
        try {
            List<String> lines = Files.readAllLines(path);
            int count = 0;
            for (String line : lines) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                Matcher m = ENV_LINE.matcher(trimmed);
                if (m.matches() && !merged.containsKey(m.group(1))) {
                    merged.put(m.group(1), unquote(m.group(2).trim()));
                    count++;
                }
            }
            if (count > 0) {
                log.info("Loaded {} keys from {}", count, path);
            }
        } catch (IOException e) {
            throw new ProxyConfigException("Could not read " + path + ": " + e.getMessage(), e);
        }
        return merged;
    }

    public static ProxyConfig load(Map<String, String> env) {
        ProxyConfig config = new ProxyConfig();
        OAuthClientConfig oauth = config.getOauth();

        config.setUpstream(value(env, UPSTREAM, s -> new UpstreamTarget(httpUri(s)).baseUrl(), config.getUpstream()));
        oauth.setTokenUrl(value(env, TOKEN_URL, ProxyConfigLoader::httpUri, oauth.getTokenUrl()));
        oauth.setClientId(required(env, CLIENT_ID));
        oauth.setClientSecret(required(env, CLIENT_SECRET));
        if (env.containsKey(SCOPE)) {
            oauth.setScope(env.get(SCOPE));
        }
        oauth.setLeewaySeconds(value(env, LEEWAY_SECONDS, s -> nonNegative(LEEWAY_SECONDS, s), oauth.getLeewaySeconds()));
        oauth.setRefreshAheadSeconds(value(env, REFRESH_AHEAD_SECONDS, s -> nonNegative(REFRESH_AHEAD_SECONDS, s),
            oauth.getRefreshAheadSeconds()));
        oauth.setRetryBackoffSeconds(value(env, RETRY_SECONDS, s -> positive(RETRY_SECONDS, s),
            oauth.getRetryBackoffSeconds()));

        config.setBind(value(env, BIND, ProxyConfigLoader::bindAddress, config.getBind()));
        config.setResponseDumpBytes(value(env, RESPONSE_DUMP_BYTES,
            s -> (int) nonNegative(RESPONSE_DUMP_BYTES, s), config.getResponseDumpBytes()));
        config.setWorkerThreads(value(env, WORKER_THREADS, s -> (int) positive(WORKER_THREADS, s),
            config.getWorkerThreads()));

        log.info("Proxy config: bind={} upstream={} tokenUrl={} clientId={} scope={}",
            config.getBind(), config.getUpstream(), oauth.getTokenUrl(), oauth.getClientId(), oauth.scopeOrNull());
        return config;
    }

    private static <T> T value(Map<String, String> env, String key, Function<String, T> parser, T fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return parser.apply(raw.trim());
        } catch (ProxyConfigException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProxyConfigException(key + " is invalid: " + e.getMessage(), e);
        }
    }

    private static String required(Map<String, String> env, String key) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            throw new ProxyConfigException(key + " missing");
        }
        return raw.trim();
    }

    static URI httpUri(String raw) {
        URI uri = URI.create(raw);
        if (uri.getHost() == null || !("http".equalsIgnoreCase(uri.getScheme())
            || "https".equalsIgnoreCase(uri.getScheme()))) {
            throw new IllegalArgumentException("expected an http(s) URL, got " + raw);
        }
        return uri;
    }

    static InetSocketAddress bindAddress(String raw) {
        int idx = raw.lastIndexOf(':');
        if (idx <= 0 || idx == raw.length() - 1) {
            throw new IllegalArgumentException("expected host:port, got " + raw);
        }
        String host = raw.substring(0, idx);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port = Integer.parseInt(raw.substring(idx + 1));
        return new InetSocketAddress(host, port);
    }

    private static long nonNegative(String key, String raw) {
        long v = Long.parseLong(raw);
        if (v < 0) {
            throw new ProxyConfigException(key + " must be >= 0, got " + v);
        }
        return v;
    }

    private static long positive(String key, String raw) {
        long v = Long.parseLong(raw);
        if (v <= 0) {
            throw new ProxyConfigException(key + " must be > 0, got " + v);
        }
        return v;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\\\"", "\"");
        }
        if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
