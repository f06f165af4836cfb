package com.esplora.auth.proxy.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.esplora.auth.proxy.OAuthClientConfig;

class ProxyConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static Map<String, String> credentials() {
        Map<String, String> env = new HashMap<>();
        env.put(ProxyConfigLoader.CLIENT_ID, "proxy-client");
        env.put(ProxyConfigLoader.CLIENT_SECRET, "hunter2");
        return env;
    }

    @Test
    void defaultsMatchPublicEsploraDeployment() {
        ProxyConfig config = ProxyConfigLoader.load(credentials());

        assertThat(config.getUpstream()).isEqualTo(ProxyConfig.DEFAULT_UPSTREAM);
        assertThat(config.getBind().getHostString()).isEqualTo("127.0.0.1");
        assertThat(config.getBind().getPort()).isEqualTo(3002);
        assertThat(config.getResponseDumpBytes()).isZero();
        assertThat(config.getOauth().getTokenUrl()).isEqualTo(OAuthClientConfig.DEFAULT_TOKEN_URL);
        assertThat(config.getOauth().scopeOrNull()).isEqualTo("openid");
        assertThat(config.getOauth().getLeewaySeconds()).isEqualTo(20);
    }

    @Test
    void overridesAreParsed() {
        Map<String, String> env = credentials();
        env.put(ProxyConfigLoader.UPSTREAM, "https://esplora.internal/api");
        env.put(ProxyConfigLoader.TOKEN_URL, "https://idp.internal/token");
        env.put(ProxyConfigLoader.BIND, "0.0.0.0:8080");
        env.put(ProxyConfigLoader.SCOPE, "");
        env.put(ProxyConfigLoader.LEEWAY_SECONDS, "45");
        env.put(ProxyConfigLoader.REFRESH_AHEAD_SECONDS, "60");
        env.put(ProxyConfigLoader.RETRY_SECONDS, "2");
        env.put(ProxyConfigLoader.RESPONSE_DUMP_BYTES, "256");
        env.put(ProxyConfigLoader.WORKER_THREADS, "8");

        ProxyConfig config = ProxyConfigLoader.load(env);

        assertThat(config.upstreamTarget().host()).isEqualTo("esplora.internal");
        assertThat(config.getOauth().getTokenUrl()).hasToString("https://idp.internal/token");
        assertThat(config.getBind().getPort()).isEqualTo(8080);
        assertThat(config.getOauth().scopeOrNull()).isNull();
        assertThat(config.getOauth().leeway()).hasSeconds(45);
        assertThat(config.getOauth().refreshAhead()).hasSeconds(60);
        assertThat(config.getOauth().retryBackoff()).hasSeconds(2);
        assertThat(config.getResponseDumpBytes()).isEqualTo(256);
        assertThat(config.getWorkerThreads()).isEqualTo(8);
    }

    @Test
    void missingCredentialsAreRejected() {
        Map<String, String> env = credentials();
        env.remove(ProxyConfigLoader.CLIENT_SECRET);

        assertThatThrownBy(() -> ProxyConfigLoader.load(env))
            .isInstanceOf(ProxyConfigException.class)
            .hasMessageContaining(ProxyConfigLoader.CLIENT_SECRET);
    }

    @Test
    void invalidValuesAreRejected() {
        Map<String, String> badBind = credentials();
        badBind.put(ProxyConfigLoader.BIND, "3002");
        Map<String, String> badUpstream = credentials();
        badUpstream.put(ProxyConfigLoader.UPSTREAM, "enterprise.blockstream.info/api");
        Map<String, String> queryUpstream = credentials();
        queryUpstream.put(ProxyConfigLoader.UPSTREAM, "https://enterprise.blockstream.info/api?x=1");
        Map<String, String> badRetry = credentials();
        badRetry.put(ProxyConfigLoader.RETRY_SECONDS, "0");

        assertThatThrownBy(() -> ProxyConfigLoader.load(badBind)).isInstanceOf(ProxyConfigException.class);
        assertThatThrownBy(() -> ProxyConfigLoader.load(badUpstream)).isInstanceOf(ProxyConfigException.class);
        assertThatThrownBy(() -> ProxyConfigLoader.load(queryUpstream)).isInstanceOf(ProxyConfigException.class);
        assertThatThrownBy(() -> ProxyConfigLoader.load(badRetry)).isInstanceOf(ProxyConfigException.class);
    }

    @Test
    void envFileFillsGapsWithoutOverridingEnvironment() throws Exception {
        Path envFile = tempDir.resolve(".env");
        Files.writeString(envFile, String.join("\n",
            "# local credentials",
            "ESPLORA_CLIENT_ID=from-file",
            "export ESPLORA_CLIENT_SECRET=\"quoted secret\"",
            "BIND='127.0.0.1:4000'",
            "not a pair"));
        Map<String, String> env = Map.of(ProxyConfigLoader.CLIENT_ID, "from-env");

        Map<String, String> merged = ProxyConfigLoader.withEnvFile(env, envFile);

        assertThat(merged)
            .containsEntry(ProxyConfigLoader.CLIENT_ID, "from-env")
            .containsEntry(ProxyConfigLoader.CLIENT_SECRET, "quoted secret")
            .containsEntry(ProxyConfigLoader.BIND, "127.0.0.1:4000");
    }

    @Test
    void absentEnvFileIsOptional() {
        Map<String, String> env = credentials();

        assertThat(ProxyConfigLoader.withEnvFile(env, tempDir.resolve("missing.env"))).isSameAs(env);
    }
}
