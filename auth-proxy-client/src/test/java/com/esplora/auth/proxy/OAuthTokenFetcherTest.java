package com.esplora.auth.proxy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

class OAuthTokenFetcherTest {

    private static final String SECRET = "s3cr=t&value";
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final HttpClient http = HttpClient.newHttpClient();
    private FakeIdentityProvider idp;

    @BeforeEach
    void setUp() throws Exception {
        idp = new FakeIdentityProvider();
    }

    @AfterEach
    void tearDown() {
        idp.close();
    }

    private OAuthTokenFetcher fetcher(URI tokenUrl, String scope) {
        return new OAuthTokenFetcher(http, tokenUrl, "proxy-client", SECRET, scope, Duration.ofSeconds(20),
            Clock.fixed(NOW, ZoneOffset.UTC),
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    @Test
    void postsClientCredentialsFormAndSubtractsLeeway() {
        idp.enqueue(200, "{\"access_token\":\"tok-1\",\"expires_in\":300,\"token_type\":\"Bearer\",\"not-before-policy\":0}");

        AccessToken token = fetcher(idp.tokenUrl(), "openid").fetch();

        assertThat(token.value()).isEqualTo("tok-1");
        assertThat(token.expiresAt()).isEqualTo(NOW.plusSeconds(280));
        assertThat(idp.forms).hasSize(1);
        assertThat(idp.forms.get(0))
            .startsWith("grant_type=client_credentials")
            .contains("client_id=proxy-client")
            .contains("client_secret=s3cr%3Dt%26value")
            .contains("scope=openid");
    }

    @Test
    void omitsScopeWhenBlank() {
        fetcher(idp.tokenUrl(), " ").fetch();

        assertThat(idp.forms.get(0)).doesNotContain("scope=");
    }

    @Test
    void leewayIsCappedAtHalfOfShortLifetimes() {
        idp.enqueue(200, "{\"access_token\":\"tok-short\",\"expires_in\":30}");

        AccessToken token = fetcher(idp.tokenUrl(), null).fetch();

        assertThat(token.expiresAt()).isEqualTo(NOW.plusSeconds(15));
    }

    @Test
    void nonPositiveLifetimeYieldsAlreadyExpiredToken() {
        idp.enqueue(200, "{\"access_token\":\"tok-zero\",\"expires_in\":0}");

        AccessToken token = fetcher(idp.tokenUrl(), null).fetch();

        assertThat(token.expiresAt()).isEqualTo(NOW);
        assertThat(token.isValidAt(NOW)).isFalse();
    }

    @Test
    void rejectedCredentialsAreUnauthorized() {
        idp.enqueue(401, "{\"error\":\"invalid_client\"}");

        assertThatThrownBy(() -> fetcher(idp.tokenUrl(), null).fetch())
            .isInstanceOfSatisfying(FetchException.class, e -> {
                assertThat(e.getKind()).isEqualTo(FetchException.Kind.UNAUTHORIZED);
                assertThat(e.getMessage()).doesNotContain(SECRET);
            });
    }

    @Test
    void forbiddenIsUnauthorizedToo() {
        idp.enqueue(403, "");

        assertThatThrownBy(() -> fetcher(idp.tokenUrl(), null).fetch())
            .isInstanceOfSatisfying(FetchException.class,
                e -> assertThat(e.getKind()).isEqualTo(FetchException.Kind.UNAUTHORIZED));
    }

    @Test
    void serverErrorIsReportedAsNetworkFailure() {
        idp.enqueue(503, "maintenance");

        assertThatThrownBy(() -> fetcher(idp.tokenUrl(), null).fetch())
            .isInstanceOfSatisfying(FetchException.class, e -> {
                assertThat(e.getKind()).isEqualTo(FetchException.Kind.NETWORK);
                assertThat(e.getMessage()).contains("503").doesNotContain("maintenance");
            });
    }

    @Test
    void missingFieldsAreMalformed() {
        idp.enqueue(200, "{\"token_type\":\"Bearer\",\"expires_in\":300}");
        idp.enqueue(200, "{\"access_token\":\"tok-1\"}");
        idp.enqueue(200, "<html>login</html>");

        OAuthTokenFetcher fetcher = fetcher(idp.tokenUrl(), null);
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(fetcher::fetch)
                .isInstanceOfSatisfying(FetchException.class,
                    e -> assertThat(e.getKind()).isEqualTo(FetchException.Kind.MALFORMED_RESPONSE));
        }
    }

    @Test
    void unreachableEndpointIsNetworkFailure() throws Exception {
        URI closed;
        try (FakeIdentityProvider gone = new FakeIdentityProvider()) {
            closed = gone.tokenUrl();
        }

        assertThatThrownBy(() -> fetcher(closed, null).fetch())
            .isInstanceOfSatisfying(FetchException.class,
                e -> assertThat(e.getKind()).isEqualTo(FetchException.Kind.NETWORK));
    }

    @Test
    void toStringNeverRendersSecret() {
        OAuthTokenFetcher fetcher = fetcher(idp.tokenUrl(), "openid");

        assertThat(fetcher.toString()).contains("proxy-client").doesNotContain(SECRET);
        assertThat(new AccessToken("tok-visible", NOW).toString()).doesNotContain("tok-visible");
    }
}
