package com.tessera.jwt.spring;

import static org.assertj.core.api.Assertions.assertThat;

import com.tessera.jwt.Algorithm;
import com.tessera.jwt.testing.TestClaims;
import com.tessera.jwt.testing.TestTokenFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link JwtTokenService}: a plain unit, no Spring context.
 */
@DisplayName("JwtTokenService")
class JwtTokenServiceTest {

    private SimpleMeterRegistry registry;
    private JwtTokenService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new JwtTokenService(
                new JwtProperties(TestTokenFactory.SECRET, Algorithm.HS256), new TokenMetrics(registry));
    }

    private double verifiedCount(String outcome) {
        var counter = registry.find(TokenMetrics.VERIFIED)
                .tag(TokenMetrics.TAG_ALGORITHM, "HS256")
                .tag(TokenMetrics.TAG_OUTCOME, outcome)
                .counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Nested
    @DisplayName("issue()")
    class Issue {

        @Test
        @DisplayName("signs with the configured secret and algorithm")
        void signs() {
            assertThat(service.issue(TestTokenFactory.claims())).isEqualTo(TestTokenFactory.token());
        }

        @Test
        @DisplayName("counts issued tokens")
        void counts() {
            service.issue(TestTokenFactory.claims());
            service.issue(TestTokenFactory.claims());
            assertThat(registry.get(TokenMetrics.ISSUED).tag(TokenMetrics.TAG_ALGORITHM, "HS256").counter().count())
                    .isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("verify()")
    class Verify {

        @Test
        @DisplayName("returns claims for a valid token and counts success")
        void valid() {
            assertThat(service.verify(TestTokenFactory.token(), TestClaims.class)).contains(TestTokenFactory.claims());
            assertThat(verifiedCount(TokenMetrics.OUTCOME_SUCCESS)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("returns empty for a tampered token and counts invalid_signature")
        void tampered() {
            String token = TestTokenFactory.withTamperedSignature(TestTokenFactory.token(), 0);
            assertThat(service.verify(token, TestClaims.class)).isEmpty();
            assertThat(verifiedCount("invalid_signature")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("returns empty for a token signed with another algorithm")
        void otherAlgorithm() {
            assertThat(service.verify(TestTokenFactory.token(Algorithm.HS512), TestClaims.class)).isEmpty();
            assertThat(verifiedCount("wrong_algorithm_header")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("returns empty for null and malformed tokens")
        void malformed() {
            assertThat(service.verify(null, TestClaims.class)).isEmpty();
            assertThat(service.verify("not-a-token", TestClaims.class)).isEmpty();
            assertThat(verifiedCount("invalid_token")).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("verifyBearer()")
    class VerifyBearer {

        @Test
        @DisplayName("verifies the token from a Bearer header")
        void bearer() {
            assertThat(service.verifyBearer("Bearer " + TestTokenFactory.token(), TestClaims.class))
                    .contains(TestTokenFactory.claims());
        }

        @Test
        @DisplayName("returns empty without counting when there is no bearer token")
        void noBearer() {
            assertThat(service.verifyBearer("Basic dXNlcjpwYXNz", TestClaims.class)).isEmpty();
            assertThat(service.verifyBearer(null, TestClaims.class)).isEmpty();
            assertThat(registry.find(TokenMetrics.VERIFIED).counters()).isEmpty();
        }

        @Test
        @DisplayName("matches the scheme case-insensitively and trims around the token")
        void schemeAndWhitespace() {
            assertThat(JwtTokenService.bearerToken("bearer abc")).isEqualTo("abc");
            assertThat(JwtTokenService.bearerToken("BEARER\tabc")).isEqualTo("abc");
            assertThat(JwtTokenService.bearerToken("  Bearer    abc  ")).isEqualTo("abc");
        }

        @Test
        @DisplayName("finds no token without a separator or after a bare scheme")
        void noToken() {
            assertThat(JwtTokenService.bearerToken("Bearerabc")).isNull();
            assertThat(JwtTokenService.bearerToken("Bearer")).isNull();
            assertThat(JwtTokenService.bearerToken("Bearer   ")).isNull();
            assertThat(JwtTokenService.bearerToken("")).isNull();
            assertThat(JwtTokenService.bearerToken("Bear abc")).isNull();
        }

        @Test
        @DisplayName("a rejected bearer token is counted like any other")
        void rejectedBearer() {
            assertThat(service.verifyBearer("Bearer not-a-token", TestClaims.class)).isEmpty();
            assertThat(verifiedCount("invalid_token")).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("JwtProperties.toString does not reveal the secret")
    void propertiesHideSecret() {
        assertThat(new JwtProperties("top-secret", null).toString())
                .doesNotContain("top-secret")
                .contains("HS256");
    }
}
