package com.tessera.jwt.spring;

import com.tessera.jwt.Algorithm;
import com.tessera.jwt.Jwt;
import com.tessera.jwt.JwtException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies tokens with the configured secret and algorithm.
 *
 * <p>WHY a service over the static {@link Jwt} API: application code should not handle the
 * secret. This bean holds it, logs outcomes and records metrics, while the core stays free of
 * logging and configuration.
 *
 * <p>This is a POJO (no Spring annotations) so it can be created in unit tests without a context;
 * {@link JwtAutoConfiguration} does the wiring.
 */
public class JwtTokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    private static final String BEARER = "Bearer";

    private final byte[] secret;
    private final Algorithm algorithm;
    private final TokenMetrics metrics;

    public JwtTokenService(JwtProperties properties, TokenMetrics metrics) {
        Objects.requireNonNull(properties, "properties");
        this.secret = properties.secretBytes();
        this.algorithm = properties.algorithm();
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Signs the given claims.
     *
     * @param claims any Jackson-serializable value
     * @return the compact token
     * @throws JwtException with kind {@code JSON_ENCODE} if the claims cannot be serialized
     */
    public String issue(Object claims) {
        String token = Jwt.encode(claims, secret, algorithm);
        metrics.issued(algorithm);
        log.debug("Issued {} token for claims type {}", algorithm.value(), claims.getClass().getSimpleName());
        return token;
    }

    /**
     * Verifies a token and decodes its claims.
     *
     * @param token the compact token (may be null)
     * @param claimsType the claims type to decode to
     * @return the claims, or empty if the token is rejected for any reason
     */
    public <T> Optional<T> verify(String token, Class<T> claimsType) {
        try {
            T claims = Jwt.decode(token, secret, algorithm, claimsType);
            metrics.verified(algorithm);
            return Optional.of(claims);
        } catch (JwtException e) {
            metrics.rejected(algorithm, e.kind());
            log.warn("Token rejected: {}", e.kind());
            return Optional.empty();
        }
    }

    /**
     * Verifies the token carried by an HTTP Authorization header of the form
     * {@code Bearer <token>}. The scheme is case-insensitive.
     *
     * <p>A header without a bearer token is not a verification attempt: it is logged at debug and
     * not counted.
     *
     * @param authorizationHeader the full header value (may be null)
     * @param claimsType the claims type to decode to
     * @return the claims, or empty if there is no bearer token or it is rejected
     */
    public <T> Optional<T> verifyBearer(String authorizationHeader, Class<T> claimsType) {
        String token = bearerToken(authorizationHeader);
        if (token == null) {
            log.debug("No bearer token in Authorization header");
            return Optional.empty();
        }
        return verify(token, claimsType);
    }

    /** The algorithm tokens are signed and verified with. */
    public Algorithm algorithm() {
        return algorithm;
    }

    /** Token part of {@code "Bearer <token>"}, or null when the header carries none. */
    static String bearerToken(String authorizationHeader) {
        if (authorizationHeader == null) {
            return null;
        }
        String value = authorizationHeader.strip();
        int schemeEnd = BEARER.length();
        if (value.length() <= schemeEnd
                || !value.regionMatches(true, 0, BEARER, 0, schemeEnd)
                || !Character.isWhitespace(value.charAt(schemeEnd))) {
            return null;
        }
        return value.substring(schemeEnd).strip();
    }
}
