package com.tessera.jwt.spring;

import com.tessera.jwt.Algorithm;
import com.tessera.jwt.JwtException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;

/**
 * Micrometer counters for token issuance and verification.
 *
 * <p>Every counter is tagged with {@value #TAG_ALGORITHM} and {@value #TAG_OUTCOME}. The outcome of
 * a rejected token is the lowercase failure kind (e.g. {@code invalid_signature}), so dashboards can
 * separate tampering from misconfiguration.
 */
public final class TokenMetrics {

    /** Counter for issued tokens. */
    public static final String ISSUED = "tessera.jwt.issued";

    /** Counter for verification attempts, successful or not. */
    public static final String VERIFIED = "tessera.jwt.verified";

    public static final String TAG_ALGORITHM = "algorithm";
    public static final String TAG_OUTCOME = "outcome";
    public static final String OUTCOME_SUCCESS = "success";

    private final MeterRegistry registry;

    /**
     * Creates metrics bound to the given registry.
     *
     * @param registry the Micrometer meter registry
     */
    public TokenMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /** Records one issued token. */
    public void issued(Algorithm algorithm) {
        counter(ISSUED, "Number of tokens issued", algorithm, OUTCOME_SUCCESS).increment();
    }

    /** Records one successful verification. */
    public void verified(Algorithm algorithm) {
        counter(VERIFIED, "Number of token verification attempts", algorithm, OUTCOME_SUCCESS).increment();
    }

    /** Records one rejected token. */
    public void rejected(Algorithm algorithm, JwtException.Kind kind) {
        counter(VERIFIED, "Number of token verification attempts", algorithm, outcome(kind)).increment();
    }

    static String outcome(JwtException.Kind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    private Counter counter(String name, String description, Algorithm algorithm, String outcome) {
        return Counter.builder(name)
                .description(description)
                .tags(Tags.of(TAG_ALGORITHM, algorithm.value(), TAG_OUTCOME, outcome))
                .register(registry);
    }
}
