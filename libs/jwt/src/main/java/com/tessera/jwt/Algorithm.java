package com.tessera.jwt;

import java.util.Optional;

/**
 * Signing algorithms supported for tokens.
 *
 * <p>WHY an enum: the set is closed. Each constant binds exactly one HMAC hash function and one
 * precomputed header encoding, so a token header can only ever name one of these three values.
 * Adding an algorithm means adding a constant here, never a new implementing type.
 */
public enum Algorithm {

    HS256("HS256", "HmacSHA256", 32, "eyJ0eXAiOiJKV1QiLCJhbGciOiJIUzI1NiJ9"),
    HS384("HS384", "HmacSHA384", 48, "eyJ0eXAiOiJKV1QiLCJhbGciOiJIUzM4NCJ9"),
    HS512("HS512", "HmacSHA512", 64, "eyJ0eXAiOiJKV1QiLCJhbGciOiJIUzUxMiJ9");

    private final String value;
    private final String jcaName;
    private final int digestLength;
    private final String headerBase64;

    Algorithm(String value, String jcaName, int digestLength, String headerBase64) {
        this.value = value;
        this.jcaName = jcaName;
        this.digestLength = digestLength;
        this.headerBase64 = headerBase64;
    }

    /** The JOSE name written into the header's {@code alg} field (e.g. "HS256"). */
    public String value() {
        return value;
    }

    /** The JCA {@link javax.crypto.Mac} algorithm name (e.g. "HmacSHA256"). */
    public String jcaName() {
        return jcaName;
    }

    /** Size of the raw HMAC digest in bytes. */
    public int digestLength() {
        return digestLength;
    }

    /**
     * The base64url encoding of {@code {"typ":"JWT","alg":"<value>"}}.
     *
     * <p>The header JSON for an algorithm never varies, so it is a constant rather than something
     * the JSON codec produces per token.
     */
    public String headerBase64() {
        return headerBase64;
    }

    /**
     * Looks up an Algorithm by its JOSE name. Matching is exact and case-sensitive.
     *
     * @param value the string to match (e.g. "HS512")
     * @return the matching Algorithm, or empty if not found
     */
    public static Optional<Algorithm> fromString(String value) {
        for (Algorithm algorithm : values()) {
            if (algorithm.value.equals(value)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string is the JOSE name of a supported algorithm. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }

    /**
     * Finds the algorithm whose precomputed header encoding is exactly {@code encoded}.
     *
     * @param encoded a header segment as it appears in a token
     * @return the matching Algorithm, or empty for any other text
     */
    public static Optional<Algorithm> fromHeaderBase64(String encoded) {
        for (Algorithm algorithm : values()) {
            if (algorithm.headerBase64.equals(encoded)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }
}
