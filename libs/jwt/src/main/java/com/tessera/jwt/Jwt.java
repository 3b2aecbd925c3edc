package com.tessera.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Issues and verifies compact HMAC-signed tokens of the form
 * {@code base64url(header).base64url(claims).base64url(signature)}.
 *
 * <p>All methods are pure: no shared mutable state, no I/O, no logging. They may be called
 * concurrently from any number of threads with the same secret and algorithm.
 *
 * <h2>Decoding order</h2>
 *
 * <ol>
 *   <li>Split into exactly three non-empty segments, else {@code INVALID_TOKEN}.
 *   <li>If the header is the literal of a supported algorithm other than the requested one,
 *       {@code WRONG_ALGORITHM_HEADER}. No keyed hash is computed under an algorithm the header
 *       did not name.
 *   <li>Recompute the signature with the requested algorithm and compare in constant time, else
 *       {@code INVALID_SIGNATURE}. Nothing past this point runs on unauthenticated input.
 *   <li>Decode the header, else {@code INVALID_TOKEN}.
 *   <li>Decode the claims into the caller's type.
 * </ol>
 *
 * <p>The algorithm is always chosen by the caller, never read from the token.
 */
public final class Jwt {

    private static final PartCodec<Object> ANY_CLAIMS = JsonPartCodec.of(Object.class);

    private Jwt() {
        // utility class
    }

    /**
     * Encodes and signs claims with the default JSON claims codec.
     *
     * @param claims any Jackson-serializable value, typically a record
     * @param secret the shared HMAC key
     * @param algorithm the signing algorithm, also written into the header
     * @return the compact token
     * @throws JwtException with kind {@code JSON_ENCODE} if the claims cannot be serialized
     */
    public static String encode(Object claims, byte[] secret, Algorithm algorithm) {
        return encode(claims, ANY_CLAIMS, secret, algorithm);
    }

    /** Same as {@link #encode(Object, byte[], Algorithm)} with a UTF-8 string secret. */
    public static String encode(Object claims, String secret, Algorithm algorithm) {
        return encode(claims, utf8(secret), algorithm);
    }

    /**
     * Encodes and signs claims with a caller-supplied codec.
     *
     * @param claims the claims value
     * @param claimsCodec converts the claims to base64url text
     * @param secret the shared HMAC key
     * @param algorithm the signing algorithm, also written into the header
     * @return the compact token
     */
    public static <T> String encode(T claims, PartCodec<? super T> claimsCodec, byte[] secret, Algorithm algorithm) {
        Objects.requireNonNull(claims, "claims");
        Objects.requireNonNull(claimsCodec, "claimsCodec");
        Objects.requireNonNull(secret, "secret");
        Objects.requireNonNull(algorithm, "algorithm");

        String header = HeaderCodec.INSTANCE.toBase64(new Header(algorithm));
        String payload = header + '.' + claimsCodec.toBase64(claims);
        return payload + '.' + HmacSigner.sign(payload, secret, algorithm);
    }

    /**
     * Verifies a token and decodes its claims with the default JSON claims codec.
     *
     * @param token the compact token
     * @param secret the shared HMAC key
     * @param algorithm the algorithm the token must have been signed with
     * @param claimsType the claims type to decode to
     * @return the decoded claims
     * @throws JwtException on any structural, signature, algorithm or decoding failure
     */
    public static <T> T decode(String token, byte[] secret, Algorithm algorithm, Class<T> claimsType) {
        return decode(token, secret, algorithm, JsonPartCodec.of(claimsType));
    }

    /** Same as {@link #decode(String, byte[], Algorithm, Class)} with a UTF-8 string secret. */
    public static <T> T decode(String token, String secret, Algorithm algorithm, Class<T> claimsType) {
        return decode(token, utf8(secret), algorithm, claimsType);
    }

    /**
     * Verifies a token and decodes its claims with a caller-supplied codec.
     *
     * @param token the compact token
     * @param secret the shared HMAC key
     * @param algorithm the algorithm the token must have been signed with
     * @param claimsCodec converts the claims segment to a value
     * @return the decoded claims
     * @throws JwtException on any structural, signature, algorithm or decoding failure
     */
    public static <T> T decode(String token, byte[] secret, Algorithm algorithm, PartCodec<T> claimsCodec) {
        Objects.requireNonNull(secret, "secret");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(claimsCodec, "claimsCodec");

        TokenSegments segments = TokenSegments.parse(token);

        Optional<Algorithm> named = Algorithm.fromHeaderBase64(segments.header());
        if (named.isPresent() && named.get() != algorithm) {
            throw new JwtException(
                    JwtException.Kind.WRONG_ALGORITHM_HEADER,
                    "Token header names " + named.get().value() + " but " + algorithm.value() + " was requested");
        }

        if (!HmacSigner.verify(segments.signature(), segments.signingInput(), secret, algorithm)) {
            throw new JwtException(JwtException.Kind.INVALID_SIGNATURE, "Token signature does not match");
        }

        HeaderCodec.INSTANCE.fromBase64(segments.header());
        return claimsCodec.fromBase64(segments.claims());
    }

    /**
     * Like {@link #decode(String, byte[], Algorithm, Class)} but returns empty instead of throwing
     * {@link JwtException}.
     */
    public static <T> Optional<T> tryDecode(String token, byte[] secret, Algorithm algorithm, Class<T> claimsType) {
        try {
            return Optional.of(decode(token, secret, algorithm, claimsType));
        } catch (JwtException e) {
            return Optional.empty();
        }
    }

    private static byte[] utf8(String secret) {
        Objects.requireNonNull(secret, "secret");
        return secret.getBytes(StandardCharsets.UTF_8);
    }
}
