package com.tessera.jwt;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC signing and verification of a token's signing input ({@code header.claims}).
 *
 * <p>Stateless: a fresh {@link Mac} is obtained per call, so the methods are safe to call from any
 * number of threads with the same secret.
 */
public final class HmacSigner {

    private HmacSigner() {
        // utility class
    }

    /**
     * Computes the HMAC of the UTF-8 bytes of {@code signingInput}.
     *
     * @param signingInput the text to sign, {@code base64(header) + "." + base64(claims)}
     * @param secret the shared key, possibly empty
     * @param algorithm selects the hash function
     * @return the digest as unpadded base64url text
     */
    public static String sign(String signingInput, byte[] secret, Algorithm algorithm) {
        return Base64Url.encode(mac(signingInput, secret, algorithm));
    }

    /**
     * Recomputes the signature and compares it with {@code signature} in constant time.
     *
     * @return true only if both signatures are byte-for-byte identical
     */
    public static boolean verify(String signature, String signingInput, byte[] secret, Algorithm algorithm) {
        Objects.requireNonNull(signature, "signature");
        byte[] expected = sign(signingInput, secret, algorithm).getBytes(StandardCharsets.US_ASCII);
        return constantTimeEquals(expected, signature.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Compares two arrays without short-circuiting on the first difference.
     *
     * <p>Every byte pair is XORed into one accumulator and the result is inspected only after the
     * full scan, so the running time depends on the length alone. Arrays of different length are
     * unequal immediately; signature length is fixed per algorithm and is not secret.
     */
    public static boolean constantTimeEquals(byte[] a, byte[] b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.length != b.length) {
            return false;
        }
        int diff = 0;
        for (int i = 0; i < a.length; i++) {
            diff |= a[i] ^ b[i];
        }
        return diff == 0;
    }

    private static byte[] mac(String signingInput, byte[] secret, Algorithm algorithm) {
        Objects.requireNonNull(signingInput, "signingInput");
        Objects.requireNonNull(secret, "secret");
        Objects.requireNonNull(algorithm, "algorithm");
        try {
            Mac mac = Mac.getInstance(algorithm.jcaName());
            mac.init(keyFor(secret, algorithm));
            return mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC failure (" + algorithm.jcaName() + ")", e);
        }
    }

    /**
     * HMAC pads short keys with zero bytes up to the block size, so an empty key and a single zero
     * byte produce the same MAC. {@link SecretKeySpec} refuses empty arrays, hence the substitute.
     */
    private static SecretKeySpec keyFor(byte[] secret, Algorithm algorithm) {
        return new SecretKeySpec(secret.length == 0 ? new byte[1] : secret, algorithm.jcaName());
    }
}
