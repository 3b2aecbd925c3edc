package com.tessera.jwt;

import java.util.Base64;
import java.util.Objects;

/**
 * Unpadded base64url, strict on input.
 *
 * <p>The JDK decoder accepts trailing {@code =} padding; tokens never carry padding, so it is
 * rejected here along with every character outside {@code [A-Za-z0-9_-]}.
 */
public final class Base64Url {

    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder URL_DECODER = Base64.getUrlDecoder();

    private Base64Url() {
        // utility class
    }

    /** Encodes bytes as base64url text without padding. */
    public static String encode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return URL_ENCODER.encodeToString(bytes);
    }

    /**
     * Decodes unpadded base64url text.
     *
     * @param encoded the text to decode
     * @return the decoded bytes
     * @throws JwtException with kind {@link JwtException.Kind#BASE64_DECODE} on padding, a
     *     character outside the URL-safe alphabet, or an impossible length
     */
    public static byte[] decode(String encoded) {
        Objects.requireNonNull(encoded, "encoded");
        for (int i = 0; i < encoded.length(); i++) {
            if (!isUrlSafe(encoded.charAt(i))) {
                throw new JwtException(
                        JwtException.Kind.BASE64_DECODE,
                        "Invalid base64url character at index " + i);
            }
        }
        // A single leftover character cannot encode a whole byte
        if (encoded.length() % 4 == 1) {
            throw new JwtException(JwtException.Kind.BASE64_DECODE, "Invalid base64url length");
        }
        try {
            return URL_DECODER.decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new JwtException(JwtException.Kind.BASE64_DECODE, "Invalid base64url text", e);
        }
    }

    private static boolean isUrlSafe(char c) {
        return (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '-'
                || c == '_';
    }
}
