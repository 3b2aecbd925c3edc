package com.tessera.jwt;

/**
 * The three dot-separated segments of a compact token, still encoded.
 *
 * <p>Splitting works on the base64url text, which never contains {@code .}; a dot inside a decoded
 * claim value cannot move a boundary.
 *
 * @param header base64url header segment
 * @param claims base64url claims segment
 * @param signature base64url signature segment
 */
public record TokenSegments(String header, String claims, String signature) {

    private static final char SEPARATOR = '.';

    /**
     * Splits a compact token into exactly three non-empty segments.
     *
     * @param token the compact token
     * @return the segments
     * @throws JwtException with kind {@link JwtException.Kind#INVALID_TOKEN} if the token is null,
     *     does not contain exactly two separators, or any segment is empty
     */
    public static TokenSegments parse(String token) {
        if (token == null) {
            throw invalid("Token must not be null");
        }
        int signatureDot = token.lastIndexOf(SEPARATOR);
        if (signatureDot < 0) {
            throw invalid("Token has no signature segment");
        }
        int claimsDot = token.lastIndexOf(SEPARATOR, signatureDot - 1);
        if (claimsDot < 0) {
            throw invalid("Token has no claims segment");
        }
        if (token.lastIndexOf(SEPARATOR, claimsDot - 1) >= 0) {
            throw invalid("Token has more than three segments");
        }

        String header = token.substring(0, claimsDot);
        String claims = token.substring(claimsDot + 1, signatureDot);
        String signature = token.substring(signatureDot + 1);
        if (header.isEmpty() || claims.isEmpty() || signature.isEmpty()) {
            throw invalid("Token has an empty segment");
        }
        return new TokenSegments(header, claims, signature);
    }

    /** The text the signature covers: {@code header + "." + claims}. */
    public String signingInput() {
        return header + SEPARATOR + claims;
    }

    /** Re-joins the segments into the compact form. */
    public String compact() {
        return signingInput() + SEPARATOR + signature;
    }

    private static JwtException invalid(String message) {
        return new JwtException(JwtException.Kind.INVALID_TOKEN, message);
    }
}
