package com.tessera.jwt;

import java.util.Objects;

/**
 * Header codec backed by the fixed literal table in {@link Algorithm}.
 *
 * <p>WHY no JSON parsing: decoding accepts only the three exact encodings the library itself
 * produces. A header naming {@code none}, an asymmetric algorithm, reordered fields or extra
 * whitespace is not a known literal and is rejected as {@link JwtException.Kind#INVALID_TOKEN}.
 */
public final class HeaderCodec implements PartCodec<Header> {

    /** Shared instance; the codec holds no state. */
    public static final HeaderCodec INSTANCE = new HeaderCodec();

    private HeaderCodec() {
    }

    @Override
    public String toBase64(Header header) {
        Objects.requireNonNull(header, "header");
        return header.algorithm().headerBase64();
    }

    @Override
    public Header fromBase64(String encoded) {
        return Algorithm.fromHeaderBase64(encoded)
                .map(Header::new)
                .orElseThrow(() -> new JwtException(
                        JwtException.Kind.INVALID_TOKEN, "Token header is not a recognized encoding"));
    }
}
