package com.tessera.jwt;

/**
 * Converts one part of a token (header or claims) to and from its base64url text form.
 *
 * <p>WHY an interface: the token pipeline is agnostic to the claims shape. Any type for which a
 * codec exists can be carried, and the compiler checks that the type decoded is the type asked
 * for. {@link HeaderCodec} and {@link JsonPartCodec} are the two implementations shipped here.
 *
 * <p>Implementations must be stateless or immutable so they can be shared across threads.
 *
 * @param <T> the type of the part's value
 */
public interface PartCodec<T> {

    /**
     * Encodes a value as unpadded base64url text.
     *
     * @throws JwtException with kind {@link JwtException.Kind#JSON_ENCODE} if the value cannot be
     *     serialized
     */
    String toBase64(T value);

    /**
     * Decodes unpadded base64url text back to a value.
     *
     * @throws JwtException if the text is not valid base64url, not UTF-8, or does not describe a
     *     value of the target type
     */
    T fromBase64(String encoded);
}
