package com.tessera.jwt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Claims codec: value → JSON → UTF-8 bytes → base64url, and back.
 *
 * <p>WHY Jackson: records and POJOs serialize without per-type code, and the target
 * {@link JavaType} keeps generic claim shapes such as {@code Map<String, Object>} type-safe. The
 * {@code JavaTimeModule} writes {@code Instant} claims as ISO 8601 strings.
 *
 * <p>Decoding fails in three distinct ways, each reported as its own {@link JwtException.Kind}:
 * bad base64url, bytes that are not UTF-8, and JSON that does not fit the target type (unknown
 * properties included).
 *
 * @param <T> the claims type
 */
public final class JsonPartCodec<T> implements PartCodec<T> {

    private static final ObjectMapper MAPPER = createMapper();

    private final JavaType type;

    private JsonPartCodec(JavaType type) {
        this.type = type;
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /** Creates a codec for a non-generic claims type, typically a record. */
    public static <T> JsonPartCodec<T> of(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return new JsonPartCodec<>(MAPPER.getTypeFactory().constructType(type));
    }

    /** Creates a codec for a generic claims type, e.g. {@code new TypeReference<Map<String, Object>>() {}}. */
    public static <T> JsonPartCodec<T> of(TypeReference<T> type) {
        Objects.requireNonNull(type, "type");
        return new JsonPartCodec<>(MAPPER.getTypeFactory().constructType(type));
    }

    @Override
    public String toBase64(T value) {
        Objects.requireNonNull(value, "value");
        try {
            return Base64Url.encode(MAPPER.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new JwtException(
                    JwtException.Kind.JSON_ENCODE,
                    "Failed to serialize claims of type " + value.getClass().getName(),
                    e);
        }
    }

    @Override
    public T fromBase64(String encoded) {
        String json = decodeUtf8(Base64Url.decode(encoded));
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new JwtException(
                    JwtException.Kind.JSON_DECODE,
                    "Failed to deserialize claims as " + type.toCanonical(),
                    e);
        }
    }

    private static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new JwtException(JwtException.Kind.UTF8_DECODE, "Claims are not valid UTF-8", e);
        }
    }
}
