package com.tessera.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Base64Url")
class Base64UrlTest {

    @Test
    @DisplayName("encodes with the URL-safe alphabet and no padding")
    void encodesUrlSafeWithoutPadding() {
        assertThat(Base64Url.encode(new byte[] {(byte) 0xff, (byte) 0xfe})).isEqualTo("__4");
        assertThat(Base64Url.encode("not json".getBytes(StandardCharsets.US_ASCII))).isEqualTo("bm90IGpzb24");
        assertThat(Base64Url.encode(new byte[0])).isEmpty();
    }

    @Test
    @DisplayName("decodes unpadded text")
    void decodesUnpadded() {
        assertThat(Base64Url.decode("__4")).containsExactly((byte) 0xff, (byte) 0xfe);
    }

    @Test
    @DisplayName("rejects padding")
    void rejectsPadding() {
        assertThatThrownBy(() -> Base64Url.decode("__4="))
                .isInstanceOf(JwtException.class)
                .extracting(e -> ((JwtException) e).kind())
                .isEqualTo(JwtException.Kind.BASE64_DECODE);
    }

    @Test
    @DisplayName("rejects the standard alphabet's + and /")
    void rejectsStandardAlphabet() {
        assertThatThrownBy(() -> Base64Url.decode("//4"))
                .isInstanceOf(JwtException.class)
                .extracting(e -> ((JwtException) e).kind())
                .isEqualTo(JwtException.Kind.BASE64_DECODE);
        assertThatThrownBy(() -> Base64Url.decode("++4"))
                .isInstanceOf(JwtException.class);
    }

    @Test
    @DisplayName("rejects whitespace and dots")
    void rejectsOtherCharacters() {
        assertThatThrownBy(() -> Base64Url.decode("ab cd")).isInstanceOf(JwtException.class);
        assertThatThrownBy(() -> Base64Url.decode("ab.cd")).isInstanceOf(JwtException.class);
    }

    @Test
    @DisplayName("rejects a length that cannot encode whole bytes")
    void rejectsImpossibleLength() {
        assertThatThrownBy(() -> Base64Url.decode("abcde"))
                .isInstanceOf(JwtException.class)
                .extracting(e -> ((JwtException) e).kind())
                .isEqualTo(JwtException.Kind.BASE64_DECODE);
    }
}
