package com.tessera.jwt.spring;

import com.tessera.jwt.Algorithm;
import jakarta.validation.constraints.NotBlank;
import java.nio.charset.StandardCharsets;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token signing configuration bound from {@code tessera.jwt.*}.
 *
 * <p>WHY a validated record: a missing secret must stop the application at startup, not surface
 * as a failed verification on the first request.
 *
 * <pre>
 * tessera:
 *   jwt:
 *     secret: ${JWT_SECRET}
 *     algorithm: HS512
 * </pre>
 *
 * @param secret shared HMAC secret, used as UTF-8 bytes. Required.
 * @param algorithm algorithm used to sign and required when verifying (default HS256).
 */
@ConfigurationProperties(prefix = "tessera.jwt")
@Validated
public record JwtProperties(@NotBlank String secret, Algorithm algorithm) {

    /** Compact constructor applies the algorithm default before Bean Validation runs. */
    public JwtProperties {
        if (algorithm == null) {
            algorithm = Algorithm.HS256;
        }
    }

    /** The secret as UTF-8 bytes; a new array on each call. */
    public byte[] secretBytes() {
        return secret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "JwtProperties[secret=[REDACTED], algorithm=" + algorithm + "]";
    }
}
