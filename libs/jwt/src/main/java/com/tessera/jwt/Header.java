package com.tessera.jwt;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * The JOSE header of a token.
 *
 * <p>Only the algorithm varies; the type is always {@value #TYPE} and cannot be set. Jackson
 * serializes this record to exactly {@code {"typ":"JWT","alg":"HS256"}} (field order fixed), which
 * is the JSON the literals in {@link Algorithm#headerBase64()} encode.
 *
 * @param algorithm the signing algorithm named by the header
 */
@JsonPropertyOrder({"typ", "alg"})
public record Header(@JsonProperty("alg") Algorithm algorithm) {

    /** Value of the {@code typ} field. */
    public static final String TYPE = "JWT";

    public Header {
        Objects.requireNonNull(algorithm, "algorithm");
    }

    @JsonProperty("typ")
    public String type() {
        return TYPE;
    }
}
