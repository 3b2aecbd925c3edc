package com.tessera.jwt;

/**
 * Thrown when a token cannot be produced or accepted.
 *
 * <p>WHY a single RuntimeException with a kind: callers usually treat every failure the same way
 * (reject the request) but still need to tell them apart for diagnostics and metrics. The
 * {@link Kind} set is closed; wrapped collaborator failures keep the underlying cause.
 *
 * <p>Messages never contain the token text or the secret.
 */
public class JwtException extends RuntimeException {

    /** Failure categories. */
    public enum Kind {
        /** Wrong number of segments, an empty segment, or an unrecognized header. */
        INVALID_TOKEN,
        /** The recomputed signature does not match the one in the token. */
        INVALID_SIGNATURE,
        /** The header names a different algorithm than the one requested for verification. */
        WRONG_ALGORITHM_HEADER,
        /** A segment is not unpadded base64url. */
        BASE64_DECODE,
        /** Decoded claims bytes are not valid UTF-8. */
        UTF8_DECODE,
        /** Claims JSON is malformed or does not match the target type. */
        JSON_DECODE,
        /** Claims value could not be serialized to JSON. */
        JSON_ENCODE
    }

    private final Kind kind;

    public JwtException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public JwtException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
