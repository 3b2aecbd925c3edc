/**
 * Compact HMAC-signed tokens.
 *
 * <p>Entry point is {@link com.tessera.jwt.Jwt}. The pieces it composes:
 *
 * <ul>
 *   <li>{@link com.tessera.jwt.Algorithm}: the closed set of HMAC algorithms and their fixed
 *       header encodings
 *   <li>{@link com.tessera.jwt.HeaderCodec} and {@link com.tessera.jwt.JsonPartCodec}: the two
 *       {@link com.tessera.jwt.PartCodec} implementations for header and claims
 *   <li>{@link com.tessera.jwt.HmacSigner}: signing and constant-time verification
 *   <li>{@link com.tessera.jwt.TokenSegments}: strict three-segment splitting
 * </ul>
 *
 * <p>Claim semantics (expiry, audience, issuer) are left to the application; the decoded claims
 * record is returned as-is.
 */
package com.tessera.jwt;
