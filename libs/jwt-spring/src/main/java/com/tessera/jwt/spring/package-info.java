/**
 * Spring Boot integration: {@code tessera.jwt.*} properties, auto-configuration, and a
 * {@link com.tessera.jwt.spring.JwtTokenService} that logs and counts verification outcomes.
 */
package com.tessera.jwt.spring;
