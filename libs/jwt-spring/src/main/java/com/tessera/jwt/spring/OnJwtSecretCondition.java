package com.tessera.jwt.spring;

import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches when {@code tessera.jwt.secret} is present, whatever its value.
 *
 * <p>Unlike {@code @ConditionalOnProperty}, a secret of {@code false} matches. Blank values match
 * too and are then rejected by validation on {@link JwtProperties}.
 */
class OnJwtSecretCondition extends SpringBootCondition {

    static final String PROPERTY = "tessera.jwt.secret";

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        if (context.getEnvironment().containsProperty(PROPERTY)) {
            return ConditionOutcome.match(PROPERTY + " is set");
        }
        return ConditionOutcome.noMatch(PROPERTY + " is not set");
    }
}
