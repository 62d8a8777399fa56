package com.axiom.gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.Name;

/**
 * Token bucket tiers, bound from {@code axiom.rate-limit.*}.
 *
 * <pre>
 * axiom:
 *   rate-limit:
 *     default:
 *       max-tokens: 100
 *       refill-rate: 10
 *       refill-period: 1m
 *     strict:
 *       max-tokens: 20
 *       refill-rate: 2
 *       refill-period: 1m
 * </pre>
 */
@ConfigurationProperties(prefix = "axiom.rate-limit")
public record RateLimitProperties(@Name("default") Tier standard, Tier strict) {

    public RateLimitProperties {
        standard = Tier.withDefaults(standard, 100, 10);
        strict = Tier.withDefaults(strict, 20, 2);
    }

    /** One limiter's bucket size and refill schedule. */
    public record Tier(int maxTokens, int refillRate, Duration refillPeriod) {

        static Tier withDefaults(Tier tier, int maxTokens, int refillRate) {
            if (tier == null) {
                return new Tier(maxTokens, refillRate, Duration.ofMinutes(1));
            }
            return new Tier(
                    tier.maxTokens() > 0 ? tier.maxTokens() : maxTokens,
                    tier.refillRate() > 0 ? tier.refillRate() : refillRate,
                    tier.refillPeriod() != null ? tier.refillPeriod() : Duration.ofMinutes(1));
        }
    }
}
