package com.example.rabbitretry.backoff;

import java.util.Locale;

import com.example.rabbitretry.config.BackoffHandlerProperties;

/**
 * 按名称解析退避策略（quadratic / fixed / exponential）
 */
public final class BackoffPolicies {

    public static final String QUADRATIC = "quadratic";
    public static final String FIXED = "fixed";
    public static final String EXPONENTIAL = "exponential";

    private BackoffPolicies() {
    }

    public static BackoffPolicy resolve(BackoffHandlerProperties.Backoff backoff) {
        String strategy = backoff.getStrategy() == null
                ? QUADRATIC
                : backoff.getStrategy().trim().toLowerCase(Locale.ROOT);

        switch (strategy) {
            case QUADRATIC:
                return new QuadraticBackoffPolicy();
            case FIXED:
                return new FixedBackoffPolicy(backoff.getFixedDelay());
            case EXPONENTIAL:
                return new ExponentialBackoffPolicy(backoff.getBaseDelay(), backoff.getMaxDelay());
            default:
                throw new IllegalArgumentException("Unknown backoff strategy: " + backoff.getStrategy());
        }
    }
}
