package com.example.rabbitretry.backoff;

import com.google.common.base.Preconditions;

/**
 * 默认退避策略：delay = (attemptIndex + 1)^2
 *
 * 第 1 次重试 1 秒，之后 4、9、16 ... 秒。
 */
public class QuadraticBackoffPolicy implements BackoffPolicy {

    @Override
    public long delayFor(int attemptIndex) {
        Preconditions.checkArgument(attemptIndex >= 0, "attemptIndex must be >= 0, got: %s", attemptIndex);
        long next = attemptIndex + 1L;
        return next * next;
    }

    @Override
    public String toString() {
        return BackoffPolicies.QUADRATIC;
    }
}
