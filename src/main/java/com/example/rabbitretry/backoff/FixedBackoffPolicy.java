package com.example.rabbitretry.backoff;

import com.google.common.base.Preconditions;

/**
 * 固定延迟退避策略
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    private final long delaySeconds;

    public FixedBackoffPolicy(long delaySeconds) {
        Preconditions.checkArgument(delaySeconds > 0, "delaySeconds must be > 0, got: %s", delaySeconds);
        this.delaySeconds = delaySeconds;
    }

    @Override
    public long delayFor(int attemptIndex) {
        Preconditions.checkArgument(attemptIndex >= 0, "attemptIndex must be >= 0, got: %s", attemptIndex);
        return delaySeconds;
    }

    @Override
    public String toString() {
        return BackoffPolicies.FIXED + "(" + delaySeconds + "s)";
    }
}
