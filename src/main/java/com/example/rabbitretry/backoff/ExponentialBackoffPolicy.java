package com.example.rabbitretry.backoff;

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;

/**
 * 指数退避策略：delay = baseDelay * 2^attemptIndex，上限 maxDelay
 *
 * 不加随机抖动，同一个 attemptIndex 总是得到同一个延迟，
 * 这样每个延迟值只会对应一个重试队列。
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    private final long baseDelaySeconds;
    private final long maxDelaySeconds;

    public ExponentialBackoffPolicy(long baseDelaySeconds, long maxDelaySeconds) {
        Preconditions.checkArgument(baseDelaySeconds > 0, "baseDelaySeconds must be > 0, got: %s", baseDelaySeconds);
        Preconditions.checkArgument(maxDelaySeconds >= baseDelaySeconds,
                "maxDelaySeconds must be >= baseDelaySeconds, got: %s < %s", maxDelaySeconds, baseDelaySeconds);
        this.baseDelaySeconds = baseDelaySeconds;
        this.maxDelaySeconds = maxDelaySeconds;
    }

    @Override
    public long delayFor(int attemptIndex) {
        Preconditions.checkArgument(attemptIndex >= 0, "attemptIndex must be >= 0, got: %s", attemptIndex);
        if (attemptIndex >= Long.SIZE - 1) {
            return maxDelaySeconds;
        }
        long delay = LongMath.saturatedMultiply(baseDelaySeconds, 1L << attemptIndex);
        return Math.min(delay, maxDelaySeconds);
    }

    @Override
    public String toString() {
        return BackoffPolicies.EXPONENTIAL + "(" + baseDelaySeconds + "s.." + maxDelaySeconds + "s)";
    }
}
