package com.example.rabbitretry.backoff;

/**
 * 退避策略：根据已失败次数计算下一次重试的延迟（单位：秒）
 *
 * 实现必须是纯函数，不能有副作用。
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param attemptIndex 之前已记录的失败次数（从 0 开始）
     * @return 延迟秒数，必须大于 0
     */
    long delayFor(int attemptIndex);
}
