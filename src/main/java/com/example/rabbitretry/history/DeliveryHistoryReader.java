package com.example.rabbitretry.history;

import java.util.List;
import java.util.Map;

import org.springframework.amqp.core.MessageProperties;

import com.example.rabbitretry.constant.RetryHeaders;

/**
 * 从 x-death 头中读取某个逻辑队列的历史失败次数
 *
 * 队列名按前缀匹配：{queue}.retry.{delay} 这类重试队列上的记录
 * 都计入同一个逻辑队列的重试预算。
 * 注意：名字互为前缀的两个逻辑队列（如 orders 与 orders-archive）会互相计数。
 */
public final class DeliveryHistoryReader {

    private DeliveryHistoryReader() {
    }

    /**
     * @return 历史失败次数，没有 x-death 记录时为 0
     */
    public static int attemptCount(MessageProperties properties, String logicalQueueName) {
        if (properties == null) {
            return 0;
        }
        return attemptCount(properties.getHeaders(), logicalQueueName);
    }

    public static int attemptCount(Map<String, Object> headers, String logicalQueueName) {
        if (headers == null) {
            return 0;
        }
        Object xDeath = headers.get(RetryHeaders.Header.X_DEATH);
        if (!(xDeath instanceof List)) {
            return 0;
        }

        long total = 0;
        for (Object record : (List<?>) xDeath) {
            if (!(record instanceof Map)) {
                continue;
            }
            Map<?, ?> death = (Map<?, ?>) record;
            Object queue = death.get(RetryHeaders.DeathRecord.QUEUE);
            Object count = death.get(RetryHeaders.DeathRecord.COUNT);
            if (queue != null && queue.toString().startsWith(logicalQueueName) && count instanceof Number) {
                total += ((Number) count).longValue();
            }
        }
        return (int) Math.min(total, Integer.MAX_VALUE);
    }
}
