package com.example.rabbitretry.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.example.rabbitretry.constant.RetryHeaders;
import com.google.common.base.Preconditions;

import lombok.Data;

/**
 * 退避重试处理器配置（绑定前缀：backoff-handler）
 *
 * YAML 示例：
 * backoff-handler:
 *   max-retries: 25
 *   queue:
 *     name: orders
 *     durable: true
 *     arguments:
 *       "[x-dead-letter-exchange]": orders.dlx
 *       "[x-dead-letter-routing-key]": orders
 *   exchange:
 *     name: orders.exchange
 *     type: topic
 *     durable: true
 *   backoff:
 *     strategy: quadratic
 *   worker:
 *     concurrency: 3
 *     prefetch: 1
 *     timeout: 30s
 */
@Data
@ConfigurationProperties(prefix = "backoff-handler")
public class BackoffHandlerProperties {

    /** 进入错误队列前的最大重试次数 */
    private int maxRetries = RetryHeaders.DefaultConfig.DEFAULT_MAX_RETRIES;

    private QueueOptions queue = new QueueOptions();

    private ExchangeOptions exchange = new ExchangeOptions();

    private Backoff backoff = new Backoff();

    private Worker worker = new Worker();

    /**
     * 错误交换机名称，取自逻辑队列自身的 x-dead-letter-exchange 参数
     */
    public String deadLetterExchangeName() {
        return requiredQueueArgument(RetryHeaders.QueueArgument.DEAD_LETTER_EXCHANGE);
    }

    /**
     * 错误队列的绑定路由键，取自逻辑队列自身的 x-dead-letter-routing-key 参数
     */
    public String deadLetterRoutingKey() {
        return requiredQueueArgument(RetryHeaders.QueueArgument.DEAD_LETTER_ROUTING_KEY);
    }

    private String requiredQueueArgument(String key) {
        Object value = queue.getArguments().get(key);
        Preconditions.checkState(value != null && !value.toString().isBlank(),
                "Queue argument '%s' is required for queue '%s'", key, queue.getName());
        return value.toString();
    }

    @Data
    public static class QueueOptions {
        /** 逻辑队列名 */
        private String name;

        /** 持久化队列会附加 x-queue-type=quorum */
        private boolean durable = true;

        private Map<String, Object> arguments = new LinkedHashMap<>();
    }

    @Data
    public static class ExchangeOptions {
        /** 主交换机名 */
        private String name;

        private String type = "topic";

        private boolean durable = true;
    }

    @Data
    public static class Backoff {
        /** quadratic / fixed / exponential */
        private String strategy = "quadratic";

        /** fixed 策略的延迟（秒） */
        private long fixedDelay = 30;

        /** exponential 策略的基础延迟（秒） */
        private long baseDelay = 1;

        /** exponential 策略的延迟上限（秒） */
        private long maxDelay = 3600;
    }

    @Data
    public static class Worker {
        private int concurrency = 3;

        private int prefetch = 1;

        /** 单条消息的处理超时，超时后按 timeout 信号重试 */
        private Duration timeout = Duration.ofSeconds(30);
    }
}
