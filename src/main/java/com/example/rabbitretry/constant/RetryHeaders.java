package com.example.rabbitretry.constant;

/**
 * 重试 / 死信相关常量定义
 *
 * 统一管理消息头、队列参数、拒绝原因等常量
 */
public class RetryHeaders {

    /**
     * 消息头
     */
    public static class Header {
        /** Broker 维护的死信历史 */
        public static final String X_DEATH = "x-death";

        /** rabbitmq-delayed-message-exchange 插件使用的延迟头 */
        public static final String X_DELAY = "x-delay";

        /** 本处理器写入的拒绝原因 */
        public static final String REJECTION_REASON = "rejectionReason";
    }

    /**
     * x-death 记录中的字段
     */
    public static class DeathRecord {
        public static final String QUEUE = "queue";
        public static final String COUNT = "count";
    }

    /**
     * 队列参数
     */
    public static class QueueArgument {
        public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
        public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
        public static final String MESSAGE_TTL = "x-message-ttl";

        /** x-message-ttl 上限（2^32 - 1 毫秒） */
        public static final long MAX_MESSAGE_TTL_MILLIS = 4_294_967_295L;
    }

    /**
     * 拒绝原因标记
     */
    public static class Reason {
        public static final String REJECT = "reject";
        public static final String TIMEOUT = "timeout";
    }

    /**
     * 默认配置
     */
    public static class DefaultConfig {
        /** 默认最大重试次数 */
        public static final int DEFAULT_MAX_RETRIES = 25;

        /** 重试队列名后缀 */
        public static final String RETRY_QUEUE_INFIX = ".retry.";

        /** 错误队列名后缀 */
        public static final String ERROR_QUEUE_SUFFIX = ".error";
    }
}
