package com.example.rabbitretry.topology;

import lombok.Value;

/**
 * 已创建的重试队列
 */
@Value
public class RetryQueueDescriptor {

    /** 延迟（秒） */
    long delay;

    /** {queue}.retry.{delay} */
    String queueName;

    /** {queue}.{delay} */
    String routingKey;

    /** x-message-ttl（毫秒） */
    long ttlMillis;
}
