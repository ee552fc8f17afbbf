package com.example.rabbitretry.exception;

import org.springframework.amqp.AmqpException;

/**
 * 重试 / 错误拓扑无法创建
 *
 * 删除并重建一次后仍然冲突，或者逻辑队列 / 错误队列本身冲突时抛出。
 */
public class RetryQueueProvisioningException extends AmqpException {

    public RetryQueueProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
