package com.example.rabbitretry.exception;

import org.springframework.amqp.AmqpException;

/**
 * 队列已存在且参数不一致（PRECONDITION_FAILED）
 */
public class TopologyConflictException extends AmqpException {

    private final String queueName;

    public TopologyConflictException(String queueName, Throwable cause) {
        super("Queue '" + queueName + "' already exists with different arguments", cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
