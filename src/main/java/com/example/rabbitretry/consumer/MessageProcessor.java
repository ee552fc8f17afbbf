package com.example.rabbitretry.consumer;

import org.springframework.amqp.core.Message;

/**
 * 业务处理回调
 *
 * 抛出的异常按 error 信号处理，超时按 timeout 信号处理。
 */
@FunctionalInterface
public interface MessageProcessor {

    ProcessingResult process(Message message) throws Exception;
}
