package com.example.rabbitretry.handler;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.MessagePropertiesBuilder;
import org.springframework.amqp.rabbit.core.RabbitOperations;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;

import com.example.rabbitretry.backoff.BackoffPolicy;
import com.example.rabbitretry.config.BackoffHandlerProperties;
import com.example.rabbitretry.constant.RetryHeaders;
import com.example.rabbitretry.history.DeliveryHistoryReader;
import com.example.rabbitretry.topology.RetryQueueDescriptor;
import com.example.rabbitretry.topology.RetryTopologyProvisioner;
import com.google.common.base.Preconditions;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

import lombok.extern.slf4j.Slf4j;

/**
 * 指数退避重试处理器
 *
 * 处理流程（reject / error / timeout 共用）：
 * 1. 从 x-death 计算逻辑队列的历史失败次数
 * 2. 复制消息头，写入 rejectionReason，去掉 x-delay
 * 3. 次数 < maxRetries：按退避策略算延迟，确保 {queue}.retry.{delay} 存在，
 *    以 {queue}.{delay} 为路由键发回主交换机
 * 4. 次数 >= maxRetries：以死信路由键发到错误交换机
 * 5. 确认（ack）原消息
 *
 * 失败处理：
 * - 连接级错误：关闭 channel 后抛出，原消息不确认，等 broker 断线重投
 * - 其他异常：nack 并重新入队后抛出
 *
 * 实例可被多个消费线程并发调用。
 */
@Slf4j
public class BackoffRetryHandler {

    private final String queueName;
    private final int maxRetries;
    private final BackoffPolicy backoffPolicy;
    private final RetryTopologyProvisioner provisioner;
    private final RabbitOperations rabbitOperations;
    private final FailureClassifier failureClassifier;

    private final String primaryExchangeName;
    private final String errorExchangeName;
    private final String deadLetterRoutingKey;

    public BackoffRetryHandler(BackoffHandlerProperties properties,
                               BackoffPolicy backoffPolicy,
                               RetryTopologyProvisioner provisioner,
                               RabbitOperations rabbitOperations) {
        this(properties, backoffPolicy, provisioner, rabbitOperations, new FailureClassifier());
    }

    public BackoffRetryHandler(BackoffHandlerProperties properties,
                               BackoffPolicy backoffPolicy,
                               RetryTopologyProvisioner provisioner,
                               RabbitOperations rabbitOperations,
                               FailureClassifier failureClassifier) {
        Preconditions.checkArgument(properties.getMaxRetries() >= 0,
                "maxRetries must be >= 0, got: %s", properties.getMaxRetries());
        this.queueName = provisioner.getQueueName();
        this.maxRetries = properties.getMaxRetries();
        this.backoffPolicy = backoffPolicy;
        this.provisioner = provisioner;
        this.rabbitOperations = rabbitOperations;
        this.failureClassifier = failureClassifier;
        this.primaryExchangeName = properties.getExchange().getName();
        this.errorExchangeName = properties.deadLetterExchangeName();
        this.deadLetterRoutingKey = properties.deadLetterRoutingKey();

        provisioner.initialize();
        log.info("✓ [Backoff Handler] 初始化完成: queue={}, maxRetries={}, backoff={}",
                queueName, maxRetries, backoffPolicy);
    }

    /**
     * 处理成功，直接确认
     */
    public void onAcknowledge(Channel channel, Message message) {
        try {
            channel.basicAck(deliveryTag(message), false);
        } catch (IOException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    public void onReject(Channel channel, Message message) {
        retryMessage(channel, message, RetryHeaders.Reason.REJECT);
    }

    public void onError(Channel channel, Message message, Throwable error) {
        retryMessage(channel, message, String.valueOf(error));
    }

    public void onError(Channel channel, Message message, String errorDescription) {
        retryMessage(channel, message, errorDescription);
    }

    public void onTimeout(Channel channel, Message message) {
        retryMessage(channel, message, RetryHeaders.Reason.TIMEOUT);
    }

    /**
     * 消息已在别处处理，不做任何事
     */
    public void onNoop(Channel channel, Message message) {
        log.debug("→ [Backoff Handler] noop: queue={}, deliveryTag={}", queueName, deliveryTag(message));
    }

    public String getQueueName() {
        return queueName;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }

    public RetryTopologyProvisioner getProvisioner() {
        return provisioner;
    }

    private void retryMessage(Channel channel, Message message, String reason) {
        long deliveryTag = deliveryTag(message);
        MessageProperties properties = message.getMessageProperties();

        try {
            int attemptNumber = DeliveryHistoryReader.attemptCount(properties, queueName);
            Message republished = rebuild(message, reason);

            long delay = attemptNumber < maxRetries ? backoffPolicy.delayFor(attemptNumber) : 0L;

            if (attemptNumber < maxRetries && provisioner.supportsDelay(delay)) {
                log.warn("⟳ [Backoff Handler] 消息重试: queue={}, count={}, delay={}s, messageId={}, reason={}",
                        queueName, attemptNumber, delay, properties.getMessageId(), reason);

                RetryQueueDescriptor retryQueue = provisioner.ensureRetryQueue(delay);
                rabbitOperations.send(primaryExchangeName, retryQueue.getRoutingKey(), republished);
            } else {
                if (attemptNumber < maxRetries) {
                    // 超出 x-message-ttl 上限的队列 broker 拒绝声明，只能隔离
                    log.error("☠ [Backoff Handler] 退避延迟超出 broker 上限，转入错误队列: queue={}, count={}, delay={}s, messageId={}",
                            queueName, attemptNumber, delay, properties.getMessageId());
                } else {
                    log.error("☠ [Backoff Handler] 重试次数耗尽，转入错误队列: queue={}, count={}, routingKey={}, messageId={}, reason={}",
                            queueName, attemptNumber, deadLetterRoutingKey, properties.getMessageId(), reason);
                }

                rabbitOperations.send(errorExchangeName, deadLetterRoutingKey, republished);
            }

            channel.basicAck(deliveryTag, false);
        } catch (Exception e) {
            throw handleFailure(channel, deliveryTag, e);
        }
    }

    /**
     * 复制消息头（不修改原消息），写入拒绝原因并去掉延迟插件头
     * 带 x-delay 的消息进入 TTL 队列可能在延迟结束前随队列过期而丢失
     *
     * 入站消息的投递模式只保存在 receivedDeliveryMode 中，需要显式带回，缺失时按持久化发送
     */
    private Message rebuild(Message message, String reason) {
        MessageDeliveryMode receivedMode = message.getMessageProperties().getReceivedDeliveryMode();
        MessageProperties republished = MessagePropertiesBuilder
                .fromClonedProperties(message.getMessageProperties())
                .setHeader(RetryHeaders.Header.REJECTION_REASON, reason)
                .setDeliveryMode(receivedMode != null ? receivedMode : MessageDeliveryMode.PERSISTENT)
                .build();
        republished.getHeaders().remove(RetryHeaders.Header.X_DELAY);
        return new Message(message.getBody(), republished);
    }

    private RuntimeException handleFailure(Channel channel, long deliveryTag, Exception failure) {
        if (failureClassifier.isConnectionFatal(failure)) {
            log.error("✗ [Backoff Handler] 连接已关闭: queue={}, error='{}'", queueName, failure.getMessage());
            if (channel.isOpen()) {
                try {
                    channel.close();
                } catch (IOException | TimeoutException | ShutdownSignalException closeFailure) {
                    failure.addSuppressed(closeFailure);
                }
            }
        } else {
            log.error("✗ [Backoff Handler] 处理器异常，消息重新入队: queue={}, deliveryTag={}, error='{}'",
                    queueName, deliveryTag, failure.getMessage(), failure);
            // 不 nack 的话消息会一直停在 unacked 状态直到进程退出
            if (channel.isOpen()) {
                try {
                    channel.basicNack(deliveryTag, false, true);
                } catch (IOException | ShutdownSignalException nackFailure) {
                    failure.addSuppressed(nackFailure);
                }
            }
        }

        if (failure instanceof RuntimeException) {
            return (RuntimeException) failure;
        }
        return RabbitExceptionTranslator.convertRabbitAccessException(failure);
    }

    private static long deliveryTag(Message message) {
        return message.getMessageProperties().getDeliveryTag();
    }
}
