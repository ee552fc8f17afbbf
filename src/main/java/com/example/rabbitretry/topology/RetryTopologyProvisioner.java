package com.example.rabbitretry.topology;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.ExchangeTypes;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.RabbitUtils;
import org.springframework.retry.support.RetryTemplate;

import com.example.rabbitretry.config.BackoffHandlerProperties;
import com.example.rabbitretry.constant.RetryHeaders;
import com.example.rabbitretry.exception.RetryQueueProvisioningException;
import com.example.rabbitretry.exception.TopologyConflictException;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;

import lombok.extern.slf4j.Slf4j;

/**
 * 重试拓扑管理
 *
 * 负责声明：
 * 1. 主交换机，以及逻辑队列到主交换机的绑定（路由键 = 队列名）
 * 2. 错误交换机 + {queue}.error 错误队列
 * 3. 按延迟懒创建的重试队列 {queue}.retry.{delay}：
 *    TTL 到期后死信回主交换机，路由键为逻辑队列名
 *
 * 重试队列的创建在同一个锁内串行执行，已创建的队列缓存在本地，
 * 同一个延迟值在一个实例内只声明一次。
 */
@Slf4j
public class RetryTopologyProvisioner {

    /** x-message-ttl 上限对应的最大延迟（秒） */
    public static final long MAX_DELAY_SECONDS = RetryHeaders.QueueArgument.MAX_MESSAGE_TTL_MILLIS / 1000L;

    private final AmqpAdmin amqpAdmin;
    private final BackoffHandlerProperties properties;
    private final String queueName;

    private final ConcurrentMap<Long, RetryQueueDescriptor> retryQueues = new ConcurrentHashMap<>();
    private final Object provisioningLock = new Object();

    // 第一次冲突后删除旧队列再声明一次，第二次冲突直接抛出
    private final RetryTemplate conflictRetryTemplate = RetryTemplate.builder()
            .maxAttempts(2)
            .retryOn(TopologyConflictException.class)
            .noBackoff()
            .build();

    public RetryTopologyProvisioner(AmqpAdmin amqpAdmin, BackoffHandlerProperties properties) {
        Preconditions.checkArgument(properties.getQueue().getName() != null, "backoff-handler.queue.name is required");
        Preconditions.checkArgument(properties.getExchange().getName() != null, "backoff-handler.exchange.name is required");
        this.amqpAdmin = amqpAdmin;
        this.properties = properties;
        this.queueName = properties.getQueue().getName();
    }

    /**
     * 创建处理器依赖的静态拓扑，在处理任何消息之前调用一次
     */
    public void initialize() {
        ensurePrimaryExchange();
        ensureLogicalQueue();
        ensureErrorDestination();
    }

    /**
     * 声明主交换机
     */
    public Exchange ensurePrimaryExchange() {
        BackoffHandlerProperties.ExchangeOptions options = properties.getExchange();
        return declareExchange(options.getName(), options.getType());
    }

    /**
     * 声明逻辑队列并绑定到主交换机
     * 重试队列到期后以队列名为路由键死信回来，依赖这个绑定
     */
    public void ensureLogicalQueue() {
        Queue queue = buildQueue(queueName, properties.getQueue().getArguments());
        try {
            amqpAdmin.declareQueue(queue);
        } catch (AmqpException e) {
            if (RabbitUtils.isMismatchedQueueArgs(e)) {
                throw new RetryQueueProvisioningException(
                        "Logical queue '" + queueName + "' already exists with different arguments", e);
            }
            throw e;
        }
        bind(queueName, properties.getExchange().getName(), queueName);
    }

    /**
     * 声明错误交换机和 {queue}.error 错误队列，按死信路由键绑定
     */
    public void ensureErrorDestination() {
        String exchangeName = properties.deadLetterExchangeName();
        String routingKey = properties.deadLetterRoutingKey();
        String errorQueueName = errorQueueName();

        declareExchange(exchangeName, ExchangeTypes.TOPIC);

        Queue errorQueue = buildQueue(errorQueueName, Map.of());
        try {
            amqpAdmin.declareQueue(errorQueue);
        } catch (AmqpException e) {
            // 错误队列里是已隔离的消息，不做删除重建
            if (RabbitUtils.isMismatchedQueueArgs(e)) {
                throw new RetryQueueProvisioningException(
                        "Error queue '" + errorQueueName + "' already exists with different arguments", e);
            }
            throw e;
        }
        bind(errorQueueName, exchangeName, routingKey);
    }

    /**
     * 获取（必要时创建）指定延迟的重试队列
     *
     * @param delay 延迟（秒）
     */
    public RetryQueueDescriptor ensureRetryQueue(long delay) {
        Preconditions.checkArgument(supportsDelay(delay),
                "delay must be between 1 and %s seconds, got: %s", MAX_DELAY_SECONDS, delay);

        RetryQueueDescriptor existing = retryQueues.get(delay);
        if (existing != null) {
            return existing;
        }

        synchronized (provisioningLock) {
            existing = retryQueues.get(delay);
            if (existing != null) {
                return existing;
            }

            RetryQueueDescriptor descriptor = new RetryQueueDescriptor(
                    delay,
                    retryQueueName(delay),
                    retryRoutingKey(delay),
                    Math.multiplyExact(delay, 1000L));

            Map<String, Object> arguments = new LinkedHashMap<>();
            arguments.put(RetryHeaders.QueueArgument.DEAD_LETTER_EXCHANGE, properties.getExchange().getName());
            arguments.put(RetryHeaders.QueueArgument.DEAD_LETTER_ROUTING_KEY, queueName);
            arguments.put(RetryHeaders.QueueArgument.MESSAGE_TTL, descriptor.getTtlMillis());

            declareWithConflictRecovery(buildQueue(descriptor.getQueueName(), arguments));
            bind(descriptor.getQueueName(), properties.getExchange().getName(), descriptor.getRoutingKey());

            retryQueues.put(delay, descriptor);
            log.info("✓ [Retry Topology] 重试队列已就绪: queue={}, routingKey={}, ttl={}ms",
                    descriptor.getQueueName(), descriptor.getRoutingKey(), descriptor.getTtlMillis());
            return descriptor;
        }
    }

    /**
     * 延迟能否用 TTL 队列表达
     */
    public boolean supportsDelay(long delay) {
        return delay > 0 && delay <= MAX_DELAY_SECONDS;
    }

    /**
     * 连接重建后 broker 上的非持久拓扑可能已不存在，清空缓存让下次重试重新声明
     */
    public void evictRetryQueues() {
        synchronized (provisioningLock) {
            if (!retryQueues.isEmpty()) {
                log.info("⟳ [Retry Topology] 连接重建，清空重试队列缓存: delays={}", retryQueues.keySet());
                retryQueues.clear();
            }
        }
    }

    /**
     * 已创建的重试队列快照（按延迟排序）
     */
    public SortedMap<Long, RetryQueueDescriptor> getProvisionedRetryQueues() {
        return ImmutableSortedMap.copyOf(retryQueues);
    }

    public String getQueueName() {
        return queueName;
    }

    public String retryQueueName(long delay) {
        return queueName + RetryHeaders.DefaultConfig.RETRY_QUEUE_INFIX + delay;
    }

    public String retryRoutingKey(long delay) {
        return queueName + "." + delay;
    }

    public String errorQueueName() {
        return queueName + RetryHeaders.DefaultConfig.ERROR_QUEUE_SUFFIX;
    }

    private Exchange declareExchange(String name, String type) {
        log.info("→ [Retry Topology] 声明交换机: exchange={}, type={}", name, type);
        Exchange exchange = new ExchangeBuilder(name, type)
                .durable(properties.getExchange().isDurable())
                .build();
        amqpAdmin.declareExchange(exchange);
        return exchange;
    }

    private Queue buildQueue(String name, Map<String, Object> arguments) {
        QueueBuilder builder = properties.getQueue().isDurable()
                ? QueueBuilder.durable(name).quorum()
                : QueueBuilder.nonDurable(name);
        return builder.withArguments(arguments).build();
    }

    private void declareWithConflictRecovery(Queue queue) {
        try {
            conflictRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("⚠ [Retry Topology] 队列参数冲突，删除后重建: queue={}", queue.getName());
                    amqpAdmin.deleteQueue(queue.getName());
                }
                try {
                    return amqpAdmin.declareQueue(queue);
                } catch (AmqpException e) {
                    if (RabbitUtils.isMismatchedQueueArgs(e)) {
                        throw new TopologyConflictException(queue.getName(), e);
                    }
                    throw e;
                }
            });
        } catch (TopologyConflictException e) {
            log.error("✗ [Retry Topology] 重建后仍然冲突: queue={}", queue.getName());
            throw new RetryQueueProvisioningException(
                    "Unable to provision retry queue '" + queue.getName() + "'", e);
        }
    }

    private void bind(String destination, String exchange, String routingKey) {
        amqpAdmin.declareBinding(new Binding(destination, Binding.DestinationType.QUEUE, exchange, routingKey, null));
    }
}
