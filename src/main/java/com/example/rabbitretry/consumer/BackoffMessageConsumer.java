package com.example.rabbitretry.consumer;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.config.BackoffHandlerProperties;
import com.example.rabbitretry.handler.BackoffRetryHandler;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.rabbitmq.client.Channel;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * 逻辑队列消费者
 *
 * 在超时限制内执行业务处理，并把结果交给退避重试处理器：
 * 1. ACK    -> 确认
 * 2. REJECT -> reject 信号，进入退避重试
 * 3. NOOP   -> 不做处理
 * 4. 抛异常 -> error 信号
 * 5. 超时   -> timeout 信号
 *
 * 处理器抛出的系统级异常（连接断开、拓扑创建失败）直接抛给监听容器。
 */
@Slf4j
@Component
public class BackoffMessageConsumer {

    @Autowired
    private BackoffRetryHandler backoffRetryHandler;

    @Autowired
    private MessageProcessor messageProcessor;

    @Autowired
    private BackoffHandlerProperties properties;

    private final AtomicInteger messageCount = new AtomicInteger(0);

    private ExecutorService workerExecutor;

    /**
     * 线程数与消费者并发数一致
     * 忽略中断的处理逻辑会一直占住线程，之后的消息排队直至超时，不会无限创建线程
     */
    @PostConstruct
    public void init() {
        workerExecutor = Executors.newFixedThreadPool(properties.getWorker().getConcurrency(), new ThreadFactoryBuilder()
                .setNameFormat("backoff-worker-%d")
                .setDaemon(true)
                .build());
    }

    @PreDestroy
    public void shutdown() {
        workerExecutor.shutdownNow();
    }

    @RabbitListener(queues = "${backoff-handler.queue.name}", ackMode = "MANUAL")
    public void consume(Message message, Channel channel) throws InterruptedException {
        int count = messageCount.incrementAndGet();
        Duration timeout = properties.getWorker().getTimeout();

        log.info("← [Backoff Consumer] 收到消息 #{}: queue={}, messageId={}, deliveryTag={}",
                count, backoffRetryHandler.getQueueName(),
                message.getMessageProperties().getMessageId(),
                message.getMessageProperties().getDeliveryTag());

        Future<ProcessingResult> future = workerExecutor.submit(() -> messageProcessor.process(message));

        ProcessingResult result;
        try {
            result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⏱ [Backoff Consumer] 处理超时（{}ms）: messageId={}",
                    timeout.toMillis(), message.getMessageProperties().getMessageId());
            backoffRetryHandler.onTimeout(channel, message);
            return;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("✗ [Backoff Consumer] 处理失败: messageId={}, error={}",
                    message.getMessageProperties().getMessageId(), cause.toString());
            backoffRetryHandler.onError(channel, message, cause);
            return;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }

        if (result == null) {
            backoffRetryHandler.onError(channel, message, "MessageProcessor returned no result");
            return;
        }

        switch (result) {
            case ACK:
                backoffRetryHandler.onAcknowledge(channel, message);
                break;
            case REJECT:
                backoffRetryHandler.onReject(channel, message);
                break;
            case NOOP:
                backoffRetryHandler.onNoop(channel, message);
                break;
            default:
                throw new IllegalStateException("Unknown processing result: " + result);
        }
    }
}
