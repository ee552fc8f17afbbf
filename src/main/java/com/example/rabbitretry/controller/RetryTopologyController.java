package com.example.rabbitretry.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.rabbitretry.config.BackoffHandlerProperties;
import com.example.rabbitretry.handler.BackoffRetryHandler;
import com.example.rabbitretry.model.OrderEvent;
import com.example.rabbitretry.topology.RetryQueueDescriptor;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * 重试拓扑运维接口
 */
@Slf4j
@RestController
@RequestMapping("/api/retry")
public class RetryTopologyController {

    @Autowired
    private BackoffRetryHandler backoffRetryHandler;

    @Autowired
    private BackoffHandlerProperties properties;

    @Autowired
    private RabbitTemplate rabbitTemplate;

    /**
     * 查看当前拓扑和已创建的重试队列
     *
     * GET http://localhost:8080/api/retry/topology
     */
    @GetMapping("/topology")
    public ResponseEntity<Map<String, Object>> getTopology() {
        List<Map<String, Object>> retryQueues = backoffRetryHandler.getProvisioner()
                .getProvisionedRetryQueues()
                .values()
                .stream()
                .map(this::toView)
                .collect(Collectors.toList());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("queue", backoffRetryHandler.getQueueName());
        response.put("exchange", properties.getExchange().getName());
        response.put("errorExchange", properties.deadLetterExchangeName());
        response.put("errorQueue", backoffRetryHandler.getProvisioner().errorQueueName());
        response.put("errorRoutingKey", properties.deadLetterRoutingKey());
        response.put("maxRetries", backoffRetryHandler.getMaxRetries());
        response.put("backoff", String.valueOf(backoffRetryHandler.getBackoffPolicy()));
        response.put("retryQueues", retryQueues);
        return ResponseEntity.ok(response);
    }

    /**
     * 向逻辑队列发送一条测试订单事件
     *
     * POST http://localhost:8080/api/retry/messages
     * Content-Type: application/json
     *
     * {
     *   "status": "INVALID",
     *   "content": "trigger retry"
     * }
     */
    @PostMapping("/messages")
    public ResponseEntity<Map<String, Object>> publishTestMessage(@RequestBody TestMessageRequest request) {
        OrderEvent event = new OrderEvent(UUID.randomUUID().toString(), request.getStatus(), request.getContent());
        Map<String, Object> response = new LinkedHashMap<>();

        try {
            rabbitTemplate.convertAndSend(properties.getExchange().getName(), backoffRetryHandler.getQueueName(), event);
            log.info("→ [Retry API] 测试消息已发送: ID={}", event.getId());

            response.put("success", true);
            response.put("messageId", event.getId());
            return ResponseEntity.ok(response);
        } catch (AmqpException e) {
            log.error("✗ [Retry API] 发送测试消息失败: ", e);
            response.put("success", false);
            response.put("message", "消息发送异常: " + e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }

    private Map<String, Object> toView(RetryQueueDescriptor descriptor) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("delay", descriptor.getDelay());
        view.put("queue", descriptor.getQueueName());
        view.put("routingKey", descriptor.getRoutingKey());
        view.put("ttlMillis", descriptor.getTtlMillis());
        return view;
    }

    /**
     * 测试消息请求
     */
    @Data
    public static class TestMessageRequest {
        private String status;
        private String content;
    }
}
