package com.example.rabbitretry.consumer;

import org.springframework.amqp.core.Message;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.model.OrderEvent;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * 示例业务处理：解析 JSON 订单事件
 *
 * - 内容包含 "error"：抛异常（error 信号）
 * - 状态为 INVALID：业务拒绝（reject 信号）
 * - 其他：处理成功
 */
@Slf4j
@Component
public class OrderEventProcessor implements MessageProcessor {

    @Autowired
    private ObjectMapper objectMapper;

    @Override
    public ProcessingResult process(Message message) throws Exception {
        OrderEvent event = objectMapper.readValue(message.getBody(), OrderEvent.class);
        log.info("→ [Order Processor] 处理订单事件: ID={}, Status={}", event.getId(), event.getStatus());

        if (event.getContent() != null && event.getContent().toLowerCase().contains("error")) {
            throw new IllegalStateException("业务处理失败：消息内容包含错误标识");
        }

        if (OrderEvent.STATUS_INVALID.equalsIgnoreCase(event.getStatus())) {
            log.warn("⚠ [Order Processor] 订单状态非法，拒绝: ID={}", event.getId());
            return ProcessingResult.REJECT;
        }

        log.info("✓ [Order Processor] 订单事件处理完成: ID={}", event.getId());
        return ProcessingResult.ACK;
    }
}
