package com.example.rabbitretry.model;

import java.io.Serializable;
import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 订单事件（示例消息体）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderEvent implements Serializable {

    public static final String STATUS_INVALID = "INVALID";

    private String id;
    private String status;
    private String content;
    private LocalDateTime timestamp;

    public OrderEvent(String id, String status, String content) {
        this.id = id;
        this.status = status;
        this.content = content;
        this.timestamp = LocalDateTime.now();
    }
}
