package com.example.rabbitretry.consumer;

/**
 * 业务处理结果
 */
public enum ProcessingResult {

    /** 处理成功，确认消息 */
    ACK,

    /** 业务拒绝，进入退避重试 */
    REJECT,

    /** 消息已在别处处理（例如已转发），不再确认 */
    NOOP
}
