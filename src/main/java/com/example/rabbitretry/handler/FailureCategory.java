package com.example.rabbitretry.handler;

/**
 * 处理器内部失败的分类
 */
public enum FailureCategory {

    /** 连接已不可用：关闭 channel 并抛出，消息依赖断线重投 */
    CONNECTION_FATAL,

    /** 其他异常：nack 重新入队后抛出 */
    UNEXPECTED
}
