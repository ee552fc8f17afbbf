package com.example.rabbitretry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * RabbitMQ 退避重试应用主类
 *
 * 功能说明：
 * 1. 消费失败（拒绝 / 异常 / 超时）的消息按退避延迟进入重试队列
 * 2. 重试次数耗尽的消息转入错误队列
 */
@SpringBootApplication
public class RabbitRetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(RabbitRetryApplication.class, args);
    }
}
