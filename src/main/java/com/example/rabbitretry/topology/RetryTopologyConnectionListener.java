package com.example.rabbitretry.topology;

import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionListener;

import lombok.extern.slf4j.Slf4j;

/**
 * 连接（重新）建立时清空重试队列缓存
 *
 * 静态拓扑和已声明的重试队列由 RabbitAdmin 在重连时重新声明，
 * 缓存清空后下一次重试会再次确认队列存在。
 */
@Slf4j
public class RetryTopologyConnectionListener implements ConnectionListener {

    private final RetryTopologyProvisioner provisioner;

    public RetryTopologyConnectionListener(RetryTopologyProvisioner provisioner) {
        this.provisioner = provisioner;
    }

    @Override
    public void onCreate(Connection connection) {
        log.debug("→ [Retry Topology] 连接已建立: queue={}", provisioner.getQueueName());
        provisioner.evictRetryQueues();
    }
}
