package com.example.rabbitretry.config;

import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.rabbitretry.backoff.BackoffPolicies;
import com.example.rabbitretry.backoff.BackoffPolicy;
import com.example.rabbitretry.handler.BackoffRetryHandler;
import com.example.rabbitretry.topology.RetryTopologyConnectionListener;
import com.example.rabbitretry.topology.RetryTopologyProvisioner;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * RabbitMQ 配置类
 *
 * 组装退避重试处理器：
 * 1. 退避策略（按 backoff-handler.backoff.strategy 选择）
 * 2. 拓扑管理（主交换机、逻辑队列、错误队列、按延迟创建的重试队列）
 * 3. 处理器本身，创建时即声明静态拓扑
 */
@Configuration
@EnableConfigurationProperties(BackoffHandlerProperties.class)
public class RabbitMQConfig {

    /**
     * 退避策略
     */
    @Bean
    public BackoffPolicy backoffPolicy(BackoffHandlerProperties properties) {
        return BackoffPolicies.resolve(properties.getBackoff());
    }

    /**
     * 用于声明 / 删除队列、交换机和绑定
     * 拓扑都是运行时通过 AmqpAdmin 声明的，重连后需要由 RabbitAdmin 重新声明
     */
    @Bean
    public RabbitAdmin rabbitAdmin(ConnectionFactory connectionFactory) {
        RabbitAdmin rabbitAdmin = new RabbitAdmin(connectionFactory);
        rabbitAdmin.setRedeclareManualDeclarations(true);
        return rabbitAdmin;
    }

    @Bean
    public RetryTopologyProvisioner retryTopologyProvisioner(AmqpAdmin amqpAdmin,
                                                             BackoffHandlerProperties properties,
                                                             ConnectionFactory connectionFactory) {
        RetryTopologyProvisioner provisioner = new RetryTopologyProvisioner(amqpAdmin, properties);
        connectionFactory.addConnectionListener(new RetryTopologyConnectionListener(provisioner));
        return provisioner;
    }

    @Bean
    public BackoffRetryHandler backoffRetryHandler(BackoffHandlerProperties properties,
                                                   BackoffPolicy backoffPolicy,
                                                   RetryTopologyProvisioner retryTopologyProvisioner,
                                                   RabbitTemplate rabbitTemplate) {
        return new BackoffRetryHandler(properties, backoffPolicy, retryTopologyProvisioner, rabbitTemplate);
    }

    /**
     * 配置消息转换器（JSON格式），仅用于运维接口发送测试消息
     * 重试时原样转发消息体，不经过转换器
     */
    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory,
                                         MessageConverter messageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(messageConverter);
        return rabbitTemplate;
    }
}
