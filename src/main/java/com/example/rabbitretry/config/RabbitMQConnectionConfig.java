package com.example.rabbitretry.config;

import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.RabbitListenerContainerFactory;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 连接池和消费者配置
 */
@Configuration
public class RabbitMQConnectionConfig {

    /**
     * 配置连接工厂
     * 处理器在多个消费线程上并发发布重试消息，channel 缓存要足够大
     */
    @Bean
    public CachingConnectionFactory connectionFactory(RabbitProperties properties) {
        CachingConnectionFactory factory = new CachingConnectionFactory();

        factory.setHost(properties.getHost());
        factory.setPort(properties.getPort());
        factory.setUsername(properties.getUsername());
        factory.setPassword(properties.getPassword());
        factory.setVirtualHost(properties.getVirtualHost());

        factory.setChannelCacheSize(25);
        factory.setChannelCheckoutTimeout(2000);

        factory.getRabbitConnectionFactory().setConnectionTimeout(15000);
        factory.getRabbitConnectionFactory().setHandshakeTimeout(10000);

        return factory;
    }

    /**
     * 监听器容器工厂
     * 手动确认：ack / nack 全部由退避重试处理器发出
     */
    @Bean
    public RabbitListenerContainerFactory<?> rabbitListenerContainerFactory(
            ConnectionFactory connectionFactory,
            SimpleRabbitListenerContainerFactoryConfigurer configurer,
            MessageConverter messageConverter,
            BackoffHandlerProperties backoffHandlerProperties) {

        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        configurer.configure(factory, connectionFactory);

        BackoffHandlerProperties.Worker worker = backoffHandlerProperties.getWorker();
        factory.setMessageConverter(messageConverter);
        factory.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        factory.setPrefetchCount(worker.getPrefetch());
        factory.setConcurrentConsumers(worker.getConcurrency());
        factory.setMaxConcurrentConsumers(worker.getConcurrency());

        return factory;
    }
}
