package com.example.rabbitretry.topology;

import static com.example.rabbitretry.TestFixtures.DLX;
import static com.example.rabbitretry.TestFixtures.EXCHANGE;
import static com.example.rabbitretry.TestFixtures.QUEUE;
import static com.example.rabbitretry.TestFixtures.ordersProperties;
import static com.example.rabbitretry.TestFixtures.queueConflict;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Queue;

import com.example.rabbitretry.config.BackoffHandlerProperties;
import com.example.rabbitretry.exception.RetryQueueProvisioningException;
import com.example.rabbitretry.exception.TopologyConflictException;

/**
 * RetryTopologyProvisioner 单元测试
 */
@ExtendWith(MockitoExtension.class)
class RetryTopologyProvisionerTest {

    @Mock
    private AmqpAdmin amqpAdmin;

    private BackoffHandlerProperties properties;

    private RetryTopologyProvisioner provisioner;

    @BeforeEach
    void setUp() {
        properties = ordersProperties();
        provisioner = new RetryTopologyProvisioner(amqpAdmin, properties);
    }

    @Test
    void testInitialize_DeclaresStaticTopology() {
        // When
        provisioner.initialize();

        // Then
        ArgumentCaptor<Exchange> exchanges = ArgumentCaptor.forClass(Exchange.class);
        verify(amqpAdmin, times(2)).declareExchange(exchanges.capture());
        assertEquals(EXCHANGE, exchanges.getAllValues().get(0).getName());
        assertEquals("topic", exchanges.getAllValues().get(0).getType());
        assertTrue(exchanges.getAllValues().get(0).isDurable());
        assertEquals(DLX, exchanges.getAllValues().get(1).getName());

        ArgumentCaptor<Queue> queues = ArgumentCaptor.forClass(Queue.class);
        verify(amqpAdmin, times(2)).declareQueue(queues.capture());
        Queue logical = queues.getAllValues().get(0);
        assertEquals(QUEUE, logical.getName());
        assertEquals("quorum", logical.getArguments().get("x-queue-type"));
        assertEquals(DLX, logical.getArguments().get("x-dead-letter-exchange"));
        Queue error = queues.getAllValues().get(1);
        assertEquals("orders.error", error.getName());
        assertTrue(error.isDurable());
        assertEquals("quorum", error.getArguments().get("x-queue-type"));

        ArgumentCaptor<Binding> bindings = ArgumentCaptor.forClass(Binding.class);
        verify(amqpAdmin, times(2)).declareBinding(bindings.capture());
        assertBinding(bindings.getAllValues().get(0), QUEUE, EXCHANGE, QUEUE);
        assertBinding(bindings.getAllValues().get(1), "orders.error", DLX, "orders");
    }

    @Test
    void testEnsureRetryQueue_DeclaresTtlQueueBoundToPrimaryExchange() {
        // When
        RetryQueueDescriptor descriptor = provisioner.ensureRetryQueue(1);

        // Then
        assertEquals("orders.retry.1", descriptor.getQueueName());
        assertEquals("orders.1", descriptor.getRoutingKey());
        assertEquals(1000L, descriptor.getTtlMillis());

        ArgumentCaptor<Queue> queue = ArgumentCaptor.forClass(Queue.class);
        verify(amqpAdmin).declareQueue(queue.capture());
        assertEquals("orders.retry.1", queue.getValue().getName());
        assertEquals(1000L, queue.getValue().getArguments().get("x-message-ttl"));
        assertEquals(EXCHANGE, queue.getValue().getArguments().get("x-dead-letter-exchange"));
        assertEquals(QUEUE, queue.getValue().getArguments().get("x-dead-letter-routing-key"));
        assertEquals("quorum", queue.getValue().getArguments().get("x-queue-type"));

        ArgumentCaptor<Binding> binding = ArgumentCaptor.forClass(Binding.class);
        verify(amqpAdmin).declareBinding(binding.capture());
        assertBinding(binding.getValue(), "orders.retry.1", EXCHANGE, "orders.1");
    }

    @Test
    void testEnsureRetryQueue_NonDurableQueueHasNoQuorumHint() {
        // Given
        properties.getQueue().setDurable(false);

        // When
        provisioner.ensureRetryQueue(4);

        // Then
        ArgumentCaptor<Queue> queue = ArgumentCaptor.forClass(Queue.class);
        verify(amqpAdmin).declareQueue(queue.capture());
        assertFalse(queue.getValue().isDurable());
        assertFalse(queue.getValue().getArguments().containsKey("x-queue-type"));
    }

    @Test
    void testEnsureRetryQueue_IsIdempotent() {
        // When
        RetryQueueDescriptor first = provisioner.ensureRetryQueue(9);
        RetryQueueDescriptor second = provisioner.ensureRetryQueue(9);

        // Then
        assertSame(first, second);
        verify(amqpAdmin, times(1)).declareQueue(any(Queue.class));
        verify(amqpAdmin, times(1)).declareBinding(any(Binding.class));
        assertEquals(1, provisioner.getProvisionedRetryQueues().size());
    }

    @Test
    void testEnsureRetryQueue_ConflictDeletesAndRedeclaresOnce() {
        // Given
        when(amqpAdmin.declareQueue(any(Queue.class)))
                .thenThrow(queueConflict())
                .thenReturn("orders.retry.4");

        // When
        RetryQueueDescriptor descriptor = provisioner.ensureRetryQueue(4);

        // Then
        assertEquals("orders.retry.4", descriptor.getQueueName());
        verify(amqpAdmin, times(1)).deleteQueue("orders.retry.4");
        verify(amqpAdmin, times(2)).declareQueue(any(Queue.class));
        verify(amqpAdmin, times(1)).declareBinding(any(Binding.class));
    }

    @Test
    void testEnsureRetryQueue_SecondConflictPropagates() {
        // Given
        when(amqpAdmin.declareQueue(any(Queue.class)))
                .thenThrow(queueConflict())
                .thenThrow(queueConflict());

        // When
        RetryQueueProvisioningException e = assertThrows(RetryQueueProvisioningException.class,
                () -> provisioner.ensureRetryQueue(4));

        // Then
        assertTrue(e.getCause() instanceof TopologyConflictException);
        verify(amqpAdmin, times(1)).deleteQueue("orders.retry.4");
        verify(amqpAdmin, times(2)).declareQueue(any(Queue.class));
        verify(amqpAdmin, never()).declareBinding(any(Binding.class));
        assertTrue(provisioner.getProvisionedRetryQueues().isEmpty());
    }

    @Test
    void testEnsureRetryQueue_OtherFailuresAreNotRetried() {
        // Given
        AmqpIOException failure = new AmqpIOException(new IOException("socket closed"));
        when(amqpAdmin.declareQueue(any(Queue.class))).thenThrow(failure);

        // When
        AmqpIOException thrown = assertThrows(AmqpIOException.class, () -> provisioner.ensureRetryQueue(1));

        // Then
        assertSame(failure, thrown);
        verify(amqpAdmin, times(1)).declareQueue(any(Queue.class));
        verify(amqpAdmin, never()).deleteQueue(any());
    }

    @Test
    void testEnsureRetryQueue_ConcurrentSameDelayDeclaresOnce() throws Exception {
        // Given
        when(amqpAdmin.declareQueue(any(Queue.class))).thenAnswer(invocation -> {
            Thread.sleep(100);
            return "orders.retry.7";
        });
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);

        try {
            // When
            Future<RetryQueueDescriptor> first = executor.submit(() -> {
                start.await();
                return provisioner.ensureRetryQueue(7);
            });
            Future<RetryQueueDescriptor> second = executor.submit(() -> {
                start.await();
                return provisioner.ensureRetryQueue(7);
            });
            start.countDown();

            // Then
            assertSame(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));
            verify(amqpAdmin, times(1)).declareQueue(any(Queue.class));
            verify(amqpAdmin, times(1)).declareBinding(any(Binding.class));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testEnsureRetryQueue_DistinctDelaysCoexist() {
        // When
        provisioner.ensureRetryQueue(1);
        provisioner.ensureRetryQueue(4);
        provisioner.ensureRetryQueue(9);

        // Then
        assertEquals(List.of(1L, 4L, 9L), List.copyOf(provisioner.getProvisionedRetryQueues().keySet()));
    }

    @Test
    void testEnsureRetryQueue_DelayBeyondTtlLimitRejected() {
        // When / Then
        assertThrows(IllegalArgumentException.class,
                () -> provisioner.ensureRetryQueue(RetryTopologyProvisioner.MAX_DELAY_SECONDS + 1));
        verify(amqpAdmin, never()).declareQueue(any(Queue.class));
        assertFalse(provisioner.supportsDelay(0));
    }

    @Test
    void testEnsureRetryQueue_LargestDelayFitsTtlLimit() {
        // When
        RetryQueueDescriptor descriptor = provisioner.ensureRetryQueue(RetryTopologyProvisioner.MAX_DELAY_SECONDS);

        // Then
        assertEquals(4_294_967_000L, descriptor.getTtlMillis());
    }

    @Test
    void testEvictRetryQueues_RedeclaresOnNextUse() {
        // Given
        provisioner.ensureRetryQueue(4);

        // When: 连接重建
        new RetryTopologyConnectionListener(provisioner).onCreate(null);
        RetryQueueDescriptor descriptor = provisioner.ensureRetryQueue(4);

        // Then
        assertEquals("orders.retry.4", descriptor.getQueueName());
        verify(amqpAdmin, times(2)).declareQueue(any(Queue.class));
        verify(amqpAdmin, times(2)).declareBinding(any(Binding.class));
    }

    @Test
    void testEnsureErrorDestination_ConflictIsNotDeleted() {
        // Given
        when(amqpAdmin.declareQueue(any(Queue.class))).thenThrow(queueConflict());

        // When / Then
        assertThrows(RetryQueueProvisioningException.class, () -> provisioner.ensureErrorDestination());
        verify(amqpAdmin, never()).deleteQueue(any());
    }

    @Test
    void testEnsureErrorDestination_RequiresDeadLetterArguments() {
        // Given
        properties.getQueue().getArguments().remove("x-dead-letter-exchange");

        // When / Then
        assertThrows(IllegalStateException.class, () -> provisioner.ensureErrorDestination());
    }

    private static void assertBinding(Binding binding, String destination, String exchange, String routingKey) {
        assertEquals(destination, binding.getDestination());
        assertEquals(Binding.DestinationType.QUEUE, binding.getDestinationType());
        assertEquals(exchange, binding.getExchange());
        assertEquals(routingKey, binding.getRoutingKey());
    }
}
