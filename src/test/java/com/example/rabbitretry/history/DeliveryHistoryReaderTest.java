package com.example.rabbitretry.history;

import static com.example.rabbitretry.TestFixtures.death;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.MessageProperties;

/**
 * DeliveryHistoryReader 单元测试
 */
class DeliveryHistoryReaderTest {

    @Test
    void testAttemptCount_NoHistory() {
        assertEquals(0, DeliveryHistoryReader.attemptCount(new MessageProperties(), "Q"));
        assertEquals(0, DeliveryHistoryReader.attemptCount((MessageProperties) null, "Q"));
        assertEquals(0, DeliveryHistoryReader.attemptCount(Collections.emptyMap(), "Q"));
    }

    @Test
    void testAttemptCount_SumsRetryVariantsByPrefix() {
        // Given
        MessageProperties properties = new MessageProperties();
        properties.setHeader("x-death", List.of(
                death("Q", 3),
                death("Q.retry.4", 2),
                death("Other", 9)));

        // When
        int count = DeliveryHistoryReader.attemptCount(properties, "Q");

        // Then
        assertEquals(5, count);
    }

    @Test
    void testAttemptCount_IgnoresMalformedRecords() {
        // Given
        Map<String, Object> missingCount = new HashMap<>();
        missingCount.put("queue", "orders.retry.1");
        MessageProperties properties = new MessageProperties();
        properties.setHeader("x-death", List.of(death("orders", 1), missingCount, "garbage"));

        // When
        int count = DeliveryHistoryReader.attemptCount(properties, "orders");

        // Then
        assertEquals(1, count);
    }

    @Test
    void testAttemptCount_SharedPrefixIsCounted() {
        // 名字互为前缀的逻辑队列会互相计数
        MessageProperties properties = new MessageProperties();
        properties.setHeader("x-death", List.of(death("orders-archive", 2), death("orders.retry.1", 1)));

        assertEquals(3, DeliveryHistoryReader.attemptCount(properties, "orders"));
    }

    @Test
    void testAttemptCount_IntegerCounts() {
        Map<String, Object> record = new HashMap<>();
        record.put("queue", "orders");
        record.put("count", 4);
        MessageProperties properties = new MessageProperties();
        properties.setHeader("x-death", List.of(record));

        assertEquals(4, DeliveryHistoryReader.attemptCount(properties, "orders"));
    }
}
