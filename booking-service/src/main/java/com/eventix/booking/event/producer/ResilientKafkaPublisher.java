package com.eventix.booking.event.producer;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Direct Kafka send for best-effort messages that do not go through the outbox.
 * Synchronous send so failures reach Resilience4j; once retries are exhausted or the
 * circuit is open the message is dropped and logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResilientKafkaPublisher {

    private static final int SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Retry(name = "kafkaProducer")
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "publishFallback")
    public void publish(String topic, String key, Object message, String messageName) {
        try {
            kafkaTemplate.send(topic, key, message).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new KafkaPublishException("Failed to publish " + messageName + " to " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new KafkaPublishException("Timeout publishing " + messageName + " to " + topic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KafkaPublishException("Interrupted publishing " + messageName + " to " + topic, e);
        }
    }

    @SuppressWarnings("unused")
    void publishFallback(String topic, String key, Object message, String messageName, Throwable t) {
        log.error("Kafka publish gave up, message dropped: {} topic={} key={}",
                messageName, topic, key, t);
    }

    public static class KafkaPublishException extends RuntimeException {
        public KafkaPublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
