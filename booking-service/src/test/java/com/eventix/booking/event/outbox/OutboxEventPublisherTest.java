package com.eventix.booking.event.outbox;

import com.eventix.booking.config.BookingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxEventPublisherTest {

    @Mock
    private OutboxEventRepository outboxEventRepository;
    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private OutboxEventPublisher publisher;

    @BeforeEach
    void setUp() {
        BookingProperties properties = new BookingProperties();
        properties.getOutbox().setMaxRetries(2);
        properties.getOutbox().setSendTimeout(Duration.ofMillis(50));
        publisher = new OutboxEventPublisher(outboxEventRepository, kafkaTemplate, properties);
    }

    @Test
    @SuppressWarnings("unchecked")
    void relay_brokerAcks_marksPublished() {
        OutboxEvent event = outboxEvent();
        SendResult<String, String> result = mock(SendResult.class);
        when(kafkaTemplate.send("ticket.booking.created", "10", "{}"))
                .thenReturn(CompletableFuture.completedFuture(result));

        assertThat(publisher.relay(event)).isTrue();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PUBLISHED);
        assertThat(event.getPublishedAt()).isNotNull();
        verify(outboxEventRepository).save(event);
    }

    @Test
    void relay_sendFails_keepsRowForRetryWithCause() {
        OutboxEvent event = outboxEvent();
        when(kafkaTemplate.send("ticket.booking.created", "10", "{}"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThat(publisher.relay(event)).isFalse();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.RETRYING);
        assertThat(event.getRetryCount()).isEqualTo(1);
        assertThat(event.getLastError()).isEqualTo("broker down");
        verify(outboxEventRepository).save(event);
    }

    @Test
    void relay_noAckWithinTimeout_countsAsFailedAttempt() {
        OutboxEvent event = outboxEvent();
        when(kafkaTemplate.send("ticket.booking.created", "10", "{}"))
                .thenReturn(new CompletableFuture<>());

        assertThat(publisher.relay(event)).isFalse();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.RETRYING);
        assertThat(event.getLastError()).contains("50ms");
    }

    @Test
    void relay_retriesExhausted_parksRowAsFailed() {
        OutboxEvent event = outboxEvent();
        event.markRetrying("earlier failure");
        event.markRetrying("earlier failure");
        when(kafkaTemplate.send("ticket.booking.created", "10", "{}"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.relay(event);

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.FAILED);
        assertThat(event.getLastError()).isEqualTo("broker down");
    }

    private static OutboxEvent outboxEvent() {
        return new OutboxEvent("Booking", "1", "BOOKING_CREATED", "ticket.booking.created", "10", "{}");
    }
}
