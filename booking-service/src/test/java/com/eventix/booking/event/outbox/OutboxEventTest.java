package com.eventix.booking.event.outbox;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OutboxEventTest {

    @Test
    void newEvent_isPending() {
        OutboxEvent event = new OutboxEvent("Booking", "1", "BOOKING_EXPIRED",
                "ticket.booking.expired", "10", "{}");

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PENDING);
        assertThat(event.getRetryCount()).isZero();
        assertThat(event.getCreatedAt()).isNotNull();
    }

    @Test
    void markRetrying_longError_truncated() {
        OutboxEvent event = new OutboxEvent("Booking", "1", "BOOKING_EXPIRED",
                "ticket.booking.expired", "10", "{}");

        event.markRetrying("x".repeat(800));

        assertThat(event.getLastError()).hasSize(500);
        assertThat(event.getRetryCount()).isEqualTo(1);
    }

    @Test
    void markPublished_clearsLastError() {
        OutboxEvent event = new OutboxEvent("Booking", "1", "BOOKING_EXPIRED",
                "ticket.booking.expired", "10", "{}");
        event.markRetrying("timeout");

        event.markPublished();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PUBLISHED);
        assertThat(event.getLastError()).isNull();
    }
}
