package com.eventix.common.event;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DomainEventTest {

    @Test
    void bookingEvent_created_hasCorrectFields() {
        BookingEvent event = BookingEvent.created(1L, 100L, 200L, "INV-1-ABC123", 3,
                BigDecimal.valueOf(58000));

        assertThat(event.getEventType()).isEqualTo("BOOKING_CREATED");
        assertThat(event.getBookingId()).isEqualTo(1L);
        assertThat(event.getUserId()).isEqualTo(100L);
        assertThat(event.getCatalogEventId()).isEqualTo(200L);
        assertThat(event.getTicketCount()).isEqualTo(3);
        assertThat(event.getFinalAmount()).isEqualByComparingTo("58000");
        assertThat(event.getEventId()).isNotBlank();
        assertThat(event.getOccurredAt()).isNotNull();
    }

    @Test
    void bookingEvent_expired_hasNoAmount() {
        BookingEvent event = BookingEvent.expired(1L, 100L, 200L, "INV-1-ABC123", 2);

        assertThat(event.getEventType()).isEqualTo("BOOKING_EXPIRED");
        assertThat(event.getTicketCount()).isEqualTo(2);
        assertThat(event.getFinalAmount()).isNull();
    }

    @Test
    void eachEvent_getsDistinctEventId() {
        BookingEvent first = BookingEvent.canceled(1L, 100L, 200L, "INV-1", 1);
        BookingEvent second = BookingEvent.canceled(1L, 100L, 200L, "INV-1", 1);

        assertThat(first.getEventId()).isNotEqualTo(second.getEventId());
    }

    @Test
    void catalogSyncedEvent_carriesTicketTypesAndVouchers() {
        var ticketType = new EventCatalogSyncedEvent.TicketTypeInfo(
                10L, "VIP", BigDecimal.valueOf(60000), 50);
        var voucher = new EventCatalogSyncedEvent.VoucherInfo(
                5L, "EARLY", "FIXED", BigDecimal.valueOf(50000), null, BigDecimal.ZERO, 100,
                LocalDateTime.of(2026, 1, 1, 0, 0), LocalDateTime.of(2026, 12, 31, 0, 0));

        var event = new EventCatalogSyncedEvent(200L, 7L, "Concert",
                LocalDateTime.of(2026, 12, 31, 20, 0), true, 500,
                List.of(ticketType), List.of(voucher));

        assertThat(event.getEventType()).isEqualTo("EVENT_CATALOG_SYNCED");
        assertThat(event.getTicketTypes()).singleElement()
                .extracting(EventCatalogSyncedEvent.TicketTypeInfo::getCapacity).isEqualTo(50);
        assertThat(event.getVouchers()).singleElement()
                .extracting(EventCatalogSyncedEvent.VoucherInfo::getCode).isEqualTo("EARLY");
    }

    @Test
    void notificationEvent_hasPayload() {
        NotificationEvent event = new NotificationEvent(100L, "BOOKING_CREATED",
                Map.of("invoiceNumber", "INV-1"));

        assertThat(event.getEventType()).isEqualTo("NOTIFICATION_REQUESTED");
        assertThat(event.getPayload()).containsEntry("invoiceNumber", "INV-1");
    }

    @Test
    void topics_dlt_appendsSuffix() {
        assertThat(Topics.dlt(Topics.BOOKING_CREATED)).isEqualTo("ticket.booking.created.DLT");
    }
}
