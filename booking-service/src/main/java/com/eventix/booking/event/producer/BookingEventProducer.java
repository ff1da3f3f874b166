package com.eventix.booking.event.producer;

import com.eventix.booking.domain.Booking;
import com.eventix.booking.event.outbox.OutboxEventService;
import com.eventix.common.event.BookingEvent;
import com.eventix.common.event.Topics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Records booking lifecycle events in the outbox. Call from inside the unit of work
 * that made the change, after the booking row has an id.
 * Keyed by event id so all bookings of one event land on one partition.
 */
@Component
@RequiredArgsConstructor
public class BookingEventProducer {

    private static final String AGGREGATE_TYPE = "Booking";

    private final OutboxEventService outboxEventService;

    public void publishBookingCreated(Booking booking) {
        save(Topics.BOOKING_CREATED, booking, BookingEvent.created(
                booking.getId(), booking.getUserId(), booking.getEventId(),
                booking.getInvoiceNumber(), booking.getTicketCount(), booking.getFinalAmount()));
    }

    public void publishAwaitingConfirmation(Booking booking) {
        save(Topics.BOOKING_AWAITING_CONFIRMATION, booking, BookingEvent.awaitingConfirmation(
                booking.getId(), booking.getUserId(), booking.getEventId(), booking.getInvoiceNumber()));
    }

    public void publishBookingConfirmed(Booking booking) {
        save(Topics.BOOKING_CONFIRMED, booking, BookingEvent.confirmed(
                booking.getId(), booking.getUserId(), booking.getEventId(),
                booking.getInvoiceNumber(), booking.getTicketCount(), booking.getFinalAmount()));
    }

    public void publishBookingRejected(Booking booking) {
        save(Topics.BOOKING_REJECTED, booking, BookingEvent.rejected(
                booking.getId(), booking.getUserId(), booking.getEventId(),
                booking.getInvoiceNumber(), booking.getTicketCount()));
    }

    public void publishBookingExpired(Booking booking) {
        save(Topics.BOOKING_EXPIRED, booking, BookingEvent.expired(
                booking.getId(), booking.getUserId(), booking.getEventId(),
                booking.getInvoiceNumber(), booking.getTicketCount()));
    }

    public void publishBookingCanceled(Booking booking) {
        save(Topics.BOOKING_CANCELED, booking, BookingEvent.canceled(
                booking.getId(), booking.getUserId(), booking.getEventId(),
                booking.getInvoiceNumber(), booking.getTicketCount()));
    }

    private void save(String topic, Booking booking, BookingEvent event) {
        outboxEventService.save(AGGREGATE_TYPE, String.valueOf(booking.getId()),
                topic, String.valueOf(booking.getEventId()), event);
    }
}
