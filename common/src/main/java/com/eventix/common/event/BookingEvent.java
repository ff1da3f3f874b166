package com.eventix.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Booking lifecycle change, published through the booking-service outbox
 * for reporting and attendee-facing consumers.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEvent extends DomainEvent {

    public static final String TYPE_CREATED = "BOOKING_CREATED";
    public static final String TYPE_AWAITING_CONFIRMATION = "BOOKING_AWAITING_CONFIRMATION";
    public static final String TYPE_CONFIRMED = "BOOKING_CONFIRMED";
    public static final String TYPE_REJECTED = "BOOKING_REJECTED";
    public static final String TYPE_EXPIRED = "BOOKING_EXPIRED";
    public static final String TYPE_CANCELED = "BOOKING_CANCELED";

    private Long bookingId;
    private Long userId;
    private Long catalogEventId;
    private String invoiceNumber;
    private Integer ticketCount;
    private BigDecimal finalAmount;

    private BookingEvent(String eventType, Long bookingId, Long userId, Long catalogEventId,
                         String invoiceNumber, Integer ticketCount, BigDecimal finalAmount) {
        super(eventType);
        this.bookingId = bookingId;
        this.userId = userId;
        this.catalogEventId = catalogEventId;
        this.invoiceNumber = invoiceNumber;
        this.ticketCount = ticketCount;
        this.finalAmount = finalAmount;
    }

    public static BookingEvent created(Long bookingId, Long userId, Long catalogEventId,
                                       String invoiceNumber, int ticketCount, BigDecimal finalAmount) {
        return new BookingEvent(TYPE_CREATED, bookingId, userId, catalogEventId,
                invoiceNumber, ticketCount, finalAmount);
    }

    public static BookingEvent awaitingConfirmation(Long bookingId, Long userId, Long catalogEventId,
                                                    String invoiceNumber) {
        return new BookingEvent(TYPE_AWAITING_CONFIRMATION, bookingId, userId, catalogEventId,
                invoiceNumber, null, null);
    }

    public static BookingEvent confirmed(Long bookingId, Long userId, Long catalogEventId,
                                         String invoiceNumber, int ticketCount, BigDecimal finalAmount) {
        return new BookingEvent(TYPE_CONFIRMED, bookingId, userId, catalogEventId,
                invoiceNumber, ticketCount, finalAmount);
    }

    public static BookingEvent rejected(Long bookingId, Long userId, Long catalogEventId,
                                        String invoiceNumber, int ticketCount) {
        return new BookingEvent(TYPE_REJECTED, bookingId, userId, catalogEventId,
                invoiceNumber, ticketCount, null);
    }

    public static BookingEvent expired(Long bookingId, Long userId, Long catalogEventId,
                                       String invoiceNumber, int ticketCount) {
        return new BookingEvent(TYPE_EXPIRED, bookingId, userId, catalogEventId,
                invoiceNumber, ticketCount, null);
    }

    public static BookingEvent canceled(Long bookingId, Long userId, Long catalogEventId,
                                        String invoiceNumber, int ticketCount) {
        return new BookingEvent(TYPE_CANCELED, bookingId, userId, catalogEventId,
                invoiceNumber, ticketCount, null);
    }
}
