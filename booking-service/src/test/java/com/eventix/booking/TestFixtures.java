package com.eventix.booking;

import com.eventix.booking.domain.Booking;

import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Shared test utility for creating entities with preset IDs.
 * Uses reflection because JPA @Id and ledger-owned fields have no public setter.
 */
public final class TestFixtures {

    public static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 14, 10, 0);

    private TestFixtures() {}

    public static void setEntityId(Object entity, Long id) {
        setField(entity, "id", id);
    }

    public static void setField(Object entity, String name, Object value) {
        try {
            Field field = entity.getClass().getDeclaredField(name);
            field.setAccessible(true);
            field.set(entity, value);
        } catch (NoSuchFieldException | IllegalAccessException e) {
            throw new RuntimeException("Failed to set " + name + " on " + entity.getClass().getSimpleName(), e);
        }
    }

    public static Booking createBookingWithId(Long id, Long userId, Long eventId) {
        Booking booking = Booking.builder()
                .userId(userId)
                .eventId(eventId)
                .invoiceNumber("INV-" + id)
                .paymentDeadline(NOW.plusHours(2))
                .build();
        setEntityId(booking, id);
        return booking;
    }

    /**
     * Booking for one line of {@code quantity} tickets of type 1000 at 60000 each.
     */
    public static Booking createBookingWithLine(Long id, Long userId, Long eventId, int quantity) {
        Booking booking = createBookingWithId(id, userId, eventId);
        booking.addLineItem(1000L, "Regular", quantity, new BigDecimal("60000"));
        return booking;
    }
}
