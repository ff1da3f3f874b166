package com.eventix.booking.notification;

import java.util.Map;

/**
 * Outbound user notification. Implementations must not throw: booking state never
 * depends on whether a notification went out.
 */
public interface Notifier {

    String BOOKING_CREATED = "BOOKING_CREATED";
    String BOOKING_CONFIRMED = "BOOKING_CONFIRMED";
    String BOOKING_REJECTED = "BOOKING_REJECTED";

    void notify(Long userId, String kind, Map<String, Object> payload);
}
