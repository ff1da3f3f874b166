package com.eventix.common.event;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Topics {

    // Booking
    public static final String BOOKING_CREATED = "ticket.booking.created";
    public static final String BOOKING_AWAITING_CONFIRMATION = "ticket.booking.awaiting-confirmation";
    public static final String BOOKING_CONFIRMED = "ticket.booking.confirmed";
    public static final String BOOKING_REJECTED = "ticket.booking.rejected";
    public static final String BOOKING_EXPIRED = "ticket.booking.expired";
    public static final String BOOKING_CANCELED = "ticket.booking.canceled";

    // Catalog
    public static final String CATALOG_EVENT_SYNCED = "ticket.catalog.event-synced";

    // Rewards
    public static final String REWARDS_COUPON_ISSUED = "ticket.rewards.coupon-issued";
    public static final String REWARDS_POINTS_GRANTED = "ticket.rewards.points-granted";

    // Notification
    public static final String NOTIFICATION_REQUESTED = "ticket.notification.requested";

    // Dead Letter Topics (DLT) - suffix: .DLT
    public static final String DLT_SUFFIX = ".DLT";

    // Partition counts per topic category
    public static final int PARTITIONS_BOOKING = 8;
    public static final int PARTITIONS_CATALOG = 3;
    public static final int PARTITIONS_REWARDS = 4;
    public static final int PARTITIONS_NOTIFICATION = 4;

    public static String dlt(String topic) {
        return topic + DLT_SUFFIX;
    }
}
