package com.eventix.booking.domain;

public enum BookingStatus {
    AWAITING_PAYMENT,
    AWAITING_CONFIRMATION,
    CONFIRMED,
    REJECTED,
    EXPIRED,
    CANCELED;

    /**
     * Statuses whose line items still hold inventory.
     */
    public boolean holdsInventory() {
        return this == AWAITING_PAYMENT || this == AWAITING_CONFIRMATION || this == CONFIRMED;
    }
}
