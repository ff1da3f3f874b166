package com.eventix.booking.discount;

public enum DiscountType {
    PERCENTAGE,
    FIXED
}
