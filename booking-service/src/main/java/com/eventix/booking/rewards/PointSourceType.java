package com.eventix.booking.rewards;

public enum PointSourceType {
    REFERRAL,
    REFUND,
    PROMOTION
}
