package com.eventix.booking.rewards;

import com.eventix.booking.discount.DiscountRule;

/**
 * An unused, unexpired coupon owned by the buyer, with its template's rule.
 */
public record CouponCandidate(
        Long id,
        String code,
        DiscountRule rule
) {
}
