package com.eventix.booking.discount;

import java.math.BigDecimal;

/**
 * Discount definition shared by vouchers and coupon templates.
 *
 * @param cap         upper bound for percentage discounts, or null for none
 * @param minPurchase total the booking must reach before the rule applies
 */
public record DiscountRule(
        DiscountType type,
        BigDecimal value,
        BigDecimal cap,
        BigDecimal minPurchase
) {

    public DiscountRule {
        if (type == null || value == null || value.signum() < 0) {
            throw new IllegalArgumentException("Discount rule needs a type and a non-negative value");
        }
        if (minPurchase == null) {
            minPurchase = BigDecimal.ZERO;
        }
    }

    public static DiscountRule percentage(BigDecimal percent, BigDecimal cap) {
        return new DiscountRule(DiscountType.PERCENTAGE, percent, cap, BigDecimal.ZERO);
    }

    public static DiscountRule fixed(BigDecimal amount) {
        return new DiscountRule(DiscountType.FIXED, amount, null, BigDecimal.ZERO);
    }

    public boolean isMinimumMetBy(BigDecimal amount) {
        return amount.compareTo(minPurchase) >= 0;
    }
}
