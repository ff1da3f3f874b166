package com.eventix.booking.discount;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pure discount arithmetic. Minimum-purchase checks belong to the caller.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DiscountCalculator {

    public static final int MONEY_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Returns the discount {@code rule} grants on {@code baseAmount}, always within [0, baseAmount].
     */
    public static BigDecimal computeDiscount(BigDecimal baseAmount, DiscountRule rule) {
        if (baseAmount.signum() <= 0) {
            return BigDecimal.ZERO.setScale(MONEY_SCALE);
        }

        BigDecimal discount;
        if (rule.type() == DiscountType.PERCENTAGE) {
            discount = baseAmount.multiply(rule.value())
                    .divide(HUNDRED, MONEY_SCALE, RoundingMode.HALF_UP);
            if (rule.cap() != null && discount.compareTo(rule.cap()) > 0) {
                discount = rule.cap();
            }
        } else {
            discount = rule.value();
        }

        return discount.min(baseAmount).max(BigDecimal.ZERO).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
