package com.eventix.booking.discount;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * All discount sources are computed against the undiscounted total and then subtracted together;
 * the amount due never goes below zero.
 */
public record PriceBreakdown(
        BigDecimal totalAmount,
        BigDecimal pointsApplied,
        BigDecimal voucherDiscount,
        BigDecimal couponDiscount,
        BigDecimal finalAmount
) {

    public static PriceBreakdown of(BigDecimal totalAmount, BigDecimal pointsApplied,
                                    BigDecimal voucherDiscount, BigDecimal couponDiscount) {
        BigDecimal due = totalAmount
                .subtract(pointsApplied)
                .subtract(voucherDiscount)
                .subtract(couponDiscount)
                .max(BigDecimal.ZERO);
        return new PriceBreakdown(
                money(totalAmount), money(pointsApplied),
                money(voucherDiscount), money(couponDiscount), money(due));
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(DiscountCalculator.MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
