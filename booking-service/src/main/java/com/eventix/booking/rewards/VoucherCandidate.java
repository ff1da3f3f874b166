package com.eventix.booking.rewards;

import com.eventix.booking.discount.DiscountRule;

/**
 * A voucher that matched the code, the event and today's date.
 */
public record VoucherCandidate(
        Long id,
        String code,
        DiscountRule rule,
        int maxUsage,
        int usedCount
) {

    public boolean isExhausted() {
        return usedCount >= maxUsage;
    }
}
