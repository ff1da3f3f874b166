package com.eventix.booking.rewards;

import com.eventix.booking.discount.DiscountCalculator;
import com.eventix.booking.uow.UnitOfWork;
import com.eventix.common.exception.BusinessException;
import com.eventix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Turns the buyer's optional voucher and coupon codes into discounts.
 * Lookup misses (unknown code, wrong event, outside validity, already used) are skipped
 * and the booking continues without that discount. A candidate that was found but fails
 * its own rule (usage limit, minimum purchase) is an error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscountResolver {

    private final RewardsLedger rewardsLedger;

    public ResolvedDiscounts resolve(UnitOfWork uow, Long eventId, Long buyerId,
                                     BigDecimal totalAmount, String voucherCode, String couponCode) {
        VoucherCandidate voucher = normalize(voucherCode)
                .flatMap(code -> lookupVoucher(uow, code, eventId))
                .orElse(null);
        BigDecimal voucherDiscount = BigDecimal.ZERO;
        if (voucher != null) {
            if (voucher.isExhausted()) {
                throw new BusinessException(ErrorCode.VOUCHER_EXHAUSTED,
                        "Voucher " + voucher.code() + " has reached its usage limit");
            }
            if (!voucher.rule().isMinimumMetBy(totalAmount)) {
                throw new BusinessException(ErrorCode.VOUCHER_MINIMUM_NOT_MET,
                        "Voucher " + voucher.code() + " requires a minimum purchase of "
                                + voucher.rule().minPurchase());
            }
            voucherDiscount = DiscountCalculator.computeDiscount(totalAmount, voucher.rule());
        }

        CouponCandidate coupon = normalize(couponCode)
                .flatMap(code -> lookupCoupon(uow, code, buyerId))
                .orElse(null);
        BigDecimal couponDiscount = BigDecimal.ZERO;
        if (coupon != null) {
            if (!coupon.rule().isMinimumMetBy(totalAmount)) {
                throw new BusinessException(ErrorCode.COUPON_MINIMUM_NOT_MET,
                        "Coupon " + coupon.code() + " requires a minimum purchase of "
                                + coupon.rule().minPurchase());
            }
            couponDiscount = DiscountCalculator.computeDiscount(totalAmount, coupon.rule());
        }

        return new ResolvedDiscounts(voucher, voucherDiscount, coupon, couponDiscount);
    }

    private Optional<VoucherCandidate> lookupVoucher(UnitOfWork uow, String code, Long eventId) {
        Optional<VoucherCandidate> voucher = rewardsLedger.findVoucher(uow, code, eventId);
        if (voucher.isEmpty()) {
            log.debug("Voucher not applicable, skipped: code={}, eventId={}", code, eventId);
        }
        return voucher;
    }

    private Optional<CouponCandidate> lookupCoupon(UnitOfWork uow, String code, Long buyerId) {
        Optional<CouponCandidate> coupon = rewardsLedger.findCoupon(uow, code, buyerId);
        if (coupon.isEmpty()) {
            log.debug("Coupon not applicable, skipped: code={}, userId={}", code, buyerId);
        }
        return coupon;
    }

    private static Optional<String> normalize(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(code.trim());
    }

    public record ResolvedDiscounts(
            VoucherCandidate voucher,
            BigDecimal voucherDiscount,
            CouponCandidate coupon,
            BigDecimal couponDiscount
    ) {

        public Long voucherId() {
            return voucher != null ? voucher.id() : null;
        }

        public Long couponId() {
            return coupon != null ? coupon.id() : null;
        }
    }
}
