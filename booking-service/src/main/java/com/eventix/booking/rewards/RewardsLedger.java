package com.eventix.booking.rewards;

import com.eventix.booking.config.BookingProperties;
import com.eventix.booking.discount.DiscountRule;
import com.eventix.booking.discount.DiscountType;
import com.eventix.booking.rewards.RewardsTables.CouponTemplates;
import com.eventix.booking.rewards.RewardsTables.PointLots;
import com.eventix.booking.rewards.RewardsTables.UserCoupons;
import com.eventix.booking.rewards.RewardsTables.Vouchers;
import com.eventix.booking.uow.UnitOfWork;
import com.eventix.common.exception.BusinessException;
import com.eventix.common.exception.LedgerInvariantException;
import com.eventix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jooq.Condition;
import org.jooq.Record;
import org.jooq.Record2;
import org.jooq.Result;
import org.jooq.impl.DSL;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sole writer of point lot amounts, voucher usage counts and coupon used flags.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RewardsLedger {

    private final BookingProperties properties;

    // -- Points --

    public BigDecimal availablePoints(UnitOfWork uow, Long userId) {
        BigDecimal sum = uow.dsl()
                .select(DSL.sum(PointLots.AMOUNT))
                .from(PointLots.TABLE)
                .where(liveLotsOf(userId, uow.now()))
                .fetchOne(0, BigDecimal.class);
        return sum != null ? sum : BigDecimal.ZERO;
    }

    /**
     * Consumes points from live lots, soonest expiry first. All-or-nothing: if the lots do not
     * cover {@code amount}, nothing is written. Lots are locked in scan order.
     */
    public void debitPoints(UnitOfWork uow, Long userId, BigDecimal amount) {
        if (amount.signum() <= 0) {
            return;
        }

        Result<Record2<Long, BigDecimal>> lots = uow.dsl()
                .select(PointLots.ID, PointLots.AMOUNT)
                .from(PointLots.TABLE)
                .where(liveLotsOf(userId, uow.now()))
                .orderBy(PointLots.EXPIRY_DATE.asc(), PointLots.ID.asc())
                .forUpdate()
                .fetch();

        List<LotDeduction> plan = new ArrayList<>();
        BigDecimal remaining = amount;
        for (Record2<Long, BigDecimal> lot : lots) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal take = lot.value2().min(remaining);
            plan.add(new LotDeduction(lot.value1(), take));
            remaining = remaining.subtract(take);
        }

        if (remaining.signum() > 0) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_POINTS,
                    "Requested " + amount + " points, available " + amount.subtract(remaining));
        }

        for (LotDeduction deduction : plan) {
            int updated = uow.dsl().update(PointLots.TABLE)
                    .set(PointLots.AMOUNT, PointLots.AMOUNT.minus(deduction.amount()))
                    .where(PointLots.ID.eq(deduction.lotId()))
                    .and(PointLots.AMOUNT.ge(deduction.amount()))
                    .execute();
            if (updated == 0) {
                throw new LedgerInvariantException("Point lot " + deduction.lotId()
                        + " changed while locked for debit");
            }
        }

        log.debug("Points debited: userId={}, amount={}, lots={}", userId, amount, plan.size());
    }

    /**
     * Returns points to the user's most recently created lot while it is still live;
     * otherwise opens a new lot valid for the configured refund window.
     */
    public void creditPoints(UnitOfWork uow, Long userId, BigDecimal amount, PointSourceType sourceType) {
        if (amount.signum() <= 0) {
            return;
        }

        Record latest = uow.dsl()
                .select(PointLots.ID, PointLots.EXPIRY_DATE, PointLots.IS_EXPIRED)
                .from(PointLots.TABLE)
                .where(PointLots.USER_ID.eq(userId))
                .orderBy(PointLots.CREATED_AT.desc(), PointLots.ID.desc())
                .limit(1)
                .forUpdate()
                .fetchOne();

        boolean latestIsLive = latest != null
                && !Boolean.TRUE.equals(latest.get(PointLots.IS_EXPIRED))
                && !latest.get(PointLots.EXPIRY_DATE).isBefore(uow.now());

        if (latestIsLive) {
            uow.dsl().update(PointLots.TABLE)
                    .set(PointLots.AMOUNT, PointLots.AMOUNT.plus(amount))
                    .where(PointLots.ID.eq(latest.get(PointLots.ID)))
                    .execute();
            log.debug("Points credited to lot: userId={}, lotId={}, amount={}",
                    userId, latest.get(PointLots.ID), amount);
            return;
        }

        LocalDateTime expiry = uow.now().plusMonths(properties.getRefundPointValidityMonths());
        grantPoints(uow, userId, amount, sourceType, null, expiry);
    }

    public void grantPoints(UnitOfWork uow, Long userId, BigDecimal amount, PointSourceType sourceType,
                            Long sourceId, LocalDateTime expiryDate) {
        if (amount.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Point grant must be positive: " + amount);
        }
        uow.dsl().insertInto(PointLots.TABLE)
                .set(PointLots.USER_ID, userId)
                .set(PointLots.AMOUNT, amount)
                .set(PointLots.SOURCE_TYPE, sourceType.name())
                .set(PointLots.SOURCE_ID, sourceId)
                .set(PointLots.EXPIRY_DATE, expiryDate)
                .set(PointLots.IS_EXPIRED, false)
                .set(PointLots.CREATED_AT, uow.now())
                .execute();
        log.debug("Point lot created: userId={}, amount={}, source={}, expiry={}",
                userId, amount, sourceType, expiryDate);
    }

    // -- Vouchers --

    /**
     * Finds a voucher for the event whose validity window contains now. Usage limits are not
     * checked here.
     */
    public Optional<VoucherCandidate> findVoucher(UnitOfWork uow, String code, Long eventId) {
        return uow.dsl()
                .select(Vouchers.ID, Vouchers.CODE, Vouchers.DISCOUNT_TYPE, Vouchers.DISCOUNT_VALUE,
                        Vouchers.MAX_DISCOUNT_AMOUNT, Vouchers.MIN_PURCHASE_AMOUNT,
                        Vouchers.MAX_USAGE, Vouchers.USED_COUNT)
                .from(Vouchers.TABLE)
                .where(Vouchers.CODE.eq(code))
                .and(Vouchers.EVENT_ID.eq(eventId))
                .and(Vouchers.START_DATE.le(uow.now()))
                .and(Vouchers.END_DATE.ge(uow.now()))
                .fetchOptional(r -> new VoucherCandidate(
                        r.get(Vouchers.ID),
                        r.get(Vouchers.CODE),
                        new DiscountRule(
                                DiscountType.valueOf(r.get(Vouchers.DISCOUNT_TYPE)),
                                r.get(Vouchers.DISCOUNT_VALUE),
                                r.get(Vouchers.MAX_DISCOUNT_AMOUNT),
                                r.get(Vouchers.MIN_PURCHASE_AMOUNT)),
                        r.get(Vouchers.MAX_USAGE),
                        r.get(Vouchers.USED_COUNT)));
    }

    public void redeemVoucher(UnitOfWork uow, Long voucherId) {
        int updated = uow.dsl().update(Vouchers.TABLE)
                .set(Vouchers.USED_COUNT, Vouchers.USED_COUNT.plus(1))
                .where(Vouchers.ID.eq(voucherId))
                .and(Vouchers.USED_COUNT.lt(Vouchers.MAX_USAGE))
                .execute();
        if (updated == 0) {
            throw new BusinessException(ErrorCode.VOUCHER_EXHAUSTED,
                    "Voucher usage limit reached: voucherId=" + voucherId);
        }
    }

    /**
     * Saturates at zero. A miss means the count was already zero and is logged, not raised,
     * so rollback of the rest of the booking still goes through.
     */
    public void unredeemVoucher(UnitOfWork uow, Long voucherId) {
        int updated = uow.dsl().update(Vouchers.TABLE)
                .set(Vouchers.USED_COUNT, Vouchers.USED_COUNT.minus(1))
                .where(Vouchers.ID.eq(voucherId))
                .and(Vouchers.USED_COUNT.gt(0))
                .execute();
        if (updated == 0) {
            log.warn("Voucher usage already zero on unredeem: voucherId={}", voucherId);
        }
    }

    // -- Coupons --

    public Optional<CouponCandidate> findCoupon(UnitOfWork uow, String code, Long userId) {
        return uow.dsl()
                .select(UserCoupons.ID, UserCoupons.CODE, CouponTemplates.DISCOUNT_TYPE,
                        CouponTemplates.DISCOUNT_VALUE, CouponTemplates.MAX_DISCOUNT_AMOUNT,
                        CouponTemplates.MIN_PURCHASE_AMOUNT)
                .from(UserCoupons.TABLE)
                .join(CouponTemplates.TABLE).on(CouponTemplates.ID.eq(UserCoupons.TEMPLATE_ID))
                .where(UserCoupons.CODE.eq(code))
                .and(UserCoupons.USER_ID.eq(userId))
                .and(UserCoupons.IS_USED.eq(false))
                .and(UserCoupons.EXPIRY_DATE.ge(uow.now()))
                .fetchOptional(r -> new CouponCandidate(
                        r.get(UserCoupons.ID),
                        r.get(UserCoupons.CODE),
                        new DiscountRule(
                                DiscountType.valueOf(r.get(CouponTemplates.DISCOUNT_TYPE)),
                                r.get(CouponTemplates.DISCOUNT_VALUE),
                                r.get(CouponTemplates.MAX_DISCOUNT_AMOUNT),
                                r.get(CouponTemplates.MIN_PURCHASE_AMOUNT))));
    }

    public void redeemCoupon(UnitOfWork uow, Long couponId) {
        int updated = uow.dsl().update(UserCoupons.TABLE)
                .set(UserCoupons.IS_USED, true)
                .where(UserCoupons.ID.eq(couponId))
                .and(UserCoupons.IS_USED.eq(false))
                .execute();
        if (updated == 0) {
            throw new BusinessException(ErrorCode.COUPON_ALREADY_USED,
                    "Coupon has already been used: couponId=" + couponId);
        }
    }

    public void unredeemCoupon(UnitOfWork uow, Long couponId) {
        int updated = uow.dsl().update(UserCoupons.TABLE)
                .set(UserCoupons.IS_USED, false)
                .where(UserCoupons.ID.eq(couponId))
                .and(UserCoupons.IS_USED.eq(true))
                .execute();
        if (updated == 0) {
            log.warn("Coupon already unused on unredeem: couponId={}", couponId);
        }
    }

    private Condition liveLotsOf(Long userId, LocalDateTime now) {
        return PointLots.USER_ID.eq(userId)
                .and(PointLots.IS_EXPIRED.eq(false))
                .and(PointLots.EXPIRY_DATE.ge(now))
                .and(PointLots.AMOUNT.gt(BigDecimal.ZERO));
    }

    private record LotDeduction(Long lotId, BigDecimal amount) {
    }
}
