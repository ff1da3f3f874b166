package com.eventix.booking.event.consumer;

import com.eventix.booking.discount.DiscountType;
import com.eventix.booking.domain.CouponTemplate;
import com.eventix.booking.domain.UserCoupon;
import com.eventix.booking.event.IdempotencyService;
import com.eventix.booking.repository.CouponTemplateRepository;
import com.eventix.booking.repository.UserCouponRepository;
import com.eventix.booking.rewards.PointSourceType;
import com.eventix.booking.rewards.RewardsLedger;
import com.eventix.booking.uow.UnitOfWorkTemplate;
import com.eventix.common.event.CouponIssuedEvent;
import com.eventix.common.event.PointsGrantedEvent;
import com.eventix.common.event.Topics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Consumes rewards events: issued referral coupons and granted point lots.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RewardsEventConsumer {

    private final UnitOfWorkTemplate unitOfWork;
    private final CouponTemplateRepository couponTemplateRepository;
    private final UserCouponRepository userCouponRepository;
    private final RewardsLedger rewardsLedger;
    private final IdempotencyService idempotencyService;

    @KafkaListener(topics = Topics.REWARDS_COUPON_ISSUED, groupId = "booking-service")
    public void handleCouponIssued(CouponIssuedEvent event) {
        unitOfWork.run(uow -> {
            if (idempotencyService.isDuplicate(event)) {
                log.debug("Duplicate coupon-issued event skipped: eventId={}", event.getEventId());
                return;
            }

            DiscountType discountType = DiscountType.valueOf(event.getDiscountType().toUpperCase());
            CouponTemplate template = couponTemplateRepository.findById(event.getTemplateId())
                    .map(existing -> {
                        existing.updateFrom(event.getTemplateName(), discountType, event.getDiscountValue(),
                                event.getMaxDiscountAmount(), event.getMinPurchaseAmount());
                        return existing;
                    })
                    .orElseGet(() -> new CouponTemplate(event.getTemplateId(), event.getTemplateName(),
                            discountType, event.getDiscountValue(), event.getMaxDiscountAmount(),
                            event.getMinPurchaseAmount()));
            couponTemplateRepository.save(template);

            if (userCouponRepository.existsById(event.getUserCouponId())) {
                log.warn("User coupon already present, not re-issued: userCouponId={}", event.getUserCouponId());
            } else {
                userCouponRepository.save(new UserCoupon(event.getUserCouponId(), event.getUserId(),
                        event.getTemplateId(), event.getCode(), event.getExpiryDate()));
                log.info("Coupon issued: userCouponId={}, userId={}, templateId={}",
                        event.getUserCouponId(), event.getUserId(), event.getTemplateId());
            }

            idempotencyService.markProcessed(event, Topics.REWARDS_COUPON_ISSUED);
        });
    }

    @KafkaListener(topics = Topics.REWARDS_POINTS_GRANTED, groupId = "booking-service")
    public void handlePointsGranted(PointsGrantedEvent event) {
        unitOfWork.run(uow -> {
            if (idempotencyService.isDuplicate(event)) {
                log.debug("Duplicate points-granted event skipped: eventId={}", event.getEventId());
                return;
            }

            rewardsLedger.grantPoints(uow, event.getUserId(), event.getAmount(),
                    PointSourceType.valueOf(event.getSourceType().toUpperCase()),
                    event.getSourceId(), event.getExpiryDate());
            log.info("Points granted: userId={}, amount={}, source={}",
                    event.getUserId(), event.getAmount(), event.getSourceType());

            idempotencyService.markProcessed(event, Topics.REWARDS_POINTS_GRANTED);
        });
    }
}
