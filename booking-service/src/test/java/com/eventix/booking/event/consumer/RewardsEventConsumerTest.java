package com.eventix.booking.event.consumer;

import com.eventix.booking.discount.DiscountType;
import com.eventix.booking.domain.CouponTemplate;
import com.eventix.booking.domain.UserCoupon;
import com.eventix.booking.event.IdempotencyService;
import com.eventix.booking.repository.CouponTemplateRepository;
import com.eventix.booking.repository.UserCouponRepository;
import com.eventix.booking.rewards.PointSourceType;
import com.eventix.booking.rewards.RewardsLedger;
import com.eventix.booking.uow.UnitOfWork;
import com.eventix.booking.uow.UnitOfWorkTemplate;
import com.eventix.common.event.CouponIssuedEvent;
import com.eventix.common.event.PointsGrantedEvent;
import com.eventix.common.event.Topics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.Consumer;

import static com.eventix.booking.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RewardsEventConsumerTest {

    @InjectMocks
    private RewardsEventConsumer consumer;

    @Mock
    private UnitOfWorkTemplate unitOfWork;
    @Mock
    private CouponTemplateRepository couponTemplateRepository;
    @Mock
    private UserCouponRepository userCouponRepository;
    @Mock
    private RewardsLedger rewardsLedger;
    @Mock
    private IdempotencyService idempotencyService;

    private final UnitOfWork uow = UnitOfWork.open(null, NOW);

    @BeforeEach
    void setUp() {
        willAnswer(inv -> {
            Consumer<UnitOfWork> work = inv.getArgument(0);
            work.accept(uow);
            return null;
        }).given(unitOfWork).run(any());
    }

    @Test
    void handleCouponIssued_newTemplate_savesTemplateAndCoupon() {
        CouponIssuedEvent event = couponIssued();
        given(couponTemplateRepository.findById(3L)).willReturn(Optional.empty());
        given(userCouponRepository.existsById(50L)).willReturn(false);

        consumer.handleCouponIssued(event);

        ArgumentCaptor<CouponTemplate> templateCaptor = ArgumentCaptor.forClass(CouponTemplate.class);
        verify(couponTemplateRepository).save(templateCaptor.capture());
        assertThat(templateCaptor.getValue().getDiscountType()).isEqualTo(DiscountType.PERCENTAGE);
        assertThat(templateCaptor.getValue().getMaxDiscountAmount()).isEqualByComparingTo("20000");

        ArgumentCaptor<UserCoupon> couponCaptor = ArgumentCaptor.forClass(UserCoupon.class);
        verify(userCouponRepository).save(couponCaptor.capture());
        assertThat(couponCaptor.getValue().getCode()).isEqualTo("REF-ABC123");
        assertThat(couponCaptor.getValue().getUserId()).isEqualTo(100L);
        assertThat(couponCaptor.getValue().isUsed()).isFalse();
        verify(idempotencyService).markProcessed(event, Topics.REWARDS_COUPON_ISSUED);
    }

    @Test
    void handleCouponIssued_existingCoupon_updatesTemplateOnly() {
        CouponIssuedEvent event = couponIssued();
        CouponTemplate template = new CouponTemplate(3L, "Old name", DiscountType.FIXED,
                new BigDecimal("5000"), null, BigDecimal.ZERO);
        given(couponTemplateRepository.findById(3L)).willReturn(Optional.of(template));
        given(userCouponRepository.existsById(50L)).willReturn(true);

        consumer.handleCouponIssued(event);

        verify(couponTemplateRepository).save(template);
        assertThat(template.getName()).isEqualTo("Referral 10%");
        assertThat(template.getDiscountType()).isEqualTo(DiscountType.PERCENTAGE);
        verify(userCouponRepository, never()).save(any());
    }

    @Test
    void handleCouponIssued_duplicate_skipped() {
        CouponIssuedEvent event = couponIssued();
        given(idempotencyService.isDuplicate(event)).willReturn(true);

        consumer.handleCouponIssued(event);

        verifyNoInteractions(couponTemplateRepository, userCouponRepository);
    }

    @Test
    void handlePointsGranted_grantsLotThroughLedger() {
        PointsGrantedEvent event = new PointsGrantedEvent(100L, new BigDecimal("10000"), "referral",
                77L, NOW.plusMonths(3));

        consumer.handlePointsGranted(event);

        verify(rewardsLedger).grantPoints(uow, 100L, new BigDecimal("10000"), PointSourceType.REFERRAL,
                77L, NOW.plusMonths(3));
        verify(idempotencyService).markProcessed(event, Topics.REWARDS_POINTS_GRANTED);
    }

    @Test
    void handlePointsGranted_duplicate_skipped() {
        PointsGrantedEvent event = new PointsGrantedEvent(100L, new BigDecimal("10000"), "REFERRAL",
                77L, NOW.plusMonths(3));
        given(idempotencyService.isDuplicate(event)).willReturn(true);

        consumer.handlePointsGranted(event);

        verifyNoInteractions(rewardsLedger);
    }

    private static CouponIssuedEvent couponIssued() {
        return new CouponIssuedEvent(50L, 100L, "REF-ABC123", NOW.plusMonths(3),
                3L, "Referral 10%", "percentage", BigDecimal.TEN, new BigDecimal("20000"), BigDecimal.ZERO);
    }
}
