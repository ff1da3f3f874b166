package com.eventix.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A referral coupon was issued to a user. Includes the template's discount rule.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CouponIssuedEvent extends DomainEvent {

    public static final String TYPE = "COUPON_ISSUED";

    private Long userCouponId;
    private Long userId;
    private String code;
    private LocalDateTime expiryDate;
    private Long templateId;
    private String templateName;
    private String discountType;
    private BigDecimal discountValue;
    private BigDecimal maxDiscountAmount;
    private BigDecimal minPurchaseAmount;

    public CouponIssuedEvent(Long userCouponId, Long userId, String code, LocalDateTime expiryDate,
                             Long templateId, String templateName, String discountType,
                             BigDecimal discountValue, BigDecimal maxDiscountAmount,
                             BigDecimal minPurchaseAmount) {
        super(TYPE);
        this.userCouponId = userCouponId;
        this.userId = userId;
        this.code = code;
        this.expiryDate = expiryDate;
        this.templateId = templateId;
        this.templateName = templateName;
        this.discountType = discountType;
        this.discountValue = discountValue;
        this.maxDiscountAmount = maxDiscountAmount;
        this.minPurchaseAmount = minPurchaseAmount;
    }
}
