package com.eventix.booking.domain;

import com.eventix.booking.discount.DiscountType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;

@Entity
@Table(name = "coupon_templates")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CouponTemplate implements Persistable<Long> {

    @Id
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DiscountType discountType;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal discountValue;

    @Column(precision = 15, scale = 2)
    private BigDecimal maxDiscountAmount;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal minPurchaseAmount;

    @Transient
    private boolean isNew = true;

    public CouponTemplate(Long id, String name, DiscountType discountType, BigDecimal discountValue,
                          BigDecimal maxDiscountAmount, BigDecimal minPurchaseAmount) {
        this.id = id;
        updateFrom(name, discountType, discountValue, maxDiscountAmount, minPurchaseAmount);
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PrePersist
    void markNotNew() {
        this.isNew = false;
    }

    public void updateFrom(String name, DiscountType discountType, BigDecimal discountValue,
                           BigDecimal maxDiscountAmount, BigDecimal minPurchaseAmount) {
        this.name = name;
        this.discountType = discountType;
        this.discountValue = discountValue;
        this.maxDiscountAmount = maxDiscountAmount;
        this.minPurchaseAmount = minPurchaseAmount != null ? minPurchaseAmount : BigDecimal.ZERO;
    }
}
