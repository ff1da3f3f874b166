package com.eventix.booking.domain;

import com.eventix.booking.discount.DiscountType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Organizer-issued, event-scoped discount code. {@code usedCount} is owned by RewardsLedger.
 */
@Entity
@Table(name = "event_vouchers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Voucher implements Persistable<Long> {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long eventId;

    @Column(nullable = false, unique = true, length = 50)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DiscountType discountType;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal discountValue;

    @Column(precision = 15, scale = 2)
    private BigDecimal maxDiscountAmount;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal minPurchaseAmount;

    @Column(nullable = false)
    private int maxUsage;

    @Column(nullable = false, insertable = false, updatable = false)
    private int usedCount;

    @Column(nullable = false)
    private LocalDateTime startDate;

    @Column(nullable = false)
    private LocalDateTime endDate;

    @Transient
    private boolean isNew = true;

    public Voucher(Long id, Long eventId, String code, DiscountType discountType,
                   BigDecimal discountValue, BigDecimal maxDiscountAmount, BigDecimal minPurchaseAmount,
                   int maxUsage, LocalDateTime startDate, LocalDateTime endDate) {
        this.id = id;
        this.eventId = eventId;
        this.code = code;
        updateFrom(discountType, discountValue, maxDiscountAmount, minPurchaseAmount,
                maxUsage, startDate, endDate);
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

    public void updateFrom(DiscountType discountType, BigDecimal discountValue,
                           BigDecimal maxDiscountAmount, BigDecimal minPurchaseAmount,
                           int maxUsage, LocalDateTime startDate, LocalDateTime endDate) {
        this.discountType = discountType;
        this.discountValue = discountValue;
        this.maxDiscountAmount = maxDiscountAmount;
        this.minPurchaseAmount = minPurchaseAmount != null ? minPurchaseAmount : BigDecimal.ZERO;
        this.maxUsage = maxUsage;
        this.startDate = startDate;
        this.endDate = endDate;
    }
}
