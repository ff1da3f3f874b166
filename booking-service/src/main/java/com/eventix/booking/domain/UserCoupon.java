package com.eventix.booking.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * A coupon issued to one user. The {@code isUsed} latch is owned by RewardsLedger.
 */
@Entity
@Table(name = "user_coupons")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserCoupon implements Persistable<Long> {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false)
    private Long templateId;

    @Column(nullable = false, unique = true, length = 50)
    private String code;

    @Column(nullable = false)
    private LocalDateTime expiryDate;

    @Column(nullable = false, insertable = false, updatable = false)
    private boolean isUsed;

    @Transient
    private boolean isNew = true;

    public UserCoupon(Long id, Long userId, Long templateId, String code, LocalDateTime expiryDate) {
        this.id = id;
        this.userId = userId;
        this.templateId = templateId;
        this.code = code;
        this.expiryDate = expiryDate;
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
}
