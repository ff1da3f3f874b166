package com.eventix.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PointsGrantedEvent extends DomainEvent {

    public static final String TYPE = "POINTS_GRANTED";

    private Long userId;
    private BigDecimal amount;
    private String sourceType;
    private Long sourceId;
    private LocalDateTime expiryDate;

    public PointsGrantedEvent(Long userId, BigDecimal amount, String sourceType,
                              Long sourceId, LocalDateTime expiryDate) {
        super(TYPE);
        this.userId = userId;
        this.amount = amount;
        this.sourceType = sourceType;
        this.sourceId = sourceId;
        this.expiryDate = expiryDate;
    }
}
