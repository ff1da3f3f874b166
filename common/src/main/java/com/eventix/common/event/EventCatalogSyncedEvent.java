package com.eventix.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Published by the catalog whenever an event, its ticket types or its vouchers change.
 * Carries the full bookable state so booking-service can upsert its local replica.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EventCatalogSyncedEvent extends DomainEvent {

    public static final String TYPE = "EVENT_CATALOG_SYNCED";

    private Long catalogEventId;
    private Long organizerId;
    private String title;
    private LocalDateTime startDate;
    private boolean published;
    private Integer availableSeats;
    private List<TicketTypeInfo> ticketTypes;
    private List<VoucherInfo> vouchers;

    public EventCatalogSyncedEvent(Long catalogEventId, Long organizerId, String title,
                                   LocalDateTime startDate, boolean published, Integer availableSeats,
                                   List<TicketTypeInfo> ticketTypes, List<VoucherInfo> vouchers) {
        super(TYPE);
        this.catalogEventId = catalogEventId;
        this.organizerId = organizerId;
        this.title = title;
        this.startDate = startDate;
        this.published = published;
        this.availableSeats = availableSeats;
        this.ticketTypes = ticketTypes;
        this.vouchers = vouchers;
    }

    @Getter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    public static class TicketTypeInfo {
        private Long ticketTypeId;
        private String name;
        private BigDecimal price;
        private Integer capacity;

        public TicketTypeInfo(Long ticketTypeId, String name, BigDecimal price, Integer capacity) {
            this.ticketTypeId = ticketTypeId;
            this.name = name;
            this.price = price;
            this.capacity = capacity;
        }
    }

    @Getter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    public static class VoucherInfo {
        private Long voucherId;
        private String code;
        private String discountType;
        private BigDecimal discountValue;
        private BigDecimal maxDiscountAmount;
        private BigDecimal minPurchaseAmount;
        private Integer maxUsage;
        private LocalDateTime startDate;
        private LocalDateTime endDate;

        public VoucherInfo(Long voucherId, String code, String discountType,
                           BigDecimal discountValue, BigDecimal maxDiscountAmount,
                           BigDecimal minPurchaseAmount, Integer maxUsage,
                           LocalDateTime startDate, LocalDateTime endDate) {
            this.voucherId = voucherId;
            this.code = code;
            this.discountType = discountType;
            this.discountValue = discountValue;
            this.maxDiscountAmount = maxDiscountAmount;
            this.minPurchaseAmount = minPurchaseAmount;
            this.maxUsage = maxUsage;
            this.startDate = startDate;
            this.endDate = endDate;
        }
    }
}
