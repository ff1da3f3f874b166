package com.eventix.booking.domain;

import com.eventix.booking.discount.PriceBreakdown;
import com.eventix.common.domain.BaseTimeEntity;
import com.eventix.common.exception.BusinessException;
import com.eventix.common.response.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.BatchSize;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One buyer's purchase of tickets for one event. Prices and discounts are fixed at creation;
 * afterwards only the status (and payment proof) changes.
 */
@Entity
@Table(name = "bookings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false)
    private Long eventId;

    @Column(nullable = false, unique = true, length = 40)
    private String invoiceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private BookingStatus status;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal totalAmount;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal pointsApplied;

    private Long voucherId;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal voucherDiscount;

    private Long couponId;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal couponDiscount;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal finalAmount;

    @Column(nullable = false)
    private LocalDateTime paymentDeadline;

    @Column(length = 500)
    private String paymentProofUrl;

    private LocalDateTime paymentProofSubmittedAt;

    private LocalDateTime closedAt;

    @Version
    private Long version;

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("ticketTypeId ASC")
    @BatchSize(size = 50)
    private List<BookingLineItem> lineItems = new ArrayList<>();

    @Builder
    private Booking(Long userId, Long eventId, String invoiceNumber, LocalDateTime paymentDeadline) {
        this.userId = userId;
        this.eventId = eventId;
        this.invoiceNumber = invoiceNumber;
        this.paymentDeadline = paymentDeadline;
        this.status = BookingStatus.AWAITING_PAYMENT;
        this.totalAmount = BigDecimal.ZERO;
        this.pointsApplied = BigDecimal.ZERO;
        this.voucherDiscount = BigDecimal.ZERO;
        this.couponDiscount = BigDecimal.ZERO;
        this.finalAmount = BigDecimal.ZERO;
    }

    public void addLineItem(Long ticketTypeId, String ticketTypeName, int quantity, BigDecimal unitPrice) {
        BookingLineItem item = new BookingLineItem(this, ticketTypeId, ticketTypeName, quantity, unitPrice);
        this.lineItems.add(item);
        this.totalAmount = this.totalAmount.add(item.getSubtotal());
        this.finalAmount = this.totalAmount;
    }

    public void applyPricing(PriceBreakdown breakdown, Long voucherId, Long couponId) {
        if (breakdown.totalAmount().compareTo(this.totalAmount) != 0) {
            throw new IllegalStateException("Price breakdown total " + breakdown.totalAmount()
                    + " does not match line items total " + this.totalAmount);
        }
        this.pointsApplied = breakdown.pointsApplied();
        this.voucherId = voucherId;
        this.voucherDiscount = breakdown.voucherDiscount();
        this.couponId = couponId;
        this.couponDiscount = breakdown.couponDiscount();
        this.finalAmount = breakdown.finalAmount();
    }

    public void submitPaymentProof(String proofUrl, LocalDateTime now) {
        requireStatus(BookingStatus.AWAITING_PAYMENT, "submit payment proof for");
        this.paymentProofUrl = proofUrl;
        this.paymentProofSubmittedAt = now;
        this.status = BookingStatus.AWAITING_CONFIRMATION;
    }

    public void confirm(LocalDateTime now) {
        requireStatus(BookingStatus.AWAITING_CONFIRMATION, "confirm");
        close(BookingStatus.CONFIRMED, now);
    }

    public void reject(LocalDateTime now) {
        requireStatus(BookingStatus.AWAITING_CONFIRMATION, "reject");
        close(BookingStatus.REJECTED, now);
    }

    public void expire(LocalDateTime now) {
        requireStatus(BookingStatus.AWAITING_PAYMENT, "expire");
        close(BookingStatus.EXPIRED, now);
    }

    public void cancel(LocalDateTime now) {
        requireStatus(BookingStatus.AWAITING_PAYMENT, "cancel");
        close(BookingStatus.CANCELED, now);
    }

    public boolean isOverdue(LocalDateTime now) {
        return this.status == BookingStatus.AWAITING_PAYMENT
                && now.isAfter(this.paymentDeadline);
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId.equals(userId);
    }

    public int getTicketCount() {
        return lineItems.stream().mapToInt(BookingLineItem::getQuantity).sum();
    }

    private void requireStatus(BookingStatus expected, String action) {
        if (this.status != expected) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                    "Cannot " + action + " booking " + id + ": current status=" + this.status);
        }
    }

    private void close(BookingStatus terminal, LocalDateTime now) {
        this.status = terminal;
        this.closedAt = now;
    }
}
