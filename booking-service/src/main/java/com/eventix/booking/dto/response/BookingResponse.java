package com.eventix.booking.dto.response;

import com.eventix.booking.domain.Booking;
import com.eventix.booking.domain.BookingStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record BookingResponse(
        Long bookingId,
        String invoiceNumber,
        Long userId,
        Long eventId,
        BookingStatus status,
        BigDecimal totalAmount,
        BigDecimal pointsApplied,
        BigDecimal voucherDiscount,
        BigDecimal couponDiscount,
        BigDecimal finalAmount,
        LocalDateTime paymentDeadline,
        String paymentProofUrl,
        List<LineItemInfo> lineItems,
        LocalDateTime createdAt
) {
    public record LineItemInfo(Long ticketTypeId, String ticketTypeName, int quantity,
                               BigDecimal unitPrice, BigDecimal subtotal) {
    }

    public static BookingResponse from(Booking booking) {
        List<LineItemInfo> lineItems = booking.getLineItems().stream()
                .map(li -> new LineItemInfo(li.getTicketTypeId(), li.getTicketTypeName(),
                        li.getQuantity(), li.getUnitPrice(), li.getSubtotal()))
                .toList();
        return new BookingResponse(
                booking.getId(),
                booking.getInvoiceNumber(),
                booking.getUserId(),
                booking.getEventId(),
                booking.getStatus(),
                booking.getTotalAmount(),
                booking.getPointsApplied(),
                booking.getVoucherDiscount(),
                booking.getCouponDiscount(),
                booking.getFinalAmount(),
                booking.getPaymentDeadline(),
                booking.getPaymentProofUrl(),
                lineItems,
                booking.getCreatedAt()
        );
    }
}
