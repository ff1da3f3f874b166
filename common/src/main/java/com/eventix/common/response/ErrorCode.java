package com.eventix.common.response;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(400, "C001", "Invalid input"),
    RESOURCE_NOT_FOUND(404, "C002", "Resource not found"),
    INTERNAL_ERROR(500, "C003", "Internal server error"),
    UNAUTHORIZED(401, "C004", "Unauthorized"),
    FORBIDDEN(403, "C005", "Forbidden"),
    INVARIANT_VIOLATION(500, "C006", "Ledger invariant violated"),

    // Event catalog
    EVENT_NOT_BOOKABLE(400, "E001", "Event is not open for booking"),
    TICKET_TYPE_NOT_FOUND(404, "E002", "Ticket type not found for event"),

    // Inventory
    INSUFFICIENT_INVENTORY(409, "I001", "Not enough tickets left for ticket type"),
    INSUFFICIENT_SEATS(409, "I002", "Not enough seats left for event"),

    // Rewards
    POINTS_EXCEED_AMOUNT(400, "R001", "Points to use exceed the total amount"),
    INSUFFICIENT_POINTS(400, "R002", "Not enough points available"),
    VOUCHER_EXHAUSTED(409, "R003", "Voucher usage limit reached"),
    VOUCHER_MINIMUM_NOT_MET(400, "R004", "Minimum purchase for voucher not met"),
    COUPON_ALREADY_USED(409, "R005", "Coupon has already been used"),
    COUPON_MINIMUM_NOT_MET(400, "R006", "Minimum purchase for coupon not met"),

    // Booking
    BOOKING_NOT_FOUND(404, "B001", "Booking not found"),
    BOOKING_EXPIRED(400, "B002", "Booking has expired"),
    PAYMENT_PROOF_REQUIRED(400, "B003", "Payment proof file is required"),
    FILE_STORE_FAILED(500, "B004", "Failed to store payment proof");

    private final int status;
    private final String code;
    private final String message;
}
