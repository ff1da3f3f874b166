package com.eventix.booking.controller;

import com.eventix.booking.domain.BookingStatus;
import com.eventix.booking.dto.request.ConfirmBookingRequest;
import com.eventix.booking.dto.request.CreateBookingRequest;
import com.eventix.booking.dto.response.BookingResponse;
import com.eventix.booking.service.BookingQueryService;
import com.eventix.booking.service.BookingService;
import com.eventix.booking.service.PaymentProof;
import com.eventix.common.exception.BusinessException;
import com.eventix.common.response.ApiResponse;
import com.eventix.common.response.ErrorCode;
import com.eventix.common.response.PageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@Slf4j
@Tag(name = "Booking", description = "Ticket booking lifecycle")
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;
    private final BookingQueryService bookingQueryService;

    @Operation(summary = "Create booking", description = "Reserve tickets, apply points and discounts, start the payment window")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Booking created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error or event not bookable"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Ticket type not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Sold out, voucher exhausted or coupon used")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<BookingResponse>> createBooking(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody CreateBookingRequest request) {
        var booking = bookingService.createBooking(request.toCommand(userId));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(booking));
    }

    @Operation(summary = "Submit payment proof", description = "Upload a transfer receipt image before the payment deadline")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Awaiting organizer confirmation"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Payment deadline passed or proof missing"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found or not awaiting payment")
    })
    @PostMapping(value = "/{bookingId}/payment-proof", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<BookingResponse>> submitPaymentProof(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestPart("file") MultipartFile file) {
        var booking = bookingService.submitPaymentProof(bookingId, userId, toPaymentProof(file));
        return ResponseEntity.ok(ApiResponse.ok(booking));
    }

    @Operation(summary = "Review booking", description = "Organizer accepts or rejects a submitted payment")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking confirmed or rejected"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found or not awaiting confirmation")
    })
    @PostMapping("/{bookingId}/confirmation")
    public ResponseEntity<ApiResponse<BookingResponse>> confirmBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody ConfirmBookingRequest request) {
        var booking = bookingService.confirmBooking(bookingId, userId, request.accept());
        return ResponseEntity.ok(ApiResponse.ok(booking));
    }

    @Operation(summary = "Cancel booking", description = "Buyer cancels a booking that is still awaiting payment")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking canceled"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found or not awaiting payment")
    })
    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<ApiResponse<BookingResponse>> cancelBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        var booking = bookingService.cancelBooking(bookingId, userId);
        return ResponseEntity.ok(ApiResponse.ok(booking));
    }

    @Operation(summary = "Get booking", description = "Visible to the buyer and the event organizer")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found")
    })
    @GetMapping("/{bookingId}")
    public ResponseEntity<ApiResponse<BookingResponse>> getBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(ApiResponse.ok(bookingQueryService.getBooking(bookingId, userId)));
    }

    @Operation(summary = "List my bookings", description = "Newest first, 1-based pages")
    @GetMapping
    public ResponseEntity<ApiResponse<PageResponse<BookingResponse>>> getUserBookings(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) BookingStatus status,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(ApiResponse.ok(
                bookingQueryService.listBookingsForUser(userId, status, page, size)));
    }

    private static PaymentProof toPaymentProof(MultipartFile file) {
        if (file.isEmpty()) {
            throw new BusinessException(ErrorCode.PAYMENT_PROOF_REQUIRED);
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Payment proof must be an image, got " + contentType);
        }
        try {
            return new PaymentProof(file.getBytes(), file.getOriginalFilename());
        } catch (IOException e) {
            log.error("Failed to read uploaded payment proof: name={}", file.getOriginalFilename(), e);
            throw new BusinessException(ErrorCode.FILE_STORE_FAILED);
        }
    }
}
