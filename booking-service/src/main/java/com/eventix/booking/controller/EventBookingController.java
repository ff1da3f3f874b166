package com.eventix.booking.controller;

import com.eventix.booking.domain.BookingStatus;
import com.eventix.booking.dto.response.BookingResponse;
import com.eventix.booking.service.BookingQueryService;
import com.eventix.common.response.ApiResponse;
import com.eventix.common.response.PageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Event bookings", description = "Organizer view of an event's bookings")
@RestController
@RequestMapping("/api/v1/events/{eventId}/bookings")
@RequiredArgsConstructor
public class EventBookingController {

    private final BookingQueryService bookingQueryService;

    @Operation(summary = "List event bookings",
            description = "Newest first, 1-based pages. Empty for anyone but the event organizer")
    @GetMapping
    public ResponseEntity<ApiResponse<PageResponse<BookingResponse>>> getEventBookings(
            @PathVariable Long eventId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) BookingStatus status,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(ApiResponse.ok(
                bookingQueryService.listBookingsForEvent(eventId, userId, status, page, size)));
    }
}
