package com.eventix.booking.service;

import java.math.BigDecimal;
import java.util.List;

public record CreateBookingCommand(
        Long buyerId,
        Long eventId,
        List<Line> lines,
        BigDecimal pointsToUse,
        String voucherCode,
        String couponCode
) {

    public CreateBookingCommand {
        lines = lines != null ? List.copyOf(lines) : List.of();
        pointsToUse = pointsToUse != null ? pointsToUse : BigDecimal.ZERO;
    }

    public record Line(Long ticketTypeId, int quantity) {
    }
}
