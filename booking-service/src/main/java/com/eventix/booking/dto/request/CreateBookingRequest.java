package com.eventix.booking.dto.request;

import com.eventix.booking.service.CreateBookingCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.List;

public record CreateBookingRequest(
        @NotNull Long eventId,
        @NotEmpty @Size(max = 20) List<@Valid @NotNull LineItemRequest> lineItems,
        @PositiveOrZero @Digits(integer = 13, fraction = 2) BigDecimal pointsToUse,
        @Size(max = 50) String voucherCode,
        @Size(max = 50) String couponCode
) {
    public CreateBookingCommand toCommand(Long buyerId) {
        List<CreateBookingCommand.Line> lines = lineItems.stream()
                .map(li -> new CreateBookingCommand.Line(li.ticketTypeId(), li.quantity()))
                .toList();
        return new CreateBookingCommand(buyerId, eventId, lines, pointsToUse, voucherCode, couponCode);
    }
}
