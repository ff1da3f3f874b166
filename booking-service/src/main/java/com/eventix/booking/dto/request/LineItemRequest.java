package com.eventix.booking.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record LineItemRequest(
        @NotNull Long ticketTypeId,
        @Positive @Max(1000) int quantity
) {
}
