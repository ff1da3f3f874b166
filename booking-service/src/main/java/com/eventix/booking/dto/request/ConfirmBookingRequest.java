package com.eventix.booking.dto.request;

import jakarta.validation.constraints.NotNull;

public record ConfirmBookingRequest(
        @NotNull Boolean accept
) {
}
