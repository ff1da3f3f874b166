package com.eventix.booking.inventory;

import java.math.BigDecimal;

public record TicketTypeSnapshot(
        Long id,
        String name,
        BigDecimal price,
        int capacity,
        int reserved
) {

    public int remaining() {
        return capacity - reserved;
    }
}
