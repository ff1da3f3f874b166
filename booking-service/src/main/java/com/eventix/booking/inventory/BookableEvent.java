package com.eventix.booking.inventory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * What the booking flow needs to know about an event, read inside the booking's unit of work.
 */
public record BookableEvent(
        Long id,
        Long organizerId,
        boolean published,
        LocalDateTime startDate,
        int seatBudget,
        int bookedSeats,
        List<TicketTypeSnapshot> ticketTypes
) {

    public boolean isOpenForBooking(LocalDateTime now) {
        return published && startDate.isAfter(now);
    }

    public int remainingSeats() {
        return seatBudget - bookedSeats;
    }

    public Optional<TicketTypeSnapshot> findTicketType(Long ticketTypeId) {
        return ticketTypes.stream()
                .filter(t -> t.id().equals(ticketTypeId))
                .findFirst();
    }
}
