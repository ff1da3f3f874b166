package com.eventix.booking.service;

import com.eventix.booking.domain.BookingStatus;
import com.eventix.booking.domain.LocalEvent;
import com.eventix.booking.domain.TicketType;
import com.eventix.booking.repository.BookingRepository;
import com.eventix.booking.repository.LocalEventRepository;
import com.eventix.booking.repository.TicketTypeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compares ledger counters with the bookings that should account for them.
 * Drift is only reported; correcting a counter is an operator decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryReconciliationService {

    private static final List<BookingStatus> LIVE_STATUSES = Arrays.stream(BookingStatus.values())
            .filter(BookingStatus::holdsInventory)
            .toList();

    private final BookingRepository bookingRepository;
    private final TicketTypeRepository ticketTypeRepository;
    private final LocalEventRepository localEventRepository;

    /**
     * Check 1: each ticket type's {@code reserved} equals the quantity held by its live bookings.
     */
    @Transactional(readOnly = true)
    public int detectTicketTypeDrift() {
        Map<Long, Long> held = bookingRepository.sumQuantitiesByTicketType(LIVE_STATUSES).stream()
                .collect(Collectors.toMap(BookingRepository.HeldQuantity::getTicketTypeId,
                        BookingRepository.HeldQuantity::getQuantity));

        int drifts = 0;
        for (TicketType ticketType : ticketTypeRepository.findAll()) {
            long expected = held.getOrDefault(ticketType.getId(), 0L);
            if (ticketType.getReserved() != expected) {
                log.error("RECONCILE: Ticket type reserved drift: ticketTypeId={}, eventId={}, reserved={}, heldByBookings={}",
                        ticketType.getId(), ticketType.getEventId(), ticketType.getReserved(), expected);
                drifts++;
            }
        }
        return drifts;
    }

    /**
     * Check 2: each event's {@code booked_seats} equals the sum of its ticket types' {@code reserved}.
     */
    @Transactional(readOnly = true)
    public int detectEventSeatDrift() {
        Map<Long, Integer> reservedByEvent = ticketTypeRepository.findAll().stream()
                .collect(Collectors.groupingBy(TicketType::getEventId,
                        Collectors.summingInt(TicketType::getReserved)));

        int drifts = 0;
        for (LocalEvent event : localEventRepository.findAll()) {
            int expected = reservedByEvent.getOrDefault(event.getId(), 0);
            if (event.getBookedSeats() != expected) {
                log.error("RECONCILE: Event booked seats drift: eventId={}, bookedSeats={}, reservedByTicketTypes={}",
                        event.getId(), event.getBookedSeats(), expected);
                drifts++;
            }
        }
        return drifts;
    }
}
