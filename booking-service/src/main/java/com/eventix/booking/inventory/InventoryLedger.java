package com.eventix.booking.inventory;

import com.eventix.booking.inventory.InventoryTables.LocalEvents;
import com.eventix.booking.inventory.InventoryTables.TicketTypes;
import com.eventix.booking.uow.UnitOfWork;
import com.eventix.common.exception.BusinessException;
import com.eventix.common.exception.LedgerInvariantException;
import com.eventix.common.response.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sole writer of ticket-type {@code reserved} and event {@code booked_seats}.
 * Every change is a single conditional UPDATE, so concurrent bookings can never push a
 * counter past its limit: the row lock serializes writers and the loser matches zero rows.
 */
@Slf4j
@Component
public class InventoryLedger {

    /**
     * Takes {@code quantity} tickets of one type and the matching event seats.
     * Fails without changing either counter if the ticket type or the event is short.
     */
    public void reserve(UnitOfWork uow, Long eventId, Long ticketTypeId, int quantity) {
        requirePositive(quantity);

        int ticketRows = uow.dsl().update(TicketTypes.TABLE)
                .set(TicketTypes.RESERVED, TicketTypes.RESERVED.plus(quantity))
                .where(TicketTypes.ID.eq(ticketTypeId))
                .and(TicketTypes.EVENT_ID.eq(eventId))
                .and(TicketTypes.RESERVED.plus(quantity).le(TicketTypes.CAPACITY))
                .execute();
        if (ticketRows == 0) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_INVENTORY,
                    "Not enough tickets left: ticketTypeId=" + ticketTypeId + ", requested=" + quantity);
        }

        int eventRows = uow.dsl().update(LocalEvents.TABLE)
                .set(LocalEvents.BOOKED_SEATS, LocalEvents.BOOKED_SEATS.plus(quantity))
                .where(LocalEvents.ID.eq(eventId))
                .and(LocalEvents.BOOKED_SEATS.plus(quantity).le(LocalEvents.AVAILABLE_SEATS))
                .execute();
        if (eventRows == 0) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_SEATS,
                    "Not enough seats left: eventId=" + eventId + ", requested=" + quantity);
        }

        log.debug("Inventory reserved: eventId={}, ticketTypeId={}, quantity={}",
                eventId, ticketTypeId, quantity);
    }

    /**
     * Gives back tickets taken by {@link #reserve}. A counter that would drop below zero means
     * the ledger is already corrupt; that is raised, never clamped.
     */
    public void release(UnitOfWork uow, Long eventId, Long ticketTypeId, int quantity) {
        requirePositive(quantity);

        int ticketRows = uow.dsl().update(TicketTypes.TABLE)
                .set(TicketTypes.RESERVED, TicketTypes.RESERVED.minus(quantity))
                .where(TicketTypes.ID.eq(ticketTypeId))
                .and(TicketTypes.EVENT_ID.eq(eventId))
                .and(TicketTypes.RESERVED.ge(quantity))
                .execute();
        if (ticketRows == 0) {
            throw new LedgerInvariantException("Cannot release " + quantity
                    + " tickets: ticketTypeId=" + ticketTypeId + " has fewer reserved");
        }

        int eventRows = uow.dsl().update(LocalEvents.TABLE)
                .set(LocalEvents.BOOKED_SEATS, LocalEvents.BOOKED_SEATS.minus(quantity))
                .where(LocalEvents.ID.eq(eventId))
                .and(LocalEvents.BOOKED_SEATS.ge(quantity))
                .execute();
        if (eventRows == 0) {
            throw new LedgerInvariantException("Cannot release " + quantity
                    + " seats: eventId=" + eventId + " has fewer booked");
        }

        log.debug("Inventory released: eventId={}, ticketTypeId={}, quantity={}",
                eventId, ticketTypeId, quantity);
    }

    /**
     * Applies a catalog capacity change unless it would drop below what is already reserved.
     */
    public boolean resizeTicketType(UnitOfWork uow, Long ticketTypeId, int capacity) {
        return uow.dsl().update(TicketTypes.TABLE)
                .set(TicketTypes.CAPACITY, capacity)
                .where(TicketTypes.ID.eq(ticketTypeId))
                .and(TicketTypes.RESERVED.le(capacity))
                .execute() == 1;
    }

    /**
     * Applies a catalog seat budget change unless it would drop below the seats already booked.
     */
    public boolean resizeSeatBudget(UnitOfWork uow, Long eventId, int availableSeats) {
        return uow.dsl().update(LocalEvents.TABLE)
                .set(LocalEvents.AVAILABLE_SEATS, availableSeats)
                .where(LocalEvents.ID.eq(eventId))
                .and(LocalEvents.BOOKED_SEATS.le(availableSeats))
                .execute() == 1;
    }

    private void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Quantity must be positive: " + quantity);
        }
    }
}
