package com.eventix.booking.inventory;

import com.eventix.booking.inventory.InventoryTables.LocalEvents;
import com.eventix.booking.inventory.InventoryTables.TicketTypes;
import com.eventix.booking.uow.UnitOfWork;
import org.jooq.Record;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Serves the catalog from the local replica tables kept current by CatalogEventConsumer.
 */
@Repository
public class JooqEventCatalog implements EventCatalog {

    @Override
    public Optional<BookableEvent> findBookableEvent(UnitOfWork uow, Long eventId) {
        Record event = uow.dsl()
                .select(LocalEvents.ID, LocalEvents.ORGANIZER_ID, LocalEvents.PUBLISHED,
                        LocalEvents.START_DATE, LocalEvents.AVAILABLE_SEATS, LocalEvents.BOOKED_SEATS)
                .from(LocalEvents.TABLE)
                .where(LocalEvents.ID.eq(eventId))
                .fetchOne();
        if (event == null) {
            return Optional.empty();
        }

        List<TicketTypeSnapshot> ticketTypes = uow.dsl()
                .select(TicketTypes.ID, TicketTypes.NAME, TicketTypes.PRICE,
                        TicketTypes.CAPACITY, TicketTypes.RESERVED)
                .from(TicketTypes.TABLE)
                .where(TicketTypes.EVENT_ID.eq(eventId))
                .orderBy(TicketTypes.ID.asc())
                .fetch(r -> new TicketTypeSnapshot(
                        r.get(TicketTypes.ID),
                        r.get(TicketTypes.NAME),
                        r.get(TicketTypes.PRICE),
                        r.get(TicketTypes.CAPACITY),
                        r.get(TicketTypes.RESERVED)));

        return Optional.of(new BookableEvent(
                event.get(LocalEvents.ID),
                event.get(LocalEvents.ORGANIZER_ID),
                Boolean.TRUE.equals(event.get(LocalEvents.PUBLISHED)),
                event.get(LocalEvents.START_DATE),
                event.get(LocalEvents.AVAILABLE_SEATS),
                event.get(LocalEvents.BOOKED_SEATS),
                ticketTypes));
    }

    @Override
    public Optional<Long> findOrganizerId(UnitOfWork uow, Long eventId) {
        return uow.dsl()
                .select(LocalEvents.ORGANIZER_ID)
                .from(LocalEvents.TABLE)
                .where(LocalEvents.ID.eq(eventId))
                .fetchOptional(LocalEvents.ORGANIZER_ID);
    }
}
