package com.eventix.booking.inventory;

import com.eventix.booking.uow.UnitOfWork;

import java.util.Optional;

/**
 * Read access to events and their ticket types.
 */
public interface EventCatalog {

    Optional<BookableEvent> findBookableEvent(UnitOfWork uow, Long eventId);

    Optional<Long> findOrganizerId(UnitOfWork uow, Long eventId);
}
