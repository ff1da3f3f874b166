package com.eventix.booking.uow;

import org.jooq.DSLContext;

import java.time.LocalDateTime;

/**
 * Handle on the single database transaction a booking operation runs in.
 * Ledger operations take it as their first argument, so they cannot run outside one.
 * {@code now} is fixed when the unit of work opens and used for every time decision inside it.
 */
public final class UnitOfWork {

    private final DSLContext dsl;
    private final LocalDateTime now;

    private UnitOfWork(DSLContext dsl, LocalDateTime now) {
        this.dsl = dsl;
        this.now = now;
    }

    public static UnitOfWork open(DSLContext dsl, LocalDateTime now) {
        return new UnitOfWork(dsl, now);
    }

    public DSLContext dsl() {
        return dsl;
    }

    public LocalDateTime now() {
        return now;
    }
}
