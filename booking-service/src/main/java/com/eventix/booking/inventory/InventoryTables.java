package com.eventix.booking.inventory;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

/**
 * jOOQ references for the inventory replica tables (see db/schema.sql).
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class InventoryTables {

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class LocalEvents {
        public static final Table<Record> TABLE = table(name("local_events"));
        public static final Field<Long> ID = field(name("local_events", "id"), Long.class);
        public static final Field<Long> ORGANIZER_ID = field(name("local_events", "organizer_id"), Long.class);
        public static final Field<String> TITLE = field(name("local_events", "title"), String.class);
        public static final Field<LocalDateTime> START_DATE =
                field(name("local_events", "start_date"), LocalDateTime.class);
        public static final Field<Boolean> PUBLISHED = field(name("local_events", "published"), Boolean.class);
        public static final Field<Integer> AVAILABLE_SEATS =
                field(name("local_events", "available_seats"), Integer.class);
        public static final Field<Integer> BOOKED_SEATS =
                field(name("local_events", "booked_seats"), Integer.class);
    }

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class TicketTypes {
        public static final Table<Record> TABLE = table(name("ticket_types"));
        public static final Field<Long> ID = field(name("ticket_types", "id"), Long.class);
        public static final Field<Long> EVENT_ID = field(name("ticket_types", "event_id"), Long.class);
        public static final Field<String> NAME = field(name("ticket_types", "name"), String.class);
        public static final Field<BigDecimal> PRICE = field(name("ticket_types", "price"), BigDecimal.class);
        public static final Field<Integer> CAPACITY = field(name("ticket_types", "capacity"), Integer.class);
        public static final Field<Integer> RESERVED = field(name("ticket_types", "reserved"), Integer.class);
    }
}
