package com.eventix.booking;

import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;

import java.math.BigDecimal;
import java.sql.Connection;
import java.time.LocalDateTime;

/**
 * In-memory H2 copy of the ledger tables, for testing jOOQ SQL without PostgreSQL.
 */
public final class LedgerTestDatabase {

    private LedgerTestDatabase() {}

    public static String url(String name) {
        return "jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE;LOCK_TIMEOUT=10000";
    }

    public static void createSchema(Connection connection) {
        DSLContext setup = DSL.using(connection, SQLDialect.H2);

        setup.execute("""
                CREATE TABLE IF NOT EXISTS local_events (
                    id BIGINT PRIMARY KEY,
                    organizer_id BIGINT NOT NULL,
                    title VARCHAR(200) NOT NULL,
                    start_date TIMESTAMP NOT NULL,
                    published BOOLEAN NOT NULL DEFAULT FALSE,
                    available_seats INTEGER NOT NULL,
                    booked_seats INTEGER NOT NULL DEFAULT 0,
                    synced_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
                )
                """);
        setup.execute("""
                CREATE TABLE IF NOT EXISTS ticket_types (
                    id BIGINT PRIMARY KEY,
                    event_id BIGINT NOT NULL REFERENCES local_events(id),
                    name VARCHAR(100) NOT NULL,
                    price DECIMAL(15,2) NOT NULL,
                    capacity INTEGER NOT NULL,
                    reserved INTEGER NOT NULL DEFAULT 0,
                    synced_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
                )
                """);
        setup.execute("""
                CREATE TABLE IF NOT EXISTS point_lots (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    user_id BIGINT NOT NULL,
                    amount DECIMAL(15,2) NOT NULL,
                    source_type VARCHAR(20) NOT NULL,
                    source_id BIGINT,
                    expiry_date TIMESTAMP NOT NULL,
                    is_expired BOOLEAN NOT NULL DEFAULT FALSE,
                    created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
                )
                """);
        setup.execute("""
                CREATE TABLE IF NOT EXISTS event_vouchers (
                    id BIGINT PRIMARY KEY,
                    event_id BIGINT NOT NULL,
                    code VARCHAR(50) NOT NULL UNIQUE,
                    discount_type VARCHAR(20) NOT NULL,
                    discount_value DECIMAL(15,2) NOT NULL,
                    max_discount_amount DECIMAL(15,2),
                    min_purchase_amount DECIMAL(15,2) NOT NULL DEFAULT 0,
                    max_usage INTEGER NOT NULL,
                    used_count INTEGER NOT NULL DEFAULT 0,
                    start_date TIMESTAMP NOT NULL,
                    end_date TIMESTAMP NOT NULL
                )
                """);
        setup.execute("""
                CREATE TABLE IF NOT EXISTS coupon_templates (
                    id BIGINT PRIMARY KEY,
                    name VARCHAR(100) NOT NULL,
                    discount_type VARCHAR(20) NOT NULL,
                    discount_value DECIMAL(15,2) NOT NULL,
                    max_discount_amount DECIMAL(15,2),
                    min_purchase_amount DECIMAL(15,2) NOT NULL DEFAULT 0
                )
                """);
        setup.execute("""
                CREATE TABLE IF NOT EXISTS user_coupons (
                    id BIGINT PRIMARY KEY,
                    user_id BIGINT NOT NULL,
                    template_id BIGINT NOT NULL REFERENCES coupon_templates(id),
                    code VARCHAR(50) NOT NULL UNIQUE,
                    expiry_date TIMESTAMP NOT NULL,
                    is_used BOOLEAN NOT NULL DEFAULT FALSE
                )
                """);
    }

    public static void clear(DSLContext dsl) {
        dsl.execute("DELETE FROM user_coupons");
        dsl.execute("DELETE FROM coupon_templates");
        dsl.execute("DELETE FROM event_vouchers");
        dsl.execute("DELETE FROM point_lots");
        dsl.execute("DELETE FROM ticket_types");
        dsl.execute("DELETE FROM local_events");
    }

    public static void insertEvent(DSLContext dsl, long id, long organizerId, boolean published,
                                   LocalDateTime startDate, int availableSeats) {
        dsl.execute("INSERT INTO local_events (id, organizer_id, title, start_date, published, available_seats) "
                + "VALUES (?, ?, ?, ?, ?, ?)", id, organizerId, "Event " + id, startDate, published, availableSeats);
    }

    public static void insertTicketType(DSLContext dsl, long id, long eventId, String name,
                                        BigDecimal price, int capacity) {
        dsl.execute("INSERT INTO ticket_types (id, event_id, name, price, capacity) VALUES (?, ?, ?, ?, ?)",
                id, eventId, name, price, capacity);
    }

    public static void insertPointLot(DSLContext dsl, long userId, BigDecimal amount,
                                      LocalDateTime expiryDate, LocalDateTime createdAt) {
        dsl.execute("INSERT INTO point_lots (user_id, amount, source_type, expiry_date, created_at) "
                + "VALUES (?, ?, 'REFERRAL', ?, ?)", userId, amount, expiryDate, createdAt);
    }

    public static void insertVoucher(DSLContext dsl, long id, long eventId, String code, String discountType,
                                     BigDecimal value, BigDecimal cap, BigDecimal minPurchase, int maxUsage,
                                     LocalDateTime startDate, LocalDateTime endDate) {
        dsl.execute("INSERT INTO event_vouchers (id, event_id, code, discount_type, discount_value, "
                        + "max_discount_amount, min_purchase_amount, max_usage, start_date, end_date) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                id, eventId, code, discountType, value, cap, minPurchase, maxUsage, startDate, endDate);
    }

    public static void insertCoupon(DSLContext dsl, long id, long userId, String code, String discountType,
                                    BigDecimal value, BigDecimal cap, LocalDateTime expiryDate) {
        dsl.execute("MERGE INTO coupon_templates (id, name, discount_type, discount_value, max_discount_amount) "
                + "KEY (id) VALUES (?, ?, ?, ?, ?)", id, "Template " + id, discountType, value, cap);
        dsl.execute("INSERT INTO user_coupons (id, user_id, template_id, code, expiry_date) VALUES (?, ?, ?, ?, ?)",
                id, userId, id, code, expiryDate);
    }

    public static int intValue(DSLContext dsl, String sql, Object... bindings) {
        return ((Number) dsl.fetchValue(sql, bindings)).intValue();
    }

    public static BigDecimal decimalValue(DSLContext dsl, String sql, Object... bindings) {
        return (BigDecimal) dsl.fetchValue(sql, bindings);
    }
}
