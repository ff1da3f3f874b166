package com.eventix.booking.rewards;

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
 * jOOQ references for point lots, vouchers and coupons (see db/schema.sql).
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RewardsTables {

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class PointLots {
        public static final Table<Record> TABLE = table(name("point_lots"));
        public static final Field<Long> ID = field(name("point_lots", "id"), Long.class);
        public static final Field<Long> USER_ID = field(name("point_lots", "user_id"), Long.class);
        public static final Field<BigDecimal> AMOUNT = field(name("point_lots", "amount"), BigDecimal.class);
        public static final Field<String> SOURCE_TYPE = field(name("point_lots", "source_type"), String.class);
        public static final Field<Long> SOURCE_ID = field(name("point_lots", "source_id"), Long.class);
        public static final Field<LocalDateTime> EXPIRY_DATE =
                field(name("point_lots", "expiry_date"), LocalDateTime.class);
        public static final Field<Boolean> IS_EXPIRED = field(name("point_lots", "is_expired"), Boolean.class);
        public static final Field<LocalDateTime> CREATED_AT =
                field(name("point_lots", "created_at"), LocalDateTime.class);
    }

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Vouchers {
        public static final Table<Record> TABLE = table(name("event_vouchers"));
        public static final Field<Long> ID = field(name("event_vouchers", "id"), Long.class);
        public static final Field<Long> EVENT_ID = field(name("event_vouchers", "event_id"), Long.class);
        public static final Field<String> CODE = field(name("event_vouchers", "code"), String.class);
        public static final Field<String> DISCOUNT_TYPE =
                field(name("event_vouchers", "discount_type"), String.class);
        public static final Field<BigDecimal> DISCOUNT_VALUE =
                field(name("event_vouchers", "discount_value"), BigDecimal.class);
        public static final Field<BigDecimal> MAX_DISCOUNT_AMOUNT =
                field(name("event_vouchers", "max_discount_amount"), BigDecimal.class);
        public static final Field<BigDecimal> MIN_PURCHASE_AMOUNT =
                field(name("event_vouchers", "min_purchase_amount"), BigDecimal.class);
        public static final Field<Integer> MAX_USAGE = field(name("event_vouchers", "max_usage"), Integer.class);
        public static final Field<Integer> USED_COUNT = field(name("event_vouchers", "used_count"), Integer.class);
        public static final Field<LocalDateTime> START_DATE =
                field(name("event_vouchers", "start_date"), LocalDateTime.class);
        public static final Field<LocalDateTime> END_DATE =
                field(name("event_vouchers", "end_date"), LocalDateTime.class);
    }

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class UserCoupons {
        public static final Table<Record> TABLE = table(name("user_coupons"));
        public static final Field<Long> ID = field(name("user_coupons", "id"), Long.class);
        public static final Field<Long> USER_ID = field(name("user_coupons", "user_id"), Long.class);
        public static final Field<Long> TEMPLATE_ID = field(name("user_coupons", "template_id"), Long.class);
        public static final Field<String> CODE = field(name("user_coupons", "code"), String.class);
        public static final Field<LocalDateTime> EXPIRY_DATE =
                field(name("user_coupons", "expiry_date"), LocalDateTime.class);
        public static final Field<Boolean> IS_USED = field(name("user_coupons", "is_used"), Boolean.class);
    }

    @NoArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class CouponTemplates {
        public static final Table<Record> TABLE = table(name("coupon_templates"));
        public static final Field<Long> ID = field(name("coupon_templates", "id"), Long.class);
        public static final Field<String> DISCOUNT_TYPE =
                field(name("coupon_templates", "discount_type"), String.class);
        public static final Field<BigDecimal> DISCOUNT_VALUE =
                field(name("coupon_templates", "discount_value"), BigDecimal.class);
        public static final Field<BigDecimal> MAX_DISCOUNT_AMOUNT =
                field(name("coupon_templates", "max_discount_amount"), BigDecimal.class);
        public static final Field<BigDecimal> MIN_PURCHASE_AMOUNT =
                field(name("coupon_templates", "min_purchase_amount"), BigDecimal.class);
    }
}
