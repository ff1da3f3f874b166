package com.eventix.booking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "booking")
public class BookingProperties {

    /** Time a buyer has to upload a payment proof after creating a booking. */
    private Duration paymentWindow = Duration.ofHours(2);

    /** Lifetime of a point lot created when points are refunded and no live lot exists. */
    private int refundPointValidityMonths = 3;

    private final Expiry expiry = new Expiry();
    private final FileStore fileStore = new FileStore();
    private final Paging paging = new Paging();
    private final Outbox outbox = new Outbox();

    @Getter
    @Setter
    public static class Expiry {
        private long sweepIntervalMs = 30_000;
        private int batchSize = 100;
    }

    @Getter
    @Setter
    public static class FileStore {
        private String root = "./data/payment-proofs";
    }

    @Getter
    @Setter
    public static class Paging {
        private int defaultSize = 10;
        private int maxSize = 100;
    }

    @Getter
    @Setter
    public static class Outbox {
        /** Failed sends tolerated before a row is parked as FAILED. */
        private int maxRetries = 5;
        private Duration sendTimeout = Duration.ofSeconds(5);
    }
}
