package com.eventix.booking.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Invoice numbers look like {@code INV-1767225600000-K3Q9ZT}: creation millis plus six
 * random base-36 characters. Uniqueness is enforced by the bookings table.
 */
@Component
public class InvoiceNumberGenerator {

    private static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final int SUFFIX_LENGTH = 6;

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public InvoiceNumberGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        StringBuilder sb = new StringBuilder("INV-").append(clock.millis()).append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
