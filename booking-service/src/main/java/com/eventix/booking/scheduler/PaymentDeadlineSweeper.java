package com.eventix.booking.scheduler;

import com.eventix.booking.config.BookingProperties;
import com.eventix.booking.domain.BookingStatus;
import com.eventix.booking.repository.BookingRepository;
import com.eventix.booking.service.BookingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Expires bookings whose payment deadline passed without a payment proof.
 * Each booking expires in its own unit of work, so one failure does not hold up the batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentDeadlineSweeper {

    private final BookingRepository bookingRepository;
    private final BookingService bookingService;
    private final BookingProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${booking.expiry.sweep-interval-ms:30000}")
    @SchedulerLock(name = "paymentDeadlineSweep", lockAtMostFor = "PT5M", lockAtLeastFor = "PT5S")
    public int sweepOverdueBookings() {
        List<Long> overdueIds = bookingRepository.findIdsByStatusAndPaymentDeadlineBefore(
                BookingStatus.AWAITING_PAYMENT, LocalDateTime.now(clock),
                PageRequest.of(0, properties.getExpiry().getBatchSize()));

        if (overdueIds.isEmpty()) {
            return 0;
        }

        log.info("Expiring {} overdue bookings", overdueIds.size());

        int expired = 0;
        for (Long bookingId : overdueIds) {
            try {
                if (bookingService.expireBooking(bookingId)) {
                    expired++;
                }
            } catch (Exception e) {
                log.error("Failed to expire overdue booking: bookingId={}", bookingId, e);
            }
        }
        return expired;
    }
}
