package com.eventix.booking.scheduler;

import com.eventix.booking.config.BookingProperties;
import com.eventix.booking.domain.BookingStatus;
import com.eventix.booking.repository.BookingRepository;
import com.eventix.booking.service.BookingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static com.eventix.booking.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentDeadlineSweeperTest {

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookingService bookingService;

    private PaymentDeadlineSweeper sweeper;

    @BeforeEach
    void setUp() {
        BookingProperties properties = new BookingProperties();
        properties.getExpiry().setBatchSize(50);
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        sweeper = new PaymentDeadlineSweeper(bookingRepository, bookingService, properties, clock);
    }

    @Test
    void sweepOverdueBookings_nothingOverdue_doesNothing() {
        when(bookingRepository.findIdsByStatusAndPaymentDeadlineBefore(
                eq(BookingStatus.AWAITING_PAYMENT), eq(NOW), any(Pageable.class)))
                .thenReturn(Collections.emptyList());

        assertThat(sweeper.sweepOverdueBookings()).isZero();

        verify(bookingService, never()).expireBooking(anyLong());
    }

    @Test
    void sweepOverdueBookings_queriesOneBatch() {
        when(bookingRepository.findIdsByStatusAndPaymentDeadlineBefore(any(), any(), any()))
                .thenReturn(Collections.emptyList());

        sweeper.sweepOverdueBookings();

        verify(bookingRepository).findIdsByStatusAndPaymentDeadlineBefore(
                BookingStatus.AWAITING_PAYMENT, NOW, PageRequest.of(0, 50));
    }

    @Test
    void sweepOverdueBookings_expiresEachAndCountsTransitions() {
        when(bookingRepository.findIdsByStatusAndPaymentDeadlineBefore(
                eq(BookingStatus.AWAITING_PAYMENT), eq(NOW), any(Pageable.class)))
                .thenReturn(List.of(1L, 2L, 3L));
        when(bookingService.expireBooking(1L)).thenReturn(true);
        // paid between the query and the lock
        when(bookingService.expireBooking(2L)).thenReturn(false);
        when(bookingService.expireBooking(3L)).thenReturn(true);

        assertThat(sweeper.sweepOverdueBookings()).isEqualTo(2);
    }

    @Test
    void sweepOverdueBookings_oneFails_othersStillExpire() {
        when(bookingRepository.findIdsByStatusAndPaymentDeadlineBefore(
                eq(BookingStatus.AWAITING_PAYMENT), eq(NOW), any(Pageable.class)))
                .thenReturn(List.of(1L, 2L));
        when(bookingService.expireBooking(1L)).thenThrow(new RuntimeException("DB error"));
        when(bookingService.expireBooking(2L)).thenReturn(true);

        assertThat(sweeper.sweepOverdueBookings()).isEqualTo(1);

        verify(bookingService).expireBooking(1L);
        verify(bookingService).expireBooking(2L);
    }
}
