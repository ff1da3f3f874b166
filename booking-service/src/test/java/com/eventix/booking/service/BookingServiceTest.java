package com.eventix.booking.service;

import com.eventix.booking.TestFixtures;
import com.eventix.booking.domain.Booking;
import com.eventix.booking.domain.BookingStatus;
import com.eventix.booking.dto.response.BookingResponse;
import com.eventix.booking.notification.Notifier;
import com.eventix.booking.storage.FileStore;
import com.eventix.booking.uow.UnitOfWork;
import com.eventix.booking.uow.UnitOfWorkTemplate;
import com.eventix.common.exception.BusinessException;
import com.eventix.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static com.eventix.booking.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

    private static final Long BUYER_ID = 100L;
    private static final Long EVENT_ID = 10L;
    private static final Long ORGANIZER_ID = 7L;

    @Mock
    private UnitOfWorkTemplate unitOfWork;
    @Mock
    private BookingTransactionService transactionService;
    @Mock
    private FileStore fileStore;
    @Mock
    private Notifier notifier;

    @InjectMocks
    private BookingService bookingService;

    private final UnitOfWork uow = UnitOfWork.open(null, NOW);

    @BeforeEach
    void setUp() {
        lenient().when(unitOfWork.execute(any())).thenAnswer(inv -> {
            Function<UnitOfWork, Object> work = inv.getArgument(0);
            return work.apply(uow);
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void createBooking_success_returnsResponseAndNotifiesBuyer() {
        CreateBookingCommand command = new CreateBookingCommand(BUYER_ID, EVENT_ID,
                List.of(new CreateBookingCommand.Line(1000L, 2)), BigDecimal.ZERO, null, null);
        Booking booking = TestFixtures.createBookingWithLine(1L, BUYER_ID, EVENT_ID, 2);
        when(transactionService.create(uow, command)).thenReturn(booking);

        BookingResponse response = bookingService.createBooking(command);

        assertThat(response.bookingId()).isEqualTo(1L);
        assertThat(response.status()).isEqualTo(BookingStatus.AWAITING_PAYMENT);
        assertThat(response.totalAmount()).isEqualByComparingTo("120000");
        assertThat(response.lineItems()).hasSize(1);

        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(notifier).notify(eq(BUYER_ID), eq(Notifier.BOOKING_CREATED), payload.capture());
        assertThat(payload.getValue())
                .containsEntry("bookingId", 1L)
                .containsEntry("invoiceNumber", "INV-1")
                .containsEntry("status", "AWAITING_PAYMENT");
    }

    @Test
    void createBooking_failure_doesNotNotify() {
        CreateBookingCommand command = new CreateBookingCommand(BUYER_ID, EVENT_ID,
                List.of(new CreateBookingCommand.Line(1000L, 2)), BigDecimal.ZERO, null, null);
        when(transactionService.create(uow, command))
                .thenThrow(new BusinessException(ErrorCode.INSUFFICIENT_INVENTORY));

        assertThatThrownBy(() -> bookingService.createBooking(command))
                .isInstanceOf(BusinessException.class);

        verifyNoInteractions(notifier);
    }

    @Test
    void submitPaymentProof_beforeDeadline_storesFileThenAttaches() {
        PaymentProof proof = new PaymentProof(new byte[]{1, 2, 3}, "receipt.png");
        Booking booking = TestFixtures.createBookingWithLine(1L, BUYER_ID, EVENT_ID, 1);
        booking.submitPaymentProof("file:///proofs/abc.png", NOW);
        when(transactionService.expireIfOverdue(uow, 1L, BUYER_ID)).thenReturn(false);
        when(fileStore.store(proof.content(), "receipt.png")).thenReturn("file:///proofs/abc.png");
        when(transactionService.attachPaymentProof(uow, 1L, BUYER_ID, "file:///proofs/abc.png"))
                .thenReturn(booking);

        BookingResponse response = bookingService.submitPaymentProof(1L, BUYER_ID, proof);

        assertThat(response.status()).isEqualTo(BookingStatus.AWAITING_CONFIRMATION);
        assertThat(response.paymentProofUrl()).isEqualTo("file:///proofs/abc.png");
        InOrder order = inOrder(transactionService, fileStore);
        order.verify(transactionService).expireIfOverdue(uow, 1L, BUYER_ID);
        order.verify(fileStore).store(proof.content(), "receipt.png");
        order.verify(transactionService).attachPaymentProof(uow, 1L, BUYER_ID, "file:///proofs/abc.png");
    }

    @Test
    void submitPaymentProof_expiredWhileStoring_deletesStoredFile() {
        PaymentProof proof = new PaymentProof(new byte[]{1}, "receipt.png");
        when(transactionService.expireIfOverdue(uow, 1L, BUYER_ID)).thenReturn(false);
        when(fileStore.store(proof.content(), "receipt.png")).thenReturn("file:///proofs/abc.png");
        when(transactionService.attachPaymentProof(uow, 1L, BUYER_ID, "file:///proofs/abc.png"))
                .thenThrow(new BusinessException(ErrorCode.BOOKING_EXPIRED));

        assertThatThrownBy(() -> bookingService.submitPaymentProof(1L, BUYER_ID, proof))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.BOOKING_EXPIRED);

        verify(fileStore).delete("file:///proofs/abc.png");
    }

    @Test
    void submitPaymentProof_afterDeadline_throwsExpiredWithoutStoringFile() {
        PaymentProof proof = new PaymentProof(new byte[]{1}, "late.png");
        when(transactionService.expireIfOverdue(uow, 1L, BUYER_ID)).thenReturn(true);

        assertThatThrownBy(() -> bookingService.submitPaymentProof(1L, BUYER_ID, proof))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.BOOKING_EXPIRED);

        verifyNoInteractions(fileStore);
        verify(transactionService, never()).attachPaymentProof(any(), any(), any(), anyString());
        // the expiry committed in its own unit of work before the error
        verify(unitOfWork, times(1)).execute(any());
    }

    @Test
    void confirmBooking_accept_notifiesConfirmed() {
        Booking booking = TestFixtures.createBookingWithLine(1L, BUYER_ID, EVENT_ID, 1);
        booking.submitPaymentProof("proof", NOW);
        booking.confirm(NOW);
        when(transactionService.confirm(uow, 1L, ORGANIZER_ID, true)).thenReturn(booking);

        BookingResponse response = bookingService.confirmBooking(1L, ORGANIZER_ID, true);

        assertThat(response.status()).isEqualTo(BookingStatus.CONFIRMED);
        verify(notifier).notify(eq(BUYER_ID), eq(Notifier.BOOKING_CONFIRMED), anyMap());
    }

    @Test
    void confirmBooking_reject_notifiesRejected() {
        Booking booking = TestFixtures.createBookingWithLine(1L, BUYER_ID, EVENT_ID, 1);
        booking.submitPaymentProof("proof", NOW);
        booking.reject(NOW);
        when(transactionService.confirm(uow, 1L, ORGANIZER_ID, false)).thenReturn(booking);

        BookingResponse response = bookingService.confirmBooking(1L, ORGANIZER_ID, false);

        assertThat(response.status()).isEqualTo(BookingStatus.REJECTED);
        verify(notifier).notify(eq(BUYER_ID), eq(Notifier.BOOKING_REJECTED), anyMap());
    }

    @Test
    void cancelBooking_success_returnsCanceledWithoutNotification() {
        Booking booking = TestFixtures.createBookingWithLine(1L, BUYER_ID, EVENT_ID, 1);
        booking.cancel(NOW);
        when(transactionService.cancel(uow, 1L, BUYER_ID)).thenReturn(booking);

        BookingResponse response = bookingService.cancelBooking(1L, BUYER_ID);

        assertThat(response.status()).isEqualTo(BookingStatus.CANCELED);
        verifyNoInteractions(notifier);
    }

    @Test
    void expireBooking_delegatesToTransactionService() {
        when(transactionService.expire(uow, 1L)).thenReturn(true);

        assertThat(bookingService.expireBooking(1L)).isTrue();
    }
}
