package com.eventix.booking.service;

import com.eventix.booking.domain.Booking;
import com.eventix.booking.dto.response.BookingResponse;
import com.eventix.booking.notification.Notifier;
import com.eventix.booking.storage.FileStore;
import com.eventix.booking.uow.UnitOfWorkTemplate;
import com.eventix.common.exception.BusinessException;
import com.eventix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for booking commands. Each command runs in its own unit of work;
 * notifications go out only after it committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private final UnitOfWorkTemplate unitOfWork;
    private final BookingTransactionService transactionService;
    private final FileStore fileStore;
    private final Notifier notifier;

    public BookingResponse createBooking(CreateBookingCommand command) {
        log.info("Create booking: userId={}, eventId={}, lines={}",
                command.buyerId(), command.eventId(), command.lines().size());

        BookingResponse response = unitOfWork.execute(uow ->
                BookingResponse.from(transactionService.create(uow, command)));

        notifier.notify(response.userId(), Notifier.BOOKING_CREATED, payload(response));
        return response;
    }

    /**
     * Overdue bookings are expired (and committed) before {@code BOOKING_EXPIRED} is raised,
     * and the proof is only written to the file store once the booking is still payable. A stored
     * proof that could not be attached is deleted again.
     */
    public BookingResponse submitPaymentProof(Long bookingId, Long buyerId, PaymentProof proof) {
        log.info("Submit payment proof: bookingId={}, userId={}", bookingId, buyerId);

        boolean expired = unitOfWork.execute(uow ->
                transactionService.expireIfOverdue(uow, bookingId, buyerId));
        if (expired) {
            throw new BusinessException(ErrorCode.BOOKING_EXPIRED,
                    "Payment deadline passed for booking " + bookingId);
        }

        String proofUrl = fileStore.store(proof.content(), proof.filename());
        try {
            return unitOfWork.execute(uow ->
                    BookingResponse.from(transactionService.attachPaymentProof(uow, bookingId, buyerId, proofUrl)));
        } catch (RuntimeException e) {
            // booking may have been expired by the sweeper since the check above
            log.info("Payment proof not attached, discarding file: bookingId={}, proof={}", bookingId, proofUrl);
            fileStore.delete(proofUrl);
            throw e;
        }
    }

    public BookingResponse confirmBooking(Long bookingId, Long organizerId, boolean accept) {
        log.info("Review booking: bookingId={}, organizerId={}, accept={}", bookingId, organizerId, accept);

        BookingResponse response = unitOfWork.execute(uow ->
                BookingResponse.from(transactionService.confirm(uow, bookingId, organizerId, accept)));

        notifier.notify(response.userId(),
                accept ? Notifier.BOOKING_CONFIRMED : Notifier.BOOKING_REJECTED, payload(response));
        return response;
    }

    public BookingResponse cancelBooking(Long bookingId, Long buyerId) {
        log.info("Cancel booking: bookingId={}, userId={}", bookingId, buyerId);
        return unitOfWork.execute(uow ->
                BookingResponse.from(transactionService.cancel(uow, bookingId, buyerId)));
    }

    /**
     * @return true if this call moved the booking to EXPIRED
     */
    public boolean expireBooking(Long bookingId) {
        return unitOfWork.execute(uow -> transactionService.expire(uow, bookingId));
    }

    private static Map<String, Object> payload(BookingResponse booking) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("bookingId", booking.bookingId());
        payload.put("invoiceNumber", booking.invoiceNumber());
        payload.put("eventId", booking.eventId());
        payload.put("status", booking.status().name());
        payload.put("finalAmount", booking.finalAmount());
        payload.put("paymentDeadline", booking.paymentDeadline());
        return payload;
    }
}
