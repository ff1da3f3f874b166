package com.eventix.booking.service;

import com.eventix.booking.config.BookingProperties;
import com.eventix.booking.discount.DiscountCalculator;
import com.eventix.booking.discount.PriceBreakdown;
import com.eventix.booking.domain.Attendance;
import com.eventix.booking.domain.Booking;
import com.eventix.booking.domain.BookingLineItem;
import com.eventix.booking.domain.BookingStatus;
import com.eventix.booking.event.producer.BookingEventProducer;
import com.eventix.booking.inventory.BookableEvent;
import com.eventix.booking.inventory.EventCatalog;
import com.eventix.booking.inventory.InventoryLedger;
import com.eventix.booking.inventory.TicketTypeSnapshot;
import com.eventix.booking.repository.AttendanceRepository;
import com.eventix.booking.repository.BookingRepository;
import com.eventix.booking.rewards.DiscountResolver;
import com.eventix.booking.rewards.DiscountResolver.ResolvedDiscounts;
import com.eventix.booking.rewards.PointSourceType;
import com.eventix.booking.rewards.RewardsLedger;
import com.eventix.booking.uow.UnitOfWork;
import com.eventix.common.exception.BusinessException;
import com.eventix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Booking state machine. Every method runs inside the caller's unit of work, so a failure at
 * any step leaves bookings, inventory and rewards exactly as they were.
 *
 * <pre>
 * AWAITING_PAYMENT      -> AWAITING_CONFIRMATION   payment proof before the deadline
 * AWAITING_PAYMENT      -> EXPIRED                 deadline passed           (rollback)
 * AWAITING_PAYMENT      -> CANCELED                buyer cancels             (rollback)
 * AWAITING_CONFIRMATION -> CONFIRMED               organizer accepts         (attendance)
 * AWAITING_CONFIRMATION -> REJECTED                organizer rejects         (rollback)
 * </pre>
 *
 * Each rollback happens only after the booking row is locked and its status moved,
 * so side effects are reversed at most once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingTransactionService {

    private final BookingRepository bookingRepository;
    private final AttendanceRepository attendanceRepository;
    private final EventCatalog eventCatalog;
    private final InventoryLedger inventoryLedger;
    private final RewardsLedger rewardsLedger;
    private final DiscountResolver discountResolver;
    private final BookingEventProducer bookingEventProducer;
    private final InvoiceNumberGenerator invoiceNumberGenerator;
    private final BookingProperties properties;

    public Booking create(UnitOfWork uow, CreateBookingCommand command) {
        validate(command);

        BookableEvent event = eventCatalog.findBookableEvent(uow, command.eventId())
                .filter(e -> e.isOpenForBooking(uow.now()))
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_BOOKABLE,
                        "Event is not open for booking: " + command.eventId()));

        // Ticket-type order keeps row locks in a fixed order across concurrent bookings
        List<CreateBookingCommand.Line> lines = command.lines().stream()
                .sorted(Comparator.comparing(CreateBookingCommand.Line::ticketTypeId))
                .toList();

        BigDecimal totalAmount = BigDecimal.ZERO;
        int seatsRequested = 0;
        for (CreateBookingCommand.Line line : lines) {
            TicketTypeSnapshot ticketType = requireTicketType(event, line.ticketTypeId());
            if (ticketType.remaining() < line.quantity()) {
                throw new BusinessException(ErrorCode.INSUFFICIENT_INVENTORY,
                        "Only " + ticketType.remaining() + " tickets left for " + ticketType.name());
            }
            totalAmount = totalAmount.add(ticketType.price().multiply(BigDecimal.valueOf(line.quantity())));
            seatsRequested += line.quantity();
        }
        if (seatsRequested > event.remainingSeats()) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_SEATS,
                    "Only " + event.remainingSeats() + " seats left for event " + event.id());
        }

        BigDecimal points = command.pointsToUse();
        if (points.compareTo(totalAmount) > 0) {
            throw new BusinessException(ErrorCode.POINTS_EXCEED_AMOUNT,
                    "Points to use (" + points + ") exceed total amount (" + totalAmount + ")");
        }
        if (points.signum() > 0) {
            BigDecimal available = rewardsLedger.availablePoints(uow, command.buyerId());
            if (points.compareTo(available) > 0) {
                throw new BusinessException(ErrorCode.INSUFFICIENT_POINTS,
                        "Requested " + points + " points, available " + available);
            }
        }

        ResolvedDiscounts discounts = discountResolver.resolve(uow, event.id(), command.buyerId(),
                totalAmount, command.voucherCode(), command.couponCode());
        PriceBreakdown breakdown = PriceBreakdown.of(totalAmount, points,
                discounts.voucherDiscount(), discounts.couponDiscount());

        Booking booking = Booking.builder()
                .userId(command.buyerId())
                .eventId(event.id())
                .invoiceNumber(invoiceNumberGenerator.next())
                .paymentDeadline(uow.now().plus(properties.getPaymentWindow()))
                .build();
        for (CreateBookingCommand.Line line : lines) {
            TicketTypeSnapshot ticketType = requireTicketType(event, line.ticketTypeId());
            booking.addLineItem(ticketType.id(), ticketType.name(), line.quantity(), ticketType.price());
        }
        booking.applyPricing(breakdown, discounts.voucherId(), discounts.couponId());
        booking = bookingRepository.save(booking);

        for (CreateBookingCommand.Line line : lines) {
            inventoryLedger.reserve(uow, event.id(), line.ticketTypeId(), line.quantity());
        }
        if (discounts.voucherId() != null) {
            rewardsLedger.redeemVoucher(uow, discounts.voucherId());
        }
        if (discounts.couponId() != null) {
            rewardsLedger.redeemCoupon(uow, discounts.couponId());
        }
        if (breakdown.pointsApplied().signum() > 0) {
            rewardsLedger.debitPoints(uow, command.buyerId(), breakdown.pointsApplied());
        }

        bookingEventProducer.publishBookingCreated(booking);
        log.info("Booking created: bookingId={}, invoice={}, eventId={}, total={}, final={}",
                booking.getId(), booking.getInvoiceNumber(), event.id(),
                booking.getTotalAmount(), booking.getFinalAmount());
        return booking;
    }

    public Booking confirm(UnitOfWork uow, Long bookingId, Long organizerId, boolean accept) {
        Booking booking = lockBooking(bookingId);
        boolean organizes = eventCatalog.findOrganizerId(uow, booking.getEventId())
                .map(organizerId::equals)
                .orElse(false);
        if (!organizes) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_FOUND, "Booking not found: " + bookingId);
        }

        if (accept) {
            booking.confirm(uow.now());
            attendanceRepository.save(Attendance.of(booking));
            bookingEventProducer.publishBookingConfirmed(booking);
        } else {
            booking.reject(uow.now());
            rollback(uow, booking);
            bookingEventProducer.publishBookingRejected(booking);
        }

        log.info("Booking reviewed: bookingId={}, status={}, organizerId={}",
                bookingId, booking.getStatus(), organizerId);
        return booking;
    }

    public Booking attachPaymentProof(UnitOfWork uow, Long bookingId, Long buyerId, String proofUrl) {
        Booking booking = lockOwnedBooking(bookingId, buyerId);
        if (booking.getStatus() == BookingStatus.EXPIRED || booking.isOverdue(uow.now())) {
            throw new BusinessException(ErrorCode.BOOKING_EXPIRED,
                    "Payment deadline passed for booking " + bookingId);
        }

        booking.submitPaymentProof(proofUrl, uow.now());
        bookingEventProducer.publishAwaitingConfirmation(booking);
        log.info("Payment proof submitted: bookingId={}", bookingId);
        return booking;
    }

    /**
     * Expires the buyer's booking if its deadline has passed. Returns true when the booking
     * is expired afterwards; fails if it is no longer awaiting payment for any other reason.
     */
    public boolean expireIfOverdue(UnitOfWork uow, Long bookingId, Long buyerId) {
        Booking booking = lockOwnedBooking(bookingId, buyerId);
        if (booking.getStatus() == BookingStatus.EXPIRED) {
            return true;
        }
        if (booking.getStatus() != BookingStatus.AWAITING_PAYMENT) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                    "Booking " + bookingId + " is not awaiting payment: status=" + booking.getStatus());
        }
        if (!booking.isOverdue(uow.now())) {
            return false;
        }
        expireLocked(uow, booking);
        return true;
    }

    /**
     * Sweeper entry point. No-op when the booking already left AWAITING_PAYMENT or is not yet due.
     */
    public boolean expire(UnitOfWork uow, Long bookingId) {
        Booking booking = lockBooking(bookingId);
        if (!booking.isOverdue(uow.now())) {
            log.debug("Booking not expirable, skipped: bookingId={}, status={}", bookingId, booking.getStatus());
            return false;
        }
        expireLocked(uow, booking);
        return true;
    }

    public Booking cancel(UnitOfWork uow, Long bookingId, Long buyerId) {
        Booking booking = lockOwnedBooking(bookingId, buyerId);
        booking.cancel(uow.now());
        rollback(uow, booking);
        bookingEventProducer.publishBookingCanceled(booking);
        log.info("Booking canceled: bookingId={}", bookingId);
        return booking;
    }

    private void expireLocked(UnitOfWork uow, Booking booking) {
        booking.expire(uow.now());
        rollback(uow, booking);
        bookingEventProducer.publishBookingExpired(booking);
        log.info("Booking expired: bookingId={}, deadline={}", booking.getId(), booking.getPaymentDeadline());
    }

    /**
     * Reverses every side effect of {@link #create}: inventory, voucher, coupon, points.
     */
    private void rollback(UnitOfWork uow, Booking booking) {
        List<BookingLineItem> items = booking.getLineItems().stream()
                .sorted(Comparator.comparing(BookingLineItem::getTicketTypeId))
                .toList();
        for (BookingLineItem item : items) {
            inventoryLedger.release(uow, booking.getEventId(), item.getTicketTypeId(), item.getQuantity());
        }
        if (booking.getVoucherId() != null) {
            rewardsLedger.unredeemVoucher(uow, booking.getVoucherId());
        }
        if (booking.getCouponId() != null) {
            rewardsLedger.unredeemCoupon(uow, booking.getCouponId());
        }
        if (booking.getPointsApplied().signum() > 0) {
            rewardsLedger.creditPoints(uow, booking.getUserId(), booking.getPointsApplied(),
                    PointSourceType.REFUND);
        }
        log.debug("Booking side effects rolled back: bookingId={}, status={}",
                booking.getId(), booking.getStatus());
    }

    private Booking lockBooking(Long bookingId) {
        return bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
    }

    private Booking lockOwnedBooking(Long bookingId, Long buyerId) {
        Booking booking = lockBooking(bookingId);
        if (!booking.isOwnedBy(buyerId)) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_FOUND, "Booking not found: " + bookingId);
        }
        return booking;
    }

    private static TicketTypeSnapshot requireTicketType(BookableEvent event, Long ticketTypeId) {
        return event.findTicketType(ticketTypeId)
                .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_TYPE_NOT_FOUND,
                        "Ticket type " + ticketTypeId + " not found for event " + event.id()));
    }

    private static void validate(CreateBookingCommand command) {
        if (command.lines().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "At least one ticket line is required");
        }
        Set<Long> seen = new HashSet<>();
        for (CreateBookingCommand.Line line : command.lines()) {
            if (line.quantity() <= 0) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Quantity must be positive for ticket type " + line.ticketTypeId());
            }
            if (!seen.add(line.ticketTypeId())) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Duplicate ticket type in request: " + line.ticketTypeId());
            }
        }
        if (command.pointsToUse().signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Points to use must not be negative");
        }
        if (command.pointsToUse().stripTrailingZeros().scale() > DiscountCalculator.MONEY_SCALE) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Points to use must have at most " + DiscountCalculator.MONEY_SCALE + " decimal places");
        }
    }
}
