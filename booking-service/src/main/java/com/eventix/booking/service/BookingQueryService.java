package com.eventix.booking.service;

import com.eventix.booking.config.BookingProperties;
import com.eventix.booking.domain.Booking;
import com.eventix.booking.domain.BookingStatus;
import com.eventix.booking.domain.LocalEvent;
import com.eventix.booking.dto.response.BookingResponse;
import com.eventix.booking.repository.BookingRepository;
import com.eventix.booking.repository.LocalEventRepository;
import com.eventix.common.exception.BusinessException;
import com.eventix.common.response.ErrorCode;
import com.eventix.common.response.PageResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingQueryService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final BookingRepository bookingRepository;
    private final LocalEventRepository localEventRepository;
    private final BookingProperties properties;

    /**
     * Visible to the buyer and to the organizer of the booked event. Anyone else gets
     * {@code BOOKING_NOT_FOUND}, same as for a missing booking.
     */
    public BookingResponse getBooking(Long bookingId, Long requesterId) {
        Booking booking = bookingRepository.findById(bookingId)
                .filter(b -> b.isOwnedBy(requesterId) || organizes(requesterId, b.getEventId()))
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
        return BookingResponse.from(booking);
    }

    public PageResponse<BookingResponse> listBookingsForUser(Long userId, BookingStatus status,
                                                             Integer page, Integer size) {
        Pageable pageable = pageable(page, size);
        Page<Booking> bookings = status == null
                ? bookingRepository.findByUserId(userId, pageable)
                : bookingRepository.findByUserIdAndStatus(userId, status, pageable);
        return PageResponse.from(bookings, BookingResponse::from);
    }

    public PageResponse<BookingResponse> listBookingsForEvent(Long eventId, Long organizerId, BookingStatus status,
                                                              Integer page, Integer size) {
        Pageable pageable = pageable(page, size);
        if (!organizes(organizerId, eventId)) {
            log.debug("Event bookings hidden from non-organizer: eventId={}, userId={}", eventId, organizerId);
            return PageResponse.empty(pageable.getPageNumber() + 1, pageable.getPageSize());
        }
        Page<Booking> bookings = status == null
                ? bookingRepository.findByEventId(eventId, pageable)
                : bookingRepository.findByEventIdAndStatus(eventId, status, pageable);
        return PageResponse.from(bookings, BookingResponse::from);
    }

    private boolean organizes(Long userId, Long eventId) {
        return localEventRepository.findById(eventId)
                .map(LocalEvent::getOrganizerId)
                .map(userId::equals)
                .orElse(false);
    }

    // API pages are 1-based
    private Pageable pageable(Integer page, Integer size) {
        BookingProperties.Paging paging = properties.getPaging();
        int pageNumber = page == null || page < 1 ? 1 : page;
        int pageSize = size == null || size < 1 ? paging.getDefaultSize() : Math.min(size, paging.getMaxSize());
        return PageRequest.of(pageNumber - 1, pageSize, NEWEST_FIRST);
    }
}
