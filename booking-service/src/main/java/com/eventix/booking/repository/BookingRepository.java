package com.eventix.booking.repository;

import com.eventix.booking.domain.Booking;
import com.eventix.booking.domain.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    /**
     * Row lock for status transitions. Whoever locks first decides the transition;
     * the other caller then sees the new status.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT b.id FROM Booking b WHERE b.status = :status AND b.paymentDeadline < :now ORDER BY b.paymentDeadline ASC")
    List<Long> findIdsByStatusAndPaymentDeadlineBefore(
            @Param("status") BookingStatus status, @Param("now") LocalDateTime now, Pageable pageable);

    Page<Booking> findByUserId(Long userId, Pageable pageable);

    Page<Booking> findByUserIdAndStatus(Long userId, BookingStatus status, Pageable pageable);

    Page<Booking> findByEventId(Long eventId, Pageable pageable);

    Page<Booking> findByEventIdAndStatus(Long eventId, BookingStatus status, Pageable pageable);

    @Query("""
            SELECT li.ticketTypeId AS ticketTypeId, SUM(li.quantity) AS quantity
            FROM BookingLineItem li
            WHERE li.booking.status IN :statuses
            GROUP BY li.ticketTypeId
            """)
    List<HeldQuantity> sumQuantitiesByTicketType(@Param("statuses") Collection<BookingStatus> statuses);

    interface HeldQuantity {
        Long getTicketTypeId();

        Long getQuantity();
    }
}
