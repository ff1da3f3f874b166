package com.eventix.booking.domain;

import com.eventix.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Created when an organizer accepts a booking. One per booking.
 */
@Entity
@Table(name = "event_attendees")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Attendance extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long eventId;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false, unique = true)
    private Long bookingId;

    @Column(nullable = false)
    private int ticketCount;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal totalPaid;

    public static Attendance of(Booking booking) {
        Attendance attendance = new Attendance();
        attendance.eventId = booking.getEventId();
        attendance.userId = booking.getUserId();
        attendance.bookingId = booking.getId();
        attendance.ticketCount = booking.getTicketCount();
        attendance.totalPaid = booking.getFinalAmount();
        return attendance;
    }
}
