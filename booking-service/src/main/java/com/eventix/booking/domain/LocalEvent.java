package com.eventix.booking.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Local replica of a catalog event, synced via Kafka.
 * The seat budget is only written on insert; later changes and the booked-seat
 * counter go through InventoryLedger.
 */
@Entity
@Table(name = "local_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LocalEvent implements Persistable<Long> {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long organizerId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false)
    private LocalDateTime startDate;

    @Column(nullable = false)
    private boolean published;

    @Column(nullable = false, updatable = false)
    private int availableSeats;

    @Column(nullable = false, insertable = false, updatable = false)
    private int bookedSeats;

    @Column(nullable = false)
    private LocalDateTime syncedAt;

    @Transient
    private boolean isNew = true;

    public LocalEvent(Long id, Long organizerId, String title, LocalDateTime startDate,
                      boolean published, int availableSeats) {
        this.id = id;
        this.organizerId = organizerId;
        this.title = title;
        this.startDate = startDate;
        this.published = published;
        this.availableSeats = availableSeats;
        this.syncedAt = LocalDateTime.now();
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PrePersist
    void markNotNew() {
        this.isNew = false;
    }

    public void updateFrom(Long organizerId, String title, LocalDateTime startDate, boolean published) {
        this.organizerId = organizerId;
        this.title = title;
        this.startDate = startDate;
        this.published = published;
        this.syncedAt = LocalDateTime.now();
    }
}
