package com.eventix.booking.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Replica of a catalog ticket type. {@code reserved} is owned by InventoryLedger and
 * never written through JPA.
 */
@Entity
@Table(name = "ticket_types")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TicketType implements Persistable<Long> {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long eventId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, updatable = false)
    private int capacity;

    @Column(nullable = false, insertable = false, updatable = false)
    private int reserved;

    @Column(nullable = false)
    private LocalDateTime syncedAt;

    @Transient
    private boolean isNew = true;

    public TicketType(Long id, Long eventId, String name, BigDecimal price, int capacity) {
        this.id = id;
        this.eventId = eventId;
        this.name = name;
        this.price = price;
        this.capacity = capacity;
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

    public void updateFrom(String name, BigDecimal price) {
        this.name = name;
        this.price = price;
        this.syncedAt = LocalDateTime.now();
    }
}
