package com.eventix.booking.repository;

import com.eventix.booking.domain.LocalEvent;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LocalEventRepository extends JpaRepository<LocalEvent, Long> {
}
