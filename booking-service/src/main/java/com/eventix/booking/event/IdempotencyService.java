package com.eventix.booking.event;

import com.eventix.common.event.DomainEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Kafka consumer deduplication keyed on {@link DomainEvent#getEventId()}.
 * Must be called inside the consumer's transaction so the marker commits with the work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private final ProcessedEventRepository processedEventRepository;

    /**
     * Returns true if the event was already processed and should be skipped.
     */
    public boolean isDuplicate(DomainEvent event) {
        if (event.getEventId() == null) {
            return false;
        }
        return processedEventRepository.existsById(event.getEventId());
    }

    /**
     * Records the event as processed. A concurrent duplicate fails here on the primary key
     * and its whole transaction rolls back; the redelivery is then skipped by {@link #isDuplicate}.
     */
    public void markProcessed(DomainEvent event, String topic) {
        if (event.getEventId() == null) {
            log.warn("Event without id processed without dedup marker: type={}, topic={}",
                    event.getEventType(), topic);
            return;
        }
        processedEventRepository.saveAndFlush(
                new ProcessedEvent(event.getEventId(), topic, event.getEventType()));
    }
}
