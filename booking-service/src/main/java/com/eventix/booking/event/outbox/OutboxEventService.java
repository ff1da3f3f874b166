package com.eventix.booking.event.outbox;

import com.eventix.common.event.DomainEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Saves events to the outbox table within the caller's transaction.
 * Must be called inside an open unit of work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    public void save(String aggregateType, String aggregateId,
                     String topic, String partitionKey, DomainEvent event) {
        OutboxEvent outboxEvent = new OutboxEvent(
                aggregateType, aggregateId, event.getEventType(),
                topic, partitionKey, serialize(event));

        outboxEventRepository.save(outboxEvent);
        log.debug("Outbox event saved: type={}, topic={}, aggregateId={}",
                event.getEventType(), topic, aggregateId);
    }

    private String serialize(DomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize outbox event " + event.getEventType(), e);
        }
    }
}
