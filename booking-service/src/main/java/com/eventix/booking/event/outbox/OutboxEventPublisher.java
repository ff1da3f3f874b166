package com.eventix.booking.event.outbox;

import com.eventix.booking.config.BookingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends a stored booking event and records the delivery state on its outbox row.
 * A row whose state update is lost after a successful send goes out again on the next poll.
 */
@Slf4j
@Service
public class OutboxEventPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> outboxKafkaTemplate;
    private final BookingProperties.Outbox settings;

    public OutboxEventPublisher(
            OutboxEventRepository outboxEventRepository,
            @Qualifier("outboxKafkaTemplate") KafkaTemplate<String, String> outboxKafkaTemplate,
            BookingProperties properties) {
        this.outboxEventRepository = outboxEventRepository;
        this.outboxKafkaTemplate = outboxKafkaTemplate;
        this.settings = properties.getOutbox();
    }

    /**
     * @return true if the broker acknowledged the event
     */
    @Transactional
    public boolean relay(OutboxEvent event) {
        long timeoutMs = settings.getSendTimeout().toMillis();
        try {
            outboxKafkaTemplate.send(event.getTopic(), event.getPartitionKey(), event.getPayload())
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted while sending", e);
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            recordFailure(event, cause.getMessage(), cause);
            return false;
        } catch (TimeoutException e) {
            recordFailure(event, "no broker ack within " + timeoutMs + "ms", e);
            return false;
        }

        event.markPublished();
        outboxEventRepository.save(event);
        log.debug("Booking event relayed: outboxId={}, type={}, key={}",
                event.getId(), event.getEventType(), event.getPartitionKey());
        return true;
    }

    private void recordFailure(OutboxEvent event, String reason, Throwable cause) {
        boolean exhausted = event.getRetryCount() >= settings.getMaxRetries();
        if (exhausted) {
            event.markFailed(reason);
        } else {
            event.markRetrying(reason);
        }
        outboxEventRepository.save(event);

        if (exhausted) {
            log.error("Booking event parked after {} attempts: outboxId={}, type={}, reason={}",
                    settings.getMaxRetries() + 1, event.getId(), event.getEventType(), reason, cause);
        } else {
            log.warn("Booking event relay failed, attempt {}: outboxId={}, type={}, reason={}",
                    event.getRetryCount(), event.getId(), event.getEventType(), reason);
        }
    }
}
