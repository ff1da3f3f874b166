package com.eventix.booking.event.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Polls outbox_events and relays pending rows in id order.
 * ShedLock keeps a single relay across replicas, which also preserves per-aggregate order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxPollingPublisher {

    private static final int BATCH_SIZE = 50;
    private static final int RETENTION_DAYS = 3;

    private final OutboxEventRepository outboxEventRepository;
    private final OutboxEventPublisher outboxEventPublisher;
    private final Clock clock;

    @Scheduled(fixedDelay = 1000)
    @SchedulerLock(name = "outboxPolling", lockAtMostFor = "30s", lockAtLeastFor = "500ms")
    public void pollAndPublish() {
        List<OutboxEvent> events = outboxEventRepository.findPendingEvents(BATCH_SIZE);
        if (events.isEmpty()) {
            return;
        }

        int relayed = 0;
        for (OutboxEvent event : events) {
            if (outboxEventPublisher.relay(event)) {
                relayed++;
            }
        }
        if (relayed < events.size()) {
            log.info("Outbox poll: relayed={}, pending={}", relayed, events.size() - relayed);
        }
    }

    @Scheduled(cron = "0 0 4 * * *")
    @SchedulerLock(name = "outboxCleanup", lockAtMostFor = "5m", lockAtLeastFor = "1m")
    @Transactional
    public void cleanupPublishedEvents() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(RETENTION_DAYS);
        int deleted = outboxEventRepository.deletePublishedBefore(cutoff);
        if (deleted > 0) {
            log.info("Cleaned up {} published outbox events older than {}", deleted, cutoff);
        }
    }
}
