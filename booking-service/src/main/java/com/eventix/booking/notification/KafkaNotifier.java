package com.eventix.booking.notification;

import com.eventix.booking.event.producer.ResilientKafkaPublisher;
import com.eventix.common.event.NotificationEvent;
import com.eventix.common.event.Topics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Hands notifications to the notification service over Kafka.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaNotifier implements Notifier {

    private final ResilientKafkaPublisher kafkaPublisher;

    @Override
    public void notify(Long userId, String kind, Map<String, Object> payload) {
        try {
            kafkaPublisher.publish(Topics.NOTIFICATION_REQUESTED, String.valueOf(userId),
                    new NotificationEvent(userId, kind, payload), "notification-" + kind);
        } catch (RuntimeException e) {
            log.warn("Notification not sent: userId={}, kind={}", userId, kind, e);
        }
    }
}
