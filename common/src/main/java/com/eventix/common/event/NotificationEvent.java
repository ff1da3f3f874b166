package com.eventix.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request for the notification service to tell a user about something.
 * Delivery (email, push) is decided by the consumer.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationEvent extends DomainEvent {

    public static final String TYPE = "NOTIFICATION_REQUESTED";

    private Long userId;
    private String kind;
    private Map<String, Object> payload;

    public NotificationEvent(Long userId, String kind, Map<String, Object> payload) {
        super(TYPE);
        this.userId = userId;
        this.kind = kind;
        this.payload = payload;
    }
}
