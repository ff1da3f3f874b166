package com.eventix.common.config;

import com.eventix.common.event.Topics;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

/**
 * Auto-creates Kafka topics with their DLTs.
 * Only activates when spring.kafka.bootstrap-servers is configured.
 */
@AutoConfiguration
@ConditionalOnClass(KafkaAdmin.class)
@ConditionalOnProperty(name = "spring.kafka.bootstrap-servers")
public class KafkaTopicConfig {

    private static final short REPLICATION_FACTOR = 1;

    @Bean
    public KafkaAdmin.NewTopics bookingTopics() {
        return topicsWithDlt(Topics.PARTITIONS_BOOKING,
                Topics.BOOKING_CREATED,
                Topics.BOOKING_AWAITING_CONFIRMATION,
                Topics.BOOKING_CONFIRMED,
                Topics.BOOKING_REJECTED,
                Topics.BOOKING_EXPIRED,
                Topics.BOOKING_CANCELED);
    }

    // -- Catalog: low frequency, large payloads --

    @Bean
    public KafkaAdmin.NewTopics catalogTopics() {
        return topicsWithDlt(Topics.PARTITIONS_CATALOG, Topics.CATALOG_EVENT_SYNCED);
    }

    @Bean
    public KafkaAdmin.NewTopics rewardsTopics() {
        return topicsWithDlt(Topics.PARTITIONS_REWARDS,
                Topics.REWARDS_COUPON_ISSUED,
                Topics.REWARDS_POINTS_GRANTED);
    }

    @Bean
    public NewTopic notificationRequestedTopic() {
        return buildTopic(Topics.NOTIFICATION_REQUESTED, Topics.PARTITIONS_NOTIFICATION);
    }

    private KafkaAdmin.NewTopics topicsWithDlt(int partitions, String... names) {
        NewTopic[] topics = new NewTopic[names.length * 2];
        for (int i = 0; i < names.length; i++) {
            topics[i * 2] = buildTopic(names[i], partitions);
            topics[i * 2 + 1] = buildTopic(Topics.dlt(names[i]), partitions);
        }
        return new KafkaAdmin.NewTopics(topics);
    }

    private NewTopic buildTopic(String name, int partitions) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(REPLICATION_FACTOR)
                .build();
    }
}
