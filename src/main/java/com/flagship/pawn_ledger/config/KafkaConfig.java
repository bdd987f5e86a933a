package com.flagship.pawn_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for loan payment events.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.loan-payments:loan-payments}")
    private String loanPaymentsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Created on startup if missing. Events are keyed by loan id,
     * so each loan's events stay on one partition.
     */
    @Bean
    public NewTopic loanPaymentsTopic() {
        return TopicBuilder.name(loanPaymentsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
