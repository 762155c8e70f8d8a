package com.sashkomusic.catalogingest.messaging.producer;

import com.sashkomusic.catalogingest.config.CatalogConfig;
import com.sashkomusic.catalogingest.messaging.producer.dto.OrphanCleanupResultDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class OrphanCleanupResultProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final CatalogConfig catalogConfig;
    static final String TOPIC = "orphan-cleanup-complete";

    public void send(OrphanCleanupResultDto message) {
        if (!catalogConfig.getEvents().isEnabled()) {
            return;
        }
        log.info("Sending orphan cleanup result to Kafka: trigger={}, dryRun={}, count={}",
                message.trigger(), message.dryRun(), message.count());

        try {
            kafkaTemplate.send(TOPIC, message);
        } catch (Exception e) {
            log.warn("Failed to publish orphan cleanup result: {}", e.getMessage());
        }
    }
}
