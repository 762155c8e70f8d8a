package com.sashkomusic.catalogingest.messaging.producer;

import com.sashkomusic.catalogingest.config.CatalogConfig;
import com.sashkomusic.catalogingest.messaging.producer.dto.TrackIngestedDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class TrackIngestedProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final CatalogConfig catalogConfig;
    static final String TOPIC = "track-ingested";

    public void send(TrackIngestedDto message) {
        if (!catalogConfig.getEvents().isEnabled()) {
            return;
        }
        log.info("Sending track ingested event to Kafka: trackId={}, tier={}", message.trackId(), message.storageTier());

        try {
            kafkaTemplate.send(TOPIC, String.valueOf(message.trackId()), message)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish track ingested event for {}: {}", message.trackId(), ex.getMessage());
                        }
                    });
        } catch (Exception e) {
            log.warn("Failed to publish track ingested event for {}: {}", message.trackId(), e.getMessage());
        }
    }
}
