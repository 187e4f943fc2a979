package com.flagship.prior_auth.outbox;

import com.flagship.prior_auth.observability.UpdateRelayMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays outbox events to the authorization updates topic.
 *
 * Sends are synchronous and keyed by authorization ID, so updates for one
 * authorization stay ordered within their partition. When a send fails, the
 * authorization's later events in the same batch are held back until the next
 * poll. Events that fail {@code max-retries} times are parked in the table for
 * manual replay.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final UpdateRelayMetrics relayMetrics;

    @Value("${kafka.topic.authorization-updates:authorization-updates}")
    private String updatesTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not read pending authorization updates", e);
            return;
        }
        if (batch.isEmpty()) {
            return;
        }

        Set<UUID> blocked = new HashSet<>();
        int relayed = 0;
        for (OutboxEvent event : batch) {
            if (blocked.contains(event.getAggregateId())) {
                continue;
            }
            if (relay(event)) {
                relayed++;
            } else {
                blocked.add(event.getAggregateId());
            }
        }
        log.debug("Relayed {} of {} authorization updates; {} authorizations held back",
                relayed, batch.size(), blocked.size());
    }

    private boolean relay(OutboxEvent event) {
        String failure;
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(updatesTopic, event.getAggregateId().toString(), event.getPayload())
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            outboxService.markPublished(event.getId());
            relayMetrics.recordRelayed(event.getEventType());
            log.debug("Relayed {} for authorization {} to partition {} offset {}",
                    event.getEventType(), event.getAggregateId(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = "Interrupted while relaying";
        } catch (ExecutionException e) {
            failure = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
        } catch (TimeoutException e) {
            failure = "No broker acknowledgement within " + SEND_TIMEOUT_SECONDS + "s";
        } catch (RuntimeException e) {
            failure = e.getMessage();
        }

        log.error("Relay failed for event {} ({}) of authorization {}: {}",
                event.getId(), event.getEventType(), event.getAggregateId(), failure);
        outboxService.markFailed(event.getId(), failure);
        relayMetrics.recordRelayFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Event {} parked after {} relay attempts; authorization {} needs manual replay",
                    event.getId(), maxRetries, event.getAggregateId());
            relayMetrics.recordParked(event.getEventType());
        }
        return false;
    }

    /**
     * Runs one relay pass on the caller's thread.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
