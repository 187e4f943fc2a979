package com.flagship.prior_auth.observability;

import com.flagship.prior_auth.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Meters for relaying authorization updates from the outbox to Kafka.
 *
 * Backlog gauges read a snapshot taken on a schedule, so a Prometheus scrape never
 * reaches the database.
 */
@Component
@Slf4j
public class UpdateRelayMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong lagSeconds = new AtomicLong();
    private final AtomicLong parked = new AtomicLong();

    public UpdateRelayMetrics(OutboxEventRepository outboxRepository,
                              MeterRegistry meterRegistry,
                              @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.clock = Clock.systemUTC();
        this.maxRetries = maxRetries;

        Gauge.builder("updates.relay.pending", pending, AtomicLong::get)
                .description("Authorization updates written but not yet on Kafka")
                .register(meterRegistry);
        Gauge.builder("updates.relay.lag.seconds", lagSeconds, AtomicLong::get)
                .description("Age of the oldest authorization update still waiting for relay")
                .baseUnit("seconds")
                .register(meterRegistry);
        Gauge.builder("updates.relay.parked", parked, AtomicLong::get)
                .description("Authorization updates that used up their relay attempts")
                .register(meterRegistry);
    }

    /** Refreshes the backlog snapshot the gauges read. */
    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshBacklog() {
        try {
            pending.set(outboxRepository.countUnpublished());
            lagSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L));
            parked.set(outboxRepository.countByRetryCountGreaterThanEqual(maxRetries));
            log.debug("Relay backlog: pending={}, lag={}s, parked={}", pending.get(), lagSeconds.get(), parked.get());
        } catch (RuntimeException e) {
            // Gauges keep their last values until the database answers again
            log.warn("Could not refresh relay backlog: {}", e.getMessage());
        }
    }

    /** Counts an update acknowledged by Kafka. */
    public void recordRelayed(String eventType) {
        meterRegistry.counter("updates.relay.sent", "event_type", eventType, "outcome", "relayed").increment();
    }

    /** Counts a failed relay attempt. */
    public void recordRelayFailed(String eventType) {
        meterRegistry.counter("updates.relay.sent", "event_type", eventType, "outcome", "failed").increment();
    }

    /** Counts an update that used its last relay attempt. */
    public void recordParked(String eventType) {
        meterRegistry.counter("updates.relay.parked.total", "event_type", eventType).increment();
    }
}
