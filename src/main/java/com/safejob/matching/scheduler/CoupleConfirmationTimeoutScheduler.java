package com.safejob.matching.scheduler;

import com.safejob.matching.service.CoupleCoordinator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodically withdraws couple applications whose partner did not confirm before the deadline.
 * Every pass is idempotent; a run that overlaps a confirmation loses or wins on the row itself.
 */
@Slf4j
@Component
public class CoupleConfirmationTimeoutScheduler {
    private final CoupleCoordinator coupleCoordinator;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int batchSize;
    private final int maxBatchesPerRun;

    public CoupleConfirmationTimeoutScheduler(
            CoupleCoordinator coupleCoordinator,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${couple.timeout.batch-size:500}") int batchSize,
            @Value("${couple.timeout.max-batches-per-run:20}") int maxBatchesPerRun) {
        this.coupleCoordinator = coupleCoordinator;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.batchSize = batchSize;
        this.maxBatchesPerRun = maxBatchesPerRun;
    }

    @Scheduled(fixedDelayString = "${couple.timeout.sweep-interval-ms:60000}")
    public void sweep() {
        Timer.Sample sample = Timer.start(meterRegistry);
        Instant now = Instant.now(clock);
        int total = 0;
        try {
            for (int batch = 0; batch < maxBatchesPerRun; batch++) {
                int expired = coupleCoordinator.expireOverdue(now);
                total += expired;
                if (expired < batchSize) {
                    break;
                }
            }
            if (total > 0) {
                log.info("Couple confirmation sweep expired {} applications (cutoff={})", total, now);
            } else {
                log.debug("Couple confirmation sweep found nothing to expire (cutoff={})", now);
            }
        } catch (RuntimeException e) {
            log.error("Couple confirmation sweep failed after expiring {} applications: {}", total, e.getMessage(), e);
            meterRegistry.counter("couple_timeout_sweep_failures").increment();
        } finally {
            sample.stop(meterRegistry.timer("couple_timeout_sweep_duration"));
        }
    }
}
