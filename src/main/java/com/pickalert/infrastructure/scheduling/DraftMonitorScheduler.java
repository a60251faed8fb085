package com.pickalert.infrastructure.scheduling;

import com.pickalert.application.usecase.PollRegisteredDraftsUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers one poll of all registered drafts per tick.
 * Uses a fixed delay so a slow tick never overlaps the next one, which keeps cycles for the same draft sequential.
 */
@Component
@ConditionalOnProperty(name = "draft-monitor.enabled", havingValue = "true", matchIfMissing = true)
public class DraftMonitorScheduler {

    private static final Logger logger = LoggerFactory.getLogger(DraftMonitorScheduler.class);

    private final PollRegisteredDraftsUseCase pollRegisteredDraftsUseCase;

    public DraftMonitorScheduler(PollRegisteredDraftsUseCase pollRegisteredDraftsUseCase) {
        this.pollRegisteredDraftsUseCase = pollRegisteredDraftsUseCase;
    }

    @Scheduled(
        fixedDelayString = "${draft-monitor.poll-interval-ms:60000}",
        initialDelayString = "${draft-monitor.initial-delay-ms:10000}"
    )
    public void pollDrafts() {
        try {
            pollRegisteredDraftsUseCase.execute();
        } catch (Exception e) {
            logger.error("Draft poll tick failed", e);
        }
    }
}
