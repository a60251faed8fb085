package com.pickalert.application.usecase;

import com.pickalert.application.monitor.CycleOutcome;
import com.pickalert.application.monitor.DraftMonitor;
import com.pickalert.domain.model.Registration;
import com.pickalert.domain.ports.OperatorAlerter;
import com.pickalert.domain.ports.RegistrationStore;
import com.pickalert.domain.ports.RegistrationStoreException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Use case for checking every registered draft once.
 * Drafts share no state, so their cycles run in parallel; each draft gets exactly one cycle per call.
 */
@Service
public class PollRegisteredDraftsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(PollRegisteredDraftsUseCase.class);

    private final DraftMonitor draftMonitor;
    private final RegistrationStore registrationStore;
    private final OperatorAlerter operatorAlerter;
    private final ExecutorService executorService;

    public PollRegisteredDraftsUseCase(
            DraftMonitor draftMonitor,
            RegistrationStore registrationStore,
            OperatorAlerter operatorAlerter,
            @Value("${draft-monitor.parallelism:4}") int parallelism) {
        this.draftMonitor = draftMonitor;
        this.registrationStore = registrationStore;
        this.operatorAlerter = operatorAlerter;
        this.executorService = Executors.newFixedThreadPool(Math.max(parallelism, 1));
    }

    /**
     * Runs one cycle for each registered draft and reports what happened.
     *
     * @return Summary of the poll
     */
    public PollSummary execute() {
        List<Registration> registrations;
        try {
            registrations = registrationStore.findAll();
        } catch (RegistrationStoreException e) {
            logger.error("Could not list registered drafts", e);
            return new PollSummary(0, 0, List.of(), Map.of("registrations", e.getMessage()));
        }

        if (registrations.isEmpty()) {
            logger.debug("No drafts registered, nothing to poll");
            return new PollSummary(0, 0, List.of(), Map.of());
        }

        logger.info("Polling {} registered drafts", registrations.size());

        List<CompletableFuture<CycleResult>> futures = registrations.stream()
            .map(Registration::draftId)
            .distinct()
            .map(draftId -> CompletableFuture.supplyAsync(() -> executeCycle(draftId), executorService))
            .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<CycleOutcome> outcomes = new ArrayList<>();
        Map<String, String> errorsByDraft = new HashMap<>();
        int picksAnnounced = 0;

        for (CompletableFuture<CycleResult> future : futures) {
            CycleResult result = future.join();
            if (result.outcome() == null) {
                errorsByDraft.put(result.draftId(), result.error());
                operatorAlerter.alert(result.draftId(), "unexpected error: " + result.error());
                continue;
            }
            CycleOutcome outcome = result.outcome();
            outcomes.add(outcome);
            if (outcome instanceof CycleOutcome.Advanced advanced) {
                picksAnnounced += advanced.notificationsSent();
            }
            if (outcome.isFailure()) {
                errorsByDraft.put(outcome.draftId(), outcome.describe());
            }
            report(outcome);
        }

        logger.info("Poll finished: {} drafts checked, {} picks announced, {} errors",
            outcomes.size(), picksAnnounced, errorsByDraft.size());
        return new PollSummary(outcomes.size(), picksAnnounced, outcomes, errorsByDraft);
    }

    /**
     * Runs one cycle for a single draft right away, reporting failures the same way a scheduled poll does.
     * Must not be called while a scheduled poll is processing the same draft.
     *
     * @throws RuntimeException if the cycle failed unexpectedly; the operator has already been alerted
     */
    public CycleOutcome checkDraft(String draftId) {
        CycleOutcome outcome;
        try {
            outcome = draftMonitor.runCycle(draftId);
        } catch (RuntimeException e) {
            logger.error("Unexpected error checking draft {}", draftId, e);
            operatorAlerter.alert(draftId, "unexpected error: " + e.getMessage());
            throw e;
        }
        report(outcome);
        return outcome;
    }

    private CycleResult executeCycle(String draftId) {
        try {
            return new CycleResult(draftId, draftMonitor.runCycle(draftId), null);
        } catch (RuntimeException e) {
            logger.error("Unexpected error checking draft {}", draftId, e);
            return new CycleResult(draftId, null, e.getMessage());
        }
    }

    private void report(CycleOutcome outcome) {
        if (outcome instanceof CycleOutcome.DataIntegrityFailure failure) {
            operatorAlerter.alert(failure.draftId(), failure.describe());
        } else if (outcome instanceof CycleOutcome.TransientFailure failure) {
            logger.warn("Draft {} will be retried next tick: {}", failure.draftId(), failure.describe());
        }
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }

    private record CycleResult(String draftId, CycleOutcome outcome, String error) {}

    public record PollSummary(
        int draftsChecked,
        int picksAnnounced,
        List<CycleOutcome> outcomes,
        Map<String, String> errors
    ) {}
}
