package com.pickalert.infrastructure.rest;

import com.pickalert.application.monitor.CycleOutcome;
import com.pickalert.application.usecase.LastPickUseCase;
import com.pickalert.application.usecase.PollRegisteredDraftsUseCase;
import com.pickalert.application.usecase.RegisterDraftUseCase;
import com.pickalert.domain.model.Registration;
import com.pickalert.domain.ports.DraftFeedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for draft registrations and on-demand checks.
 */
@RestController
public class DraftController {

    private static final Logger logger = LoggerFactory.getLogger(DraftController.class);

    private final RegisterDraftUseCase registerDraftUseCase;
    private final PollRegisteredDraftsUseCase pollRegisteredDraftsUseCase;
    private final LastPickUseCase lastPickUseCase;

    public DraftController(
            RegisterDraftUseCase registerDraftUseCase,
            PollRegisteredDraftsUseCase pollRegisteredDraftsUseCase,
            LastPickUseCase lastPickUseCase) {
        this.registerDraftUseCase = registerDraftUseCase;
        this.pollRegisteredDraftsUseCase = pollRegisteredDraftsUseCase;
        this.lastPickUseCase = lastPickUseCase;
    }

    /**
     * PUT /drafts/{draftId}/registration
     */
    @PutMapping("/drafts/{draftId}/registration")
    public ResponseEntity<Registration> register(
            @PathVariable String draftId,
            @RequestBody RegisterDraftRequest request) {
        logger.info("Received request to register draft {} to channel {}", draftId, request.channelId());
        try {
            return ResponseEntity.ok(registerDraftUseCase.register(draftId, request.channelId()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        } catch (DraftFeedException e) {
            logger.warn("Could not register draft {}: {}", draftId, e.getMessage());
            return ResponseEntity.status(feedStatus(e)).build();
        } catch (Exception e) {
            logger.error("Error registering draft {}", draftId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @DeleteMapping("/drafts/{draftId}/registration")
    public ResponseEntity<Void> unregister(@PathVariable String draftId) {
        try {
            return registerDraftUseCase.unregister(draftId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
        } catch (Exception e) {
            logger.error("Error unregistering draft {}", draftId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping("/drafts")
    public ResponseEntity<List<Registration>> list() {
        try {
            return ResponseEntity.ok(registerDraftUseCase.list());
        } catch (Exception e) {
            logger.error("Error listing drafts", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * POST /drafts/{draftId}/check
     *
     * Runs one cycle immediately. Must not be used while a scheduled tick is processing the same draft.
     */
    @PostMapping("/drafts/{draftId}/check")
    public ResponseEntity<CycleResponse> check(@PathVariable String draftId) {
        CycleOutcome outcome;
        try {
            outcome = pollRegisteredDraftsUseCase.checkDraft(draftId);
        } catch (Exception e) {
            logger.error("Error checking draft {}", draftId, e);
            return ResponseEntity.internalServerError().build();
        }
        CycleResponse body = CycleResponse.of(outcome);
        if (outcome instanceof CycleOutcome.NotRegistered) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
        if (outcome.isFailure()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
        }
        return ResponseEntity.ok(body);
    }

    /**
     * POST /drafts/poll
     */
    @PostMapping("/drafts/poll")
    public ResponseEntity<PollRegisteredDraftsUseCase.PollSummary> poll() {
        logger.info("Received request to poll all drafts");
        try {
            return ResponseEntity.ok(pollRegisteredDraftsUseCase.execute());
        } catch (Exception e) {
            logger.error("Error polling drafts", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping("/channels/{channelId}/last-pick")
    public ResponseEntity<LastPickUseCase.LastPickResult> lastPick(@PathVariable String channelId) {
        try {
            LastPickUseCase.LastPickResult result = lastPickUseCase.execute(channelId);
            if (result.status() == LastPickUseCase.Status.NO_DRAFT_REGISTERED) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
            }
            return ResponseEntity.ok(result);
        } catch (DraftFeedException e) {
            logger.warn("Could not fetch last pick for channel {}: {}", channelId, e.getMessage());
            return ResponseEntity.status(feedStatus(e)).build();
        } catch (Exception e) {
            logger.error("Error fetching last pick for channel {}", channelId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    private static HttpStatus feedStatus(DraftFeedException e) {
        return e.getReason() == DraftFeedException.Reason.NOT_FOUND ? HttpStatus.NOT_FOUND : HttpStatus.BAD_GATEWAY;
    }

    public record RegisterDraftRequest(String channelId) {}

    public record CycleResponse(String draftId, String outcome, String detail) {

        static CycleResponse of(CycleOutcome outcome) {
            return new CycleResponse(outcome.draftId(), outcome.getClass().getSimpleName(), outcome.describe());
        }
    }
}
