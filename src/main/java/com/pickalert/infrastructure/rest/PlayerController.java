package com.pickalert.infrastructure.rest;

import com.pickalert.domain.model.PlayerMapping;
import com.pickalert.infrastructure.persistence.MongoPlayerDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for Sleeper user to Slack member mappings.
 */
@RestController
@RequestMapping("/players")
public class PlayerController {

    private static final Logger logger = LoggerFactory.getLogger(PlayerController.class);

    private final MongoPlayerDirectory playerDirectory;

    public PlayerController(MongoPlayerDirectory playerDirectory) {
        this.playerDirectory = playerDirectory;
    }

    @PutMapping("/{externalId}")
    public ResponseEntity<PlayerMapping> save(
            @PathVariable String externalId,
            @RequestBody PlayerMappingRequest request) {
        if (request.memberId() == null || request.memberId().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        try {
            PlayerMapping mapping = playerDirectory.save(externalId, request.memberId(), request.displayName());
            logger.info("Mapped Sleeper user {} to Slack member {}", externalId, mapping.memberId());
            return ResponseEntity.ok(mapping);
        } catch (Exception e) {
            logger.error("Error saving player mapping for {}", externalId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping("/{externalId}")
    public ResponseEntity<PlayerMapping> get(@PathVariable String externalId) {
        try {
            return playerDirectory.find(externalId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (Exception e) {
            logger.error("Error loading player mapping for {}", externalId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    public record PlayerMappingRequest(String memberId, String displayName) {}
}
