package com.pickalert.infrastructure.sleeper;

import com.fasterxml.jackson.databind.JsonNode;
import com.pickalert.domain.model.DraftSnapshot;
import com.pickalert.domain.ports.DraftFeedClient;
import com.pickalert.domain.ports.DraftFeedException;
import com.pickalert.infrastructure.http.HttpClientUtil;
import com.pickalert.infrastructure.http.HttpStatusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Draft feed backed by the public Sleeper API.
 * See https://docs.sleeper.com/#drafts
 */
@Component
public class SleeperDraftFeedClient implements DraftFeedClient {

    private static final Logger logger = LoggerFactory.getLogger(SleeperDraftFeedClient.class);

    private static final Pattern DRAFT_ID_PATTERN = Pattern.compile("[0-9A-Za-z]+");

    private static final Map<String, String> HEADERS = Map.of(
        "accept", "application/json"
    );

    private final String baseUrl;

    public SleeperDraftFeedClient(@Value("${sleeper.api.base-url:https://api.sleeper.app/v1}") String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public DraftSnapshot fetch(String draftId) throws DraftFeedException {
        // Ids go into the URL path as-is
        if (draftId == null || !DRAFT_ID_PATTERN.matcher(draftId).matches()) {
            throw DraftFeedException.invalidId(draftId);
        }
        JsonNode draft = request(draftId, "/draft/" + draftId);
        // Sleeper answers 200 with a null body for unknown drafts
        if (draft == null || draft.isNull()) {
            throw DraftFeedException.notFound(draftId);
        }
        JsonNode picks = request(draftId, "/draft/" + draftId + "/picks");

        DraftSnapshot snapshot = SleeperDraftMapper.mapSnapshot(draftId, draft, picks, Instant.now());
        logger.debug("Fetched draft {} with {} picks", draftId, snapshot.pickCount());
        return snapshot;
    }

    private JsonNode request(String draftId, String endpoint) throws DraftFeedException {
        String url = baseUrl + endpoint;
        try {
            return HttpClientUtil.getJson(url, HEADERS);
        } catch (HttpStatusException e) {
            if (e.getStatusCode() == 404) {
                throw DraftFeedException.notFound(draftId);
            }
            throw DraftFeedException.unavailable(draftId, e);
        } catch (IOException e) {
            logger.error("Error fetching from {}", url, e);
            throw DraftFeedException.unavailable(draftId, e);
        }
    }
}
