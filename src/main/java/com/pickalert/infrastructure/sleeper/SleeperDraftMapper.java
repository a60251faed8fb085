package com.pickalert.infrastructure.sleeper;

import com.fasterxml.jackson.databind.JsonNode;
import com.pickalert.domain.model.DraftSettings;
import com.pickalert.domain.model.DraftSnapshot;
import com.pickalert.domain.model.DraftStatus;
import com.pickalert.domain.model.DraftType;
import com.pickalert.domain.model.Pick;
import com.pickalert.domain.model.PlayerDescriptor;
import com.pickalert.domain.ports.DraftFeedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Maps Sleeper draft and pick payloads to domain types.
 * Records missing a field the monitor depends on are rejected here instead of being passed inward.
 */
public class SleeperDraftMapper {

    private SleeperDraftMapper() {
    }

    /**
     * Maps a Sleeper {@code /draft/{id}} payload to settings.
     *
     * <p>Team count comes from {@code settings.teams}, or from the size of {@code draft_order}
     * when the former is missing. A {@code reversal_round} of 0 means no reversal.</p>
     */
    public static DraftSettings mapSettings(String draftId, JsonNode draft) throws DraftFeedException {
        if (draft == null || !draft.isObject()) {
            throw DraftFeedException.malformed(draftId, "draft payload is not an object");
        }

        JsonNode settings = draft.path("settings");
        Map<Integer, String> slotOwners = mapDraftOrder(draft.path("draft_order"));

        int teamCount = settings.path("teams").asInt(0);
        if (teamCount <= 0) {
            teamCount = slotOwners.size();
        }
        if (teamCount <= 0) {
            throw DraftFeedException.malformed(draftId, "team count is missing");
        }

        int rounds = settings.path("rounds").asInt(0);
        if (rounds <= 0) {
            throw DraftFeedException.malformed(draftId, "round count is missing");
        }

        int reversalRound = settings.path("reversal_round").asInt(0);

        return new DraftSettings(
            teamCount,
            rounds,
            reversalRound > 0 ? reversalRound : null,
            DraftType.fromSourceKey(draft.path("type").asText(null)),
            DraftStatus.fromSourceKey(draft.path("status").asText(null)),
            slotOwners
        );
    }

    /**
     * Maps a Sleeper {@code /draft/{id}/picks} payload, keeping the feed's order.
     *
     * @param observedAt Timestamp given to every pick, Sleeper picks carry none
     */
    public static List<Pick> mapPicks(String draftId, JsonNode picks, Instant observedAt) throws DraftFeedException {
        if (picks == null || picks.isNull()) {
            return List.of();
        }
        if (!picks.isArray()) {
            throw DraftFeedException.malformed(draftId, "picks payload is not an array");
        }

        List<Pick> mapped = new ArrayList<>(picks.size());
        int position = 0;
        for (JsonNode rawPick : picks) {
            mapped.add(mapPick(draftId, rawPick, position, observedAt));
            position++;
        }
        return mapped;
    }

    public static DraftSnapshot mapSnapshot(String draftId, JsonNode draft, JsonNode picks, Instant observedAt)
            throws DraftFeedException {
        return new DraftSnapshot(draftId, mapSettings(draftId, draft), mapPicks(draftId, picks, observedAt));
    }

    private static Pick mapPick(String draftId, JsonNode rawPick, int position, Instant observedAt)
            throws DraftFeedException {
        JsonNode metadata = rawPick.path("metadata");
        String pickedBy = rawPick.path("picked_by").asText("");
        int pickNo = rawPick.path("pick_no").asInt(0);
        int round = rawPick.path("round").asInt(0);

        if (pickNo <= 0) {
            throw DraftFeedException.malformed(draftId, "pick at position " + position + " is missing pick_no");
        }
        if (!metadata.isObject() || pickedBy.isBlank() || round <= 0) {
            throw DraftFeedException.malformed(draftId,
                "pick at position " + position + " is missing required fields (metadata, picked_by, or round)");
        }

        PlayerDescriptor player = new PlayerDescriptor(
            textOrNull(rawPick, "player_id"),
            textOrNull(metadata, "first_name"),
            textOrNull(metadata, "last_name"),
            textOrNull(metadata, "position"),
            textOrNull(metadata, "team")
        );

        JsonNode draftSlot = rawPick.path("draft_slot");
        return new Pick(
            pickNo,
            round,
            pickedBy,
            draftSlot.canConvertToInt() && draftSlot.asInt() > 0 ? draftSlot.asInt() : null,
            player,
            observedAt
        );
    }

    /**
     * Sleeper's {@code draft_order} maps user id to slot; this inverts it to slot to user id.
     */
    private static Map<Integer, String> mapDraftOrder(JsonNode draftOrder) {
        Map<Integer, String> slotOwners = new HashMap<>();
        if (draftOrder == null || !draftOrder.isObject()) {
            return slotOwners;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = draftOrder.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            int slot = entry.getValue().asInt(0);
            if (slot > 0) {
                slotOwners.put(slot, entry.getKey());
            }
        }
        return slotOwners;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
