package com.pickalert.infrastructure.sleeper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pickalert.domain.model.DraftSettings;
import com.pickalert.domain.model.DraftSnapshot;
import com.pickalert.domain.model.DraftStatus;
import com.pickalert.domain.model.DraftType;
import com.pickalert.domain.model.Pick;
import com.pickalert.domain.ports.DraftFeedException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SleeperDraftMapper.
 */
class SleeperDraftMapperTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Instant OBSERVED_AT = Instant.parse("2025-08-30T18:00:00Z");

    private static final String DRAFT_JSON = """
        {
          "draft_id": "1050",
          "type": "snake",
          "status": "drafting",
          "settings": {"teams": 4, "rounds": 15, "reversal_round": 3},
          "draft_order": {"u-a": 1, "u-b": 2, "u-c": 3, "u-d": 4}
        }
        """;

    private static final String PICKS_JSON = """
        [
          {"pick_no": 1, "round": 1, "draft_slot": 1, "picked_by": "u-a", "player_id": "4046",
           "metadata": {"first_name": "Patrick", "last_name": "Mahomes", "position": "QB", "team": "KC"}},
          {"pick_no": 2, "round": 1, "draft_slot": 2, "picked_by": "u-b", "player_id": "9999",
           "metadata": {"first_name": "Free", "last_name": "Agent", "position": "", "team": null}}
        ]
        """;

    @Test
    void testMapSettings() throws Exception {
        DraftSettings settings = SleeperDraftMapper.mapSettings("1050", json(DRAFT_JSON));

        assertEquals(4, settings.teamCount());
        assertEquals(15, settings.totalRounds());
        assertEquals(3, settings.reversalRound());
        assertEquals(DraftType.SNAKE, settings.draftType());
        assertEquals(DraftStatus.DRAFTING, settings.status());
        assertEquals(Optional.of("u-c"), settings.ownerOfSlot(3));
    }

    @Test
    void testZeroReversalRoundMeansNone() throws Exception {
        JsonNode draft = json("""
            {"type": "snake", "settings": {"teams": 10, "rounds": 16, "reversal_round": 0}}
            """);

        DraftSettings settings = SleeperDraftMapper.mapSettings("1050", draft);

        assertNull(settings.reversalRound());
        assertTrue(settings.slotOwners().isEmpty());
    }

    @Test
    void testLinearDraftAndPreDraftStatus() throws Exception {
        JsonNode draft = json("""
            {"type": "linear", "status": "pre_draft", "settings": {"teams": 8, "rounds": 4}}
            """);

        DraftSettings settings = SleeperDraftMapper.mapSettings("1050", draft);

        assertEquals(DraftType.LINEAR, settings.draftType());
        assertEquals(DraftStatus.PRE_DRAFT, settings.status());
    }

    @Test
    void testTeamCountFallsBackToDraftOrder() throws Exception {
        JsonNode draft = json("""
            {"settings": {"rounds": 15}, "draft_order": {"u-a": 1, "u-b": 2, "u-c": 3}}
            """);

        assertEquals(3, SleeperDraftMapper.mapSettings("1050", draft).teamCount());
    }

    @Test
    void testMissingShapeIsMalformed() throws Exception {
        JsonNode noTeams = json("""
            {"settings": {"rounds": 15}}
            """);
        JsonNode noRounds = json("""
            {"settings": {"teams": 12}}
            """);

        assertEquals(DraftFeedException.Reason.MALFORMED,
            assertThrows(DraftFeedException.class, () -> SleeperDraftMapper.mapSettings("1050", noTeams)).getReason());
        assertThrows(DraftFeedException.class, () -> SleeperDraftMapper.mapSettings("1050", noRounds));
        assertThrows(DraftFeedException.class, () -> SleeperDraftMapper.mapSettings("1050", json("[]")));
    }

    @Test
    void testMapPicks() throws Exception {
        List<Pick> picks = SleeperDraftMapper.mapPicks("1050", json(PICKS_JSON), OBSERVED_AT);

        assertEquals(2, picks.size());
        Pick first = picks.get(0);
        assertEquals(1, first.globalIndex());
        assertEquals(1, first.round());
        assertEquals("u-a", first.pickedBy());
        assertEquals(1, first.draftSlot());
        assertEquals("Patrick Mahomes", first.player().fullName());
        assertEquals("QB", first.player().position());
        assertEquals(OBSERVED_AT, first.timestamp());

        Pick second = picks.get(1);
        assertEquals("N/A", second.player().position());
        assertEquals("N/A", second.player().team());
    }

    @Test
    void testNullPicksMeansNoPicks() throws Exception {
        assertTrue(SleeperDraftMapper.mapPicks("1050", json("null"), OBSERVED_AT).isEmpty());
        assertTrue(SleeperDraftMapper.mapPicks("1050", json("[]"), OBSERVED_AT).isEmpty());
    }

    @Test
    void testPickMissingRequiredFieldsIsMalformed() throws Exception {
        JsonNode noPickNo = json("""
            [{"round": 1, "picked_by": "u-a", "metadata": {}}]
            """);
        JsonNode noMetadata = json("""
            [{"pick_no": 1, "round": 1, "picked_by": "u-a"}]
            """);
        JsonNode noPicker = json("""
            [{"pick_no": 1, "round": 1, "picked_by": "", "metadata": {}}]
            """);
        JsonNode noRound = json("""
            [{"pick_no": 1, "picked_by": "u-a", "metadata": {}}]
            """);

        for (JsonNode picks : List.of(noPickNo, noMetadata, noPicker, noRound)) {
            DraftFeedException e = assertThrows(DraftFeedException.class,
                () -> SleeperDraftMapper.mapPicks("1050", picks, OBSERVED_AT));
            assertEquals(DraftFeedException.Reason.MALFORMED, e.getReason());
        }
        assertThrows(DraftFeedException.class,
            () -> SleeperDraftMapper.mapPicks("1050", json("{\"picks\": []}"), OBSERVED_AT));
    }

    @Test
    void testMapSnapshot() throws Exception {
        DraftSnapshot snapshot = SleeperDraftMapper.mapSnapshot("1050", json(DRAFT_JSON), json(PICKS_JSON), OBSERVED_AT);

        assertEquals("1050", snapshot.draftId());
        assertEquals(2, snapshot.pickCount());
        assertEquals(60, snapshot.settings().totalPicks());
    }

    private static JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }
}
