package com.pickalert.domain.service;

import com.pickalert.DraftFixtures;
import com.pickalert.domain.model.DraftSettings;
import com.pickalert.domain.model.DraftStatus;
import com.pickalert.domain.model.DraftType;
import com.pickalert.domain.model.NextPickProjection;
import com.pickalert.domain.model.PickSlot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PickOrderResolver.
 */
class PickOrderResolverTest {

    @Test
    void testTeamIndexAlwaysWithinTeamCount() {
        for (DraftSettings settings : allSmallDrafts()) {
            for (int index = 1; index <= settings.totalPicks(); index++) {
                PickSlot slot = PickOrderResolver.resolve(settings, index);
                assertTrue(slot.teamIndex() >= 1 && slot.teamIndex() <= settings.teamCount(),
                    "team " + slot.teamIndex() + " out of range for " + settings + " at pick " + index);
            }
        }
    }

    @Test
    void testRoundAndSlotRoundTrip() {
        for (DraftSettings settings : allSmallDrafts()) {
            for (int round = 1; round <= settings.totalRounds(); round++) {
                for (int slot = 1; slot <= settings.teamCount(); slot++) {
                    int index = (round - 1) * settings.teamCount() + slot;
                    PickSlot resolved = PickOrderResolver.resolve(settings, index);
                    assertEquals(round, resolved.round());
                    assertEquals(slot, resolved.slotInRound());
                    assertEquals(index, resolved.globalIndex());
                }
            }
        }
    }

    @Test
    void testEveryTeamPicksOncePerRound() {
        for (DraftSettings settings : allSmallDrafts()) {
            for (int round = 1; round <= settings.totalRounds(); round++) {
                boolean[] seen = new boolean[settings.teamCount() + 1];
                for (int slot = 1; slot <= settings.teamCount(); slot++) {
                    int team = PickOrderResolver.resolve(settings, (round - 1) * settings.teamCount() + slot).teamIndex();
                    assertFalse(seen[team], "team " + team + " picked twice in round " + round);
                    seen[team] = true;
                }
            }
        }
    }

    @Test
    void testStandardSnakeAlternates() {
        DraftSettings settings = DraftSettings.snake(10, 16, null);

        assertEquals("FBFB", directions(settings, 4));
        assertEquals(1, PickOrderResolver.resolve(settings, 1).teamIndex());
        assertEquals(10, PickOrderResolver.resolve(settings, 10).teamIndex());
        assertEquals(10, PickOrderResolver.resolve(settings, 11).teamIndex());
        assertEquals(1, PickOrderResolver.resolve(settings, 20).teamIndex());
        assertEquals(1, PickOrderResolver.resolve(settings, 21).teamIndex());
    }

    @Test
    void testThirdRoundReversal() {
        DraftSettings settings = DraftSettings.snake(10, 16, 3);

        assertEquals("FBBFBF", directions(settings, 6));

        // Rounds 2 and 3 both run from slot 10 down to slot 1
        assertEquals(1, PickOrderResolver.resolve(settings, 20).teamIndex());
        assertEquals(10, PickOrderResolver.resolve(settings, 21).teamIndex());
        assertTrue(PickOrderResolver.resolve(settings, 20).reversed());
        assertTrue(PickOrderResolver.resolve(settings, 21).reversed());

        // Team 1 closes round 3 and opens round 4
        assertEquals(1, PickOrderResolver.resolve(settings, 30).teamIndex());
        assertEquals(1, PickOrderResolver.resolve(settings, 31).teamIndex());
    }

    @Test
    void testReversalOnlyShiftsPhaseOnce() {
        DraftSettings plain = DraftSettings.snake(8, 12, null);
        DraftSettings reversed = DraftSettings.snake(8, 12, 3);

        for (int round = 3; round <= 12; round++) {
            assertNotEquals(PickOrderResolver.isReversed(plain, round), PickOrderResolver.isReversed(reversed, round),
                "round " + round);
        }
        for (int round = 1; round < 3; round++) {
            assertEquals(PickOrderResolver.isReversed(plain, round), PickOrderResolver.isReversed(reversed, round));
        }
    }

    @Test
    void testLinearDraftNeverReverses() {
        DraftSettings settings = new DraftSettings(6, 5, 3, DraftType.LINEAR, DraftStatus.DRAFTING, Map.of());

        assertEquals("FFFFF", directions(settings, 5));
        assertEquals(1, PickOrderResolver.resolve(settings, 7).teamIndex());
        assertEquals(6, PickOrderResolver.resolve(settings, 12).teamIndex());
    }

    @Test
    void testOutOfRangeIndexesAreRejected() {
        DraftSettings settings = DraftSettings.snake(12, 15, 3);

        assertThrows(PickOutOfRangeException.class, () -> PickOrderResolver.resolve(settings, 0));
        assertThrows(PickOutOfRangeException.class, () -> PickOrderResolver.resolve(settings, -4));
        PickOutOfRangeException e = assertThrows(PickOutOfRangeException.class,
            () -> PickOrderResolver.resolve(settings, 181));
        assertEquals(180, e.getTotalPicks());
        assertEquals(181, e.getGlobalIndex());
        assertEquals(180, PickOrderResolver.resolve(settings, 180).globalIndex());
    }

    @Test
    void testProjectNextNamesSlotOwner() {
        DraftSettings settings = DraftFixtures.snakeWithOwners(12, 15, 3);

        NextPickProjection projection = PickOrderResolver.projectNext(settings, 25);

        assertFalse(projection.draftComplete());
        assertEquals(26, projection.slot().globalIndex());
        assertEquals(3, projection.slot().round());
        assertEquals(11, projection.slot().teamIndex());
        assertEquals("user-11", projection.ownerId());
    }

    @Test
    void testProjectNextWithoutKnownOrder() {
        DraftSettings settings = DraftSettings.snake(4, 3, null);

        NextPickProjection projection = PickOrderResolver.projectNext(settings, 0);

        assertFalse(projection.draftComplete());
        assertEquals(1, projection.slot().teamIndex());
        assertTrue(projection.owner().isEmpty());
    }

    @Test
    void testProjectNextAfterLastPickIsDraftComplete() {
        DraftSettings settings = DraftSettings.snake(12, 15, 3);

        assertTrue(PickOrderResolver.projectNext(settings, 180).draftComplete());
        assertFalse(PickOrderResolver.projectNext(settings, 179).draftComplete());
    }

    private static String directions(DraftSettings settings, int rounds) {
        StringBuilder sb = new StringBuilder();
        for (int round = 1; round <= rounds; round++) {
            PickSlot first = PickOrderResolver.resolve(settings, (round - 1) * settings.teamCount() + 1);
            sb.append(first.reversed() ? 'B' : 'F');
        }
        return sb.toString();
    }

    private static List<DraftSettings> allSmallDrafts() {
        List<DraftSettings> drafts = new ArrayList<>();
        for (int teams = 1; teams <= 14; teams++) {
            for (int rounds = 1; rounds <= 16; rounds++) {
                drafts.add(DraftSettings.snake(teams, rounds, null));
                drafts.add(new DraftSettings(teams, rounds, null, DraftType.LINEAR, DraftStatus.DRAFTING, Map.of()));
                for (int reversal = 1; reversal <= rounds; reversal++) {
                    drafts.add(DraftSettings.snake(teams, rounds, reversal));
                }
            }
        }
        return drafts;
    }
}
