package com.pickalert.application.usecase;

import com.pickalert.DraftFixtures;
import com.pickalert.domain.model.DraftSnapshot;
import com.pickalert.domain.model.Registration;
import com.pickalert.domain.ports.DraftFeedClient;
import com.pickalert.domain.ports.DraftFeedException;
import com.pickalert.domain.ports.RegistrationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RegisterDraftUseCase.
 */
class RegisterDraftUseCaseTest {

    private TestDraftFeed feed;
    private TestRegistrationStore store;
    private RegisterDraftUseCase useCase;

    @BeforeEach
    void setUp() {
        feed = new TestDraftFeed();
        store = new TestRegistrationStore();
        useCase = new RegisterDraftUseCase(feed, store);
    }

    @Test
    void testRegisterStartsFromCurrentPickCount() throws DraftFeedException {
        feed.snapshot = DraftFixtures.snapshot("draft-1", DraftFixtures.snakeWithOwners(10, 15, 3), 7);

        Registration registration = useCase.register(" draft-1 ", "C1");

        assertEquals(new Registration("draft-1", "C1", 7), registration);
        assertEquals(Optional.of(registration), store.find("draft-1"));
    }

    @Test
    void testRegisterReplacesDraftBoundToSameChannel() throws DraftFeedException {
        feed.snapshot = DraftFixtures.snapshot("draft-2", DraftFixtures.snakeWithOwners(10, 15, 3), 0);
        store.register("draft-1", "C1", 4);

        useCase.register("draft-2", "C1");

        assertTrue(store.find("draft-1").isEmpty());
        assertEquals("draft-2", store.findByChannel("C1").orElseThrow().draftId());
        assertEquals(1, useCase.list().size());
    }

    @Test
    void testRegisterUnknownDraftFails() {
        feed.failure = DraftFeedException.notFound("missing");

        DraftFeedException e = assertThrows(DraftFeedException.class, () -> useCase.register("missing", "C1"));

        assertEquals(DraftFeedException.Reason.NOT_FOUND, e.getReason());
        assertTrue(store.findAll().isEmpty());
    }

    @Test
    void testRegisterRequiresIds() {
        assertThrows(IllegalArgumentException.class, () -> useCase.register("", "C1"));
        assertThrows(IllegalArgumentException.class, () -> useCase.register("draft-1", null));
        assertEquals(0, feed.fetchCalls);
    }

    @Test
    void testUnregister() {
        store.register("draft-1", "C1", 4);

        assertTrue(useCase.unregister("draft-1"));
        assertFalse(useCase.unregister("draft-1"));
        assertTrue(useCase.list().isEmpty());
    }

    private static class TestDraftFeed implements DraftFeedClient {
        DraftSnapshot snapshot;
        DraftFeedException failure;
        int fetchCalls;

        @Override
        public DraftSnapshot fetch(String draftId) throws DraftFeedException {
            fetchCalls++;
            if (failure != null) {
                throw failure;
            }
            return snapshot;
        }
    }

    /**
     * Store that keeps one draft per channel, like the real one.
     */
    private static class TestRegistrationStore implements RegistrationStore {
        private final Map<String, Registration> registrations = new LinkedHashMap<>();

        @Override
        public Optional<Registration> find(String draftId) {
            return Optional.ofNullable(registrations.get(draftId));
        }

        @Override
        public void setLastKnownCount(String draftId, int count) {
            registrations.computeIfPresent(draftId,
                (id, current) -> new Registration(id, current.channelId(), count));
        }

        @Override
        public List<Registration> findAll() {
            return new ArrayList<>(registrations.values());
        }

        @Override
        public Optional<Registration> findByChannel(String channelId) {
            return registrations.values().stream().filter(r -> r.channelId().equals(channelId)).findFirst();
        }

        @Override
        public Registration register(String draftId, String channelId, int initialCount) {
            registrations.values().removeIf(r -> r.channelId().equals(channelId) && !r.draftId().equals(draftId));
            Registration registration = new Registration(draftId, channelId, initialCount);
            registrations.put(draftId, registration);
            return registration;
        }

        @Override
        public boolean unregister(String draftId) {
            return registrations.remove(draftId) != null;
        }
    }
}
