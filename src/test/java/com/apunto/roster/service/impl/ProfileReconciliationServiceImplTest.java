package com.apunto.roster.service.impl;

import com.apunto.roster.domain.CharacterKey;
import com.apunto.roster.dto.ReconciliationResult;
import com.apunto.roster.dto.StoredUser;
import com.apunto.roster.shared.exception.PersistenceFailedException;
import com.apunto.roster.shared.exception.UpstreamUnauthorizedException;
import com.apunto.roster.shared.exception.UpstreamUnavailableException;
import com.apunto.roster.shared.exception.UserNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ProfileReconciliationServiceImplTest {

    private InMemoryProfileRecordStore store;
    private FakeRemoteProfileService remote;
    private ProfileReconciliationServiceImpl service;
    private StoredUser user;

    @BeforeEach
    void setUp() {
        store = new InMemoryProfileRecordStore();
        remote = new FakeRemoteProfileService();
        CharacterDetailFetcher fetcher = new CharacterDetailFetcher(remote, Runnable::run, 1);
        service = new ProfileReconciliationServiceImpl(
                store, remote, fetcher, new LocalUserLockServiceImpl(), Duration.ofSeconds(5));
        user = store.addUser(1001L, "Player#1234", "token-abc");
    }

    @Test
    void reconcile_stores_character_with_its_guild() {
        remote.character("Thrall", "area-52", 70)
                .guildOf("Thrall", "area-52", "Horde Vanguard", "Horde");

        ReconciliationResult result = service.reconcile(user.id());

        assertEquals(1, result.charactersUpdated());
        assertEquals("Player#1234", result.battletag());
        assertEquals(user.id(), result.userId());

        InMemoryProfileRecordStore.GuildRow guild = store.guild("Horde Vanguard", "area-52");
        assertNotNull(guild);
        assertEquals("Horde", guild.faction);

        InMemoryProfileRecordStore.CharacterRow thrall = store.character("Thrall", "area-52");
        assertNotNull(thrall);
        assertEquals(user.id(), thrall.ownerId);
        assertEquals(guild.id, thrall.guildId);
        assertEquals(70, thrall.level);
    }

    @Test
    void reconcile_empty_roster_deletes_every_owned_character() {
        store.seedCharacter(user.id(), "A", "area-52");
        store.seedCharacter(user.id(), "B", "area-52");
        store.seedCharacter(user.id(), "C", "illidan");

        ReconciliationResult result = service.reconcile(user.id());

        assertEquals(0, result.charactersUpdated());
        assertTrue(store.ownedBy(user.id()).isEmpty());
        assertEquals(0, store.guildBatches);
        assertEquals(0, store.characterBatches);
    }

    @Test
    void reconcile_rejected_token_writes_nothing() {
        store.seedCharacter(user.id(), "Old", "area-52");
        remote.rosterFailure = new UpstreamUnauthorizedException("Access token expired or invalid.");

        assertThrows(UpstreamUnauthorizedException.class, () -> service.reconcile(user.id()));

        assertEquals(0, store.guildBatches);
        assertEquals(0, store.characterBatches);
        assertEquals(0, store.deleteCalls);
        assertNotNull(store.character("Old", "area-52"));
    }

    @Test
    void reconcile_unavailable_upstream_writes_nothing() {
        remote.rosterFailure = new UpstreamUnavailableException("Failed to fetch account profile.");

        assertThrows(UpstreamUnavailableException.class, () -> service.reconcile(user.id()));

        assertEquals(0, store.characterBatches);
        assertEquals(0, store.deleteCalls);
    }

    @Test
    void reconcile_blank_token_is_unauthorized_without_remote_calls() {
        StoredUser noToken = store.addUser(2002L, "NoToken#1", " ");

        assertThrows(UpstreamUnauthorizedException.class, () -> service.reconcile(noToken.id()));
        assertEquals(0, remote.rosterCalls.get());
    }

    @Test
    void reconcile_unknown_user_fails_with_not_found() {
        assertThrows(UserNotFoundException.class, () -> service.reconcile(UUID.randomUUID()));
        assertEquals(0, remote.rosterCalls.get());
    }

    @Test
    void reconcile_by_battlenet_id_resolves_user_first() {
        remote.character("Jaina", "area-52", 60);

        ReconciliationResult result = service.reconcileByBattlenetId(1001L);

        assertEquals(user.id(), result.userId());
        assertNotNull(store.character("Jaina", "area-52"));
        assertThrows(UserNotFoundException.class, () -> service.reconcileByBattlenetId(9999L));
    }

    @Test
    void reconcile_shared_guild_is_upserted_once() {
        remote.character("One", "area-52", 70)
                .character("Two", "area-52", 70)
                .guildOf("One", "area-52", "Alpha", "Horde")
                .guildOf("Two", "area-52", "Alpha", "Horde");

        ReconciliationResult result = service.reconcile(user.id());

        assertEquals(2, result.charactersUpdated());
        assertEquals(1, store.guilds.size());
        assertEquals(1, store.guildBatches);

        UUID alpha = store.guild("Alpha", "area-52").id;
        assertEquals(alpha, store.character("One", "area-52").guildId);
        assertEquals(alpha, store.character("Two", "area-52").guildId);
    }

    @Test
    void reconcile_is_idempotent() {
        remote.character("Thrall", "area-52", 70)
                .character("Jaina", "illidan", 65)
                .guildOf("Thrall", "area-52", "Horde Vanguard", "Horde");

        service.reconcile(user.id());
        UUID guildId = store.guild("Horde Vanguard", "area-52").id;
        int charactersAfterFirst = store.characters.size();

        ReconciliationResult second = service.reconcile(user.id());

        assertEquals(2, second.charactersUpdated());
        assertEquals(charactersAfterFirst, store.characters.size());
        assertEquals(1, store.guilds.size());
        assertEquals(guildId, store.guild("Horde Vanguard", "area-52").id);
        assertEquals(guildId, store.character("Thrall", "area-52").guildId);
        assertNull(store.character("Jaina", "illidan").guildId);
    }

    @Test
    void reconcile_guild_batch_failure_leaves_characters_untouched() {
        store.seedCharacter(user.id(), "Gone", "area-52");
        remote.character("Thrall", "area-52", 70)
                .guildOf("Thrall", "area-52", "Horde Vanguard", "Horde");
        store.failGuildBatch = true;

        assertThrows(PersistenceFailedException.class, () -> service.reconcile(user.id()));

        assertEquals(0, store.characterBatches);
        assertEquals(0, store.deleteCalls);
        assertNull(store.character("Thrall", "area-52"));
        assertNotNull(store.character("Gone", "area-52"));
    }

    @Test
    void reconcile_character_batch_failure_skips_cleanup() {
        store.seedCharacter(user.id(), "Gone", "area-52");
        remote.character("Thrall", "area-52", 70);
        store.failCharacterBatch = true;

        assertThrows(PersistenceFailedException.class, () -> service.reconcile(user.id()));

        assertEquals(0, store.deleteCalls);
        assertNotNull(store.character("Gone", "area-52"));
    }

    @Test
    void reconcile_character_that_left_its_guild_gets_null_guild() {
        remote.character("Thrall", "area-52", 70)
                .guildOf("Thrall", "area-52", "Horde Vanguard", "Horde");
        service.reconcile(user.id());
        assertNotNull(store.character("Thrall", "area-52").guildId);

        remote.guildByCharacter.clear();
        service.reconcile(user.id());

        assertNull(store.character("Thrall", "area-52").guildId);
    }

    @Test
    void reconcile_failed_detail_lookup_only_affects_that_character() {
        remote.character("One", "area-52", 70)
                .character("Two", "area-52", 70)
                .guildOf("One", "area-52", "Alpha", "Horde")
                .guildOf("Two", "area-52", "Beta", "Horde");
        remote.failingDetails.add(FakeRemoteProfileService.key("area-52", "Two"));

        ReconciliationResult result = service.reconcile(user.id());

        assertEquals(2, result.charactersUpdated());
        assertEquals(store.guild("Alpha", "area-52").id, store.character("One", "area-52").guildId);
        assertNull(store.character("Two", "area-52").guildId);
        assertNull(store.guild("Beta", "area-52"));
    }

    @Test
    void reconcile_cleanup_never_touches_other_owners() {
        StoredUser other = store.addUser(3003L, "Other#1", "token-other");
        store.seedCharacter(other.id(), "Sylvanas", "area-52");
        store.seedCharacter(user.id(), "Orphan", "area-52");
        remote.character("Thrall", "area-52", 70);

        service.reconcile(user.id());

        assertNull(store.character("Orphan", "area-52"));
        InMemoryProfileRecordStore.CharacterRow sylvanas = store.character("Sylvanas", "area-52");
        assertNotNull(sylvanas);
        assertEquals(other.id(), sylvanas.ownerId);
    }

    @Test
    void reconcile_keeps_characters_whose_name_only_changed_case() {
        store.seedCharacter(user.id(), "thrall", "area-52");
        remote.character("Thrall", "area-52", 70);

        service.reconcile(user.id());

        assertEquals(1, store.ownedBy(user.id()).size());
        assertEquals("Thrall", store.character("Thrall", "area-52").name);
        assertEquals(0, store.deleteCalls);
    }

    @Test
    void reconcile_ignores_failed_orphan_delete() {
        store.seedCharacter(user.id(), "Stuck", "area-52");
        store.seedCharacter(user.id(), "Gone", "area-52");
        store.failDeleteFor.add(new CharacterKey("Stuck", "area-52", "us"));
        remote.character("Thrall", "area-52", 70);

        ReconciliationResult result = service.reconcile(user.id());

        assertEquals(1, result.charactersUpdated());
        assertNotNull(store.character("Stuck", "area-52"));
        assertNull(store.character("Gone", "area-52"));
    }

    @Test
    void reconcile_skips_cleanup_when_owned_characters_cannot_be_read() {
        store.seedCharacter(user.id(), "Orphan", "area-52");
        store.failListByOwner = true;
        remote.character("Thrall", "area-52", 70);

        ReconciliationResult result = service.reconcile(user.id());

        assertEquals(1, result.charactersUpdated());
        assertNotNull(store.character("Orphan", "area-52"));
    }

    @Test
    void reconcile_takes_over_character_owned_by_another_user() {
        StoredUser previous = store.addUser(4004L, "Prev#1", "token-prev");
        store.seedCharacter(previous.id(), "Thrall", "area-52");
        remote.character("Thrall", "area-52", 70);

        service.reconcile(user.id());

        assertEquals(user.id(), store.character("Thrall", "area-52").ownerId);
        assertTrue(store.ownedBy(previous.id()).isEmpty());
    }

    @Test
    void reconcile_runs_for_same_user_never_overlap() throws Exception {
        remote.character("Thrall", "area-52", 70);
        remote.rosterDelayMs = 150;

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<ReconciliationResult> a = pool.submit(() -> service.reconcile(user.id()));
            Future<ReconciliationResult> b = pool.submit(() -> service.reconcile(user.id()));

            assertEquals(1, a.get().charactersUpdated());
            assertEquals(1, b.get().charactersUpdated());
        } finally {
            pool.shutdownNow();
        }

        assertEquals(2, remote.rosterCalls.get());
        assertEquals(1, remote.maxRosterInFlight.get());
        assertEquals(1, store.characters.size());
    }

    @Test
    void reconcile_null_user_id_is_rejected() {
        assertThrows(NullPointerException.class, () -> service.reconcile(null));
        assertEquals(0, remote.rosterCalls.get());
    }
}
