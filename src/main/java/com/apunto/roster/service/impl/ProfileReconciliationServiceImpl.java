package com.apunto.roster.service.impl;

import com.apunto.roster.domain.CharacterKey;
import com.apunto.roster.domain.GuildKey;
import com.apunto.roster.domain.IdentityResolver;
import com.apunto.roster.dto.CharacterUpsert;
import com.apunto.roster.dto.ReconciliationResult;
import com.apunto.roster.dto.RemoteCharacterSummary;
import com.apunto.roster.dto.RemoteGuildSummary;
import com.apunto.roster.dto.StoredUser;
import com.apunto.roster.service.ProfileReconciliationService;
import com.apunto.roster.service.ProfileRecordStore;
import com.apunto.roster.service.RemoteProfileService;
import com.apunto.roster.service.UserLockService;
import com.apunto.roster.shared.exception.EngineException;
import com.apunto.roster.shared.exception.PersistenceFailedException;
import com.apunto.roster.shared.exception.UpstreamUnauthorizedException;
import com.apunto.roster.shared.exception.UserNotFoundException;
import com.apunto.roster.shared.util.TraceIds;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class ProfileReconciliationServiceImpl implements ProfileReconciliationService {

    private static final String ERR_USER_ID_NULL = "userId no puede ser null";

    private static final String LOG_START = "event=profile_sync.start userId={} battletag={}";
    private static final String LOG_ROSTER = "event=profile_sync.roster userId={} characters={}";
    private static final String LOG_GUILDS = "event=profile_sync.guilds userId={} reported={} unique={}";
    private static final String LOG_ABORTED = "event=profile_sync.aborted userId={} phase={} code={} err={}";
    private static final String LOG_ORPHAN_DELETED = "event=profile_sync.orphan.deleted userId={} character={}";
    private static final String LOG_ORPHAN_MISSING = "event=profile_sync.orphan.already_gone userId={} character={}";
    private static final String LOG_ORPHAN_DELETE_FAILED = "event=profile_sync.orphan.delete_failed userId={} character={} err={}";
    private static final String LOG_CLEANUP_SKIPPED = "event=profile_sync.cleanup.skipped userId={} err={}";
    private static final String LOG_OK = "event=profile_sync.ok userId={} characters={} guilds={} guildless={} orphansDeleted={} durationMs={}";

    private final ProfileRecordStore recordStore;
    private final RemoteProfileService remoteProfileService;
    private final CharacterDetailFetcher detailFetcher;
    private final UserLockService userLockService;
    private final Duration lockMaxWait;

    public ProfileReconciliationServiceImpl(
            ProfileRecordStore recordStore,
            RemoteProfileService remoteProfileService,
            CharacterDetailFetcher detailFetcher,
            UserLockService userLockService,
            @Value("${profile-sync.lock.max-wait:30s}") Duration lockMaxWait
    ) {
        this.recordStore = recordStore;
        this.remoteProfileService = remoteProfileService;
        this.detailFetcher = detailFetcher;
        this.userLockService = userLockService;
        this.lockMaxWait = lockMaxWait;
    }

    @Override
    public ReconciliationResult reconcile(UUID userId) {
        Objects.requireNonNull(userId, ERR_USER_ID_NULL);
        return userLockService.withUserLock(userId, lockMaxWait, () -> {
            StoredUser user = recordStore.getUser(userId)
                    .orElseThrow(() -> new UserNotFoundException("userId", userId));
            return runWithMdc(user);
        });
    }

    @Override
    public ReconciliationResult reconcileByBattlenetId(long battlenetId) {
        StoredUser user = recordStore.getUserByBattlenetId(battlenetId)
                .orElseThrow(() -> new UserNotFoundException("battlenetId", battlenetId));
        return reconcile(user.id());
    }

    private ReconciliationResult runWithMdc(StoredUser user) {
        final String previous = MDC.get(TraceIds.USER_ID);
        MDC.put(TraceIds.USER_ID, user.id().toString());
        try {
            return run(user);
        } finally {
            if (previous != null) MDC.put(TraceIds.USER_ID, previous);
            else MDC.remove(TraceIds.USER_ID);
        }
    }

    private ReconciliationResult run(StoredUser user) {
        final long startNs = System.nanoTime();
        final UUID userId = user.id();
        log.info(LOG_START, userId, user.battletag());

        if (!user.hasToken()) {
            log.warn(LOG_ABORTED, userId, "token", "UPSTREAM_UNAUTHORIZED", "no_stored_token");
            throw new UpstreamUnauthorizedException("No access token stored for user.", Map.of("userId", userId.toString()));
        }

        final List<RemoteCharacterSummary> roster;
        try {
            roster = IdentityResolver.dedupeCharacters(remoteProfileService.fetchAccountRoster(user.accessToken()));
        } catch (EngineException ex) {
            log.warn(LOG_ABORTED, userId, "roster", ex.getErrorCode(), ex.getMessage());
            throw ex;
        }
        log.debug(LOG_ROSTER, userId, roster.size());

        final Map<CharacterKey, Optional<RemoteGuildSummary>> guildByCharacter =
                detailFetcher.fetchGuilds(user.accessToken(), roster);

        final Map<GuildKey, UUID> guildIds = upsertGuilds(userId, guildByCharacter);

        int guildless = 0;
        final List<CharacterUpsert> rows = new ArrayList<>(roster.size());
        for (RemoteCharacterSummary c : roster) {
            final UUID guildId = resolveGuildId(c, guildByCharacter, guildIds);
            if (guildId == null) guildless++;
            rows.add(new CharacterUpsert(c, guildId));
        }

        int written = 0;
        if (!rows.isEmpty()) {
            try {
                written = recordStore.upsertCharacters(userId, rows);
            } catch (PersistenceFailedException ex) {
                log.warn(LOG_ABORTED, userId, "characters", ex.getErrorCode(), ex.getMessage());
                throw ex;
            }
        }

        final int orphansDeleted = removeOrphans(userId, IdentityResolver.rosterKeys(roster));

        final long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        log.info(LOG_OK, userId, written, guildIds.size(), guildless, orphansDeleted, durationMs);

        return new ReconciliationResult(userId, user.battletag(), written);
    }

    private Map<GuildKey, UUID> upsertGuilds(UUID userId,
                                             Map<CharacterKey, Optional<RemoteGuildSummary>> guildByCharacter) {
        final List<RemoteGuildSummary> reported = new ArrayList<>();
        for (Optional<RemoteGuildSummary> g : guildByCharacter.values()) {
            g.ifPresent(reported::add);
        }

        final List<RemoteGuildSummary> unique = IdentityResolver.dedupeGuilds(reported);
        log.debug(LOG_GUILDS, userId, reported.size(), unique.size());
        if (unique.isEmpty()) {
            return Map.of();
        }

        try {
            return IdentityResolver.buildGuildIdMap(recordStore.upsertGuilds(unique));
        } catch (PersistenceFailedException ex) {
            log.warn(LOG_ABORTED, userId, "guilds", ex.getErrorCode(), ex.getMessage());
            throw ex;
        } catch (IllegalStateException ex) {
            log.warn(LOG_ABORTED, userId, "guilds", "PERSISTENCE_FAILED", ex.getMessage());
            throw new PersistenceFailedException("Guild upsert returned conflicting ids.", ex);
        }
    }

    /**
     * Guild of a character comes only from that character's own profile lookup.
     */
    private UUID resolveGuildId(RemoteCharacterSummary character,
                                Map<CharacterKey, Optional<RemoteGuildSummary>> guildByCharacter,
                                Map<GuildKey, UUID> guildIds) {
        final Optional<RemoteGuildSummary> guild =
                guildByCharacter.getOrDefault(IdentityResolver.naturalKey(character), Optional.empty());
        if (guild.isEmpty()) {
            return null;
        }

        final GuildKey key = IdentityResolver.naturalKey(guild.get());
        final UUID id = guildIds.get(key);
        if (id == null) {
            throw new PersistenceFailedException(
                    "Guild " + key + " missing from upsert result.",
                    null,
                    Map.of("guild", key.toString(), "character", IdentityResolver.naturalKey(character).toString()));
        }
        return id;
    }

    private int removeOrphans(UUID userId, Set<CharacterKey> current) {
        final List<CharacterKey> owned;
        try {
            owned = recordStore.listCharactersByOwner(userId);
        } catch (RuntimeException ex) {
            log.warn(LOG_CLEANUP_SKIPPED, userId, ex.toString());
            return 0;
        }

        int deleted = 0;
        for (CharacterKey key : owned) {
            if (current.contains(key)) continue;

            try {
                if (recordStore.deleteCharacter(userId, key)) {
                    deleted++;
                    log.info(LOG_ORPHAN_DELETED, userId, key);
                } else {
                    log.debug(LOG_ORPHAN_MISSING, userId, key);
                }
            } catch (RuntimeException ex) {
                log.warn(LOG_ORPHAN_DELETE_FAILED, userId, key, ex.toString());
            }
        }
        return deleted;
    }
}
