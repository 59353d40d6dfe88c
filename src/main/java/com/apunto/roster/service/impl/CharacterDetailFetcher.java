package com.apunto.roster.service.impl;

import com.apunto.roster.domain.CharacterKey;
import com.apunto.roster.domain.IdentityResolver;
import com.apunto.roster.dto.RemoteCharacterSummary;
import com.apunto.roster.dto.RemoteGuildSummary;
import com.apunto.roster.service.RemoteProfileService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the per-character profile lookups of one sync and keys each result by the character it
 * belongs to. A failed lookup only affects its own character.
 */
@Slf4j
@Component
public class CharacterDetailFetcher {

    private static final String LOG_DETAIL_DEGRADED = "event=profile_sync.detail.degraded character={} err={}";
    private static final String LOG_DETAIL_REJECTED = "event=profile_sync.detail.rejected character={} err={}";

    private final RemoteProfileService remoteProfileService;
    private final Executor executor;
    private final int concurrency;

    public CharacterDetailFetcher(
            RemoteProfileService remoteProfileService,
            @Qualifier("detailFetchExecutor") Executor executor,
            @Value("${profile-sync.detail-fetch.concurrency:1}") int concurrency
    ) {
        this.remoteProfileService = remoteProfileService;
        this.executor = executor;
        this.concurrency = Math.max(1, concurrency);
    }

    /**
     * @return roster order preserved; every roster character has an entry, empty when guild is unknown
     */
    public Map<CharacterKey, Optional<RemoteGuildSummary>> fetchGuilds(String accessToken,
                                                                       List<RemoteCharacterSummary> roster) {
        final Map<CharacterKey, Optional<RemoteGuildSummary>> guilds = new LinkedHashMap<>();
        if (roster == null || roster.isEmpty()) {
            return guilds;
        }

        if (concurrency == 1 || roster.size() == 1) {
            for (RemoteCharacterSummary c : roster) {
                guilds.putIfAbsent(IdentityResolver.naturalKey(c), fetchOne(accessToken, c));
            }
            return guilds;
        }

        final List<CompletableFuture<Optional<RemoteGuildSummary>>> pending = new ArrayList<>(roster.size());
        for (RemoteCharacterSummary c : roster) {
            pending.add(submit(accessToken, c));
        }
        for (int i = 0; i < roster.size(); i++) {
            guilds.putIfAbsent(IdentityResolver.naturalKey(roster.get(i)), pending.get(i).join());
        }
        return guilds;
    }

    private CompletableFuture<Optional<RemoteGuildSummary>> submit(String accessToken,
                                                                   RemoteCharacterSummary character) {
        try {
            return CompletableFuture.supplyAsync(() -> fetchOne(accessToken, character), executor);
        } catch (RejectedExecutionException ex) {
            log.warn(LOG_DETAIL_REJECTED, IdentityResolver.naturalKey(character), ex.toString());
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    private Optional<RemoteGuildSummary> fetchOne(String accessToken, RemoteCharacterSummary character) {
        try {
            Optional<RemoteGuildSummary> guild =
                    remoteProfileService.fetchCharacterDetail(accessToken, character.realmSlug(), character.name());
            return guild == null ? Optional.empty() : guild;
        } catch (RuntimeException ex) {
            log.warn(LOG_DETAIL_DEGRADED, IdentityResolver.naturalKey(character), ex.toString());
            return Optional.empty();
        }
    }
}
