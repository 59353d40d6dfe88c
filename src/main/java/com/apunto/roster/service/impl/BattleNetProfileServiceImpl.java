package com.apunto.roster.service.impl;

import com.apunto.roster.client.BattleNetProfileClient;
import com.apunto.roster.config.BattleNetProperties;
import com.apunto.roster.dto.RemoteCharacterSummary;
import com.apunto.roster.dto.RemoteGuildSummary;
import com.apunto.roster.dto.client.AccountProfileClientResponse;
import com.apunto.roster.dto.client.CharacterProfileClientResponse;
import com.apunto.roster.mapper.ProfileMapper;
import com.apunto.roster.service.RemoteProfileService;
import com.apunto.roster.shared.exception.UpstreamUnauthorizedException;
import com.apunto.roster.shared.exception.UpstreamUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BattleNetProfileServiceImpl implements RemoteProfileService {

    private static final String BEARER = "Bearer ";

    private static final String LOG_ROSTER_OK = "event=battlenet.roster.ok accounts={} characters={} skipped={}";
    private static final String LOG_ROSTER_SKIP = "event=battlenet.roster.skip_entry reason={} characterId={}";
    private static final String LOG_ROSTER_FAILED = "event=battlenet.roster.failed status={} err={}";
    private static final String LOG_DETAIL_NO_GUILD = "event=battlenet.detail.no_guild realm={} name={}";
    private static final String LOG_DETAIL_INCOMPLETE_GUILD = "event=battlenet.detail.incomplete_guild realm={} name={} guildName={}";
    private static final String LOG_DETAIL_FAILED = "event=battlenet.detail.failed realm={} name={} status={} err={}";

    private final BattleNetProfileClient client;
    private final BattleNetProperties properties;
    private final ProfileMapper profileMapper;

    @Override
    public List<RemoteCharacterSummary> fetchAccountRoster(String accessToken) {
        final AccountProfileClientResponse account;
        try {
            account = client.accountProfile(BEARER + accessToken, properties.profileNamespace(), properties.getLocale());
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            log.warn(LOG_ROSTER_FAILED, status, ex.getMessage());
            if (status == HttpStatus.UNAUTHORIZED.value()) {
                throw new UpstreamUnauthorizedException("Access token expired or invalid.", ex);
            }
            throw new UpstreamUnavailableException("Failed to fetch account profile.", ex, Map.of("status", status));
        } catch (ResourceAccessException ex) {
            log.warn(LOG_ROSTER_FAILED, "io", ex.getMessage());
            throw new UpstreamUnavailableException("Failed to fetch account profile.", ex);
        } catch (RestClientException ex) {
            log.warn(LOG_ROSTER_FAILED, "decode", ex.getMessage());
            throw new UpstreamUnavailableException("Failed to decode account profile.", ex);
        }

        if (account == null) {
            throw new UpstreamUnavailableException("Empty account profile response.");
        }

        return flatten(account);
    }

    @Override
    public Optional<RemoteGuildSummary> fetchCharacterDetail(String accessToken, String realmSlug, String characterName) {
        final CharacterProfileClientResponse profile;
        try {
            profile = client.characterProfile(
                    BEARER + accessToken,
                    realmSlug,
                    characterName.toLowerCase(Locale.ROOT),
                    properties.profileNamespace(),
                    properties.getLocale()
            );
        } catch (RestClientResponseException ex) {
            log.warn(LOG_DETAIL_FAILED, realmSlug, characterName, ex.getStatusCode().value(), ex.getMessage());
            return Optional.empty();
        } catch (RuntimeException ex) {
            log.warn(LOG_DETAIL_FAILED, realmSlug, characterName, "error", ex.toString());
            return Optional.empty();
        }

        if (profile == null || profile.getGuild() == null) {
            log.debug(LOG_DETAIL_NO_GUILD, realmSlug, characterName);
            return Optional.empty();
        }

        CharacterProfileClientResponse.GuildRefDto guild = profile.getGuild();
        if (isBlank(guild.getName()) || guild.getRealm() == null || isBlank(guild.getRealm().getSlug())) {
            log.warn(LOG_DETAIL_INCOMPLETE_GUILD, realmSlug, characterName, guild.getName());
            return Optional.empty();
        }

        return Optional.of(profileMapper.toGuildSummary(guild, properties.getRegion()));
    }

    private List<RemoteCharacterSummary> flatten(AccountProfileClientResponse account) {
        List<AccountProfileClientResponse.WowAccountDto> wowAccounts =
                account.getWowAccounts() == null ? List.of() : account.getWowAccounts();

        List<RemoteCharacterSummary> roster = new ArrayList<>();
        int skipped = 0;

        for (AccountProfileClientResponse.WowAccountDto wowAccount : wowAccounts) {
            if (wowAccount == null || wowAccount.getCharacters() == null) continue;

            for (AccountProfileClientResponse.CharacterDto character : wowAccount.getCharacters()) {
                if (character == null) continue;

                if (isBlank(character.getName())) {
                    log.warn(LOG_ROSTER_SKIP, "name_blank", character.getId());
                    skipped++;
                    continue;
                }
                if (character.getRealm() == null || isBlank(character.getRealm().getSlug())) {
                    log.warn(LOG_ROSTER_SKIP, "realm_missing", character.getId());
                    skipped++;
                    continue;
                }

                roster.add(profileMapper.toCharacterSummary(character, properties.getRegion()));
            }
        }

        log.debug(LOG_ROSTER_OK, wowAccounts.size(), roster.size(), skipped);
        return roster;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
