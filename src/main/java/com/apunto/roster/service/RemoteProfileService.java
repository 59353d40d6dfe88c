package com.apunto.roster.service;

import com.apunto.roster.dto.RemoteCharacterSummary;
import com.apunto.roster.dto.RemoteGuildSummary;

import java.util.List;
import java.util.Optional;

public interface RemoteProfileService {

    /**
     * Lista plana de personajes de todas las wow_accounts de la cuenta.
     *
     * @throws com.apunto.roster.shared.exception.UpstreamUnauthorizedException token rechazado (401)
     * @throws com.apunto.roster.shared.exception.UpstreamUnavailableException cualquier otro fallo remoto
     */
    List<RemoteCharacterSummary> fetchAccountRoster(String accessToken);

    /**
     * Guild of one character. Empty when the character has no guild or when the lookup itself failed;
     * never throws.
     */
    Optional<RemoteGuildSummary> fetchCharacterDetail(String accessToken, String realmSlug, String characterName);
}
