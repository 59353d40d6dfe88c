package com.apunto.roster.service;

import com.apunto.roster.domain.CharacterKey;
import com.apunto.roster.domain.PersistedGuild;
import com.apunto.roster.dto.CharacterUpsert;
import com.apunto.roster.dto.RemoteGuildSummary;
import com.apunto.roster.dto.StoredUser;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary of the profile sync over {@code users}, {@code guilds} and {@code characters}.
 *
 * <p>Batch writes are all-or-nothing: they either commit every row or throw
 * {@link com.apunto.roster.shared.exception.PersistenceFailedException} with nothing committed.
 */
public interface ProfileRecordStore {

    Optional<StoredUser> getUser(UUID userId);

    Optional<StoredUser> getUserByBattlenetId(long battlenetId);

    /**
     * Insert-or-update por (name, realm_slug, region). Devuelve una fila por clave única.
     */
    List<PersistedGuild> upsertGuilds(List<RemoteGuildSummary> guilds);

    /**
     * Insert-or-update por (name sin mayúsculas, realm_slug, region), asignando el dueño.
     *
     * @return filas escritas
     */
    int upsertCharacters(UUID ownerId, List<CharacterUpsert> characters);

    List<CharacterKey> listCharactersByOwner(UUID ownerId);

    /**
     * Deletes the single row with {@code key} owned by {@code ownerId}.
     *
     * @return {@code true} when a row was removed
     */
    boolean deleteCharacter(UUID ownerId, CharacterKey key);
}
