package com.apunto.roster.service.impl;

import com.apunto.roster.domain.CharacterKey;
import com.apunto.roster.domain.GuildKey;
import com.apunto.roster.domain.IdentityResolver;
import com.apunto.roster.domain.PersistedGuild;
import com.apunto.roster.dto.CharacterUpsert;
import com.apunto.roster.dto.RemoteCharacterSummary;
import com.apunto.roster.dto.RemoteGuildSummary;
import com.apunto.roster.dto.StoredUser;
import com.apunto.roster.entity.CharacterEntity;
import com.apunto.roster.entity.GuildEntity;
import com.apunto.roster.mapper.ProfileMapper;
import com.apunto.roster.repository.CharacterRepository;
import com.apunto.roster.repository.GuildRepository;
import com.apunto.roster.repository.UserRepository;
import com.apunto.roster.service.ProfileRecordStore;
import com.apunto.roster.shared.exception.PersistenceFailedException;
import jakarta.persistence.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaProfileRecordStoreImpl implements ProfileRecordStore {

    private static final String LOG_OWNER_TRANSFERRED =
            "event=profile_sync.character.owner_transferred character={} previousOwner={} newOwner={}";
    private static final String LOG_GUILDS_UPSERTED = "event=store.guilds.upserted requested={} created={} persisted={}";
    private static final String LOG_CHARACTERS_UPSERTED = "event=store.characters.upserted ownerId={} created={} persisted={}";
    private static final String LOG_CONFLICT_RETRY = "event=store.upsert.conflict_retry operation={} err={}";

    private final UserRepository userRepository;
    private final GuildRepository guildRepository;
    private final CharacterRepository characterRepository;
    private final TransactionTemplate transactionTemplate;
    private final ProfileMapper profileMapper;

    @Override
    public Optional<StoredUser> getUser(UUID userId) {
        return guarded("users.find", () -> userRepository.findById(userId).map(profileMapper::toStoredUser));
    }

    @Override
    public Optional<StoredUser> getUserByBattlenetId(long battlenetId) {
        return guarded("users.find_by_battlenet_id",
                () -> userRepository.findByBattlenetId(battlenetId).map(profileMapper::toStoredUser));
    }

    @Override
    public List<PersistedGuild> upsertGuilds(List<RemoteGuildSummary> guilds) {
        if (guilds == null || guilds.isEmpty()) {
            return List.of();
        }

        return upsertInTransaction("guilds.upsert", () -> {
            final Map<GuildKey, GuildEntity> byKey = new LinkedHashMap<>();
            int created = 0;

            for (RemoteGuildSummary g : guilds) {
                if (g == null) continue;
                final GuildKey key = IdentityResolver.naturalKey(g);
                if (byKey.containsKey(key)) continue;

                GuildEntity entity = guildRepository
                        .findByNameAndRealmSlugAndRegion(key.name(), key.realmSlug(), key.region())
                        .orElse(null);
                if (entity == null) {
                    entity = GuildEntity.builder()
                            .name(key.name())
                            .realmSlug(key.realmSlug())
                            .region(key.region())
                            .build();
                    created++;
                }
                if (g.faction() != null && !g.faction().isBlank()) {
                    entity.setFaction(g.faction());
                }
                byKey.put(key, entity);
            }

            final List<GuildEntity> saved = guildRepository.saveAllAndFlush(byKey.values());

            final List<PersistedGuild> result = new ArrayList<>(saved.size());
            for (GuildEntity e : saved) {
                result.add(new PersistedGuild(new GuildKey(e.getName(), e.getRealmSlug(), e.getRegion()), e.getId()));
            }

            log.debug(LOG_GUILDS_UPSERTED, guilds.size(), created, result.size());
            return result;
        });
    }

    @Override
    public int upsertCharacters(UUID ownerId, List<CharacterUpsert> characters) {
        if (characters == null || characters.isEmpty()) {
            return 0;
        }

        return upsertInTransaction("characters.upsert", () -> {
            final Map<CharacterKey, CharacterEntity> byKey = new LinkedHashMap<>();
            int created = 0;

            for (CharacterUpsert row : characters) {
                if (row == null || row.character() == null) continue;
                final RemoteCharacterSummary c = row.character();
                final CharacterKey key = IdentityResolver.naturalKey(c);
                if (byKey.containsKey(key)) continue;

                CharacterEntity entity = characterRepository
                        .findByNameKeyAndRealmSlugAndRegion(key.nameKey(), key.realmSlug(), key.region())
                        .orElse(null);
                if (entity == null) {
                    entity = CharacterEntity.builder()
                            .realmSlug(key.realmSlug())
                            .region(key.region())
                            .build();
                    created++;
                } else if (entity.getUserId() != null && !entity.getUserId().equals(ownerId)) {
                    log.info(LOG_OWNER_TRANSFERRED, key, entity.getUserId(), ownerId);
                }

                // canonical casing follows the profile API
                entity.setName(c.name());
                entity.setNameKey(key.nameKey());
                entity.setUserId(ownerId);
                entity.setGuildId(row.guildId());
                entity.setLevel(c.level());
                entity.setClassId(c.classId());
                entity.setRaceId(c.raceId());

                byKey.put(key, entity);
            }

            final List<CharacterEntity> saved = characterRepository.saveAllAndFlush(byKey.values());
            log.debug(LOG_CHARACTERS_UPSERTED, ownerId, created, saved.size());
            return saved.size();
        });
    }

    @Override
    public List<CharacterKey> listCharactersByOwner(UUID ownerId) {
        return guarded("characters.list_by_owner", () -> {
            List<CharacterEntity> owned = characterRepository.findAllByUserId(ownerId);
            List<CharacterKey> keys = new ArrayList<>(owned.size());
            for (CharacterEntity e : owned) {
                keys.add(new CharacterKey(e.getName(), e.getRealmSlug(), e.getRegion()));
            }
            return keys;
        });
    }

    @Override
    public boolean deleteCharacter(UUID ownerId, CharacterKey key) {
        Integer deleted = inTransaction("characters.delete", () ->
                characterRepository.deleteOwned(ownerId, key.nameKey(), key.realmSlug(), key.region()));
        return deleted != null && deleted > 0;
    }

    /**
     * Runs an upsert batch in its own transaction. When a concurrent run inserted one of the same
     * natural keys first, the batch is rolled back and run once more: the second pass finds the
     * committed row and updates it.
     */
    private <T> T upsertInTransaction(String op, Supplier<T> work) {
        return guarded(op, () -> {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (DataIntegrityViolationException ex) {
                log.warn(LOG_CONFLICT_RETRY, op, ex.getMostSpecificCause().getMessage());
                return transactionTemplate.execute(status -> work.get());
            }
        });
    }

    private <T> T inTransaction(String op, Supplier<T> work) {
        return guarded(op, () -> transactionTemplate.execute(status -> work.get()));
    }

    private <T> T guarded(String op, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException | PersistenceException ex) {
            throw new PersistenceFailedException(
                    "Store operation failed (" + op + "): " + ex.getMessage(),
                    ex,
                    Map.of("operation", op));
        }
    }
}
