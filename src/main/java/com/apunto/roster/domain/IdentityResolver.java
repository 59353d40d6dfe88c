package com.apunto.roster.domain;

import com.apunto.roster.dto.RemoteCharacterSummary;
import com.apunto.roster.dto.RemoteGuildSummary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Pure identity rules used by the profile sync. No I/O, no Spring.
 */
public final class IdentityResolver {

    private IdentityResolver() {
    }

    public static CharacterKey naturalKey(RemoteCharacterSummary character) {
        return new CharacterKey(character.name(), character.realmSlug(), character.region());
    }

    public static GuildKey naturalKey(RemoteGuildSummary guild) {
        return new GuildKey(guild.name(), guild.realmSlug(), guild.region());
    }

    /**
     * Collapses guilds sharing a natural key. The first occurrence wins and encounter order is kept.
     */
    public static List<RemoteGuildSummary> dedupeGuilds(Collection<RemoteGuildSummary> guilds) {
        if (guilds == null || guilds.isEmpty()) {
            return List.of();
        }
        Map<GuildKey, RemoteGuildSummary> unique = new LinkedHashMap<>();
        for (RemoteGuildSummary g : guilds) {
            if (g == null) continue;
            unique.putIfAbsent(naturalKey(g), g);
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Same contract as {@link #dedupeGuilds} for characters: duplicated roster entries count once.
     */
    public static List<RemoteCharacterSummary> dedupeCharacters(Collection<RemoteCharacterSummary> roster) {
        if (roster == null || roster.isEmpty()) {
            return List.of();
        }
        Map<CharacterKey, RemoteCharacterSummary> unique = new LinkedHashMap<>();
        for (RemoteCharacterSummary c : roster) {
            if (c == null) continue;
            unique.putIfAbsent(naturalKey(c), c);
        }
        return new ArrayList<>(unique.values());
    }

    public static Map<GuildKey, UUID> buildGuildIdMap(Collection<PersistedGuild> upserted) {
        if (upserted == null || upserted.isEmpty()) {
            return Map.of();
        }
        Map<GuildKey, UUID> ids = new HashMap<>();
        for (PersistedGuild g : upserted) {
            UUID previous = ids.putIfAbsent(g.key(), g.id());
            if (previous != null && !previous.equals(g.id())) {
                throw new IllegalStateException("guild " + g.key() + " resolved to two ids: " + previous + ", " + g.id());
            }
        }
        return ids;
    }

    public static Set<CharacterKey> rosterKeys(Collection<RemoteCharacterSummary> roster) {
        if (roster == null || roster.isEmpty()) {
            return Set.of();
        }
        Set<CharacterKey> keys = new LinkedHashSet<>();
        for (RemoteCharacterSummary c : roster) {
            if (c == null) continue;
            keys.add(naturalKey(c));
        }
        return keys;
    }
}
