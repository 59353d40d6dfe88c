package com.apunto.roster.dto;

import java.util.UUID;

/**
 * A roster character with its guild already resolved to a persisted id (null when guildless).
 */
public record CharacterUpsert(RemoteCharacterSummary character, UUID guildId) {
}
