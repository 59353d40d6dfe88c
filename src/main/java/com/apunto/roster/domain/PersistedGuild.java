package com.apunto.roster.domain;

import java.util.UUID;

public record PersistedGuild(GuildKey key, UUID id) {
}
