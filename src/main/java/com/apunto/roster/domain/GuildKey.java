package com.apunto.roster.domain;

import java.util.Objects;

/**
 * Natural identity of a guild. Matched exactly, unlike {@link CharacterKey}.
 */
public record GuildKey(String name, String realmSlug, String region) {

    public GuildKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(realmSlug, "realmSlug");
        Objects.requireNonNull(region, "region");
    }

    @Override
    public String toString() {
        return name + "|" + realmSlug + "|" + region;
    }
}
