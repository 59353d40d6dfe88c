package com.apunto.roster.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Natural identity of a character: (name, realm slug, region).
 *
 * <p>Equality ignores the case of {@code name}; {@link #name()} keeps the casing it was built with
 * so the stored value can follow whatever the profile API reports.
 */
public final class CharacterKey {

    private final String name;
    private final String realmSlug;
    private final String region;
    private final String comparableName;

    public CharacterKey(String name, String realmSlug, String region) {
        this.name = Objects.requireNonNull(name, "name");
        this.realmSlug = Objects.requireNonNull(realmSlug, "realmSlug");
        this.region = Objects.requireNonNull(region, "region");
        this.comparableName = normalizeName(name);
    }

    public String name() {
        return name;
    }

    /**
     * Case-folded name, the value stored in {@code characters.name_key}.
     */
    public String nameKey() {
        return comparableName;
    }

    public static String normalizeName(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    public String realmSlug() {
        return realmSlug;
    }

    public String region() {
        return region;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharacterKey other)) return false;
        return comparableName.equals(other.comparableName)
                && realmSlug.equals(other.realmSlug)
                && region.equals(other.region);
    }

    @Override
    public int hashCode() {
        return Objects.hash(comparableName, realmSlug, region);
    }

    @Override
    public String toString() {
        return name + "|" + realmSlug + "|" + region;
    }
}
