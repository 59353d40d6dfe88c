package com.apunto.roster.entity;

import com.apunto.roster.domain.CharacterKey;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(
        name = "characters",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_characters_name_key_realm_region",
                columnNames = {"name_key", "realm_slug", "region"}
        )
)
public class CharacterEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    // FK columns kept as plain ids: owner and guild rows are managed outside this aggregate.
    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "guild_id")
    private UUID guildId;

    @Column(name = "name", nullable = false)
    private String name;

    // case-folded name; uniqueness of a character is enforced on this column
    @Column(name = "name_key", nullable = false)
    private String nameKey;

    @Column(name = "realm_slug", nullable = false)
    private String realmSlug;

    @Column(name = "region", nullable = false)
    private String region;

    @Column(name = "level")
    private Integer level;

    @Column(name = "class_id")
    private Integer classId;

    @Column(name = "race_id")
    private Integer raceId;

    @Column(name = "guild_rank")
    private Integer guildRank;

    @Column(name = "last_updated", columnDefinition = "timestamp with time zone")
    private OffsetDateTime lastUpdated;

    @PrePersist
    @PreUpdate
    void touch() {
        nameKey = name == null ? null : CharacterKey.normalizeName(name);
        lastUpdated = OffsetDateTime.now();
    }
}
