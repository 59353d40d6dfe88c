package com.apunto.roster.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(
        name = "guilds",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_guilds_name_realm_region",
                columnNames = {"name", "realm_slug", "region"}
        )
)
public class GuildEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "realm_slug", nullable = false)
    private String realmSlug;

    @Column(name = "region", nullable = false)
    private String region;

    @Column(name = "faction")
    private String faction;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;
}
