package com.apunto.roster.repository;

import com.apunto.roster.entity.GuildEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface GuildRepository extends JpaRepository<GuildEntity, UUID> {

    Optional<GuildEntity> findByNameAndRealmSlugAndRegion(String name, String realmSlug, String region);
}
