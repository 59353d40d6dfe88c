package com.apunto.roster.repository;

import com.apunto.roster.entity.CharacterEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CharacterRepository extends JpaRepository<CharacterEntity, UUID> {

    Optional<CharacterEntity> findByNameKeyAndRealmSlugAndRegion(String nameKey, String realmSlug, String region);

    List<CharacterEntity> findAllByUserId(UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            DELETE FROM CharacterEntity c
            WHERE c.userId = :userId
              AND c.nameKey = :nameKey
              AND c.realmSlug = :realmSlug
              AND c.region = :region
            """)
    int deleteOwned(
            @Param("userId") UUID userId,
            @Param("nameKey") String nameKey,
            @Param("realmSlug") String realmSlug,
            @Param("region") String region
    );
}
