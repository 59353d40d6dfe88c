package com.apunto.roster.mapper;

import com.apunto.roster.dto.RemoteCharacterSummary;
import com.apunto.roster.dto.RemoteGuildSummary;
import com.apunto.roster.dto.StoredUser;
import com.apunto.roster.dto.client.AccountProfileClientResponse;
import com.apunto.roster.dto.client.CharacterProfileClientResponse;
import com.apunto.roster.entity.UserEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface ProfileMapper {

    @Mapping(target = "name", source = "character.name")
    @Mapping(target = "realmSlug", source = "character.realm.slug")
    @Mapping(target = "classId", source = "character.playableClass.id")
    @Mapping(target = "raceId", source = "character.playableRace.id")
    @Mapping(target = "level", source = "character.level")
    @Mapping(target = "region", source = "region")
    RemoteCharacterSummary toCharacterSummary(AccountProfileClientResponse.CharacterDto character, String region);

    @Mapping(target = "name", source = "guild.name")
    @Mapping(target = "realmSlug", source = "guild.realm.slug")
    @Mapping(target = "faction", source = "guild.faction.name")
    @Mapping(target = "region", source = "region")
    RemoteGuildSummary toGuildSummary(CharacterProfileClientResponse.GuildRefDto guild, String region);

    StoredUser toStoredUser(UserEntity user);
}
