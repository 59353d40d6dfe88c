package com.apunto.roster.dto.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Subset of {@code GET /profile/wow/character/{realm}/{name}} the sync cares about: the guild reference.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CharacterProfileClientResponse {

    private Long id;
    private String name;
    private Integer level;
    private AccountProfileClientResponse.RealmRefDto realm;
    private GuildRefDto guild;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GuildRefDto {
        private Long id;
        private String name;
        private AccountProfileClientResponse.RealmRefDto realm;
        private AccountProfileClientResponse.TypedNameDto faction;
    }
}
