package com.apunto.roster.dto.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Payload of {@code GET /profile/user/wow}: account -> wow_accounts[] -> characters[].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountProfileClientResponse {

    private Long id;

    @JsonProperty("wow_accounts")
    private List<WowAccountDto> wowAccounts;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WowAccountDto {
        private Long id;
        private List<CharacterDto> characters;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CharacterDto {
        private Long id;
        private String name;
        private Integer level;
        private RealmRefDto realm;

        @JsonProperty("playable_class")
        private KeyedRefDto playableClass;

        @JsonProperty("playable_race")
        private KeyedRefDto playableRace;

        private TypedNameDto faction;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RealmRefDto {
        private Integer id;
        private String name;
        private String slug;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeyedRefDto {
        private Integer id;
        private String name;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TypedNameDto {
        private String type;
        private String name;
    }
}
