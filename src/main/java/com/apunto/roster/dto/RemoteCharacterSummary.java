package com.apunto.roster.dto;

/**
 * Flat view of one character from the account profile summary. Lives only for one sync run.
 */
public record RemoteCharacterSummary(
        String name,
        String realmSlug,
        Integer classId,
        Integer raceId,
        Integer level,
        String region
) {
}
