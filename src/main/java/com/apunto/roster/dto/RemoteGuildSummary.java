package com.apunto.roster.dto;

public record RemoteGuildSummary(
        String name,
        String realmSlug,
        String region,
        String faction
) {
}
