package com.apunto.roster.dto;

import java.util.UUID;

public record ReconciliationResult(UUID userId, String battletag, int charactersUpdated) {
}
