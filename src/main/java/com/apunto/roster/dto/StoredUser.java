package com.apunto.roster.dto;

import java.util.UUID;

public record StoredUser(UUID id, Long battlenetId, String battletag, String accessToken) {

    public boolean hasToken() {
        return accessToken != null && !accessToken.isBlank();
    }
}
