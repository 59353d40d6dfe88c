package com.apunto.roster.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "battlenet")
public class BattleNetProperties {

    @NotBlank
    @Pattern(regexp = "[a-z]{2}", message = "region must be a two-letter lowercase code (us, eu, kr, tw)")
    private String region = "us";

    @NotBlank
    private String locale = "en_US";

    /**
     * Defaults to https://{region}.api.blizzard.com when left empty.
     */
    private String apiBaseUrl;

    public String getRegion() {
        return region;
    }
    public void setRegion(String region) {
        this.region = region;
    }

    public String getLocale() {
        return locale;
    }
    public void setLocale(String locale) {
        this.locale = locale;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }
    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
    }

    public String resolvedApiBaseUrl() {
        if (apiBaseUrl != null && !apiBaseUrl.isBlank()) {
            return apiBaseUrl;
        }
        return "https://" + region + ".api.blizzard.com";
    }

    public String profileNamespace() {
        return "profile-" + region;
    }
}
