package com.apunto.roster.client;

import com.apunto.roster.dto.client.AccountProfileClientResponse;
import com.apunto.roster.dto.client.CharacterProfileClientResponse;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.service.annotation.GetExchange;
import org.springframework.web.service.annotation.HttpExchange;


@HttpExchange(accept = "application/json")
public interface BattleNetProfileClient {

    @GetExchange("/profile/user/wow")
    AccountProfileClientResponse accountProfile(
            @RequestHeader("Authorization") String authorization,
            @RequestParam("namespace") String namespace,
            @RequestParam("locale") String locale
    );

    @GetExchange("/profile/wow/character/{realmSlug}/{characterName}")
    CharacterProfileClientResponse characterProfile(
            @RequestHeader("Authorization") String authorization,
            @PathVariable("realmSlug") String realmSlug,
            @PathVariable("characterName") String characterName,
            @RequestParam("namespace") String namespace,
            @RequestParam("locale") String locale
    );
}
