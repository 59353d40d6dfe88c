package com.apunto.roster.service.impl;

import com.apunto.roster.client.BattleNetProfileClient;
import com.apunto.roster.config.BattleNetProperties;
import com.apunto.roster.dto.RemoteCharacterSummary;
import com.apunto.roster.dto.RemoteGuildSummary;
import com.apunto.roster.mapper.ProfileMapper;
import com.apunto.roster.shared.exception.UpstreamUnauthorizedException;
import com.apunto.roster.shared.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.support.RestClientAdapter;
import org.springframework.web.service.invoker.HttpServiceProxyFactory;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class BattleNetProfileServiceImplTest {

    private static final String BASE = "https://eu.api.blizzard.com";

    private MockRestServiceServer server;
    private BattleNetProfileServiceImpl service;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();

        BattleNetProfileClient client = HttpServiceProxyFactory
                .builderFor(RestClientAdapter.create(builder.build()))
                .build()
                .createClient(BattleNetProfileClient.class);

        BattleNetProperties properties = new BattleNetProperties();
        properties.setRegion("eu");
        properties.setLocale("en_GB");

        service = new BattleNetProfileServiceImpl(client, properties, Mappers.getMapper(ProfileMapper.class));
    }

    @Test
    void fetchAccountRoster_flattens_all_wow_accounts() {
        server.expect(requestTo(startsWith(BASE + "/profile/user/wow")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer tok"))
                .andExpect(queryParam("namespace", "profile-eu"))
                .andExpect(queryParam("locale", "en_GB"))
                .andRespond(withSuccess("""
                        {
                          "id": 77,
                          "wow_accounts": [
                            {"id": 1, "characters": [
                              {"id": 10, "name": "Thrall", "level": 70,
                               "realm": {"id": 3676, "name": "Area 52", "slug": "area-52"},
                               "playable_class": {"id": 7, "name": "Shaman"},
                               "playable_race": {"id": 2, "name": "Orc"},
                               "faction": {"type": "HORDE", "name": "Horde"}}
                            ]},
                            {"id": 2, "characters": [
                              {"id": 11, "name": "Jaina", "level": 60,
                               "realm": {"id": 1, "name": "Illidan", "slug": "illidan"},
                               "playable_class": {"id": 8}, "playable_race": {"id": 1},
                               "extra_field": true}
                            ]}
                          ]
                        }
                        """, MediaType.APPLICATION_JSON));

        List<RemoteCharacterSummary> roster = service.fetchAccountRoster("tok");

        assertEquals(List.of(
                new RemoteCharacterSummary("Thrall", "area-52", 7, 2, 70, "eu"),
                new RemoteCharacterSummary("Jaina", "illidan", 8, 1, 60, "eu")
        ), roster);
        server.verify();
    }

    @Test
    void fetchAccountRoster_skips_entries_without_name_or_realm() {
        server.expect(requestTo(startsWith(BASE + "/profile/user/wow")))
                .andRespond(withSuccess("""
                        {"wow_accounts": [{"id": 1, "characters": [
                          {"id": 1, "name": "", "realm": {"slug": "area-52"}},
                          {"id": 2, "name": "NoRealm"},
                          {"id": 3, "name": "Ok", "level": 10, "realm": {"slug": "area-52"}}
                        ]}]}
                        """, MediaType.APPLICATION_JSON));

        List<RemoteCharacterSummary> roster = service.fetchAccountRoster("tok");

        assertEquals(1, roster.size());
        assertEquals("Ok", roster.get(0).name());
        assertNull(roster.get(0).classId());
    }

    @Test
    void fetchAccountRoster_without_accounts_is_empty() {
        server.expect(requestTo(startsWith(BASE + "/profile/user/wow")))
                .andRespond(withSuccess("{\"id\": 5}", MediaType.APPLICATION_JSON));

        assertTrue(service.fetchAccountRoster("tok").isEmpty());
    }

    @Test
    void fetchAccountRoster_401_is_unauthorized() {
        server.expect(requestTo(startsWith(BASE + "/profile/user/wow")))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThrows(UpstreamUnauthorizedException.class, () -> service.fetchAccountRoster("expired"));
    }

    @Test
    void fetchAccountRoster_other_statuses_are_unavailable() {
        server.expect(requestTo(startsWith(BASE + "/profile/user/wow")))
                .andRespond(withServerError());

        UpstreamUnavailableException ex =
                assertThrows(UpstreamUnavailableException.class, () -> service.fetchAccountRoster("tok"));
        assertEquals(500, ex.getDetails().get("status"));
    }

    @Test
    void fetchAccountRoster_malformed_body_is_unavailable() {
        server.expect(requestTo(startsWith(BASE + "/profile/user/wow")))
                .andRespond(withSuccess("{not json", MediaType.APPLICATION_JSON));

        assertThrows(UpstreamUnavailableException.class, () -> service.fetchAccountRoster("tok"));
    }

    @Test
    void fetchCharacterDetail_lowercases_name_and_maps_guild() {
        server.expect(requestTo(startsWith(BASE + "/profile/wow/character/area-52/thrall")))
                .andExpect(header("Authorization", "Bearer tok"))
                .andExpect(queryParam("namespace", "profile-eu"))
                .andRespond(withSuccess("""
                        {"id": 10, "name": "Thrall",
                         "guild": {"id": 99, "name": "Horde Vanguard",
                                   "realm": {"id": 3676, "slug": "area-52"},
                                   "faction": {"type": "HORDE", "name": "Horde"}}}
                        """, MediaType.APPLICATION_JSON));

        Optional<RemoteGuildSummary> guild = service.fetchCharacterDetail("tok", "area-52", "Thrall");

        assertEquals(Optional.of(new RemoteGuildSummary("Horde Vanguard", "area-52", "eu", "Horde")), guild);
    }

    @Test
    void fetchCharacterDetail_without_guild_is_empty() {
        server.expect(requestTo(startsWith(BASE + "/profile/wow/character/area-52/thrall")))
                .andRespond(withSuccess("{\"id\": 10, \"name\": \"Thrall\"}", MediaType.APPLICATION_JSON));

        assertTrue(service.fetchCharacterDetail("tok", "area-52", "Thrall").isEmpty());
    }

    @Test
    void fetchCharacterDetail_incomplete_guild_is_empty() {
        server.expect(requestTo(startsWith(BASE + "/profile/wow/character/area-52/thrall")))
                .andRespond(withSuccess("{\"guild\": {\"name\": \"NoRealm\"}}", MediaType.APPLICATION_JSON));

        assertTrue(service.fetchCharacterDetail("tok", "area-52", "Thrall").isEmpty());
    }

    @Test
    void fetchCharacterDetail_failure_degrades_to_empty() {
        server.expect(requestTo(startsWith(BASE + "/profile/wow/character/area-52/thrall")))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertTrue(service.fetchCharacterDetail("tok", "area-52", "Thrall").isEmpty());
    }
}
