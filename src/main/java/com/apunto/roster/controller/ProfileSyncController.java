package com.apunto.roster.controller;

import com.apunto.roster.dto.ProfileSyncResponse;
import com.apunto.roster.dto.ReconciliationResult;
import com.apunto.roster.service.ProfileReconciliationService;
import com.apunto.roster.shared.dto.ApiResponse;
import com.apunto.roster.shared.exception.MissingUserIdentifierException;
import com.apunto.roster.shared.util.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/fetch-profile")
@RequiredArgsConstructor
public class ProfileSyncController {

    private static final List<String> IDENTIFIER_PARAMS = List.of("user_id", "battlenet_id");

    private final ProfileReconciliationService profileReconciliationService;

    @RequestMapping(method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<ApiResponse<ProfileSyncResponse>> fetchProfile(
            @RequestParam(name = "user_id", required = false) UUID userId,
            @RequestParam(name = "battlenet_id", required = false) Long battlenetId,
            HttpServletRequest request
    ) {
        final ReconciliationResult result;
        if (userId != null) {
            result = profileReconciliationService.reconcile(userId);
        } else if (battlenetId != null) {
            result = profileReconciliationService.reconcileByBattlenetId(battlenetId);
        } else {
            throw new MissingUserIdentifierException(IDENTIFIER_PARAMS);
        }

        ProfileSyncResponse body = ProfileSyncResponse.builder()
                .userId(result.userId())
                .battletag(result.battletag())
                .charactersUpdated(result.charactersUpdated())
                .build();

        String message = "Profile sync completed for user " + result.battletag()
                + ". Characters updated: " + result.charactersUpdated();

        return ResponseEntity.ok(ApiResponse.ok(message, body, request.getRequestURI(), TraceIds.current()));
    }
}
