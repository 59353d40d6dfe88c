package com.apunto.roster.service;

import com.apunto.roster.dto.ReconciliationResult;

import java.util.UUID;

public interface ProfileReconciliationService {

    /**
     * Sincroniza los personajes y guilds del usuario contra su perfil de Battle.net.
     *
     * - Upsert de guilds y luego de personajes por clave natural (name, realm, region)
     * - Borra los personajes del usuario que ya no vienen en el roster remoto
     *
     * Runs for the same user never overlap.
     *
     * @throws com.apunto.roster.shared.exception.UserNotFoundException no such user
     * @throws com.apunto.roster.shared.exception.UpstreamUnauthorizedException token rejected upstream
     * @throws com.apunto.roster.shared.exception.UpstreamUnavailableException roster fetch failed
     * @throws com.apunto.roster.shared.exception.PersistenceFailedException guild or character batch failed
     * @throws com.apunto.roster.shared.exception.SyncInProgressException another run holds the user lock
     */
    ReconciliationResult reconcile(UUID userId);

    ReconciliationResult reconcileByBattlenetId(long battlenetId);
}
