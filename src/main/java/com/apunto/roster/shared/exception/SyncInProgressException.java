package com.apunto.roster.shared.exception;

import java.util.Map;

public class SyncInProgressException extends EngineException {

    public SyncInProgressException(String lockKey, String reason) {
        super(ErrorCode.SYNC_IN_PROGRESS,
                ErrorCode.SYNC_IN_PROGRESS.getDefaultMessage(),
                Map.of("lockKey", lockKey, "reason", reason));
    }
}
