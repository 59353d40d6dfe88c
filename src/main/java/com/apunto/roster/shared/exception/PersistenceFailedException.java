package com.apunto.roster.shared.exception;

import java.util.Map;

public class PersistenceFailedException extends EngineException {

    public PersistenceFailedException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILED, message, cause);
    }

    public PersistenceFailedException(String message,
                                      Throwable cause,
                                      Map<String, Object> details) {
        super(ErrorCode.PERSISTENCE_FAILED, message, cause, details);
    }
}
