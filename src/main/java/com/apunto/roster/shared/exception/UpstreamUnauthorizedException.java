package com.apunto.roster.shared.exception;

import java.util.Map;

/**
 * Battle.net rechazó el bearer token. El caller debe pedir re-login, no reintentar.
 */
public class UpstreamUnauthorizedException extends EngineException {

    public UpstreamUnauthorizedException(String message) {
        super(ErrorCode.UPSTREAM_UNAUTHORIZED, message);
    }

    public UpstreamUnauthorizedException(String message, Map<String, Object> details) {
        super(ErrorCode.UPSTREAM_UNAUTHORIZED, message, details);
    }

    public UpstreamUnauthorizedException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_UNAUTHORIZED, message, cause);
    }
}
