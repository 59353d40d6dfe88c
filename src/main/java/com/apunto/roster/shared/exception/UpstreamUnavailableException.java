package com.apunto.roster.shared.exception;

import java.util.Map;

public class UpstreamUnavailableException extends EngineException {

    public UpstreamUnavailableException(String message) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message);
    }

    public UpstreamUnavailableException(String message, Map<String, Object> details) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, details);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
    }

    public UpstreamUnavailableException(String message,
                                        Throwable cause,
                                        Map<String, Object> details) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, cause, details);
    }
}
