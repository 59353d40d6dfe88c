package com.apunto.roster.shared.exception;

import java.util.Map;

public class UserNotFoundException extends EngineException {

    public UserNotFoundException(String field, Object value) {
        super(ErrorCode.RESOURCE_NOT_FOUND,
                "User not found in database.",
                Map.of(field, String.valueOf(value)));
    }
}
