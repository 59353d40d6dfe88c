package com.apunto.roster.shared.exception;

import java.util.List;
import java.util.Map;

public class MissingUserIdentifierException extends EngineException {

    public MissingUserIdentifierException(List<String> acceptedParameters) {
        super(ErrorCode.VALIDATION_ERROR,
                "Missing user identifier (" + String.join(" or ", acceptedParameters) + ")",
                Map.of("acceptedParameters", acceptedParameters));
    }
}
