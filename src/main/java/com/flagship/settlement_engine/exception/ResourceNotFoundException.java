package com.flagship.settlement_engine.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends SettlementEngineException {

    public ResourceNotFoundException(String resource, Object id) {
        super("NOT_FOUND", HttpStatus.NOT_FOUND, resource + " not found: " + id);
    }
}
