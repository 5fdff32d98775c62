package com.nanik.finhub.error;

import com.nanik.finhub.protocol.McpError;

/**
 * A registration or request payload is malformed. Never retried.
 */
public class ValidationException extends HubException {

    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    /**
     * Name of the offending payload field.
     */
    public String getField() {
        return field;
    }

    @Override
    public int getCode() {
        return McpError.INVALID_PARAMS;
    }

    @Override
    public McpError toMcpError() {
        return McpError.invalidParams(getMessage());
    }
}
