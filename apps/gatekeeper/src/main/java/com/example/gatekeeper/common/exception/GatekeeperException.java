package com.example.gatekeeper.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for domain failures that surface to API callers with a stable error code.
 * The message is safe to return; causes never are.
 */
public abstract class GatekeeperException extends RuntimeException {

    private final String code;

    protected GatekeeperException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected GatekeeperException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public abstract HttpStatus getStatus();

    public abstract String getCategory();
}
