package com.example.gatekeeper.auth.exception;

import com.example.gatekeeper.common.dto.ErrorResponse;
import com.example.gatekeeper.common.exception.GatekeeperException;
import org.springframework.http.HttpStatus;

/**
 * Sign-in could not produce a token pair (unknown or inactive user, storage failure).
 */
public class TokenIssuanceException extends GatekeeperException {

    public TokenIssuanceException(String message) {
        super(ErrorResponse.Codes.TOKEN_INVALID, message);
    }

    public TokenIssuanceException(String message, Throwable cause) {
        super(ErrorResponse.Codes.TOKEN_INVALID, message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNAUTHORIZED;
    }

    @Override
    public String getCategory() {
        return ErrorResponse.Categories.AUTHENTICATION_REQUIRED;
    }
}
