package com.example.gatekeeper.auth.exception;

import com.example.gatekeeper.common.dto.ErrorResponse;
import com.example.gatekeeper.common.exception.GatekeeperException;
import org.springframework.http.HttpStatus;

public class AuthenticationException extends GatekeeperException {

    public AuthenticationException(String message) {
        super(ErrorResponse.Codes.TOKEN_INVALID, message);
    }

    public AuthenticationException(String code, String message) {
        super(code, message);
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
