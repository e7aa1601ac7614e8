package com.example.gatekeeper.authz.abac.model;

import com.example.gatekeeper.common.dto.ErrorResponse;
import com.example.gatekeeper.common.exception.GatekeeperException;
import org.springframework.http.HttpStatus;

public class PolicyValidationException extends GatekeeperException {

    public PolicyValidationException(String message) {
        super(ErrorResponse.Codes.POLICY_INVALID, message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }

    @Override
    public String getCategory() {
        return ErrorResponse.Categories.VALIDATION_ERROR;
    }
}
