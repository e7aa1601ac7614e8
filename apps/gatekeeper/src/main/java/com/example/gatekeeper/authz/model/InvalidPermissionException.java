package com.example.gatekeeper.authz.model;

import com.example.gatekeeper.common.dto.ErrorResponse;
import com.example.gatekeeper.common.exception.GatekeeperException;
import org.springframework.http.HttpStatus;

public class InvalidPermissionException extends GatekeeperException {

    public InvalidPermissionException(String message) {
        super(ErrorResponse.Codes.PERMISSION_INVALID, message);
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
