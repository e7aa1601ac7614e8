package com.example.gatekeeper.common.exception;

import com.example.gatekeeper.common.dto.ErrorResponse;
import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends GatekeeperException {

    public ResourceNotFoundException(String message) {
        super(ErrorResponse.Codes.RESOURCE_NOT_FOUND, message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }

    @Override
    public String getCategory() {
        return ErrorResponse.Categories.NOT_FOUND;
    }
}
