package com.example.gatekeeper.authz.rbac;

import com.example.gatekeeper.common.dto.ErrorResponse;
import com.example.gatekeeper.common.exception.GatekeeperException;
import org.springframework.http.HttpStatus;

/**
 * A role mutation would create an inheritance cycle or reference an invalid parent.
 */
public class RoleHierarchyException extends GatekeeperException {

    public RoleHierarchyException(String message) {
        super(ErrorResponse.Codes.ROLE_HIERARCHY_INVALID, message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }

    @Override
    public String getCategory() {
        return ErrorResponse.Categories.CONFLICT;
    }
}
