package com.example.gatekeeper.authz.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the permission a controller method requires. Checked before dispatch by
 * {@link com.example.gatekeeper.authz.filter.PermissionAuthorizationFilter} in the caller's organization.
 *
 * <p>Example usage:
 * <pre>
 * {@literal @}GetMapping("/projects/{projectId}")
 * {@literal @}RequiresPermission(resource = "project", action = "read", resourceIdVariable = "projectId")
 * public Mono<Project> getProject(@PathVariable String projectId) {...}
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresPermission {

    String resource();

    String action();

    /**
     * Path variable holding the resource id, enabling instance and ownership grants.
     * Empty for type-level checks.
     */
    String resourceIdVariable() default "";
}
