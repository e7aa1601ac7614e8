package com.example.gatekeeper.authz.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

/**
 * A parsed permission string.
 *
 * <p>Accepted forms, case-sensitive ASCII:
 * <ul>
 *   <li>{@code resource:action}</li>
 *   <li>{@code resource:own:action} - granted only on resources the principal owns</li>
 *   <li>{@code resource:resource_id:action} - granted on one resource instance</li>
 * </ul>
 * {@code *} is the only wildcard and must stand for a whole segment.
 */
public record Permission(
        @NonNull String resource,
        @Nullable String scope,
        @NonNull String action
) {
    public static final String WILDCARD = "*";
    public static final String OWN = "own";
    public static final String ADMIN = "admin";

    private static final Pattern SEGMENT = Pattern.compile("^(\\*|[A-Za-z0-9_.-]+)$");
    private static final Pattern SCOPE_SEGMENT = Pattern.compile("^[A-Za-z0-9_.@-]+$");

    /**
     * @throws InvalidPermissionException if the string is not a well-formed permission
     */
    @NonNull
    public static Permission parse(@Nullable String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidPermissionException("Permission must not be blank");
        }
        String[] segments = value.split(":", -1);
        if (segments.length == 2) {
            requireSegment(segments[0], value);
            requireSegment(segments[1], value);
            return new Permission(segments[0], null, segments[1]);
        }
        if (segments.length == 3) {
            requireSegment(segments[0], value);
            if (!SCOPE_SEGMENT.matcher(segments[1]).matches()) {
                throw new InvalidPermissionException("Invalid resource scope in permission: " + value);
            }
            requireSegment(segments[2], value);
            return new Permission(segments[0], segments[1], segments[2]);
        }
        throw new InvalidPermissionException("Permission must have 2 or 3 segments: " + value);
    }

    public static boolean isValid(@Nullable String value) {
        try {
            parse(value);
            return true;
        } catch (InvalidPermissionException e) {
            return false;
        }
    }

    @NonNull
    public static String of(@NonNull String resource, @NonNull String action) {
        return resource + ":" + action;
    }

    @NonNull
    public static String of(@NonNull String resource, @NonNull String scope, @NonNull String action) {
        return resource + ":" + scope + ":" + action;
    }

    public boolean isScoped() {
        return scope != null;
    }

    @Override
    public String toString() {
        return scope == null ? of(resource, action) : of(resource, scope, action);
    }

    private static void requireSegment(String segment, String value) {
        if (!SEGMENT.matcher(segment).matches()) {
            throw new InvalidPermissionException("Invalid segment in permission: " + value);
        }
    }
}
