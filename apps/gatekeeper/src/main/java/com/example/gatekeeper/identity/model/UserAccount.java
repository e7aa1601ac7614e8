package com.example.gatekeeper.identity.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * The account behind a principal id. Only {@code active} accounts may refresh tokens.
 */
@Document("users")
public record UserAccount(
        @Id String id,
        @Indexed(unique = true) String email,
        boolean active
) {
    public UserAccount deactivated() {
        return new UserAccount(id, email, false);
    }
}
