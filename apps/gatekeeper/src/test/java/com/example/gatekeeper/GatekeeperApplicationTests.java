package com.example.gatekeeper;

import com.example.gatekeeper.auth.model.TokenPair;
import com.example.gatekeeper.auth.service.TokenLifecycleService;
import com.example.gatekeeper.authz.model.Membership;
import com.example.gatekeeper.authz.model.MembershipStatus;
import com.example.gatekeeper.authz.service.RoleAdminService;
import com.example.gatekeeper.authz.store.MembershipStore;
import com.example.gatekeeper.authz.store.RoleStore;
import com.example.gatekeeper.identity.model.UserAccount;
import com.example.gatekeeper.identity.store.UserAccountStore;
import com.example.gatekeeper.session.model.ClientInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

@SpringBootTest
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class GatekeeperApplicationTests {

    private static final String TENANT = "acme";

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private TokenLifecycleService tokenLifecycleService;

    @Autowired
    private RoleAdminService roleAdminService;

    @Autowired
    private RoleStore roleStore;

    @Autowired
    private MembershipStore membershipStore;

    @Autowired
    private UserAccountStore userAccountStore;

    @BeforeEach
    void seedTenant() {
        if (Boolean.FALSE.equals(roleStore.findById(TENANT + ":owner").hasElement().block())) {
            roleAdminService.seedDefaultRoles(TENANT, "system").blockLast();
        }
    }

    private TokenPair signIn(String roleName) {
        String userId = roleName + "-" + UUID.randomUUID();
        userAccountStore.save(new UserAccount(userId, userId + "@example.com", true)).block();
        membershipStore.save(new Membership(userId + "@" + TENANT, userId, TENANT, TENANT + ":" + roleName,
                Set.of(), MembershipStatus.ACTIVE)).block();
        return tokenLifecycleService.issueTokenPair(userId, TENANT, ClientInfo.unknown()).block();
    }

    @Test
    void contextLoads() {
        // Basic context load test
    }

    @Test
    @DisplayName("JWKS should be public and list the signing key")
    void jwksShouldBePublic() {
        webTestClient.get().uri("/.well-known/jwks.json")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.keys[0].kty").isEqualTo("RSA")
                .jsonPath("$.keys[0].kid").exists();
    }

    @Nested
    @DisplayName("API security")
    class ApiSecurity {

        @Test
        @DisplayName("should reject API calls without a bearer token")
        void shouldRequireToken() {
            webTestClient.get().uri("/api/v1/authz/permissions")
                    .exchange()
                    .expectStatus().isUnauthorized()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("TOKEN_MISSING");
        }

        @Test
        @DisplayName("should list effective permissions of a member")
        void shouldListPermissions() {
            TokenPair pair = signIn("member");

            webTestClient.get().uri("/api/v1/authz/permissions")
                    .headers(headers -> headers.setBearerAuth(pair.accessToken().token()))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.organization_id").isEqualTo(TENANT)
                    .jsonPath("$.permissions[?(@ == 'project:read')]").exists();
        }

        @Test
        @DisplayName("should forbid audit verification to members")
        void shouldForbidAuditForMembers() {
            TokenPair pair = signIn("member");

            webTestClient.get().uri("/api/v1/audit/verify")
                    .headers(headers -> headers.setBearerAuth(pair.accessToken().token()))
                    .exchange()
                    .expectStatus().isForbidden()
                    .expectBody()
                    .jsonPath("$.code").isEqualTo("PERMISSION_DENIED")
                    .jsonPath("$.details.required").isEqualTo("audit_log:read");
        }

        @Test
        @DisplayName("should let admins verify the audit chain")
        void shouldVerifyAuditForAdmins() {
            TokenPair pair = signIn("admin");

            webTestClient.get().uri("/api/v1/audit/verify")
                    .headers(headers -> headers.setBearerAuth(pair.accessToken().token()))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.valid").isEqualTo(true);
        }
    }

    @Nested
    @DisplayName("token refresh")
    class Refresh {

        @Test
        @DisplayName("should rotate a refresh token once")
        void shouldRotateOnce() {
            TokenPair pair = signIn("viewer");
            Map<String, String> body = Map.of("refresh_token", pair.refreshToken().token());

            webTestClient.post().uri("/api/v1/auth/refresh")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.access_token").exists()
                    .jsonPath("$.token_type").isEqualTo("Bearer")
                    .jsonPath("$.session_id").isEqualTo(pair.sessionId());

            webTestClient.post().uri("/api/v1/auth/refresh")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchange()
                    .expectStatus().isUnauthorized();
        }

        @Test
        @DisplayName("should reject a blank refresh token")
        void shouldRejectBlankToken() {
            webTestClient.post().uri("/api/v1/auth/refresh")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("refresh_token", ""))
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }
}
