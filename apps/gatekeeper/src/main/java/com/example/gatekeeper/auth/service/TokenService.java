package com.example.gatekeeper.auth.service;

import com.example.gatekeeper.audit.model.AuditEventType;
import com.example.gatekeeper.audit.service.AuditChainService;
import com.example.gatekeeper.auth.model.IssuedToken;
import com.example.gatekeeper.auth.model.TokenClaims;
import com.example.gatekeeper.auth.model.TokenType;
import com.example.gatekeeper.common.util.StringSanitizer;
import com.example.gatekeeper.config.properties.TokenProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.UnsupportedJwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies RS256-signed access and refresh tokens.
 *
 * <p>Claims: {@code sub}, {@code tid}, {@code type}, {@code jti}, {@code iat}, {@code exp},
 * {@code iss}, {@code aud}, plus {@code family_id} on refresh tokens. Verification never throws:
 * a bad signature, expiry, issuer, audience, type mismatch or blacklisted jti all yield an empty result.
 */
@Slf4j
@Service
public class TokenService {

    public static final String CLAIM_TENANT = "tid";
    public static final String CLAIM_TYPE = "type";
    public static final String CLAIM_FAMILY = "family_id";

    private final SigningKeyProvider keyProvider;
    private final TokenBlacklist blacklist;
    private final AuditChainService auditChain;
    private final TokenProperties properties;
    private final Clock clock;
    private final JwtParser parser;

    public TokenService(
            @NonNull SigningKeyProvider keyProvider,
            @NonNull TokenBlacklist blacklist,
            @NonNull AuditChainService auditChain,
            @NonNull TokenProperties properties,
            @NonNull Clock clock) {
        this.keyProvider = keyProvider;
        this.blacklist = blacklist;
        this.auditChain = auditChain;
        this.properties = properties;
        this.clock = clock;
        this.parser = Jwts.parser()
                .keyLocator(new LocatorAdapter<Key>() {
                    @Override
                    protected Key locate(JwsHeader header) {
                        String kid = header.getKeyId();
                        if (kid == null) {
                            throw new UnsupportedJwtException("Token carries no key id");
                        }
                        return keyProvider.verificationKey(kid)
                                .orElseThrow(() -> new UnsupportedJwtException("Unknown signing key"));
                    }
                })
                .requireIssuer(properties.issuer())
                .requireAudience(properties.audience())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @NonNull
    public IssuedToken issueAccessToken(@NonNull String userId, @NonNull String tenantId) {
        return issue(userId, tenantId, TokenType.ACCESS, null, properties.accessTokenTtl());
    }

    /**
     * Issues a refresh token. A null {@code familyId} starts a new family.
     */
    @NonNull
    public IssuedToken issueRefreshToken(@NonNull String userId, @NonNull String tenantId, @Nullable String familyId) {
        String family = familyId != null ? familyId : UUID.randomUUID().toString();
        return issue(userId, tenantId, TokenType.REFRESH, family, properties.refreshTokenTtl());
    }

    private IssuedToken issue(String userId, String tenantId, TokenType type, @Nullable String familyId, Duration ttl) {
        // JWT dates carry second precision
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(ttl);
        String jti = UUID.randomUUID().toString();
        SigningKeyProvider.SigningKey key = keyProvider.current();

        JwtBuilder builder = Jwts.builder()
                .header().keyId(key.kid()).and()
                .subject(userId)
                .claim(CLAIM_TENANT, tenantId)
                .claim(CLAIM_TYPE, type.claimValue())
                .id(jti)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .issuer(properties.issuer())
                .audience().add(properties.audience()).and();
        if (familyId != null) {
            builder.claim(CLAIM_FAMILY, familyId);
        }
        String token = builder.signWith(key.keyPair().getPrivate(), Jwts.SIG.RS256).compact();

        log.debug("Issued {} token: jti={}, kid={}", type.claimValue(), StringSanitizer.mask(jti), key.kid());
        return new IssuedToken(token, jti, familyId, expiresAt);
    }

    /**
     * Verifies {@code token} as a token of {@code expectedType}, including the blacklist check.
     *
     * @return the claims, or empty when the token must not be accepted
     */
    @NonNull
    public Mono<TokenClaims> verifyToken(@Nullable String token, @NonNull TokenType expectedType) {
        Optional<TokenClaims> parsed = parseClaims(token, expectedType);
        if (parsed.isEmpty()) {
            return Mono.empty();
        }
        TokenClaims claims = parsed.get();
        return blacklist.isBlacklisted(claims.jti())
                .flatMap(revoked -> {
                    if (revoked) {
                        log.debug("Rejected blacklisted token: jti={}", StringSanitizer.mask(claims.jti()));
                        return Mono.<TokenClaims>empty();
                    }
                    return Mono.just(claims);
                })
                .onErrorResume(e -> {
                    log.warn("Token verification failed: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Signature, expiry, issuer, audience and type checks without the blacklist lookup.
     */
    @NonNull
    Optional<TokenClaims> parseClaims(@Nullable String token, @NonNull TokenType expectedType) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();

            TokenType type = TokenType.fromClaim(claims.get(CLAIM_TYPE, String.class));
            if (type != expectedType) {
                log.debug("Token type mismatch: expected={}, actual={}", expectedType.claimValue(), type);
                return Optional.empty();
            }
            String tenantId = claims.get(CLAIM_TENANT, String.class);
            String familyId = claims.get(CLAIM_FAMILY, String.class);
            if (claims.getSubject() == null || tenantId == null || claims.getId() == null
                    || claims.getIssuedAt() == null || claims.getExpiration() == null) {
                log.debug("Token is missing required claims");
                return Optional.empty();
            }
            if (type == TokenType.REFRESH && familyId == null) {
                log.debug("Refresh token without family");
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(
                    claims.getSubject(),
                    tenantId,
                    type,
                    claims.getId(),
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant(),
                    claims.getIssuer(),
                    familyId));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Rotates the signing key and records the rotation on the global audit chain.
     */
    @NonNull
    public Mono<String> rotateSigningKey() {
        String retiredKid = keyProvider.rotate();
        String newKid = keyProvider.current().kid();
        return auditChain.append(null, null, AuditEventType.SIGNING_KEY_ROTATED,
                        Map.of("new_kid", newKid, "retired_kid", retiredKid), null, null)
                .thenReturn(newKid);
    }

    @NonNull
    public Map<String, Object> jwks() {
        return keyProvider.jwks();
    }
}
