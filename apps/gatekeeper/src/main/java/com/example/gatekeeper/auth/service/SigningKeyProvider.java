package com.example.gatekeeper.auth.service;

import com.example.gatekeeper.config.properties.TokenProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Jwks;
import io.jsonwebtoken.security.RsaPublicJwk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.security.KeyPair;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * RSA signing keys. One current key signs; retired keys stay available for verification until
 * they fall out of the retention window.
 */
@Slf4j
@Component
public class SigningKeyProvider {

    public static final String ALGORITHM = "RS256";

    private final TokenProperties properties;
    private final Clock clock;

    private volatile SigningKey current;
    private final Deque<SigningKey> retired = new ArrayDeque<>();

    public SigningKeyProvider(@NonNull TokenProperties properties, @NonNull Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.current = generate();
        log.info("Signing key initialized: kid={}", current.kid());
    }

    @NonNull
    public SigningKey current() {
        return current;
    }

    /**
     * Public key for {@code kid} if it is the current key or a retained retired one.
     */
    @NonNull
    public synchronized Optional<PublicKey> verificationKey(@NonNull String kid) {
        if (current.kid().equals(kid)) {
            return Optional.of(current.keyPair().getPublic());
        }
        return retired.stream()
                .filter(key -> key.kid().equals(kid))
                .map(key -> key.keyPair().getPublic())
                .findFirst();
    }

    /**
     * Replaces the current key. Tokens signed with the previous key keep verifying while it is retained.
     *
     * @return the retired key id
     */
    @NonNull
    public synchronized String rotate() {
        SigningKey previous = current;
        retired.addFirst(previous);
        while (retired.size() > properties.keyRetention()) {
            SigningKey dropped = retired.removeLast();
            log.info("Signing key dropped from verification set: kid={}", dropped.kid());
        }
        current = generate();
        log.info("Signing key rotated: newKid={}, retiredKid={}", current.kid(), previous.kid());
        return previous.kid();
    }

    /**
     * JSON Web Key Set with every key that can still verify tokens.
     */
    @NonNull
    public synchronized Map<String, Object> jwks() {
        List<RsaPublicJwk> keys = new ArrayList<>();
        keys.add(toJwk(current));
        retired.forEach(key -> keys.add(toJwk(key)));
        return Map.of("keys", keys);
    }

    private RsaPublicJwk toJwk(SigningKey key) {
        return Jwks.builder()
                .key((RSAPublicKey) key.keyPair().getPublic())
                .id(key.kid())
                .algorithm(ALGORITHM)
                .build();
    }

    private SigningKey generate() {
        KeyPair keyPair = Jwts.SIG.RS256.keyPair().build();
        return new SigningKey(UUID.randomUUID().toString(), keyPair, Instant.now(clock));
    }

    public record SigningKey(String kid, KeyPair keyPair, Instant createdAt) {
    }
}
