package com.example.gatekeeper.auth.controller;

import com.example.gatekeeper.auth.service.TokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

/**
 * Publishes the verification keys so resource servers can validate access tokens offline.
 */
@RestController
@RequiredArgsConstructor
public class JwksController {

    private final TokenService tokenService;

    @GetMapping("/.well-known/jwks.json")
    public ResponseEntity<Map<String, Object>> jwks() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(Duration.ofMinutes(5)).cachePublic())
                .body(tokenService.jwks());
    }
}
