package com.example.gatekeeper.authz.abac.model;

import java.time.Instant;

/**
 * Inclusive validity window; either bound may be open.
 */
public record TimeWindow(Instant start, Instant end) {

    public boolean contains(Instant instant) {
        return (start == null || !instant.isBefore(start))
                && (end == null || !instant.isAfter(end));
    }
}
