package com.example.gatekeeper.audit.store;

/**
 * Another writer already stored an entry at this (scope, sequence) position.
 */
public class AuditChainConflictException extends RuntimeException {

    public AuditChainConflictException(String chainScope, long sequence) {
        super("Audit chain position already taken: scope=" + chainScope + ", sequence=" + sequence);
    }
}
