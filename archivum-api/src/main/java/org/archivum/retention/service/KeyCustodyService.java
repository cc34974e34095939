package org.archivum.retention.service;

import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;

/**
 * Issues per-archive data keys and resolves them again by key id.
 */
public interface KeyCustodyService {

    Mono<DataKey> createKey(String tenantId);

    Mono<SecretKey> resolveKey(String keyId);

    /**
     * Removes a key whose archive was never completed.
     */
    Mono<Void> discardKey(String keyId);

    record DataKey(String keyId, SecretKey secretKey) {}
}
