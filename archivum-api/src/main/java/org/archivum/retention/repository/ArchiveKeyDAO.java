package org.archivum.retention.repository;

import org.archivum.retention.model.ArchiveKey;
import reactor.core.publisher.Mono;

public interface ArchiveKeyDAO {

    Mono<Void> save(ArchiveKey key);

    Mono<ArchiveKey> findById(String keyId);

    Mono<Void> delete(String keyId);
}
