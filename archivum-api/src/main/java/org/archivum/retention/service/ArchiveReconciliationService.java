package org.archivum.retention.service;

import reactor.core.publisher.Flux;

public interface ArchiveReconciliationService {

    /**
     * Removes archives left in {@code CREATING} by an interrupted run, together with any partial blob.
     * Emits the ids of the removed archives.
     */
    Flux<String> reconcileIncompleteArchives();
}
