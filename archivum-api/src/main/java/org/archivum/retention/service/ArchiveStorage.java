package org.archivum.retention.service;

import org.archivum.retention.enums.ArchiveLocation;
import reactor.core.publisher.Mono;

public interface ArchiveStorage {

    String FOLDER_SEPARATOR = "/";

    /**
     * The single location this storage serves, {@link ArchiveLocation#LOCAL} or {@link ArchiveLocation#CLOUD_STORAGE}.
     */
    ArchiveLocation location();

    Mono<Void> write(String storagePath, byte[] content);

    Mono<byte[]> read(String storagePath);

    /**
     * Completes normally when the blob is already gone.
     */
    Mono<Void> delete(String storagePath);
}
