package org.archivum.retention.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.enums.ArchiveLocation;
import org.archivum.retention.exception.StorageException;
import org.archivum.retention.service.ArchiveStorage;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fans archive blobs out to the storages an {@link ArchiveLocation} names.
 */
@Slf4j
@Component
public class ArchiveStorageRouter {

    private final Map<ArchiveLocation, ArchiveStorage> storages = new EnumMap<>(ArchiveLocation.class);

    public ArchiveStorageRouter(List<ArchiveStorage> storages) {
        for (ArchiveStorage storage : storages) {
            this.storages.put(storage.location(), storage);
        }
        log.info("Archive storage locations available: {}", this.storages.keySet());
    }

    public boolean supports(ArchiveLocation location) {
        try {
            targets(location);
            return true;
        } catch (StorageException e) {
            return false;
        }
    }

    public Mono<Void> write(ArchiveLocation location, String storagePath, byte[] content) {
        return Mono.defer(() -> Flux.fromIterable(targets(location))
                .concatMap(storage -> storage.write(storagePath, content))
                .then());
    }

    /**
     * Reads from local storage first when the archive has a local copy.
     */
    public Mono<byte[]> read(ArchiveLocation location, String storagePath) {
        return Mono.defer(() -> {
            List<ArchiveStorage> targets = targets(location);
            Mono<byte[]> result = targets.get(0).read(storagePath);
            for (int i = 1; i < targets.size(); i++) {
                ArchiveStorage fallback = targets.get(i);
                result = result.onErrorResume(e -> {
                    log.warn("Reading {} failed, falling back to {}: {}", storagePath, fallback.location(), e.getMessage());
                    return fallback.read(storagePath);
                });
            }
            return result;
        });
    }

    public Mono<Void> delete(ArchiveLocation location, String storagePath) {
        return Mono.defer(() -> Flux.fromIterable(targets(location))
                .concatMap(storage -> storage.delete(storagePath))
                .then());
    }

    private List<ArchiveStorage> targets(ArchiveLocation location) {
        ArchiveLocation effective = location != null ? location : ArchiveLocation.LOCAL;
        List<ArchiveStorage> targets = new ArrayList<>(2);
        if (effective.includesLocal()) {
            targets.add(require(ArchiveLocation.LOCAL));
        }
        if (effective.includesCloud()) {
            targets.add(require(ArchiveLocation.CLOUD_STORAGE));
        }
        return targets;
    }

    private ArchiveStorage require(ArchiveLocation location) {
        ArchiveStorage storage = storages.get(location);
        if (storage == null) {
            throw new StorageException("No archive storage configured for location " + location.toValue());
        }
        return storage;
    }
}
