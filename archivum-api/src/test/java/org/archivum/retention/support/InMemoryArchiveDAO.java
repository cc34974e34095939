package org.archivum.retention.support;

import org.archivum.retention.enums.ArchiveStatus;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.model.Archive;
import org.archivum.retention.model.ArchiveAccessEntry;
import org.archivum.retention.model.ArchiveAuditEntry;
import org.archivum.retention.model.RestorationEntry;
import org.archivum.retention.repository.ArchiveDAO;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stores copies so that callers mutating an {@link Archive} do not change the stored row until they update it.
 */
public class InMemoryArchiveDAO implements ArchiveDAO {

    private final Map<String, Archive> archives = new LinkedHashMap<>();
    private final List<ArchiveAuditEntry> auditTrail = new ArrayList<>();
    private final List<ArchiveAccessEntry> accessLog = new ArrayList<>();
    private final List<RestorationEntry> restorations = new ArrayList<>();

    public synchronized Archive stored(String archiveId) {
        Archive archive = archives.get(archiveId);
        return archive != null ? archive.toBuilder().build() : null;
    }

    public synchronized List<Archive> all() {
        return archives.values().stream().map(a -> a.toBuilder().build()).toList();
    }

    public synchronized List<ArchiveAuditEntry> auditEntries() {
        return List.copyOf(auditTrail);
    }

    public synchronized List<ArchiveAccessEntry> accessEntries() {
        return List.copyOf(accessLog);
    }

    public synchronized List<RestorationEntry> restorationEntries() {
        return List.copyOf(restorations);
    }

    @Override
    public Mono<Archive> insert(Archive archive) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                if (archives.containsKey(archive.getArchiveId())) {
                    throw new IllegalStateException("Archive " + archive.getArchiveId() + " already exists");
                }
                archives.put(archive.getArchiveId(), archive.toBuilder().build());
                return archive;
            }
        });
    }

    @Override
    public Mono<Archive> update(Archive archive) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                archives.put(archive.getArchiveId(), archive.toBuilder().build());
                return archive;
            }
        });
    }

    @Override
    public Mono<Archive> findById(String tenantId, String archiveId) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                Archive archive = archives.get(archiveId);
                return archive != null && tenantId.equals(archive.getTenantId()) ? archive.toBuilder().build() : null;
            }
        });
    }

    @Override
    public Flux<Archive> findByTenant(String tenantId, DataType dataType, ArchiveStatus status) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(archives.values().stream()
                        .filter(a -> tenantId.equals(a.getTenantId()))
                        .filter(a -> dataType == null || a.getDataType() == dataType)
                        .filter(a -> status == null || a.getStatus() == status)
                        .sorted(Comparator.comparing(Archive::getCreatedAt).reversed())
                        .map(a -> a.toBuilder().build())
                        .toList());
            }
        });
    }

    @Override
    public Flux<Archive> findByStatus(ArchiveStatus status) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(archives.values().stream()
                        .filter(a -> a.getStatus() == status)
                        .map(a -> a.toBuilder().build())
                        .toList());
            }
        });
    }

    @Override
    public Flux<Archive> findDueForDeletion(OffsetDateTime now, String tenantId) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(archives.values().stream()
                        .filter(a -> tenantId == null || tenantId.equals(a.getTenantId()))
                        .filter(a -> a.getScheduledDeletion() != null && a.getScheduledDeletion().deleteAfter() != null)
                        .filter(a -> !a.getScheduledDeletion().deleteAfter().isAfter(now))
                        .filter(a -> a.getLegalHold() == null || !a.getLegalHold().onHold())
                        .map(a -> a.toBuilder().build())
                        .toList());
            }
        });
    }

    @Override
    public Mono<Void> delete(String archiveId) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                archives.remove(archiveId);
            }
        });
    }

    @Override
    public Mono<Void> appendAuditEntry(ArchiveAuditEntry entry) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                auditTrail.add(entry);
            }
        });
    }

    @Override
    public Mono<Void> appendAccessEntry(ArchiveAccessEntry entry) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                accessLog.add(entry);
            }
        });
    }

    @Override
    public Mono<Void> appendRestoration(RestorationEntry entry) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                restorations.add(entry);
            }
        });
    }

    @Override
    public Flux<ArchiveAuditEntry> getAuditTrail(String archiveId) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(auditTrail.stream().filter(e -> Objects.equals(archiveId, e.archiveId())).toList());
            }
        });
    }

    @Override
    public Flux<ArchiveAccessEntry> getAccessLog(String archiveId) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(accessLog.stream().filter(e -> Objects.equals(archiveId, e.archiveId())).toList());
            }
        });
    }

    @Override
    public Flux<RestorationEntry> getRestorationHistory(String archiveId) {
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(restorations.stream().filter(e -> Objects.equals(archiveId, e.archiveId())).toList());
            }
        });
    }
}
