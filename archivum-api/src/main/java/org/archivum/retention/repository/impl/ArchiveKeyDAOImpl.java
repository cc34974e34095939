package org.archivum.retention.repository.impl;

import lombok.RequiredArgsConstructor;
import org.archivum.retention.model.ArchiveKey;
import org.archivum.retention.repository.ArchiveKeyDAO;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

import static org.archivum.retention.repository.SqlTableMapping.ARCHIVE_KEYS;

@Service
@RequiredArgsConstructor
public class ArchiveKeyDAOImpl implements ArchiveKeyDAO {

    private static final String INSERT_KEY = "INSERT INTO " + ARCHIVE_KEYS
            + " (key_id, tenant_id, wrapped_key, iv, master_key_id, created_at)"
            + " VALUES (:keyId, :tenantId, :wrappedKey, :iv, :masterKeyId, :createdAt)";

    private static final String SELECT_KEY = "SELECT key_id, tenant_id, wrapped_key, iv, master_key_id, created_at FROM "
            + ARCHIVE_KEYS + " WHERE key_id = :keyId";

    private final DatabaseClient databaseClient;

    @Override
    public Mono<Void> save(ArchiveKey key) {
        return databaseClient.sql(INSERT_KEY)
                .bind("keyId", key.keyId())
                .bind("tenantId", key.tenantId())
                .bind("wrappedKey", key.wrappedKey())
                .bind("iv", key.iv())
                .bind("masterKeyId", key.masterKeyId())
                .bind("createdAt", key.createdAt())
                .then();
    }

    @Override
    public Mono<ArchiveKey> findById(String keyId) {
        return databaseClient.sql(SELECT_KEY)
                .bind("keyId", keyId)
                .map(row -> new ArchiveKey(
                        row.get("key_id", String.class),
                        row.get("tenant_id", String.class),
                        row.get("wrapped_key", String.class),
                        row.get("iv", String.class),
                        row.get("master_key_id", String.class),
                        row.get("created_at", OffsetDateTime.class)))
                .one();
    }

    @Override
    public Mono<Void> delete(String keyId) {
        return databaseClient.sql("DELETE FROM " + ARCHIVE_KEYS + " WHERE key_id = :keyId")
                .bind("keyId", keyId)
                .then();
    }
}
