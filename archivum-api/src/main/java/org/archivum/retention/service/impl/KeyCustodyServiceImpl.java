package org.archivum.retention.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.config.EncryptionProperties;
import org.archivum.retention.exception.ConfigurationException;
import org.archivum.retention.exception.IntegrityException;
import org.archivum.retention.exception.ResourceNotFoundException;
import org.archivum.retention.exception.StorageException;
import org.archivum.retention.model.ArchiveKey;
import org.archivum.retention.repository.ArchiveKeyDAO;
import org.archivum.retention.service.KeyCustodyService;
import org.archivum.retention.utils.AesGcm;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.UUID;

/**
 * Data keys are wrapped with the platform master key and only the wrapped form is persisted.
 */
@Slf4j
@Service
public class KeyCustodyServiceImpl implements KeyCustodyService {

    private static final int MASTER_KEY_LENGTH = 32;

    private final EncryptionProperties properties;
    private final ArchiveKeyDAO archiveKeyDAO;
    private final Clock clock;

    public KeyCustodyServiceImpl(EncryptionProperties properties, ArchiveKeyDAO archiveKeyDAO, Clock clock) {
        this.properties = properties;
        this.archiveKeyDAO = archiveKeyDAO;
        this.clock = clock;
    }

    @Override
    public Mono<DataKey> createKey(String tenantId) {
        return Mono.fromCallable(() -> {
                    SecretKey masterKey = masterKey();
                    SecretKey dataKey = AesGcm.generateKey();
                    byte[] iv = AesGcm.newIv();
                    byte[] wrapped = AesGcm.encrypt(masterKey, iv, dataKey.getEncoded());
                    Base64.Encoder encoder = Base64.getEncoder();
                    ArchiveKey key = new ArchiveKey("KEY-" + UUID.randomUUID(), tenantId, encoder.encodeToString(wrapped),
                            encoder.encodeToString(iv), properties.getMasterKeyId(), OffsetDateTime.now(clock));
                    return new IssuedKey(key, dataKey);
                })
                .onErrorMap(GeneralSecurityException.class, e -> new StorageException("Could not generate archive key", e))
                .flatMap(issued -> archiveKeyDAO.save(issued.stored())
                        .doOnSuccess(v -> log.debug("Archive key {} created for tenant {}", issued.stored().keyId(), tenantId))
                        .thenReturn(new DataKey(issued.stored().keyId(), issued.dataKey())));
    }

    @Override
    public Mono<SecretKey> resolveKey(String keyId) {
        return archiveKeyDAO.findById(keyId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("ArchiveKey", keyId)))
                .map(this::unwrap);
    }

    @Override
    public Mono<Void> discardKey(String keyId) {
        return archiveKeyDAO.delete(keyId)
                .doOnSuccess(v -> log.debug("Archive key {} discarded", keyId));
    }

    private SecretKey unwrap(ArchiveKey key) {
        if (properties.getMasterKeyId() != null && !properties.getMasterKeyId().equals(key.masterKeyId())) {
            log.warn("Archive key {} was wrapped with master key {}, current is {}",
                    key.keyId(), key.masterKeyId(), properties.getMasterKeyId());
        }
        try {
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] raw = AesGcm.decrypt(masterKey(), decoder.decode(key.iv()), decoder.decode(key.wrappedKey()));
            return AesGcm.keyFromBytes(raw);
        } catch (GeneralSecurityException e) {
            throw new IntegrityException("Could not unwrap archive key " + key.keyId(), e);
        }
    }

    private SecretKey masterKey() {
        String encoded = properties.getMasterKey();
        if (encoded == null || encoded.isBlank()) {
            throw new ConfigurationException("archivum.encryption.master-key is required for encrypted archives");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("archivum.encryption.master-key is not valid base64");
        }
        if (raw.length != MASTER_KEY_LENGTH) {
            throw new ConfigurationException("archivum.encryption.master-key must be 256 bits, got " + raw.length * 8);
        }
        return AesGcm.keyFromBytes(raw);
    }

    private record IssuedKey(ArchiveKey stored, SecretKey dataKey) {}
}
