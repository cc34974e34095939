package org.archivum.retention.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.exception.IntegrityException;
import org.archivum.retention.model.Archive;
import org.archivum.retention.model.ArchiveDocument;
import org.archivum.retention.service.ArchiveCodec;
import org.archivum.retention.service.KeyCustodyService;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Read side of the archive blob: load, check the checksum, then decrypt and decompress.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArchiveContentLoader {

    private final ArchiveStorageRouter storageRouter;
    private final ArchiveCodec codec;
    private final KeyCustodyService keyCustodyService;

    public Mono<byte[]> loadRaw(Archive archive) {
        if (archive.getStorage() == null || archive.getStorage().path() == null) {
            return Mono.error(new IntegrityException("Archive " + archive.getArchiveId() + " has no storage path"));
        }
        return storageRouter.read(archive.getStorage().location(), archive.getStorage().path());
    }

    public String checksum(byte[] content) {
        return codec.checksum(content);
    }

    /**
     * Fails with an integrity error when the stored bytes do not match the recorded checksum.
     */
    public Mono<byte[]> loadVerified(Archive archive) {
        return loadRaw(archive)
                .publishOn(Schedulers.boundedElastic())
                .map(content -> {
                    String expected = archive.getFileInfo() != null ? archive.getFileInfo().checksum() : null;
                    String actual = codec.checksum(content);
                    if (expected == null || !expected.equals(actual)) {
                        log.error("Checksum mismatch for archive {}", archive.getArchiveId());
                        throw IntegrityException.checksumMismatch(archive.getArchiveId(), expected, actual);
                    }
                    return content;
                });
    }

    public Mono<ArchiveDocument> decode(Archive archive, byte[] content) {
        Mono<byte[]> plain = archive.isEncrypted()
                ? keyCustodyService.resolveKey(archive.getEncryption().keyId())
                    .publishOn(Schedulers.boundedElastic())
                    .map(key -> codec.decrypt(content, key))
                : Mono.just(content);
        return plain
                .publishOn(Schedulers.boundedElastic())
                .map(bytes -> archive.isCompressed() ? codec.decompress(bytes) : bytes)
                .map(codec::deserialize);
    }

    public Mono<ArchiveDocument> loadDocument(Archive archive) {
        return loadVerified(archive).flatMap(content -> decode(archive, content));
    }
}
