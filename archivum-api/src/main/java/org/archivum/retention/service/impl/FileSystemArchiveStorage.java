package org.archivum.retention.service.impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.config.RetentionProperties;
import org.archivum.retention.enums.ArchiveLocation;
import org.archivum.retention.exception.StorageException;
import org.archivum.retention.service.ArchiveStorage;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

@Slf4j
@Service
public class FileSystemArchiveStorage implements ArchiveStorage {

    @Getter
    private final Path rootLocation;

    public FileSystemArchiveStorage(RetentionProperties properties) {
        this.rootLocation = Paths.get(properties.getArchiveBasePath()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(rootLocation);
            log.info("Archive storage initialized at: {}", rootLocation);
        } catch (IOException e) {
            log.error("Could not initialize archive storage location: {}", rootLocation, e);
            throw new StorageException("Could not initialize archive storage", e);
        }
    }

    @Override
    public ArchiveLocation location() {
        return ArchiveLocation.LOCAL;
    }

    @Override
    public Mono<Void> write(String storagePath, byte[] content) {
        return Mono.fromRunnable(() -> {
            Path target = resolve(storagePath);
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                Files.createDirectories(target.getParent());
                Files.write(temp, content);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                log.debug("Archive written to: {} ({} bytes)", target, content.length);
            } catch (IOException e) {
                log.error("Could not write archive: {}", storagePath, e);
                throw new StorageException("Could not write archive: " + storagePath, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<byte[]> read(String storagePath) {
        return Mono.fromCallable(() -> {
            Path file = resolve(storagePath);
            try {
                return Files.readAllBytes(file);
            } catch (NoSuchFileException e) {
                throw new StorageException("Archive file not found: " + storagePath, e);
            } catch (IOException e) {
                throw new StorageException("Could not read archive: " + storagePath, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> delete(String storagePath) {
        return Mono.fromRunnable(() -> {
            try {
                Files.delete(resolve(storagePath));
                log.info("Archive file deleted: {}", storagePath);
            } catch (NoSuchFileException e) {
                log.warn("Archive file {} not found in local storage for deletion, presumed already deleted.", storagePath);
            } catch (IOException e) {
                log.error("Could not delete archive file: {}", storagePath, e);
                throw new StorageException("Could not delete archive file: " + storagePath, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    private Path resolve(String storagePath) {
        Path path = rootLocation.resolve(storagePath).normalize();
        if (!path.startsWith(rootLocation)) {
            throw new StorageException("Archive path escapes the storage root: " + storagePath);
        }
        return path;
    }
}
