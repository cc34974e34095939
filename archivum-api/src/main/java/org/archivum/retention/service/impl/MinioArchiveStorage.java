package org.archivum.retention.service.impl;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.errors.ErrorResponseException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.config.MinioProperties;
import org.archivum.retention.enums.ArchiveLocation;
import org.archivum.retention.exception.StorageException;
import org.archivum.retention.service.ArchiveStorage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

@Slf4j
@Service
@ConditionalOnProperty(name = "storage.minio.enabled", havingValue = "true")
public class MinioArchiveStorage implements ArchiveStorage {

    private static final String CONTENT_TYPE = "application/octet-stream";
    private static final String NO_SUCH_KEY = "NoSuchKey";

    private final MinioClient minioClient;
    private final String bucketName;

    public MinioArchiveStorage(MinioClient minioClient, MinioProperties properties) {
        this.minioClient = minioClient;
        this.bucketName = properties.getBucketName();
    }

    @PostConstruct
    public void init() {
        try {
            boolean found = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucketName).build());
            if (!found) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucketName).build());
                log.info("Bucket '{}' created successfully.", bucketName);
            } else {
                log.info("Bucket '{}' already exists.", bucketName);
            }
        } catch (Exception e) {
            log.error("Error ensuring bucket '{}' exists", bucketName, e);
            throw new StorageException("Could not initialize archive bucket " + bucketName, e);
        }
    }

    @Override
    public ArchiveLocation location() {
        return ArchiveLocation.CLOUD_STORAGE;
    }

    @Override
    public Mono<Void> write(String storagePath, byte[] content) {
        return Mono.fromCallable(() -> {
                    PutObjectArgs args = PutObjectArgs.builder()
                            .bucket(bucketName)
                            .object(storagePath)
                            .stream(new ByteArrayInputStream(content), content.length, -1)
                            .contentType(CONTENT_TYPE)
                            .build();
                    minioClient.putObject(args);
                    log.info("Successfully uploaded {} to MinIO bucket {}", storagePath, bucketName);
                    return storagePath;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof StorageException),
                        e -> new StorageException("MinIO upload failed for " + storagePath, e))
                .then();
    }

    @Override
    public Mono<byte[]> read(String storagePath) {
        return Mono.fromCallable(() -> {
                    try (InputStream stream = minioClient.getObject(GetObjectArgs.builder()
                            .bucket(bucketName)
                            .object(storagePath)
                            .build())) {
                        return stream.readAllBytes();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> {
                    log.error("Error loading archive {} from MinIO", storagePath, e);
                    return new StorageException("MinIO load failed for " + storagePath, e);
                });
    }

    @Override
    public Mono<Void> delete(String storagePath) {
        return Mono.fromRunnable(() -> {
            try {
                minioClient.removeObject(RemoveObjectArgs.builder()
                        .bucket(bucketName)
                        .object(storagePath)
                        .build());
                log.info("Archive '{}' deleted successfully from MinIO bucket '{}'", storagePath, bucketName);
            } catch (ErrorResponseException e) {
                if (!NO_SUCH_KEY.equals(e.errorResponse().code())) {
                    throw new StorageException("MinIO delete failed for " + storagePath, e);
                }
                log.warn("Archive {} not found in MinIO for deletion, presumed already deleted.", storagePath);
            } catch (Exception e) {
                log.error("Error deleting archive {} from MinIO", storagePath, e);
                throw new StorageException("MinIO delete failed for " + storagePath, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }
}
