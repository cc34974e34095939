package org.archivum.retention.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.exception.IntegrityException;
import org.archivum.retention.exception.StorageException;
import org.archivum.retention.model.ArchiveDocument;
import org.archivum.retention.model.CompressionSettings;
import org.archivum.retention.utils.AesGcm;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Blocking byte transformations of the archive blob. Callers run these on a bounded elastic scheduler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArchiveCodec {

    public static final String CHECKSUM_ALGORITHM = "SHA-256";
    public static final String COMPRESSION_ALGORITHM = "gzip";

    private final ObjectMapper objectMapper;

    public byte[] serialize(ArchiveDocument document) {
        try {
            return objectMapper.writeValueAsBytes(document);
        } catch (IOException e) {
            throw new StorageException("Could not serialize archive " + document.metadata().archiveId(), e);
        }
    }

    public ArchiveDocument deserialize(byte[] json) {
        try {
            return objectMapper.readValue(json, ArchiveDocument.class);
        } catch (IOException e) {
            throw new IntegrityException("Archive content is not valid JSON", e);
        }
    }

    public byte[] compress(byte[] data, int level) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 4));
        try (GZIPOutputStream gzip = new LeveledGzipOutputStream(out, level >= 0 && level <= 9 ? level : CompressionSettings.DEFAULT_LEVEL)) {
            gzip.write(data);
        } catch (IOException e) {
            throw new StorageException("Could not compress archive content", e);
        }
        return out.toByteArray();
    }

    public byte[] decompress(byte[] data) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new IntegrityException("Archive content is not valid gzip", e);
        }
    }

    /**
     * Output is the IV followed by the GCM cipher text.
     */
    public byte[] encrypt(byte[] data, SecretKey key) {
        try {
            byte[] iv = AesGcm.newIv();
            byte[] cipherText = AesGcm.encrypt(key, iv, data);
            byte[] out = new byte[iv.length + cipherText.length];
            System.arraycopy(iv, 0, out, 0, iv.length);
            System.arraycopy(cipherText, 0, out, iv.length, cipherText.length);
            return out;
        } catch (GeneralSecurityException e) {
            throw new StorageException("Could not encrypt archive content", e);
        }
    }

    public byte[] decrypt(byte[] data, SecretKey key) {
        if (data.length <= AesGcm.IV_LENGTH) {
            throw new IntegrityException("Encrypted archive content is truncated");
        }
        try {
            byte[] iv = Arrays.copyOfRange(data, 0, AesGcm.IV_LENGTH);
            byte[] cipherText = Arrays.copyOfRange(data, AesGcm.IV_LENGTH, data.length);
            return AesGcm.decrypt(key, iv, cipherText);
        } catch (GeneralSecurityException e) {
            throw new IntegrityException("Could not decrypt archive content", e);
        }
    }

    public String checksum(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance(CHECKSUM_ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Hash algorithm not available: " + CHECKSUM_ALGORITHM, e);
        }
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {

        LeveledGzipOutputStream(ByteArrayOutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
