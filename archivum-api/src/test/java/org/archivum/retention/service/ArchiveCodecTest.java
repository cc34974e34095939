package org.archivum.retention.service;

import org.archivum.retention.enums.DataType;
import org.archivum.retention.exception.IntegrityException;
import org.archivum.retention.model.ArchiveDocument;
import org.archivum.retention.model.ArchiveMetadata;
import org.archivum.retention.model.TenantRecord;
import org.archivum.retention.support.RetentionTestContext;
import org.archivum.retention.utils.AesGcm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveCodecTest {

    private ArchiveCodec codec;

    @BeforeEach
    void setUp() {
        codec = new ArchiveCodec(RetentionTestContext.objectMapper());
    }

    @Test
    void serialize_thenDeserialize_keepsRecordsAndMetadata() {
        OffsetDateTime date = OffsetDateTime.parse("2025-01-02T03:04:05Z");
        TenantRecord record = TenantRecord.builder()
                .id(UUID.randomUUID())
                .tenantId("tenant-a")
                .recordDate(date)
                .payload(Map.of("action", "login", "userId", "u-1"))
                .build();
        ArchiveDocument document = new ArchiveDocument(new ArchiveMetadata("ARC-1-ABCDEFGH", "tenant-a",
                DataType.AUDIT_LOGS, "AuditLog", 1, date, UUID.randomUUID()), List.of(record));

        ArchiveDocument decoded = codec.deserialize(codec.serialize(document));

        assertEquals(DataType.AUDIT_LOGS, decoded.metadata().dataType());
        assertEquals(1, decoded.records().size());
        assertEquals(record.getId(), decoded.records().get(0).getId());
        assertEquals(date.toInstant(), decoded.records().get(0).getRecordDate().toInstant());
        assertEquals("login", decoded.records().get(0).getPayload().get("action"));
    }

    @Test
    void serialize_writesDataTypeKey() {
        ArchiveDocument document = new ArchiveDocument(new ArchiveMetadata("ARC-1-ABCDEFGH", "tenant-a",
                DataType.FINANCIAL_RECORDS, "FinancialRecord", 0, OffsetDateTime.now(), null), List.of());

        String json = new String(codec.serialize(document), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"financial_records\""));
    }

    @Test
    void compress_shrinksRepetitiveContent() {
        byte[] data = "retention ".repeat(2000).getBytes(StandardCharsets.UTF_8);

        byte[] compressed = codec.compress(data, 9);

        assertTrue(compressed.length < data.length / 10);
        assertArrayEquals(data, codec.decompress(compressed));
    }

    @Test
    void compress_outOfRangeLevel_fallsBackToDefault() {
        byte[] data = "abc".repeat(100).getBytes(StandardCharsets.UTF_8);

        assertArrayEquals(data, codec.decompress(codec.compress(data, 42)));
    }

    @Test
    void decompress_notGzip_throwsIntegrityException() {
        assertThrows(IntegrityException.class, () -> codec.decompress("plain".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void encrypt_prefixesFreshIv() throws Exception {
        SecretKey key = AesGcm.generateKey();
        byte[] data = "secret payload".getBytes(StandardCharsets.UTF_8);

        byte[] first = codec.encrypt(data, key);
        byte[] second = codec.encrypt(data, key);

        assertEquals(AesGcm.IV_LENGTH + data.length + 16, first.length);
        assertFalse(java.util.Arrays.equals(first, second));
        assertArrayEquals(data, codec.decrypt(first, key));
    }

    @Test
    void decrypt_wrongKey_throwsIntegrityException() throws Exception {
        byte[] encrypted = codec.encrypt("secret".getBytes(StandardCharsets.UTF_8), AesGcm.generateKey());
        SecretKey other = AesGcm.generateKey();

        assertThrows(IntegrityException.class, () -> codec.decrypt(encrypted, other));
    }

    @Test
    void decrypt_truncated_throwsIntegrityException() throws Exception {
        SecretKey key = AesGcm.generateKey();

        assertThrows(IntegrityException.class, () -> codec.decrypt(new byte[AesGcm.IV_LENGTH], key));
    }

    @Test
    void checksum_isSha256Hex() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                codec.checksum("abc".getBytes(StandardCharsets.UTF_8)));
    }
}
