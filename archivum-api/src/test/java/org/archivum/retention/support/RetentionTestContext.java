package org.archivum.retention.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.archivum.retention.config.AuditChainProperties;
import org.archivum.retention.config.EncryptionProperties;
import org.archivum.retention.config.RetentionProperties;
import org.archivum.retention.enums.ArchiveLocation;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.model.ArchivalSettings;
import org.archivum.retention.model.CompressionSettings;
import org.archivum.retention.model.DeletionSettings;
import org.archivum.retention.model.EncryptionSettings;
import org.archivum.retention.model.ExecutionSchedule;
import org.archivum.retention.model.PolicyStatistics;
import org.archivum.retention.model.RetentionPeriod;
import org.archivum.retention.model.RetentionPolicy;
import org.archivum.retention.repository.RecordStoreRegistry;
import org.archivum.retention.service.ArchiveCodec;
import org.archivum.retention.service.CutoffCalculator;
import org.archivum.retention.service.PolicyScheduleCalculator;
import org.archivum.retention.service.impl.ArchiveContentLoader;
import org.archivum.retention.service.impl.ArchiveReconciliationServiceImpl;
import org.archivum.retention.service.impl.ArchiveRestoreServiceImpl;
import org.archivum.retention.service.impl.ArchiveServiceImpl;
import org.archivum.retention.service.impl.ArchiveStorageRouter;
import org.archivum.retention.service.impl.FileSystemArchiveStorage;
import org.archivum.retention.service.impl.ImmutableAuditChainServiceImpl;
import org.archivum.retention.service.impl.KeyCustodyServiceImpl;
import org.archivum.retention.service.impl.RetentionAuditServiceImpl;
import org.archivum.retention.service.impl.RetentionDeletionServiceImpl;
import org.archivum.retention.service.impl.RetentionExecutionServiceImpl;
import org.archivum.retention.service.impl.RetentionPolicyServiceImpl;
import org.archivum.retention.service.impl.RetentionReportServiceImpl;

import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The retention services wired by hand over in-memory stores, a temporary archive root and a temporary chain directory.
 */
public class RetentionTestContext {

    public static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");
    public static final String INSTANCE_ID = "test-instance";
    public static final String MASTER_KEY = Base64.getEncoder().encodeToString(new byte[]{
            1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16,
            17, 18, 19, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29, 30, 31, 32});

    public final MutableClock clock = new MutableClock(NOW);
    public final ObjectMapper objectMapper = objectMapper();
    public final RetentionProperties retentionProperties = new RetentionProperties();
    public final AuditChainProperties chainProperties = new AuditChainProperties();
    public final EncryptionProperties encryptionProperties = new EncryptionProperties();

    public final Map<DataType, InMemoryRecordStore> stores = new EnumMap<>(DataType.class);
    public final InMemoryArchiveDAO archiveDAO = new InMemoryArchiveDAO();
    public final InMemoryRetentionPolicyDAO policyDAO = new InMemoryRetentionPolicyDAO();
    public final InMemoryArchiveKeyDAO keyDAO = new InMemoryArchiveKeyDAO();
    public final InMemoryRetentionLeaseDAO leaseDAO = new InMemoryRetentionLeaseDAO();

    public final RecordStoreRegistry registry;
    public final CutoffCalculator cutoffCalculator;
    public final PolicyScheduleCalculator scheduleCalculator;
    public final ArchiveCodec codec;
    public final KeyCustodyServiceImpl keyCustodyService;
    public final FileSystemArchiveStorage localStorage;
    public final ArchiveStorageRouter storageRouter;
    public final ImmutableAuditChainServiceImpl chainService;
    public final RetentionAuditServiceImpl auditService;
    public final ArchiveContentLoader contentLoader;
    public final RetentionPolicyServiceImpl policyService;
    public final ArchiveServiceImpl archiveService;
    public final ArchiveRestoreServiceImpl restoreService;
    public final RetentionDeletionServiceImpl deletionService;
    public final RetentionExecutionServiceImpl executionService;
    public final RetentionReportServiceImpl reportService;
    public final ArchiveReconciliationServiceImpl reconciliationService;

    public RetentionTestContext(Path tempDir) {
        retentionProperties.setArchiveBasePath(tempDir.resolve("archives").toString());
        retentionProperties.setZone(ZoneOffset.UTC);
        retentionProperties.setInstanceId(INSTANCE_ID);
        chainProperties.setDirectory(tempDir.resolve("immutable").toString());
        chainProperties.setSecret("test-chain-secret");
        encryptionProperties.setMasterKey(MASTER_KEY);

        for (DataType dataType : DataType.values()) {
            stores.put(dataType, new InMemoryRecordStore(dataType));
        }
        registry = new RecordStoreRegistry(new ArrayList<>(stores.values()));
        cutoffCalculator = new CutoffCalculator(retentionProperties);
        scheduleCalculator = new PolicyScheduleCalculator(retentionProperties);
        codec = new ArchiveCodec(objectMapper);
        keyCustodyService = new KeyCustodyServiceImpl(encryptionProperties, keyDAO, clock);
        localStorage = new FileSystemArchiveStorage(retentionProperties);
        storageRouter = new ArchiveStorageRouter(List.of(localStorage));
        chainService = new ImmutableAuditChainServiceImpl(chainProperties, objectMapper, clock);
        auditService = new RetentionAuditServiceImpl(chainProperties, chainService);
        contentLoader = new ArchiveContentLoader(storageRouter, codec, keyCustodyService);
        policyService = new RetentionPolicyServiceImpl(policyDAO, registry, cutoffCalculator, scheduleCalculator,
                storageRouter, auditService, clock);
        archiveService = new ArchiveServiceImpl(archiveDAO, registry, cutoffCalculator, codec, keyCustodyService,
                storageRouter, contentLoader, auditService, clock);
        restoreService = new ArchiveRestoreServiceImpl(archiveService, archiveDAO, contentLoader, registry, auditService, clock);
        deletionService = new RetentionDeletionServiceImpl(registry, cutoffCalculator, archiveDAO, storageRouter,
                auditService, clock);
        executionService = new RetentionExecutionServiceImpl(policyDAO, policyService, leaseDAO, archiveService,
                deletionService, scheduleCalculator, retentionProperties, clock);
        reportService = new RetentionReportServiceImpl(policyDAO, archiveDAO, cutoffCalculator);
        reconciliationService = new ArchiveReconciliationServiceImpl(archiveDAO, storageRouter, registry,
                keyCustodyService, retentionProperties, clock);
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    public OffsetDateTime daysAgo(int days) {
        return now().minusDays(days);
    }

    public InMemoryRecordStore store(DataType dataType) {
        return stores.get(dataType);
    }

    public static RetentionPolicy policy(String tenantId, DataType dataType, RetentionPeriod retention) {
        return RetentionPolicy.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .policyName(dataType.getKey() + " retention")
                .dataType(dataType)
                .retentionPeriod(retention)
                .archivalSettings(ArchivalSettings.disabled())
                .deletionSettings(DeletionSettings.soft())
                .executionSchedule(ExecutionSchedule.defaultSchedule())
                .statistics(new PolicyStatistics())
                .build();
    }

    public static ArchivalSettings archival(RetentionPeriod archiveAfter, boolean compress, boolean encrypt) {
        return new ArchivalSettings(true, archiveAfter, ArchiveLocation.LOCAL,
                compress ? CompressionSettings.gzip() : CompressionSettings.none(),
                encrypt ? EncryptionSettings.on() : EncryptionSettings.off());
    }
}
