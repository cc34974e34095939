package org.archivum.retention.service.impl;

import org.archivum.retention.dto.response.ArchiveDeletionResult;
import org.archivum.retention.enums.ArchiveAuditAction;
import org.archivum.retention.enums.ArchiveLocation;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.enums.ImmutableCategory;
import org.archivum.retention.exception.StorageException;
import org.archivum.retention.model.Archive;
import org.archivum.retention.model.DeletionApproval;
import org.archivum.retention.model.DeletionSettings;
import org.archivum.retention.model.RetentionPeriod;
import org.archivum.retention.model.RetentionPolicy;
import org.archivum.retention.model.TenantRecord;
import org.archivum.retention.service.ArchiveStorage;
import org.archivum.retention.support.InMemoryRecordStore;
import org.archivum.retention.support.RetentionTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetentionDeletionServiceImplTest {

    private static final String TENANT = "tenant-a";

    @TempDir
    Path tempDir;

    private RetentionTestContext ctx;
    private InMemoryRecordStore store;
    private RetentionPolicy policy;

    @BeforeEach
    void setUp() {
        ctx = new RetentionTestContext(tempDir);
        store = ctx.store(DataType.AUDIT_LOGS);
        policy = RetentionTestContext.policy(TENANT, DataType.AUDIT_LOGS, RetentionPeriod.days(30));
    }

    @Test
    void deleteExpiredRecords_softDelete_marksOnlyExpiredRecords() {
        TenantRecord old = store.add(TENANT, ctx.daysAgo(40), Map.of("action", "login"));
        TenantRecord recent = store.add(TENANT, ctx.daysAgo(10), Map.of("action", "logout"));

        StepVerifier.create(ctx.deletionService.deleteExpiredRecords(policy, ctx.now()))
                .expectNext(1L)
                .verifyComplete();

        TenantRecord deleted = store.get(old.getId());
        assertEquals(ctx.now(), deleted.getDeletedAt());
        assertEquals("retention_policy", deleted.getDeletedBy());
        assertEquals("Retention period of 30 days expired", deleted.getDeletionReason());
        assertNull(store.get(recent.getId()).getDeletedAt());
    }

    @Test
    void deleteExpiredRecords_hardDeleteWithoutApprovalRequirement_removesRows() {
        policy.setDeletionSettings(DeletionSettings.hard());
        store.add(TENANT, ctx.daysAgo(40), Map.of("action", "login"));
        store.add(TENANT, ctx.daysAgo(31), Map.of("action", "login"));
        TenantRecord recent = store.add(TENANT, ctx.daysAgo(29), Map.of("action", "login"));

        StepVerifier.create(ctx.deletionService.deleteExpiredRecords(policy, ctx.now()))
                .expectNext(2L)
                .verifyComplete();

        assertEquals(List.of(recent.getId()), store.byTenant(TENANT).stream().map(TenantRecord::getId).toList());
    }

    @Test
    void deleteExpiredRecords_hardDeleteAwaitingApproval_fallsBackToSoftDelete() {
        policy.setDeletionSettings(new DeletionSettings(false, null, true, List.of("dpo"), null));
        TenantRecord old = store.add(TENANT, ctx.daysAgo(40), Map.of("action", "login"));

        StepVerifier.create(ctx.deletionService.deleteExpiredRecords(policy, ctx.now()))
                .expectNext(1L)
                .verifyComplete();

        assertNotNull(store.get(old.getId()));
        assertNotNull(store.get(old.getId()).getDeletedAt());
    }

    @Test
    void deleteExpiredRecords_hardDeleteApprovedByListedApprover_removesRows() {
        policy.setDeletionSettings(new DeletionSettings(false, null, true, List.of("dpo"),
                new DeletionApproval("dpo", ctx.daysAgo(1))));
        TenantRecord old = store.add(TENANT, ctx.daysAgo(40), Map.of("action", "login"));

        ctx.deletionService.deleteExpiredRecords(policy, ctx.now()).block();

        assertNull(store.get(old.getId()));
    }

    @Test
    void deleteExpiredRecords_purgesLongSoftDeletedRowsWithoutCountingThem() {
        policy.setDeletionSettings(new DeletionSettings(true, RetentionPeriod.days(30), false, List.of(), null));
        TenantRecord longGone = store.add(TENANT, ctx.daysAgo(200), Map.of("action", "login"));
        longGone.setDeletedAt(ctx.daysAgo(60));
        TenantRecord recentlyGone = store.add(TENANT, ctx.daysAgo(100), Map.of("action", "login"));
        recentlyGone.setDeletedAt(ctx.daysAgo(5));
        TenantRecord expired = store.add(TENANT, ctx.daysAgo(45), Map.of("action", "login"));

        StepVerifier.create(ctx.deletionService.deleteExpiredRecords(policy, ctx.now()))
                .expectNext(1L)
                .verifyComplete();

        assertNull(store.get(longGone.getId()));
        assertNotNull(store.get(recentlyGone.getId()));
        assertEquals(ctx.now(), store.get(expired.getId()).getDeletedAt());
    }

    @Test
    void deleteExpiredRecords_purgeAwaitingApproval_keepsSoftDeletedRows() {
        policy.setDeletionSettings(new DeletionSettings(true, RetentionPeriod.days(30), true, List.of("dpo"), null));
        TenantRecord longGone = store.add(TENANT, ctx.daysAgo(200), Map.of("action", "login"));
        longGone.setDeletedAt(ctx.daysAgo(60));

        ctx.deletionService.deleteExpiredRecords(policy, ctx.now()).block();

        assertNotNull(store.get(longGone.getId()));
    }

    @Test
    void deleteExpiredRecords_leavesOtherTenantsAlone() {
        TenantRecord mine = store.add(TENANT, ctx.daysAgo(40), Map.of("action", "login"));
        TenantRecord theirs = store.add("tenant-b", ctx.daysAgo(400), Map.of("action", "login"));

        ctx.deletionService.deleteExpiredRecords(policy, ctx.now()).block();

        assertNotNull(store.get(mine.getId()).getDeletedAt());
        assertNull(store.get(theirs.getId()).getDeletedAt());
    }

    @Test
    void deleteExpiredRecords_chainsEventOnlyWhenSomethingWasDeleted() {
        store.add(TENANT, ctx.daysAgo(5), Map.of("action", "login"));
        ctx.deletionService.deleteExpiredRecords(policy, ctx.now()).block();
        assertEquals(0L, countChainEvents("RECORDS_DELETED"));

        store.add(TENANT, ctx.daysAgo(50), Map.of("action", "login"));
        ctx.deletionService.deleteExpiredRecords(policy, ctx.now()).block();
        assertEquals(1L, countChainEvents("RECORDS_DELETED"));
    }

    @Test
    void deleteExpiredArchives_removesBlobAndRowOfDueArchive() {
        Archive archive = createArchive(TENANT);
        Path blob = ctx.localStorage.getRootLocation().resolve(archive.getStorage().path());
        assertTrue(Files.exists(blob));
        ctx.archiveService.scheduleDeletion(TENANT, archive.getArchiveId(), ctx.daysAgo(1), false, "admin").block();

        StepVerifier.create(ctx.deletionService.deleteExpiredArchives(TENANT))
                .assertNext(result -> {
                    assertEquals(archive.getArchiveId(), result.archiveId());
                    assertTrue(result.deleted());
                    assertNull(result.error());
                })
                .verifyComplete();

        assertFalse(Files.exists(blob));
        assertNull(ctx.archiveDAO.stored(archive.getArchiveId()));
        assertTrue(ctx.archiveDAO.auditEntries().stream().anyMatch(e -> e.action() == ArchiveAuditAction.DELETED));
        assertEquals(1L, countChainEvents("ARCHIVE_DELETED"));
    }

    @Test
    void deleteExpiredArchives_skipsArchivesNotYetDueOrOnHold() {
        Archive notDue = createArchive(TENANT);
        ctx.archiveService.scheduleDeletion(TENANT, notDue.getArchiveId(), ctx.now().plusDays(1), false, "admin").block();
        Archive held = createArchive(TENANT);
        ctx.archiveService.scheduleDeletion(TENANT, held.getArchiveId(), ctx.daysAgo(1), false, "admin").block();
        ctx.archiveService.placeLegalHold(TENANT, held.getArchiveId(), "litigation", "legal").block();

        StepVerifier.create(ctx.deletionService.deleteExpiredArchives(TENANT))
                .verifyComplete();

        assertNotNull(ctx.archiveDAO.stored(notDue.getArchiveId()));
        assertNotNull(ctx.archiveDAO.stored(held.getArchiveId()));
    }

    @Test
    void deleteExpiredArchives_approvalRequired_reportsWithoutDeleting() {
        Archive archive = createArchive(TENANT);
        ctx.archiveService.scheduleDeletion(TENANT, archive.getArchiveId(), ctx.daysAgo(1), true, "admin").block();

        StepVerifier.create(ctx.deletionService.deleteExpiredArchives(TENANT))
                .assertNext(result -> {
                    assertFalse(result.deleted());
                    assertEquals("Deletion requires approval", result.error());
                })
                .verifyComplete();
        assertNotNull(ctx.archiveDAO.stored(archive.getArchiveId()));
    }

    @Test
    void deleteExpiredArchives_nullTenant_coversEveryTenant() {
        Archive mine = createArchive(TENANT);
        Archive theirs = createArchive("tenant-b");
        ctx.archiveService.scheduleDeletion(TENANT, mine.getArchiveId(), ctx.daysAgo(1), false, "admin").block();
        ctx.archiveService.scheduleDeletion("tenant-b", theirs.getArchiveId(), ctx.daysAgo(1), false, "admin").block();

        List<ArchiveDeletionResult> scoped = ctx.deletionService.deleteExpiredArchives("tenant-b").collectList().block();
        assertEquals(1, scoped.size());
        assertEquals("tenant-b", scoped.get(0).tenantId());

        List<ArchiveDeletionResult> all = ctx.deletionService.deleteExpiredArchives(null).collectList().block();
        assertEquals(1, all.size());
        assertEquals(TENANT, all.get(0).tenantId());
    }

    @Test
    void deleteExpiredArchives_storageFailure_isReportedAndNextArchiveStillProcessed() {
        Archive first = createArchive(TENANT);
        Archive second = createArchive(TENANT);
        ctx.archiveService.scheduleDeletion(TENANT, first.getArchiveId(), ctx.daysAgo(1), false, "admin").block();
        ctx.archiveService.scheduleDeletion(TENANT, second.getArchiveId(), ctx.daysAgo(1), false, "admin").block();

        ArchiveStorage failing = mock(ArchiveStorage.class);
        when(failing.location()).thenReturn(ArchiveLocation.LOCAL);
        when(failing.delete(anyString())).thenAnswer(invocation ->
                invocation.getArgument(0, String.class).contains(first.getArchiveId())
                        ? Mono.error(new StorageException("permission denied"))
                        : Mono.empty());
        RetentionDeletionServiceImpl service = new RetentionDeletionServiceImpl(ctx.registry, ctx.cutoffCalculator,
                ctx.archiveDAO, new ArchiveStorageRouter(List.of(failing)), ctx.auditService, ctx.clock);

        List<ArchiveDeletionResult> results = service.deleteExpiredArchives(TENANT).collectList().block();

        assertEquals(2, results.size());
        ArchiveDeletionResult failed = results.stream().filter(r -> r.archiveId().equals(first.getArchiveId())).findFirst().orElseThrow();
        assertFalse(failed.deleted());
        assertEquals("permission denied", failed.error());
        assertNotNull(ctx.archiveDAO.stored(first.getArchiveId()));
        assertNull(ctx.archiveDAO.stored(second.getArchiveId()));
    }

    private Archive createArchive(String tenantId) {
        RetentionPolicy archiving = RetentionTestContext.policy(tenantId, DataType.DOCUMENTS, RetentionPeriod.years(1));
        archiving.setArchivalSettings(RetentionTestContext.archival(RetentionPeriod.days(30), true, false));
        InMemoryRecordStore documents = ctx.store(DataType.DOCUMENTS);
        List<TenantRecord> records = List.of(
                documents.add(tenantId, ctx.daysAgo(60), Map.of("title", "contract")),
                documents.add(tenantId, ctx.daysAgo(61), Map.of("title", "invoice")));
        return ctx.archiveService.createArchive(archiving, records, ctx.now()).block();
    }

    private long countChainEvents(String eventType) {
        return ctx.chainService.readEntries(ImmutableCategory.COMPLIANCE_EVENTS)
                .filter(e -> e.eventType().equals(eventType))
                .count()
                .block();
    }
}
