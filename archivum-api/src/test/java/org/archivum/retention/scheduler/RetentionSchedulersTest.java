package org.archivum.retention.scheduler;

import org.archivum.retention.dto.response.ArchiveDeletionResult;
import org.archivum.retention.dto.response.ChainVerificationResult;
import org.archivum.retention.dto.response.ChainVerificationResult.ChainError;
import org.archivum.retention.dto.response.PolicyExecutionResult;
import org.archivum.retention.enums.DataType;
import org.archivum.retention.enums.ImmutableCategory;
import org.archivum.retention.service.ImmutableAuditChainService;
import org.archivum.retention.service.RetentionDeletionService;
import org.archivum.retention.service.RetentionExecutionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetentionSchedulersTest {

    @Mock
    private RetentionExecutionService executionService;

    @Mock
    private RetentionDeletionService deletionService;

    @Mock
    private ImmutableAuditChainService chainService;

    @Test
    void retentionPolicyScheduler_runsEveryTenant() {
        PolicyExecutionResult skipped = PolicyExecutionResult.skipped(UUID.randomUUID(), "tenant-a", DataType.REPORTS, "leased");
        when(executionService.executeRetentionPolicies(null)).thenReturn(Flux.just(skipped));

        new RetentionPolicyScheduler(executionService).executeDuePolicies();

        verify(executionService).executeRetentionPolicies(null);
    }

    @Test
    void retentionPolicyScheduler_errorIsLoggedNotThrown() {
        when(executionService.executeRetentionPolicies(null)).thenReturn(Flux.error(new IllegalStateException("db down")));

        assertDoesNotThrow(() -> new RetentionPolicyScheduler(executionService).executeDuePolicies());
    }

    @Test
    void expiredArchiveCleanupScheduler_coversEveryTenant() {
        when(deletionService.deleteExpiredArchives(null)).thenReturn(Flux.just(
                new ArchiveDeletionResult("ARC-1", "tenant-a", true, null),
                new ArchiveDeletionResult("ARC-2", "tenant-b", false, "Deletion requires approval")));

        new ExpiredArchiveCleanupScheduler(deletionService).cleanupExpiredArchives();

        verify(deletionService).deleteExpiredArchives(null);
    }

    @Test
    void chainVerificationScheduler_reportsViolations() {
        ChainVerificationResult broken = new ChainVerificationResult(ImmutableCategory.SECURITY_EVENTS, false, 3, 2, 1, 2.0 / 3,
                List.of(new ChainError(2, 1L, ChainVerificationResult.HASH_MISMATCH, "aa", "bb", null)));
        ChainVerificationResult intact = new ChainVerificationResult(ImmutableCategory.ADMIN_ACTIONS, true, 0, 0, 0, 1.0, List.of());
        when(chainService.verifyAll()).thenReturn(Flux.just(broken, intact));

        assertDoesNotThrow(() -> new ImmutableChainVerificationScheduler(chainService).verifyImmutableChains());

        verify(chainService).verifyAll();
    }
}
