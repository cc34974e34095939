package org.archivum.retention.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.archivum.retention.config.AuditChainProperties;
import org.archivum.retention.dto.response.ChainVerificationResult;
import org.archivum.retention.dto.response.ChainVerificationResult.ChainError;
import org.archivum.retention.enums.ImmutableCategory;
import org.archivum.retention.exception.ConfigurationException;
import org.archivum.retention.model.ChainEntry;
import org.archivum.retention.model.ChainState;
import org.archivum.retention.support.MutableClock;
import org.archivum.retention.support.RetentionTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ImmutableAuditChainServiceImplTest {

    private static final ImmutableCategory CATEGORY = ImmutableCategory.COMPLIANCE_EVENTS;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = RetentionTestContext.objectMapper();
    private final MutableClock clock = new MutableClock(RetentionTestContext.NOW);
    private AuditChainProperties properties;
    private ImmutableAuditChainServiceImpl service;

    @BeforeEach
    void setUp() {
        properties = new AuditChainProperties();
        properties.setDirectory(tempDir.toString());
        properties.setSecret("chain-secret");
        service = new ImmutableAuditChainServiceImpl(properties, objectMapper, clock);
    }

    @Test
    void append_firstEntry_linksToEmptyHash() {
        StepVerifier.create(service.append(CATEGORY, "ARCHIVE_CREATED", Map.of("archiveId", "ARC-1")))
                .assertNext(entry -> {
                    assertEquals(1, entry.index());
                    assertEquals("", entry.previousHash());
                    assertEquals(64, entry.hash().length());
                    assertEquals(CATEGORY.name(), entry.category());
                    assertEquals("ARC-1", entry.data().get("archiveId").asText());
                })
                .verifyComplete();
        assertTrue(Files.exists(tempDir.resolve("compliance-events-immutable.log")));
        assertTrue(Files.exists(tempDir.resolve("compliance-events-chain.json")));
    }

    @Test
    void append_successiveEntries_formAChain() {
        ChainEntry first = service.append(CATEGORY, "A", Map.of("n", 1)).block();
        clock.advance(Duration.ofSeconds(5));
        ChainEntry second = service.append(CATEGORY, "B", Map.of("n", 2)).block();

        assertEquals(2, second.index());
        assertEquals(first.hash(), second.previousHash());
        assertNotEquals(first.hash(), second.hash());
        StepVerifier.create(service.getState(CATEGORY))
                .assertNext(state -> {
                    assertEquals(2, state.index());
                    assertEquals(second.hash(), state.lastHash());
                    assertEquals(2, state.totalEntries());
                })
                .verifyComplete();
    }

    @Test
    void computeHash_isIndependentOfDataKeyOrder() {
        ObjectNode ab = objectMapper.createObjectNode().put("a", 1).put("b", "x");
        ObjectNode ba = objectMapper.createObjectNode().put("b", "x").put("a", 1);

        assertEquals(service.computeHash("t", "E", ab, ""), service.computeHash("t", "E", ba, ""));
        assertNotEquals(service.computeHash("t", "E", ab, ""), service.computeHash("t", "E", ab, "prev"));
    }

    @Test
    void computeHash_dependsOnSecret() {
        properties.setSecret("another-secret");
        ImmutableAuditChainServiceImpl other = new ImmutableAuditChainServiceImpl(properties, objectMapper, clock);
        ObjectNode data = objectMapper.createObjectNode().put("a", 1);

        assertNotEquals(service.computeHash("t", "E", data, ""), other.computeHash("t", "E", data, ""));
    }

    @Test
    void verify_untouchedChain_isValid() {
        appendEntries(3);

        StepVerifier.create(service.verify(CATEGORY))
                .assertNext(result -> {
                    assertTrue(result.valid());
                    assertEquals(3, result.totalEntries());
                    assertEquals(3, result.validEntries());
                    assertEquals(1.0, result.integrityScore());
                    assertTrue(result.errors().isEmpty());
                })
                .verifyComplete();
    }

    @Test
    void verify_tamperedData_reportsOnlyTheModifiedEntry() throws Exception {
        appendEntries(3);
        Path log = tempDir.resolve(CATEGORY.logFileName());
        List<String> lines = new ArrayList<>(Files.readAllLines(log, StandardCharsets.UTF_8));
        ObjectNode second = (ObjectNode) objectMapper.readTree(lines.get(1));
        ((ObjectNode) second.get("data")).put("n", 999);
        lines.set(1, objectMapper.writeValueAsString(second));
        Files.write(log, lines, StandardCharsets.UTF_8);

        StepVerifier.create(service.verify(CATEGORY))
                .assertNext(result -> {
                    assertFalse(result.valid());
                    assertEquals(3, result.totalEntries());
                    assertEquals(2, result.validEntries());
                    assertEquals(1, result.invalidEntries());
                    assertEquals(2.0 / 3, result.integrityScore(), 0.0001);
                    ChainError error = result.errors().get(0);
                    assertEquals(2, error.line());
                    assertEquals(2L, error.entryIndex());
                    assertEquals(ChainVerificationResult.HASH_MISMATCH, error.reason());
                    assertNotEquals(error.expected(), error.actual());
                })
                .verifyComplete();
    }

    @Test
    void verify_unparsableLine_isReportedAsParseError() throws Exception {
        appendEntries(2);
        Files.writeString(tempDir.resolve(CATEGORY.logFileName()), "{not json\n", StandardCharsets.UTF_8,
                StandardOpenOption.APPEND);

        StepVerifier.create(service.verify(CATEGORY))
                .assertNext(result -> {
                    assertFalse(result.valid());
                    assertEquals(3, result.totalEntries());
                    assertEquals(2, result.validEntries());
                    assertEquals(ChainVerificationResult.PARSE_ERROR, result.errors().get(0).reason());
                    assertEquals(3, result.errors().get(0).line());
                })
                .verifyComplete();
    }

    @Test
    void verify_emptyChain_isValidWithFullScore() {
        StepVerifier.create(service.verify(ImmutableCategory.SECURITY_EVENTS))
                .assertNext(result -> {
                    assertTrue(result.valid());
                    assertEquals(0, result.totalEntries());
                    assertEquals(1.0, result.integrityScore());
                })
                .verifyComplete();
    }

    @Test
    void appendAndVerify_mutableCategory_throwConfigurationException() {
        StepVerifier.create(service.append(ImmutableCategory.SYSTEM_HEALTH, "PING", Map.of()))
                .expectError(ConfigurationException.class)
                .verify();
        StepVerifier.create(service.verify(ImmutableCategory.INFRASTRUCTURE_EVENTS))
                .expectError(ConfigurationException.class)
                .verify();
    }

    @Test
    void verifyAll_coversOnlyImmutableCategories() {
        appendEntries(1);

        List<ChainVerificationResult> results = service.verifyAll().collectList().block();

        assertEquals(5, results.size());
        assertTrue(results.stream().allMatch(ChainVerificationResult::valid));
        assertTrue(results.stream().noneMatch(r -> r.category() == ImmutableCategory.SYSTEM_HEALTH));
    }

    @Test
    void append_missingStateFile_continuesFromLastLogLine() throws Exception {
        appendEntries(2);
        ChainState before = service.getState(CATEGORY).block();
        Files.delete(tempDir.resolve(CATEGORY.stateFileName()));

        ChainEntry third = service.append(CATEGORY, "C", Map.of("n", 3)).block();

        assertEquals(3, third.index());
        assertEquals(before.lastHash(), third.previousHash());
        assertTrue(service.verify(CATEGORY).block().valid());
    }

    @Test
    void append_stateFileBehindLog_resumesFromTheLogHead() throws Exception {
        appendEntries(2);
        Path stateFile = tempDir.resolve(CATEGORY.stateFileName());
        byte[] staleState = Files.readAllBytes(stateFile);
        ChainEntry third = service.append(CATEGORY, "C", Map.of("n", 3)).block();
        Files.write(stateFile, staleState);

        ChainEntry fourth = service.append(CATEGORY, "D", Map.of("n", 4)).block();

        assertEquals(4, fourth.index());
        assertEquals(third.hash(), fourth.previousHash());
        assertEquals(4, service.getState(CATEGORY).block().totalEntries());
        ChainVerificationResult result = service.verify(CATEGORY).block();
        assertTrue(result.valid());
        assertEquals(4, result.totalEntries());
    }

    @Test
    void append_categoriesHaveIndependentChains() {
        service.append(CATEGORY, "A", Map.of()).block();
        ChainEntry security = service.append(ImmutableCategory.SECURITY_EVENTS, "LOGIN_FAILED", Map.of()).block();

        assertEquals(1, security.index());
        assertEquals("", security.previousHash());
    }

    @Test
    void append_concurrentWriters_keepTheChainIntact() {
        List<ChainEntry> entries = Flux.range(0, 25)
                .flatMap(i -> service.append(CATEGORY, "EVENT", Map.of("i", i)), 8)
                .collectList()
                .block();

        assertEquals(25, entries.size());
        assertEquals(25, entries.stream().map(ChainEntry::index).distinct().count());
        ChainVerificationResult result = service.verify(CATEGORY).block();
        assertTrue(result.valid());
        assertEquals(25, result.totalEntries());
    }

    @Test
    void readEntries_returnsEntriesInOrder() {
        appendEntries(3);

        StepVerifier.create(service.readEntries(CATEGORY).map(ChainEntry::index))
                .expectNext(1L, 2L, 3L)
                .verifyComplete();
    }

    private void appendEntries(int count) {
        for (int i = 1; i <= count; i++) {
            service.append(CATEGORY, "EVENT_" + i, Map.of("n", i)).block();
            clock.advance(Duration.ofSeconds(1));
        }
    }
}
