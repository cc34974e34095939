package org.archivum.retention.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.config.AuditChainProperties;
import org.archivum.retention.dto.response.ChainVerificationResult;
import org.archivum.retention.dto.response.ChainVerificationResult.ChainError;
import org.archivum.retention.enums.ImmutableCategory;
import org.archivum.retention.exception.ConfigurationException;
import org.archivum.retention.exception.StorageException;
import org.archivum.retention.model.ChainEntry;
import org.archivum.retention.model.ChainState;
import org.archivum.retention.service.ImmutableAuditChainService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import static org.archivum.retention.dto.response.ChainVerificationResult.HASH_MISMATCH;
import static org.archivum.retention.dto.response.ChainVerificationResult.PARSE_ERROR;

/**
 * File-backed chains: {@code {category}-immutable.log} holds one JSON entry per line and
 * {@code {category}-chain.json} holds the head of the chain. Appends to one category are
 * serialised by an in-process lock; different categories proceed independently.
 */
@Slf4j
@Service
public class ImmutableAuditChainServiceImpl implements ImmutableAuditChainService {

    private final Path directory;
    private final String algorithm;
    private final byte[] secret;
    private final ObjectMapper objectMapper;
    private final ObjectMapper sortedKeyMapper;
    private final Clock clock;
    private final Map<ImmutableCategory, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ImmutableAuditChainServiceImpl(AuditChainProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.directory = Paths.get(properties.getDirectory()).toAbsolutePath().normalize();
        this.algorithm = properties.getAlgorithm();
        this.secret = properties.getSecret().getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
        this.sortedKeyMapper = objectMapper.copy();
        this.sortedKeyMapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.sortedKeyMapper.configure(SerializationFeature.INDENT_OUTPUT, false);
        this.clock = clock;
    }

    @Override
    public Mono<ChainEntry> append(ImmutableCategory category, String eventType, Object data) {
        if (category == null || !category.isImmutable()) {
            return Mono.error(new ConfigurationException("Category " + category + " is not configured for immutable logging"));
        }
        return Mono.fromCallable(() -> appendLocked(category, eventType, data))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ChainEntry appendLocked(ImmutableCategory category, String eventType, Object data) {
        ReentrantLock lock = locks.computeIfAbsent(category, c -> new ReentrantLock());
        lock.lock();
        try {
            Files.createDirectories(directory);
            ChainState state = loadState(category);
            JsonNode dataNode = data != null ? objectMapper.valueToTree(data) : NullNode.getInstance();
            String timestamp = Instant.now(clock).toString();
            String hash = computeHash(timestamp, eventType, dataNode, state.lastHash());
            ChainEntry entry = new ChainEntry(state.index() + 1, timestamp, category.name(), eventType, dataNode,
                    state.lastHash(), hash);

            Files.writeString(logFile(category), objectMapper.writeValueAsString(entry) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            writeState(category, new ChainState(entry.index(), hash, timestamp, state.totalEntries() + 1));
            log.debug("Immutable entry {} appended to {}: {}", entry.index(), category, eventType);
            return entry;
        } catch (IOException e) {
            log.error("Could not append immutable entry to {}", category, e);
            throw new StorageException("Could not append immutable entry to " + category, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Mono<ChainVerificationResult> verify(ImmutableCategory category) {
        if (category == null || !category.isImmutable()) {
            return Mono.error(new ConfigurationException("Category " + category + " is not configured for immutable logging"));
        }
        return Mono.fromCallable(() -> verifyLog(category))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ChainVerificationResult verifyLog(ImmutableCategory category) {
        Path logFile = logFile(category);
        if (!Files.exists(logFile)) {
            return new ChainVerificationResult(category, true, 0, 0, 0, 1.0, List.of());
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Could not read immutable log {}", logFile, e);
            return new ChainVerificationResult(category, false, 0, 0, 0, 0.0,
                    List.of(new ChainError(0, null, PARSE_ERROR, null, null, e.getMessage())));
        }

        String expectedPrevious = "";
        long valid = 0;
        long invalid = 0;
        List<ChainError> errors = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            long lineNumber = i + 1L;
            ChainEntry entry;
            try {
                entry = objectMapper.readValue(line, ChainEntry.class);
            } catch (JsonProcessingException e) {
                invalid++;
                errors.add(new ChainError(lineNumber, null, PARSE_ERROR, null, null, e.getOriginalMessage()));
                continue;
            }
            String recomputed = computeHash(entry.timestamp(), entry.eventType(), entry.data(), expectedPrevious);
            if (recomputed.equals(entry.hash()) && expectedPrevious.equals(entry.previousHash())) {
                valid++;
            } else {
                invalid++;
                errors.add(new ChainError(lineNumber, entry.index(), HASH_MISMATCH, recomputed, entry.hash(), null));
            }
            // successors link to the stored hash, not the recomputed one
            expectedPrevious = entry.hash() != null ? entry.hash() : "";
        }

        long total = valid + invalid;
        double score = total == 0 ? 1.0 : (double) valid / total;
        if (invalid > 0) {
            log.warn("Immutable chain {} has {} invalid entries out of {}", category, invalid, total);
        }
        return new ChainVerificationResult(category, invalid == 0, total, valid, invalid, score, List.copyOf(errors));
    }

    @Override
    public Flux<ChainVerificationResult> verifyAll() {
        return Flux.fromArray(ImmutableCategory.values())
                .filter(ImmutableCategory::isImmutable)
                .concatMap(this::verify);
    }

    @Override
    public Flux<ChainEntry> readEntries(ImmutableCategory category) {
        return Mono.fromCallable(() -> {
                    Path logFile = logFile(category);
                    if (!Files.exists(logFile)) {
                        return List.<ChainEntry>of();
                    }
                    List<ChainEntry> entries = new ArrayList<>();
                    for (String line : Files.readAllLines(logFile, StandardCharsets.UTF_8)) {
                        if (line.isBlank()) {
                            continue;
                        }
                        try {
                            entries.add(objectMapper.readValue(line, ChainEntry.class));
                        } catch (JsonProcessingException e) {
                            log.warn("Skipping unreadable line in {}: {}", logFile.getFileName(), e.getOriginalMessage());
                        }
                    }
                    return entries;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(IOException.class, e -> new StorageException("Could not read immutable log " + category, e))
                .flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<ChainState> getState(ImmutableCategory category) {
        return Mono.fromCallable(() -> loadState(category))
                .subscribeOn(Schedulers.boundedElastic());
    }

    String computeHash(String timestamp, String eventType, JsonNode data, String previousHash) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("timestamp", timestamp);
        canonical.put("eventType", eventType);
        canonical.put("data", data != null ? objectMapper.convertValue(data, Object.class) : null);
        canonical.put("previousHash", previousHash != null ? previousHash : "");
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(secret, algorithm));
            byte[] digest = mac.doFinal(sortedKeyMapper.writeValueAsBytes(canonical));
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not canonicalize immutable entry", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("MAC algorithm not available: " + algorithm, e);
        }
    }

    /**
     * The state file is a cache of the log head. The log wins when the state file is missing,
     * unreadable or behind it, which happens when a write stopped between the append and the state update.
     */
    private ChainState loadState(ImmutableCategory category) throws IOException {
        ChainState stored = null;
        Path stateFile = stateFile(category);
        if (Files.exists(stateFile)) {
            try {
                stored = objectMapper.readValue(stateFile.toFile(), ChainState.class);
            } catch (IOException e) {
                log.error("Chain state {} is unreadable, rebuilding from the log", stateFile, e);
            }
        }
        Path logFile = logFile(category);
        String lastLine = Files.exists(logFile) ? lastLine(logFile) : null;
        if (lastLine == null) {
            return stored != null ? stored : ChainState.empty();
        }
        ChainEntry last;
        try {
            last = objectMapper.readValue(lastLine, ChainEntry.class);
        } catch (JsonProcessingException e) {
            if (stored == null) {
                throw e;
            }
            log.warn("Last line of {} is unreadable, keeping chain state at {}", logFile.getFileName(), stored.index());
            return stored;
        }
        if (stored != null && last.index() <= stored.index()) {
            return stored;
        }
        long total;
        if (stored != null) {
            log.warn("Chain state of {} is at {} but the log is at {}, resuming from the log", category,
                    stored.index(), last.index());
            total = stored.totalEntries() + (last.index() - stored.index());
        } else {
            try (Stream<String> lines = Files.lines(logFile, StandardCharsets.UTF_8)) {
                total = lines.filter(line -> !line.isBlank()).count();
            }
        }
        return new ChainState(last.index(), last.hash(), last.timestamp(), total);
    }

    private static String lastLine(Path file) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            long end = raf.length();
            ByteArrayOutputStream reversed = new ByteArrayOutputStream();
            for (long pos = end - 1; pos >= 0; pos--) {
                raf.seek(pos);
                int b = raf.read();
                if (b == '\n' || b == '\r') {
                    if (reversed.size() > 0) {
                        break;
                    }
                    continue;
                }
                reversed.write(b);
            }
            if (reversed.size() == 0) {
                return null;
            }
            byte[] bytes = reversed.toByteArray();
            for (int i = 0, j = bytes.length - 1; i < j; i++, j--) {
                byte tmp = bytes[i];
                bytes[i] = bytes[j];
                bytes[j] = tmp;
            }
            String line = new String(bytes, StandardCharsets.UTF_8);
            return line.isBlank() ? null : line;
        }
    }

    private void writeState(ImmutableCategory category, ChainState state) throws IOException {
        Path stateFile = stateFile(category);
        Path temp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
        Files.write(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state));
        Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Path logFile(ImmutableCategory category) {
        return directory.resolve(category.logFileName());
    }

    private Path stateFile(ImmutableCategory category) {
        return directory.resolve(category.stateFileName());
    }
}
