package org.archivum.retention.service;

import org.archivum.retention.dto.response.ChainVerificationResult;
import org.archivum.retention.enums.ImmutableCategory;
import org.archivum.retention.model.ChainEntry;
import org.archivum.retention.model.ChainState;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only, hash-chained audit log, one chain per {@link ImmutableCategory}.
 */
public interface ImmutableAuditChainService {

    /**
     * Appends an entry linked to the current head of the category's chain.
     * Fails with a configuration error for categories that are not immutable.
     */
    Mono<ChainEntry> append(ImmutableCategory category, String eventType, Object data);

    /**
     * Replays the whole log. Tampered or unreadable lines are reported in the result, never raised.
     */
    Mono<ChainVerificationResult> verify(ImmutableCategory category);

    Flux<ChainVerificationResult> verifyAll();

    Flux<ChainEntry> readEntries(ImmutableCategory category);

    Mono<ChainState> getState(ImmutableCategory category);
}
