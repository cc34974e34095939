package org.archivum.retention.service;

import org.archivum.retention.enums.ChainEventType;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Records retention events in the compliance chain.
 */
public interface RetentionAuditService {

    Mono<Void> record(ChainEventType eventType, Map<String, Object> data);
}
