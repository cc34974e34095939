package org.archivum.retention.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.archivum.retention.config.AuditChainProperties;
import org.archivum.retention.enums.ChainEventType;
import org.archivum.retention.enums.ImmutableCategory;
import org.archivum.retention.service.ImmutableAuditChainService;
import org.archivum.retention.service.RetentionAuditService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionAuditServiceImpl implements RetentionAuditService {

    private final AuditChainProperties chainProperties;
    private final ImmutableAuditChainService chainService;

    @Override
    public Mono<Void> record(ChainEventType eventType, Map<String, Object> data) {
        if (!chainProperties.isEnabled()) {
            return Mono.empty();
        }
        return chainService.append(ImmutableCategory.COMPLIANCE_EVENTS, eventType.name(), data)
                .doOnNext(entry -> log.debug("Compliance event {} chained at index {}", eventType, entry.index()))
                .then();
    }
}
