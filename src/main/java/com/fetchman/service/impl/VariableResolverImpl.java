package com.fetchman.service.impl;

import com.fetchman.model.DecryptionOutcome;
import com.fetchman.model.VariableRecord;
import com.fetchman.model.VariableTable;
import com.fetchman.service.api.SecretStore;
import com.fetchman.service.api.VariableResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a fresh {@link VariableTable} for every execution. Nothing is cached, so edits to a
 * workspace's variables apply to the very next request and decrypted values live only as long as
 * the request that uses them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VariableResolverImpl implements VariableResolver {

    private final SecretStore secretStore;
    private final StringEncryptor encryptor;

    @Override
    public Mono<VariableTable> resolve(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            return Mono.just(VariableTable.empty());
        }
        return Mono.fromCallable(() -> secretStore.load(workspaceId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(records -> buildTable(workspaceId, records));
    }

    private VariableTable buildTable(String workspaceId, List<VariableRecord> records) {
        if (records.isEmpty()) {
            return VariableTable.empty();
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (VariableRecord record : records) {
            DecryptionOutcome outcome = DecryptionOutcome.attempt(record, encryptor);
            if (outcome.isSuccess()) {
                values.put(outcome.key(), outcome.plaintext());
            } else {
                log.warn("Skipping variable '{}' of workspace '{}': {}",
                        outcome.key(), workspaceId, outcome.failure().getMessage());
            }
        }
        log.debug("Resolved {} of {} variable(s) for workspace '{}'", values.size(), records.size(), workspaceId);
        return VariableTable.of(values);
    }
}
