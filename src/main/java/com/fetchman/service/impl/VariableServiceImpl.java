package com.fetchman.service.impl;

import com.fetchman.dto.request.VariableInput;
import com.fetchman.dto.response.VariableView;
import com.fetchman.exception.InvalidRequestException;
import com.fetchman.model.DecryptionOutcome;
import com.fetchman.model.VariableRecord;
import com.fetchman.service.api.SecretStore;
import com.fetchman.service.api.VariableService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Manages the plaintext view of a workspace's variables on top of the {@link SecretStore}.
 * <p>
 * Values are encrypted before they reach the store and decrypted only for the response being built.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VariableServiceImpl implements VariableService {

    private final SecretStore secretStore;
    private final StringEncryptor encryptor;

    @Override
    public Mono<List<VariableView>> fetch(String workspaceId) {
        return Mono.fromCallable(() -> toViews(workspaceId, secretStore.load(workspaceId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<List<VariableView>> update(String workspaceId, List<VariableInput> variables) {
        return Mono.fromCallable(() -> {
                    List<VariableInput> validated = validate(variables);
                    List<VariableRecord> encrypted = validated.stream()
                            .map(input -> new VariableRecord(input.key(), encryptor.encrypt(input.value()), input.isSecret()))
                            .toList();
                    return toViews(workspaceId, secretStore.save(workspaceId, encrypted));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Trims keys and rejects blank or duplicate ones. A missing value is stored as an empty string.
     */
    private List<VariableInput> validate(List<VariableInput> variables) {
        if (variables == null) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<VariableInput> validated = new ArrayList<>(variables.size());
        for (VariableInput input : variables) {
            if (input == null || input.key() == null || input.key().isBlank()) {
                throw new InvalidRequestException("Variable key must not be blank");
            }
            String key = input.key().trim();
            if (!seen.add(key)) {
                throw new InvalidRequestException("Duplicate variable key: " + key);
            }
            validated.add(new VariableInput(key, input.value() == null ? "" : input.value(), input.isSecret()));
        }
        return validated;
    }

    private List<VariableView> toViews(String workspaceId, List<VariableRecord> records) {
        return records.stream()
                .map(record -> DecryptionOutcome.attempt(record, encryptor))
                .map(outcome -> {
                    if (outcome.isSuccess()) {
                        return VariableView.decrypted(outcome.key(), outcome.plaintext(), outcome.source().isSecret());
                    }
                    log.error("Failed to decrypt variable '{}' of workspace '{}': {}",
                            outcome.key(), workspaceId, outcome.failure().getMessage());
                    return VariableView.undecryptable(outcome.key(), outcome.source().isSecret());
                })
                .toList();
    }
}
