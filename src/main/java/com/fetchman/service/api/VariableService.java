package com.fetchman.service.api;

import com.fetchman.dto.request.VariableInput;
import com.fetchman.dto.response.VariableView;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Management view of workspace variables.
 * <p>
 * Unlike {@link VariableResolver}, which silently drops records it cannot decrypt, this view reports
 * them with {@code error = "decryption_failed"} so an operator can see that something is broken.
 */
public interface VariableService {

    Mono<List<VariableView>> fetch(String workspaceId);

    /**
     * Validates, encrypts and persists a full replacement list, then returns it decrypted.
     *
     * @throws com.fetchman.exception.InvalidRequestException on blank or duplicate keys.
     */
    Mono<List<VariableView>> update(String workspaceId, List<VariableInput> variables);
}
