package com.fetchman.service.impl;

import com.fetchman.dto.request.VariableInput;
import com.fetchman.dto.response.VariableView;
import com.fetchman.exception.InvalidRequestException;
import com.fetchman.model.VariableRecord;
import com.fetchman.security.AesGcmStringEncryptor;
import com.fetchman.service.api.SecretStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VariableServiceImplTest {

    @Mock
    private SecretStore secretStore;

    private AesGcmStringEncryptor encryptor;
    private VariableServiceImpl variableService;

    @BeforeEach
    void setUp() {
        encryptor = new AesGcmStringEncryptor("variable-service-test-secret");
        variableService = new VariableServiceImpl(secretStore, encryptor);
    }

    @Test
    void fetch_shouldDecryptValuesAndFlagCorruptOnes() {
        when(secretStore.load("ws-1")).thenReturn(List.of(
                new VariableRecord("token", encryptor.encrypt("abc"), true),
                new VariableRecord("broken", "a:b", false)));

        StepVerifier.create(variableService.fetch("ws-1"))
                .assertNext(views -> assertThat(views).containsExactly(
                        VariableView.decrypted("token", "abc", true),
                        new VariableView("broken", "", false, VariableView.DECRYPTION_FAILED)))
                .verifyComplete();
    }

    @Test
    void update_shouldEncryptEveryValueBeforeSaving() {
        // --- Arrange ---
        when(secretStore.save(eq("ws-1"), anyList())).thenAnswer(invocation -> invocation.getArgument(1));

        // --- Act ---
        List<VariableView> views = variableService.update("ws-1", List.of(
                new VariableInput(" base_url ", "https://api.example.com", false),
                new VariableInput("token", null, true))).block();

        // --- Assert ---
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<VariableRecord>> saved = ArgumentCaptor.forClass(List.class);
        verify(secretStore).save(eq("ws-1"), saved.capture());
        assertThat(saved.getValue()).extracting(VariableRecord::key).containsExactly("base_url", "token");
        assertThat(saved.getValue()).allSatisfy(record -> assertThat(record.value().split(":", -1)).hasSize(3));
        assertThat(saved.getValue().get(0).value()).doesNotContain("api.example.com");
        assertThat(encryptor.decrypt(saved.getValue().get(0).value())).isEqualTo("https://api.example.com");

        assertThat(views).containsExactly(
                VariableView.decrypted("base_url", "https://api.example.com", false),
                VariableView.decrypted("token", "", true));
    }

    @Test
    void update_shouldRejectDuplicateKeysWithoutSaving() {
        StepVerifier.create(variableService.update("ws-1", List.of(
                        new VariableInput("token", "a", true),
                        new VariableInput("token ", "b", true))))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(InvalidRequestException.class)
                        .hasMessage("Duplicate variable key: token"))
                .verify();

        verify(secretStore, never()).save(any(), any());
    }

    @Test
    void update_shouldRejectBlankKeys() {
        StepVerifier.create(variableService.update("ws-1", Arrays.asList(new VariableInput("  ", "v", false))))
                .expectError(InvalidRequestException.class)
                .verify();

        verify(secretStore, never()).save(any(), any());
    }

    @Test
    void update_shouldClearWorkspaceForNullList() {
        when(secretStore.save("ws-1", List.of())).thenReturn(List.of());

        StepVerifier.create(variableService.update("ws-1", null))
                .assertNext(views -> assertThat(views).isEmpty())
                .verifyComplete();
    }
}
