package me.golemcore.scout.domain.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.scout.domain.exception.CapabilityTimeoutException;
import me.golemcore.scout.domain.exception.CapabilityUnavailableException;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.LlmRequest;
import me.golemcore.scout.domain.model.LlmResponse;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import me.golemcore.scout.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnalysisCapabilityTest {

    private LlmPort llmPort;
    private ScoutProperties properties;
    private AnalysisCapability capability;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        when(llmPort.getCurrentModel()).thenReturn("gpt-4o-mini");
        properties = new ScoutProperties();
        properties.getLlm().setTimeout(Duration.ofMillis(100));
        capability = new AnalysisCapability(llmPort, new FindingResponseParser(new ObjectMapper()), properties);
    }

    // ===== Availability =====

    @Test
    void shouldReportUnavailableWhenCheckThrows() {
        when(llmPort.isAvailable()).thenThrow(new IllegalStateException("boom"));

        assertFalse(capability.isAvailable());
    }

    @Test
    void shouldDelegateAvailability() {
        when(llmPort.isAvailable()).thenReturn(true);

        assertTrue(capability.isAvailable());
    }

    // ===== Completion =====

    @Test
    void shouldSendPromptsWithCurrentModel() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(response("Score: 7")));

        String answer = capability.complete("system", "user");

        assertEquals("Score: 7", answer);
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertEquals("gpt-4o-mini", captor.getValue().getModel());
        assertEquals("system", captor.getValue().getSystemPrompt());
        assertEquals("user", captor.getValue().getUserPrompt());
    }

    @Test
    void shouldTimeOutAndCancelSlowCall() {
        CompletableFuture<LlmResponse> pending = new CompletableFuture<>();
        when(llmPort.chat(any())).thenReturn(pending);

        CapabilityUnavailableException e = assertThrows(CapabilityUnavailableException.class,
                () -> capability.complete("system", "user"));

        assertTrue(e.getMessage().contains("timed out"));
        assertTrue(pending.isCancelled());
    }

    @Test
    void shouldWrapProviderFailure() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("HTTP 500")));

        CapabilityUnavailableException e = assertThrows(CapabilityUnavailableException.class,
                () -> capability.complete("system", "user"));

        assertTrue(e.getMessage().contains("HTTP 500"));
    }

    @Test
    void shouldWrapSynchronousProviderFailure() {
        when(llmPort.chat(any())).thenThrow(new IllegalStateException("not configured"));

        assertThrows(CapabilityUnavailableException.class, () -> capability.complete("system", "user"));
    }

    @Test
    void shouldRejectBlankContent() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(response("   ")));

        assertThrows(CapabilityUnavailableException.class, () -> capability.complete("system", "user"));
    }

    // ===== Findings =====

    @Test
    void shouldExtractFindings() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                response("[{\"title\": \"Scheduling\", \"confidence\": 0.8}]")));

        List<Finding> findings = capability.extractFindings("task");

        assertEquals("Scheduling", findings.get(0).getTitle());
    }

    @Test
    void shouldFailWhenNoFindingsExtracted() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(response("[]")));

        assertThrows(CapabilityUnavailableException.class, () -> capability.extractFindings("task"));
    }

    private static LlmResponse response(String content) {
        return LlmResponse.builder().content(content).model("gpt-4o-mini").build();
    }

    // ===== Run budget =====

    @Test
    void shouldFailFastOnceRunBudgetIsSpent() {
        properties.getLlm().setRunBudget(Duration.ZERO);
        AnalysisCapability bounded = capability.forRun();

        assertThrows(CapabilityTimeoutException.class, () -> bounded.complete("system", "user"));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldCapCallTimeoutByRemainingBudget() {
        properties.getLlm().setRunBudget(Duration.ofMillis(50));

        AnalysisCapability bounded = capability.forRun();

        assertTrue(bounded.callTimeoutMillis() <= 50);
        assertEquals(100, capability.callTimeoutMillis());
    }

    @Test
    void shouldReportTimeoutAsCapabilityTimeout() {
        when(llmPort.chat(any())).thenReturn(new CompletableFuture<>());

        assertThrows(CapabilityTimeoutException.class, () -> capability.complete("system", "user"));
    }
}
