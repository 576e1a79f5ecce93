/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.scout.domain.pipeline;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.domain.exception.CapabilityTimeoutException;
import me.golemcore.scout.domain.exception.CapabilityUnavailableException;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.LlmRequest;
import me.golemcore.scout.domain.model.LlmResponse;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import me.golemcore.scout.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The natural-language analysis capability as seen by pipeline stages.
 *
 * <p>
 * Wraps {@link LlmPort} with a per-call timeout and turns every failure
 * (timeout, provider error, empty or malformed response) into
 * {@link CapabilityUnavailableException}, which the pipeline answers with the
 * deterministic stage variant.
 *
 * <p>
 * {@link #forRun()} returns a copy bounded by {@code scout.llm.run-budget}:
 * each of its calls waits at most for the budget that is left, and once the
 * budget is spent it fails fast with {@link CapabilityTimeoutException}.
 */
@Component
@Slf4j
public class AnalysisCapability {

    static final String FINDINGS_INSTRUCTION = """
            You are an analyst identifying business process automation opportunities.
            Answer ONLY with a JSON array. Each element must be an object with the fields:
            "title" (short string), "detail" (one or two sentences), "confidence" (number 0-1),
            "tags" (array of lowercase strings; use "automation-opportunity", "high-impact",
            "quick-win" or "growth" where they apply) and "sources" (array of {"title", "url"}).
            """;

    private final LlmPort llmPort;
    private final FindingResponseParser parser;
    private final ScoutProperties properties;
    private final Duration timeout;

    // System.nanoTime() deadline of a run-scoped copy, null when unbounded
    private Long deadlineNanos;

    public AnalysisCapability(LlmPort llmPort, FindingResponseParser parser, ScoutProperties properties) {
        this.llmPort = llmPort;
        this.parser = parser;
        this.properties = properties;
        this.timeout = properties.getLlm().getTimeout();
    }

    /**
     * Copy of this capability whose calls share one pipeline run's budget.
     */
    public AnalysisCapability forRun() {
        AnalysisCapability bounded = new AnalysisCapability(llmPort, parser, properties);
        bounded.deadlineNanos = System.nanoTime() + properties.getLlm().getRunBudget().toNanos();
        return bounded;
    }

    /**
     * Whether the capability is configured and operational. Never throws.
     */
    public boolean isAvailable() {
        try {
            return llmPort.isAvailable();
        } catch (RuntimeException e) {
            log.warn("[Pipeline] Capability availability check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Sends one prompt and returns the raw text answer.
     */
    public String complete(String systemPrompt, String userPrompt) {
        long waitMillis = callTimeoutMillis();
        if (waitMillis <= 0) {
            throw new CapabilityTimeoutException("Capability budget for this run is spent");
        }
        LlmRequest request = LlmRequest.builder()
                .model(llmPort.getCurrentModel())
                .systemPrompt(systemPrompt)
                .userPrompt(userPrompt)
                .build();

        CompletableFuture<LlmResponse> future;
        try {
            future = llmPort.chat(request);
        } catch (RuntimeException e) {
            throw new CapabilityUnavailableException("Capability call failed: " + e.getMessage(), e);
        }

        LlmResponse response;
        try {
            response = future.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CapabilityTimeoutException("Capability timed out after " + waitMillis + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CapabilityUnavailableException("Interrupted while waiting for capability", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CapabilityUnavailableException("Capability call failed: " + cause.getMessage(), cause);
        }

        if (response == null || response.getContent() == null || response.getContent().isBlank()) {
            throw new CapabilityUnavailableException("Capability returned an empty response");
        }
        return response.getContent();
    }

    /**
     * Asks for findings on the given task and parses them.
     *
     * @throws CapabilityUnavailableException
     *             also when the answer holds no findings
     */
    public List<Finding> extractFindings(String taskPrompt) {
        List<Finding> findings = parser.parse(complete(FINDINGS_INSTRUCTION, taskPrompt));
        if (findings.isEmpty()) {
            throw new CapabilityUnavailableException("No findings extracted from capability response");
        }
        return findings;
    }

    long callTimeoutMillis() {
        long callTimeout = timeout.toMillis();
        if (deadlineNanos == null) {
            return callTimeout;
        }
        long remaining = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
        return Math.min(callTimeout, remaining);
    }

    public FindingResponseParser getParser() {
        return parser;
    }
}
