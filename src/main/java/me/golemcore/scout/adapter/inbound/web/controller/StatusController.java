package me.golemcore.scout.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.adapter.inbound.web.dto.StatusResponse;
import me.golemcore.scout.domain.model.CacheStats;
import me.golemcore.scout.domain.model.QuotaStatus;
import me.golemcore.scout.domain.service.AdmissionService;
import me.golemcore.scout.domain.service.ResultCacheService;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import me.golemcore.scout.port.outbound.LlmPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Service status: the caller's quota, cache statistics and backend health.
 * Reports {@code degraded} with 503 when the counter store cannot be read.
 */
@RestController
@RequestMapping("/api/status")
@RequiredArgsConstructor
@Slf4j
public class StatusController {

    static final String STATUS_HEALTHY = "healthy";
    static final String STATUS_DEGRADED = "degraded";

    private final AdmissionService admissionService;
    private final ResultCacheService cacheService;
    private final LlmPort llmPort;
    private final ScoutProperties properties;
    private final Clock clock;

    @GetMapping
    public Mono<ResponseEntity<StatusResponse>> status(
            @RequestHeader(value = ResearchController.CLIENT_ID_HEADER, required = false) String clientId) {

        return Mono.fromCallable(() -> {
            String tenantId = AdmissionService.normalizeTenant(clientId);
            CacheStats cacheStats = cacheService.getStats();
            String llmHealth = llmPort.isAvailable() ? llmPort.getProviderId() : "unavailable";

            try {
                QuotaStatus quota = admissionService.getStatus(tenantId);
                StatusResponse response = StatusResponse.builder()
                        .status(STATUS_HEALTHY)
                        .timestamp(clock.instant())
                        .version(properties.getVersion())
                        .rateLimit(quota)
                        .cache(cacheStats)
                        .health(StatusResponse.Health.builder()
                                .api(STATUS_HEALTHY)
                                .cache(cacheStats.backend())
                                .llm(llmHealth)
                                .build())
                        .build();
                return ResponseEntity.ok(response);
            } catch (RuntimeException e) {
                log.warn("[API] Status check degraded: {}", e.getMessage());
                StatusResponse response = StatusResponse.builder()
                        .status(STATUS_DEGRADED)
                        .timestamp(clock.instant())
                        .version(properties.getVersion())
                        .cache(cacheStats)
                        .health(StatusResponse.Health.builder()
                                .api(STATUS_HEALTHY)
                                .cache(cacheStats.backend())
                                .llm(llmHealth)
                                .build())
                        .error("Counter store unavailable")
                        .build();
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
