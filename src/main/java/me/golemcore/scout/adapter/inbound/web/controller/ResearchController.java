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
import me.golemcore.scout.adapter.inbound.web.dto.ResearchRequestDto;
import me.golemcore.scout.adapter.inbound.web.dto.ResearchResponse;
import me.golemcore.scout.domain.exception.ValidationException;
import me.golemcore.scout.domain.model.ResearchRequest;
import me.golemcore.scout.domain.service.AdmissionService;
import me.golemcore.scout.domain.service.ResearchOrchestrator;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Research endpoints.
 *
 * <p>
 * {@code POST /api/research} runs an opportunity search when the body carries
 * {@code keywords}, or a deep company analysis when it carries
 * {@code companyName}/{@code companyUrl}. The tenant comes from the
 * {@code X-Client-ID} header. Orchestration blocks, so it runs on the bounded
 * elastic scheduler.
 */
@RestController
@RequestMapping("/api/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchController {

    static final String CLIENT_ID_HEADER = "X-Client-ID";

    private final ResearchOrchestrator orchestrator;
    private final ScoutProperties properties;

    @PostMapping
    public Mono<ResponseEntity<ResearchResponse>> research(
            @RequestBody ResearchRequestDto body,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientId) {

        return Mono.fromCallable(() -> {
            ResearchRequest request = toDomain(body, clientId);
            boolean hasKeywords = request.hasKeywords();
            boolean hasCompany = request.hasCompany();
            if (hasKeywords == hasCompany) {
                throw new ValidationException(hasKeywords
                        ? "Provide either keywords or company information, not both"
                        : "Provide keywords for opportunity search or companyName/companyUrl for deep research");
            }

            log.info("[API] Research request from tenant {} ({})", request.getTenantId(),
                    hasKeywords ? ResearchResponse.MODE_OPPORTUNITY_SEARCH : ResearchResponse.MODE_DEEP_RESEARCH);
            if (hasKeywords) {
                return ResponseEntity.ok(ResearchResponse.of(ResearchResponse.MODE_OPPORTUNITY_SEARCH,
                        orchestrator.searchOpportunities(request)));
            }
            return ResponseEntity.ok(ResearchResponse.of(ResearchResponse.MODE_DEEP_RESEARCH,
                    orchestrator.runDeepResearch(request)));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> describe() {
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("name", "GolemCore Scout Research API");
        descriptor.put("version", properties.getVersion());
        descriptor.put("endpoints", List.of(
                Map.of("method", "POST", "path", "/api/research",
                        "description", "Opportunity search (keywords, location) or deep research "
                                + "(companyName, companyUrl)"),
                Map.of("method", "GET", "path", "/api/status",
                        "description", "Quota, cache and capability status")));
        descriptor.put("dailyLimit", properties.getAdmission().getDailyLimit());
        return Mono.just(ResponseEntity.ok(descriptor));
    }

    static ResearchRequest toDomain(ResearchRequestDto body, String clientId) {
        ResearchRequestDto dto = body != null ? body : new ResearchRequestDto();
        return ResearchRequest.builder()
                .keywords(dto.getKeywords())
                .location(dto.getLocation())
                .companyName(dto.getCompanyName())
                .companyUrl(dto.getCompanyUrl())
                .notes(dto.getNotes())
                .tenantId(AdmissionService.normalizeTenant(clientId))
                .build();
    }
}
