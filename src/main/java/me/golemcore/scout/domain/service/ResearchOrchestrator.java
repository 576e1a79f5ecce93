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

package me.golemcore.scout.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.domain.exception.EvidenceCollectionException;
import me.golemcore.scout.domain.exception.ValidationException;
import me.golemcore.scout.domain.model.CacheNamespace;
import me.golemcore.scout.domain.model.CompanyIdentity;
import me.golemcore.scout.domain.model.CompanyOpportunity;
import me.golemcore.scout.domain.model.CompanyResearchResult;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.JobItem;
import me.golemcore.scout.domain.model.JobPosting;
import me.golemcore.scout.domain.model.JobSearchQuery;
import me.golemcore.scout.domain.model.OpportunitySearchResult;
import me.golemcore.scout.domain.model.ResearchRequest;
import me.golemcore.scout.domain.pipeline.AnalysisPipeline;
import me.golemcore.scout.domain.pipeline.PipelineRun;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import me.golemcore.scout.port.outbound.EvidencePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Entry point for both research operations.
 *
 * <p>
 * Each operation follows the same order:
 * <ol>
 * <li>validate the request</li>
 * <li>look the result up in the cache; a hit returns without touching
 * quotas</li>
 * <li>acquire an admission slot, released on every exit path</li>
 * <li>compute the result once per cache key (concurrent identical requests
 * share the computation), bounded by the request timeout</li>
 * <li>cache the result</li>
 * </ol>
 *
 * <p>
 * Keyword searches fan out one company analysis per candidate company on the
 * research executor. A company whose evidence cannot be collected is left out
 * of the result; the rest of the batch still completes.
 */
@Service
@Slf4j
public class ResearchOrchestrator {

    static final int MAX_TEXT_LENGTH = 200;
    static final int MAX_URL_LENGTH = 2048;
    static final double HIGH_CONFIDENCE = 0.8;

    private final AdmissionService admissionService;
    private final ResultCacheService cacheService;
    private final EvidencePort evidencePort;
    private final AnalysisPipeline pipeline;
    private final InFlightRegistry inFlightRegistry;
    private final ExecutorService researchExecutor;
    private final ScoutProperties properties;
    private final Clock clock;

    public ResearchOrchestrator(AdmissionService admissionService, ResultCacheService cacheService,
            EvidencePort evidencePort, AnalysisPipeline pipeline, InFlightRegistry inFlightRegistry,
            @Qualifier("researchExecutor") ExecutorService researchExecutor, ScoutProperties properties,
            Clock clock) {
        this.admissionService = admissionService;
        this.cacheService = cacheService;
        this.evidencePort = evidencePort;
        this.pipeline = pipeline;
        this.inFlightRegistry = inFlightRegistry;
        this.researchExecutor = researchExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== OPPORTUNITY SEARCH ====================

    public OpportunitySearchResult searchOpportunities(ResearchRequest request) {
        String keywords = requireText(request.getKeywords(), "Keywords are required for opportunity search",
                "keywords");
        String location = optionalText(request.getLocation(), "location");
        String notes = optionalNotes(request.getNotes());

        Map<String, Object> keyParams = new LinkedHashMap<>();
        keyParams.put("keywords", keywords);
        keyParams.put("location", location);
        keyParams.put("notes", notes);

        Optional<OpportunitySearchResult> cached = cacheService.get(
                CacheNamespace.JOB_SEARCH.getKey(), keyParams, OpportunitySearchResult.class);
        if (cached.isPresent()) {
            log.info("[Research] Cache hit for opportunity search '{}'", keywords);
            return cached.get();
        }

        try (AdmissionSlot slot = admissionService.acquire(request.getTenantId())) {
            String key = cacheService.deriveKey(CacheNamespace.JOB_SEARCH.getKey(), keyParams);
            return inFlightRegistry.execute(key, "opportunity search", requestTimeout(), () -> {
                OpportunitySearchResult result = computeOpportunities(keywords, location, notes);
                cacheService.set(CacheNamespace.JOB_SEARCH.getKey(), keyParams, result);
                return result;
            });
        }
    }

    private OpportunitySearchResult computeOpportunities(String keywords, String location, String notes) {
        log.info("[Research] Searching opportunities for '{}' in '{}'", keywords, location);
        List<JobPosting> postings = searchJobs(keywords, location);
        Map<String, List<JobPosting>> byCompany = groupByCompany(postings);
        List<String> topCompanies = topCompanies(byCompany, properties.getResearch().getMaxCompanies());
        log.info("[Research] {} postings across {} companies, analyzing top {}",
                postings.size(), byCompany.size(), topCompanies.size());

        List<Future<CompanyOpportunity>> futures = new ArrayList<>();
        for (String company : topCompanies) {
            List<JobPosting> companyJobs = byCompany.get(company);
            futures.add(researchExecutor.submit(() -> analyzeOpportunity(company, companyJobs, notes)));
        }

        List<CompanyOpportunity> opportunities = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                opportunities.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("[Research] Skipping company '{}': {}", topCompanies.get(i), cause.getMessage());
            } catch (InterruptedException e) {
                futures.forEach(future -> future.cancel(true));
                Thread.currentThread().interrupt();
                throw new CancellationException("Opportunity search interrupted");
            }
        }

        opportunities.sort(Comparator.comparingDouble(CompanyOpportunity::getAutomationScore).reversed()
                .thenComparing(CompanyOpportunity::getCompany));

        return OpportunitySearchResult.builder()
                .keywords(keywords)
                .location(location)
                .notes(notes)
                .totalJobsFound(postings.size())
                .companiesFound(byCompany.size())
                .companiesAnalyzed(opportunities.size())
                .opportunities(opportunities)
                .summary(String.format("Found %d job postings across %d companies. Top %d companies analyzed.",
                        postings.size(), byCompany.size(), opportunities.size()))
                .generatedAt(clock.instant())
                .build();
    }

    private List<JobPosting> searchJobs(String keywords, String location) {
        try {
            List<JobPosting> postings = evidencePort.searchJobs(new JobSearchQuery(keywords, location));
            return postings != null ? postings : List.of();
        } catch (EvidenceCollectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvidenceCollectionException("Job search failed: " + e.getMessage(), e);
        }
    }

    private CompanyOpportunity analyzeOpportunity(String company, List<JobPosting> jobs, String notes) {
        JobPosting first = jobs.get(0);
        String domain = normalizeDomain(first.getCompanyDomain());
        CompanyIdentity identity = CompanyIdentity.builder()
                .name(company)
                .domain(domain)
                .homepageUrl(domain != null ? "https://" + domain : null)
                .build();

        CompanyResearchResult research = cachedResearch(identity, jobs, notes);
        return CompanyOpportunity.builder()
                .company(company)
                .jobCount(jobs.size())
                .jobs(new ArrayList<>(jobs))
                .automationScore(research.getAutomationScore().getScore())
                .confidence(research.getAutomationScore().getConfidence())
                .level(research.getAutomationScore().getLevel())
                .findings(research.getFindings())
                .build();
    }

    static Map<String, List<JobPosting>> groupByCompany(List<JobPosting> postings) {
        Map<String, List<JobPosting>> grouped = new LinkedHashMap<>();
        for (JobPosting posting : postings) {
            if (posting == null || posting.getCompany() == null || posting.getCompany().isBlank()) {
                continue;
            }
            grouped.computeIfAbsent(posting.getCompany().trim(), k -> new ArrayList<>()).add(posting);
        }
        return grouped;
    }

    static List<String> topCompanies(Map<String, List<JobPosting>> byCompany, int limit) {
        return byCompany.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, List<JobPosting>>>comparingInt(e -> e.getValue().size())
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(Math.max(0, limit))
                .map(Map.Entry::getKey)
                .toList();
    }

    // ==================== DEEP RESEARCH ====================

    public CompanyResearchResult runDeepResearch(ResearchRequest request) {
        CompanyIdentity identity = validateCompany(request);
        String notes = optionalNotes(request.getNotes());
        Map<String, Object> keyParams = researchKey(identity, notes);

        Optional<CompanyResearchResult> cached = cacheService.get(
                CacheNamespace.RESEARCH.getKey(), keyParams, CompanyResearchResult.class);
        if (cached.isPresent()) {
            log.info("[Research] Cache hit for deep research on '{}'", identity.displayName());
            return cached.get();
        }

        try (AdmissionSlot slot = admissionService.acquire(request.getTenantId())) {
            String key = cacheService.deriveKey(CacheNamespace.RESEARCH.getKey(), keyParams);
            return inFlightRegistry.execute(key, "deep research", requestTimeout(), () -> {
                CompanyResearchResult result = research(identity, List.of(), notes);
                cacheService.set(CacheNamespace.RESEARCH.getKey(), keyParams, result);
                return result;
            });
        }
    }

    private CompanyResearchResult cachedResearch(CompanyIdentity identity, List<JobPosting> postings,
            String notes) {
        Map<String, Object> keyParams = researchKey(identity, notes);
        Optional<CompanyResearchResult> cached = cacheService.get(
                CacheNamespace.RESEARCH.getKey(), keyParams, CompanyResearchResult.class);
        if (cached.isPresent()) {
            log.debug("[Research] Reusing cached research for '{}'", identity.displayName());
            return cached.get();
        }
        CompanyResearchResult result = research(identity, postings, notes);
        cacheService.set(CacheNamespace.RESEARCH.getKey(), keyParams, result);
        return result;
    }

    private CompanyResearchResult research(CompanyIdentity identity, List<JobPosting> postings, String notes) {
        EvidenceBundle bundle = collectEvidence(identity);
        if (bundle.jobsOrEmpty().isEmpty() && !postings.isEmpty()) {
            List<JobItem> jobs = postings.stream().map(JobPosting::toJobItem).toList();
            bundle = bundle.toBuilder().jobs(jobs).build();
        }

        PipelineRun run = pipeline.run(bundle, notes);
        List<Finding> findings = run.getFindings();
        log.info("[Research] Analysis of '{}' finished: {} findings, score {}",
                identity.displayName(), findings.size(), run.getAutomationScore().getScore());

        return CompanyResearchResult.builder()
                .company(bundle.getCompany() != null ? bundle.getCompany() : identity)
                .automationScore(run.getAutomationScore())
                .summary(researchSummary(findings))
                .findings(new ArrayList<>(findings))
                .stageStrategies(new LinkedHashMap<>(run.getStageStrategies()))
                .evidence(bundle.collectEvidenceLinks())
                .notes(notes)
                .generatedAt(clock.instant())
                .build();
    }

    private EvidenceBundle collectEvidence(CompanyIdentity identity) {
        Map<String, Object> keyParams = new LinkedHashMap<>();
        keyParams.put("name", identity.getName());
        keyParams.put("domain", identity.getDomain());
        keyParams.put("homepageUrl", identity.getHomepageUrl());

        Optional<EvidenceBundle> cached = cacheService.get(
                CacheNamespace.EVIDENCE.getKey(), keyParams, EvidenceBundle.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        EvidenceBundle bundle;
        try {
            bundle = evidencePort.collect(identity);
        } catch (EvidenceCollectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvidenceCollectionException(
                    "Evidence collection failed for " + identity.displayName() + ": " + e.getMessage(), e);
        }
        if (bundle == null) {
            bundle = EvidenceBundle.identityOnly(identity);
        } else if (bundle.getCompany() == null) {
            bundle.setCompany(identity);
        }
        cacheService.set(CacheNamespace.EVIDENCE.getKey(), keyParams, bundle);
        return bundle;
    }

    static String researchSummary(List<Finding> findings) {
        long highConfidence = findings.stream().filter(f -> f.getConfidence() >= HIGH_CONFIDENCE).count();
        long opportunities = findings.stream()
                .filter(f -> f.hasTag(Finding.TAG_AUTOMATION_OPPORTUNITY) || f.hasTag(Finding.TAG_HIGH_IMPACT))
                .count();
        return String.format("Analysis complete: %d findings (%d high confidence). %d automation opportunities "
                + "identified.", findings.size(), highConfidence, opportunities);
    }

    // Notes feed the capability prompts, so results are only shared between identical notes.
    private static Map<String, Object> researchKey(CompanyIdentity identity, String notes) {
        Map<String, Object> keyParams = new LinkedHashMap<>();
        keyParams.put("name", identity.getName());
        keyParams.put("domain", identity.getDomain());
        keyParams.put("notes", notes);
        return keyParams;
    }

    // ==================== VALIDATION ====================

    static CompanyIdentity validateCompany(ResearchRequest request) {
        String name = optionalText(request.getCompanyName(), "companyName");
        String rawUrl = request.getCompanyUrl() != null ? request.getCompanyUrl().trim() : "";
        if (name == null && rawUrl.isEmpty()) {
            throw new ValidationException("Either companyName or companyUrl is required");
        }

        String homepageUrl = null;
        String domain = null;
        if (!rawUrl.isEmpty()) {
            if (rawUrl.length() > MAX_URL_LENGTH) {
                throw new ValidationException("companyUrl is too long");
            }
            String candidate = rawUrl.contains("://") ? rawUrl : "https://" + rawUrl;
            URI uri;
            try {
                uri = new URI(candidate);
            } catch (URISyntaxException e) {
                throw new ValidationException("Invalid companyUrl: " + rawUrl);
            }
            String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
            String host = uri.getHost();
            if (!("http".equals(scheme) || "https".equals(scheme)) || host == null || !host.contains(".")) {
                throw new ValidationException("Invalid companyUrl: " + rawUrl);
            }
            homepageUrl = candidate;
            domain = normalizeDomain(host);
        }

        return CompanyIdentity.builder()
                .name(name != null ? name : domain)
                .domain(domain)
                .homepageUrl(homepageUrl)
                .build();
    }

    static String normalizeDomain(String host) {
        if (host == null || host.isBlank()) {
            return null;
        }
        String domain = host.trim().toLowerCase(Locale.ROOT);
        return domain.startsWith("www.") ? domain.substring(4) : domain;
    }

    private static String requireText(String value, String message, String field) {
        String text = optionalText(value, field);
        if (text == null) {
            throw new ValidationException(message);
        }
        return text;
    }

    private static String optionalText(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_TEXT_LENGTH) {
            throw new ValidationException(field + " must be at most " + MAX_TEXT_LENGTH + " characters");
        }
        return trimmed;
    }

    private static String optionalNotes(String notes) {
        return notes == null || notes.isBlank() ? null : notes.trim();
    }

    private Duration requestTimeout() {
        return properties.getResearch().getRequestTimeout();
    }
}
