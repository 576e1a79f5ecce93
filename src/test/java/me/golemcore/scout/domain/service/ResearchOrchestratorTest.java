package me.golemcore.scout.domain.service;

import me.golemcore.scout.adapter.outbound.store.InMemoryCacheStore;
import me.golemcore.scout.adapter.outbound.store.InMemoryCounterStore;
import me.golemcore.scout.domain.exception.AdmissionDeniedException;
import me.golemcore.scout.domain.exception.EvidenceCollectionException;
import me.golemcore.scout.domain.exception.ResearchTimeoutException;
import me.golemcore.scout.domain.exception.ValidationException;
import me.golemcore.scout.domain.model.CompanyIdentity;
import me.golemcore.scout.domain.model.CompanyOpportunity;
import me.golemcore.scout.domain.model.CompanyResearchResult;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.JobPosting;
import me.golemcore.scout.domain.model.LlmResponse;
import me.golemcore.scout.domain.model.OpportunitySearchResult;
import me.golemcore.scout.domain.model.QuotaStatus;
import me.golemcore.scout.domain.model.ResearchRequest;
import me.golemcore.scout.domain.model.StageStrategy;
import me.golemcore.scout.domain.pipeline.AnalysisCapability;
import me.golemcore.scout.domain.pipeline.AnalysisPipeline;
import me.golemcore.scout.domain.pipeline.FindingResponseParser;
import me.golemcore.scout.domain.pipeline.stage.BusinessContextStage;
import me.golemcore.scout.domain.pipeline.stage.CrossVerificationStage;
import me.golemcore.scout.domain.pipeline.stage.InfrastructureDepthStage;
import me.golemcore.scout.domain.pipeline.stage.SynthesisStage;
import me.golemcore.scout.domain.pipeline.stage.TechnicalSignalStage;
import me.golemcore.scout.infrastructure.config.AutoConfiguration;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import me.golemcore.scout.port.outbound.EvidencePort;
import me.golemcore.scout.port.outbound.LlmPort;
import me.golemcore.scout.testsupport.time.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResearchOrchestratorTest {

    private static final String TENANT = "acme-client";

    private MutableClock clock;
    private ScoutProperties properties;
    private AdmissionService admissionService;
    private ResultCacheService cacheService;
    private EvidencePort evidencePort;
    private InFlightRegistry inFlightRegistry;
    private ExecutorService requestExecutor;
    private ExecutorService researchExecutor;
    private ResearchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        properties = new ScoutProperties();
        properties.getAdmission().setDailyLimit(5);
        properties.getAdmission().setConcurrencyLimit(2);
        properties.getResearch().setRequestTimeout(Duration.ofSeconds(5));

        admissionService = new AdmissionService(new InMemoryCounterStore(clock), properties, clock);
        cacheService = new ResultCacheService(new InMemoryCacheStore(clock),
                AutoConfiguration.objectMapper(), properties);

        evidencePort = mock(EvidencePort.class);
        when(evidencePort.collect(any())).thenAnswer(inv -> EvidenceBundle.identityOnly(inv.getArgument(0)));

        AnalysisCapability capability = mock(AnalysisCapability.class);
        when(capability.isAvailable()).thenReturn(false);

        requestExecutor = Executors.newCachedThreadPool();
        researchExecutor = Executors.newFixedThreadPool(4);
        inFlightRegistry = new InFlightRegistry(requestExecutor);
        orchestrator = newOrchestrator(capability);
    }

    private ResearchOrchestrator newOrchestrator(AnalysisCapability capability) {
        AnalysisPipeline pipeline = new AnalysisPipeline(List.of(new TechnicalSignalStage(),
                new BusinessContextStage(), new InfrastructureDepthStage(), new CrossVerificationStage(),
                new SynthesisStage()), capability, clock);
        return new ResearchOrchestrator(admissionService, cacheService, evidencePort, pipeline,
                inFlightRegistry, researchExecutor, properties, clock);
    }

    @AfterEach
    void tearDown() {
        requestExecutor.shutdownNow();
        researchExecutor.shutdownNow();
    }

    // ===== Opportunity search =====

    @Test
    void shouldAnalyzeEveryCompanyFoundInPostings() {
        List<JobPosting> postings = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            postings.add(posting("Acme Logistics", "www.AcmeLogistics.com", "Billing Clerk " + i,
                    "High volume manual data entry of invoices"));
        }
        for (int i = 0; i < 10; i++) {
            postings.add(posting("Globex", "globex.com", "Software Engineer " + i, "Build services"));
        }
        when(evidencePort.searchJobs(any())).thenReturn(postings);

        OpportunitySearchResult result = orchestrator.searchOpportunities(search("billing automation"));

        assertEquals(25, result.getTotalJobsFound());
        assertEquals(2, result.getCompaniesFound());
        assertEquals(2, result.getCompaniesAnalyzed());
        assertEquals("Found 25 job postings across 2 companies. Top 2 companies analyzed.", result.getSummary());
        List<CompanyOpportunity> opportunities = result.getOpportunities();
        assertTrue(opportunities.get(0).getAutomationScore() >= opportunities.get(1).getAutomationScore());
        for (CompanyOpportunity opportunity : opportunities) {
            assertTrue(opportunity.getConfidence() >= 0.0 && opportunity.getConfidence() <= 1.0);
            assertTrue(opportunity.getAutomationScore() >= 0.0 && opportunity.getAutomationScore() <= 10.0);
        }
        CompanyOpportunity acme = opportunities.stream().filter(o -> "Acme Logistics".equals(o.getCompany()))
                .findFirst().orElseThrow();
        assertEquals(15, acme.getJobCount());
        assertTrue(acme.getFindings().stream().anyMatch(f -> f.hasTag(Finding.TAG_AUTOMATION_OPPORTUNITY)));
        verify(evidencePort).collect(argThat(identity -> "acmelogistics.com".equals(identity.getDomain())
                && "https://acmelogistics.com".equals(identity.getHomepageUrl())));

        QuotaStatus quota = admissionService.getStatus(TENANT);
        assertEquals(1, quota.getDailyUsed());
        assertEquals(0, quota.getConcurrentUsed());
    }

    @Test
    void shouldSkipCompanyWhoseEvidenceFails() {
        when(evidencePort.searchJobs(any())).thenReturn(List.of(
                posting("Acme", "acme.com", "Clerk", null),
                posting("Broken Co", "broken.com", "Clerk", null),
                posting("Broken Co", "broken.com", "Analyst", null)));
        when(evidencePort.collect(argThat(identity -> identity != null && "Broken Co".equals(identity.getName()))))
                .thenThrow(new EvidenceCollectionException("collector down"));

        OpportunitySearchResult result = orchestrator.searchOpportunities(search("clerk"));

        assertEquals(2, result.getCompaniesFound());
        assertEquals(1, result.getCompaniesAnalyzed());
        assertEquals("Acme", result.getOpportunities().get(0).getCompany());
    }

    @Test
    void shouldServeRepeatedSearchFromCacheWithoutQuota() {
        when(evidencePort.searchJobs(any())).thenReturn(List.of(posting("Acme", "acme.com", "Clerk", null)));

        OpportunitySearchResult first = orchestrator.searchOpportunities(search("clerk"));
        OpportunitySearchResult second = orchestrator.searchOpportunities(search("  clerk "));

        assertEquals(first.getSummary(), second.getSummary());
        assertEquals(1, admissionService.getStatus(TENANT).getDailyUsed());
        verify(evidencePort, times(1)).searchJobs(any());
    }

    @Test
    void shouldLimitAnalysisToTopCompanies() {
        properties.getResearch().setMaxCompanies(1);
        when(evidencePort.searchJobs(any())).thenReturn(List.of(
                posting("Small", "small.com", "Clerk", null),
                posting("Big", "big.com", "Clerk", null),
                posting("Big", "big.com", "Clerk II", null)));

        OpportunitySearchResult result = orchestrator.searchOpportunities(search("clerk"));

        assertEquals(2, result.getCompaniesFound());
        assertEquals(1, result.getCompaniesAnalyzed());
        assertEquals("Big", result.getOpportunities().get(0).getCompany());
    }

    @Test
    void shouldRequireKeywords() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> orchestrator.searchOpportunities(search("   ")));

        assertEquals("Keywords are required for opportunity search", e.getMessage());
        assertEquals(0, admissionService.getStatus(TENANT).getDailyUsed());
    }

    @Test
    void shouldWrapUnexpectedJobSearchFailure() {
        when(evidencePort.searchJobs(any())).thenThrow(new IllegalStateException("socket closed"));

        assertThrows(EvidenceCollectionException.class, () -> orchestrator.searchOpportunities(search("clerk")));
        assertEquals(0, admissionService.getStatus(TENANT).getConcurrentUsed());
    }

    // ===== Deep research =====

    @Test
    void shouldResearchCompanyFromUrl() {
        CompanyResearchResult result = orchestrator.runDeepResearch(ResearchRequest.builder()
                .companyUrl("www.Acme.com/about")
                .notes("  Focus on finance  ")
                .tenantId(TENANT)
                .build());

        assertEquals("acme.com", result.getCompany().getName());
        assertEquals("acme.com", result.getCompany().getDomain());
        assertEquals("Focus on finance", result.getNotes());
        assertEquals(5, result.getStageStrategies().size());
        assertTrue(result.getStageStrategies().values().stream().allMatch(s -> s == StageStrategy.DETERMINISTIC));
        assertEquals(SynthesisStage.NAME, List.copyOf(result.getStageStrategies().keySet()).get(4));
        assertEquals("https://www.Acme.com/about", result.getEvidence().get(0).url());
        assertTrue(result.getSummary().startsWith("Analysis complete: " + result.getFindings().size() + " findings"));
        assertEquals(clock.instant(), result.getGeneratedAt());
    }

    @Test
    void shouldServeRepeatedResearchFromCache() {
        ResearchRequest request = ResearchRequest.builder().companyName("Acme").tenantId(TENANT).build();

        orchestrator.runDeepResearch(request);
        CompanyResearchResult cached = orchestrator.runDeepResearch(request);

        assertEquals("Acme", cached.getCompany().getName());
        assertEquals(1, admissionService.getStatus(TENANT).getDailyUsed());
        verify(evidencePort, times(1)).collect(any());
    }

    @Test
    void shouldNotShareNotesBetweenTenants() {
        CompanyResearchResult first = orchestrator.runDeepResearch(ResearchRequest.builder()
                .companyName("Acme")
                .notes("acquisition target, budget 2M")
                .tenantId("tenant-a")
                .build());
        CompanyResearchResult second = orchestrator.runDeepResearch(ResearchRequest.builder()
                .companyName("Acme")
                .tenantId("tenant-b")
                .build());

        assertEquals("acquisition target, budget 2M", first.getNotes());
        assertNull(second.getNotes());
        assertEquals(1, admissionService.getStatus("tenant-b").getDailyUsed());
        verify(evidencePort, times(1)).collect(any());
    }

    @Test
    void shouldNotShareSearchNotesBetweenTenants() {
        when(evidencePort.searchJobs(any())).thenReturn(List.of(posting("Acme", "acme.com", "Clerk", null)));

        OpportunitySearchResult first = orchestrator.searchOpportunities(ResearchRequest.builder()
                .keywords("billing").notes("internal shortlist").tenantId("tenant-a").build());
        OpportunitySearchResult second = orchestrator.searchOpportunities(ResearchRequest.builder()
                .keywords("billing").tenantId("tenant-b").build());

        assertEquals("internal shortlist", first.getNotes());
        assertNull(second.getNotes());
    }

    @Test
    void shouldFallBackWhenCapabilityNeverAnswers() {
        properties.getLlm().setTimeout(Duration.ofMillis(300));
        properties.getLlm().setRunBudget(Duration.ofMillis(600));
        properties.getResearch().setRequestTimeout(Duration.ofMillis(1200));
        LlmPort llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.chat(any())).thenAnswer(inv -> new CompletableFuture<LlmResponse>());
        AnalysisCapability capability = new AnalysisCapability(llmPort,
                new FindingResponseParser(AutoConfiguration.objectMapper()), properties);

        CompanyResearchResult result = newOrchestrator(capability).runDeepResearch(
                ResearchRequest.builder().companyName("Hung LLM Co").tenantId(TENANT).build());

        assertEquals(5, result.getStageStrategies().size());
        assertTrue(result.getStageStrategies().values().stream().allMatch(s -> s == StageStrategy.DETERMINISTIC));
        assertNotNull(result.getAutomationScore());
        verify(llmPort, times(1)).chat(any());
        assertEquals(0, admissionService.getStatus(TENANT).getConcurrentUsed());
    }

    @Test
    void shouldDenyResearchBeyondDailyLimit() {
        properties.getAdmission().setDailyLimit(1);
        orchestrator.runDeepResearch(ResearchRequest.builder().companyName("Acme").tenantId(TENANT).build());

        AdmissionDeniedException e = assertThrows(AdmissionDeniedException.class,
                () -> orchestrator.runDeepResearch(
                        ResearchRequest.builder().companyName("Globex").tenantId(TENANT).build()));

        assertEquals(Duration.ofHours(24), e.getRetryAfter());
        verify(evidencePort, times(1)).collect(any());
    }

    @Test
    void shouldReleaseSlotWhenEvidenceFails() {
        when(evidencePort.collect(any())).thenThrow(new EvidenceCollectionException("collector down"));

        assertThrows(EvidenceCollectionException.class, () -> orchestrator.runDeepResearch(
                ResearchRequest.builder().companyName("Acme").tenantId(TENANT).build()));

        assertEquals(0, admissionService.getStatus(TENANT).getConcurrentUsed());
        assertEquals(0, inFlightRegistry.size());
    }

    @Test
    void shouldTimeOutAndReleaseSlot() {
        properties.getResearch().setRequestTimeout(Duration.ofMillis(200));
        CountDownLatch never = new CountDownLatch(1);
        when(evidencePort.collect(any())).thenAnswer(inv -> {
            never.await();
            return null;
        });

        assertThrows(ResearchTimeoutException.class, () -> orchestrator.runDeepResearch(
                ResearchRequest.builder().companyName("Slow Co").tenantId(TENANT).build()));

        assertEquals(0, admissionService.getStatus(TENANT).getConcurrentUsed());
    }

    @Test
    void shouldShareConcurrentIdenticalResearch() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(evidencePort.collect(any())).thenAnswer(inv -> {
            release.await();
            return EvidenceBundle.identityOnly(inv.getArgument(0));
        });
        ResearchRequest request = ResearchRequest.builder().companyName("Acme").tenantId(TENANT).build();
        AtomicReference<CompanyResearchResult> first = new AtomicReference<>();
        AtomicReference<CompanyResearchResult> second = new AtomicReference<>();

        Thread leader = new Thread(() -> first.set(orchestrator.runDeepResearch(request)));
        leader.start();
        waitUntil(() -> inFlightRegistry.size() == 1);
        Thread follower = new Thread(() -> second.set(orchestrator.runDeepResearch(request)));
        follower.start();
        waitUntil(() -> follower.getState() == Thread.State.TIMED_WAITING);
        assertEquals(2, admissionService.getStatus(TENANT).getConcurrentUsed());
        release.countDown();
        leader.join(5_000);
        follower.join(5_000);

        assertEquals(first.get().getSummary(), second.get().getSummary());
        verify(evidencePort, times(1)).collect(any());
        assertEquals(2, admissionService.getStatus(TENANT).getDailyUsed());
        assertEquals(0, admissionService.getStatus(TENANT).getConcurrentUsed());
    }

    // ===== Validation =====

    @Test
    void shouldRequireCompanyNameOrUrl() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> orchestrator.runDeepResearch(ResearchRequest.builder().companyName(" ").build()));

        assertEquals("Either companyName or companyUrl is required", e.getMessage());
    }

    @Test
    void shouldRejectInvalidCompanyUrls() {
        for (String url : List.of("ftp://acme.com", "localhost", "https://", "http://exa mple.com")) {
            ResearchRequest request = ResearchRequest.builder().companyUrl(url).build();
            assertThrows(ValidationException.class, () -> ResearchOrchestrator.validateCompany(request), url);
        }
        ResearchRequest tooLong = ResearchRequest.builder().companyUrl("https://acme.com/" + "a".repeat(2048))
                .build();
        assertThrows(ValidationException.class, () -> ResearchOrchestrator.validateCompany(tooLong));
    }

    @Test
    void shouldRejectOverlongCompanyName() {
        ResearchRequest request = ResearchRequest.builder().companyName("x".repeat(201)).build();

        ValidationException e = assertThrows(ValidationException.class,
                () -> ResearchOrchestrator.validateCompany(request));

        assertEquals("companyName must be at most 200 characters", e.getMessage());
    }

    @Test
    void shouldKeepGivenNameAndNormalizeDomain() {
        CompanyIdentity identity = ResearchOrchestrator.validateCompany(ResearchRequest.builder()
                .companyName(" Acme Corp ").companyUrl("http://WWW.acme.io").build());

        assertEquals("Acme Corp", identity.getName());
        assertEquals("acme.io", identity.getDomain());
        assertEquals("http://WWW.acme.io", identity.getHomepageUrl());
    }

    @Test
    void shouldAcceptNameWithoutUrl() {
        CompanyIdentity identity = ResearchOrchestrator.validateCompany(
                ResearchRequest.builder().companyName("Acme").build());

        assertNull(identity.getDomain());
        assertNull(identity.getHomepageUrl());
    }

    // ===== Grouping =====

    @Test
    void shouldGroupByTrimmedCompanyAndSkipBlank() {
        Map<String, List<JobPosting>> grouped = ResearchOrchestrator.groupByCompany(List.of(
                posting(" Acme ", null, "A", null),
                posting("Acme", null, "B", null),
                posting("", null, "C", null),
                posting(null, null, "D", null)));

        assertEquals(List.of("Acme"), List.copyOf(grouped.keySet()));
        assertEquals(2, grouped.get("Acme").size());
    }

    @Test
    void shouldOrderTopCompaniesByCountThenName() {
        Map<String, List<JobPosting>> grouped = ResearchOrchestrator.groupByCompany(List.of(
                posting("Zeta", null, "A", null),
                posting("Alpha", null, "A", null),
                posting("Mid", null, "A", null),
                posting("Mid", null, "B", null)));

        assertEquals(List.of("Mid", "Alpha"), ResearchOrchestrator.topCompanies(grouped, 2));
    }

    @Test
    void shouldCountHighConfidenceAndOpportunitiesInSummary() {
        String summary = ResearchOrchestrator.researchSummary(List.of(
                Finding.builder().title("A").confidence(0.8).tag(Finding.TAG_HIGH_IMPACT).build(),
                Finding.builder().title("B").confidence(0.79).tag(Finding.TAG_AUTOMATION_OPPORTUNITY).build(),
                Finding.builder().title("C").confidence(0.95).build()));

        assertEquals("Analysis complete: 3 findings (2 high confidence). 2 automation opportunities identified.",
                summary);
    }

    private static ResearchRequest search(String keywords) {
        return ResearchRequest.builder().keywords(keywords).location("Austin, TX").tenantId(TENANT).build();
    }

    private static JobPosting posting(String company, String domain, String title, String description) {
        return JobPosting.builder()
                .company(company)
                .companyDomain(domain)
                .title(title)
                .description(description)
                .build();
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(5);
        }
    }
}
