package me.golemcore.scout.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.scout.adapter.outbound.store.InMemoryCacheStore;
import me.golemcore.scout.domain.exception.BackendUnavailableException;
import me.golemcore.scout.domain.model.AutomationScore;
import me.golemcore.scout.domain.model.CacheNamespace;
import me.golemcore.scout.domain.model.CacheStats;
import me.golemcore.scout.domain.model.CompanyIdentity;
import me.golemcore.scout.domain.model.CompanyResearchResult;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.infrastructure.config.AutoConfiguration;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import me.golemcore.scout.port.outbound.CacheStorePort;
import me.golemcore.scout.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ResultCacheServiceTest {

    private static final String RESEARCH = CacheNamespace.RESEARCH.getKey();

    private MutableClock clock;
    private InMemoryCacheStore store;
    private ScoutProperties properties;
    private ObjectMapper objectMapper;
    private ResultCacheService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        store = new InMemoryCacheStore(clock);
        properties = new ScoutProperties();
        objectMapper = AutoConfiguration.objectMapper();
        service = new ResultCacheService(store, objectMapper, properties);
    }

    // ===== key derivation =====

    @Test
    void shouldDeriveSameKeyRegardlessOfParameterOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("keywords", "accounts payable");
        first.put("location", "Austin");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("location", "Austin");
        second.put("keywords", "accounts payable");

        assertEquals(service.deriveKey("job-search", first), service.deriveKey("job-search", second));
    }

    @Test
    void shouldDeriveNamespacedKeyWithHexDigest() {
        String key = service.deriveKey(RESEARCH, Map.of("name", "Acme"));

        assertTrue(key.matches("research:[0-9a-f]{16}"), key);
        assertFalse(key.contains("@"));
        assertFalse(key.contains("#"));
    }

    @Test
    void shouldDeriveDifferentKeysForDifferentParametersOrNamespaces() {
        String acme = service.deriveKey(RESEARCH, Map.of("name", "Acme"));

        assertNotEquals(acme, service.deriveKey(RESEARCH, Map.of("name", "Globex")));
        assertNotEquals(acme, service.deriveKey("evidence", Map.of("name", "Acme")));
    }

    @Test
    void shouldKeepKeyStableAcrossInstances() {
        ResultCacheService other = new ResultCacheService(store, new ObjectMapper(), properties);

        assertEquals(service.deriveKey(RESEARCH, Map.of("name", "Acme", "domain", "acme.com")),
                other.deriveKey(RESEARCH, Map.of("domain", "acme.com", "name", "Acme")));
    }

    // ===== get / set =====

    @Test
    void shouldRoundTripResearchResult() {
        CompanyResearchResult result = sampleResult();

        service.set(RESEARCH, Map.of("name", "Acme"), result);
        Optional<CompanyResearchResult> cached = service.get(RESEARCH, Map.of("name", "Acme"),
                CompanyResearchResult.class);

        assertTrue(cached.isPresent());
        assertEquals("Acme", cached.get().getCompany().getName());
        assertEquals(7.5, cached.get().getAutomationScore().getScore());
        assertEquals(List.of("manual-process"), cached.get().getFindings().get(0).getTags());
        assertEquals(result.getGeneratedAt(), cached.get().getGeneratedAt());
    }

    @Test
    void shouldExpireAfterNamespaceDefaultTtl() {
        service.set(RESEARCH, Map.of("name", "Acme"), sampleResult());

        clock.advance(Duration.ofHours(24));

        assertTrue(service.get(RESEARCH, Map.of("name", "Acme"), CompanyResearchResult.class).isEmpty());
    }

    @Test
    void shouldHonourTtlOverride() {
        service.set(RESEARCH, Map.of("name", "Acme"), sampleResult(), Duration.ofMinutes(1));

        clock.advance(Duration.ofMinutes(2));

        assertTrue(service.get(RESEARCH, Map.of("name", "Acme"), CompanyResearchResult.class).isEmpty());
    }

    @Test
    void shouldUseDistinctNamespaceTtls() {
        assertEquals(Duration.ofHours(1), service.defaultTtl("evidence"));
        assertEquals(Duration.ofMinutes(30), service.defaultTtl("job-search"));
        assertEquals(Duration.ofHours(24), service.defaultTtl("research"));
        assertEquals(Duration.ofHours(1), service.defaultTtl("other"));
    }

    @Test
    void shouldTreatUnreadableEntryAsMiss() {
        store.set(service.deriveKey(RESEARCH, Map.of("name", "Acme")), "not json", Duration.ofHours(1));

        assertTrue(service.get(RESEARCH, Map.of("name", "Acme"), CompanyResearchResult.class).isEmpty());
    }

    // ===== disabled / failing backend =====

    @Test
    void shouldBypassStoreWhenDisabled() {
        CacheStorePort mockStore = mock(CacheStorePort.class);
        properties.getCache().setEnabled(false);
        ResultCacheService disabled = new ResultCacheService(mockStore, objectMapper, properties);

        disabled.set(RESEARCH, Map.of("name", "Acme"), sampleResult());

        assertTrue(disabled.get(RESEARCH, Map.of("name", "Acme"), CompanyResearchResult.class).isEmpty());
        assertEquals(0, disabled.invalidatePattern(RESEARCH));
        verifyNoInteractions(mockStore);
    }

    @Test
    void shouldSwallowBackendFailures() {
        CacheStorePort broken = mock(CacheStorePort.class);
        when(broken.get(anyString())).thenThrow(new BackendUnavailableException("down", null));
        doThrow(new BackendUnavailableException("down", null)).when(broken).set(anyString(), anyString(), any());
        when(broken.size()).thenThrow(new BackendUnavailableException("down", null));
        when(broken.getBackendName()).thenReturn("redis");
        ResultCacheService failing = new ResultCacheService(broken, objectMapper, properties);

        assertDoesNotThrow(() -> failing.set(RESEARCH, Map.of("name", "Acme"), sampleResult()));
        assertTrue(failing.get(RESEARCH, Map.of("name", "Acme"), CompanyResearchResult.class).isEmpty());
        assertEquals(new CacheStats("redis", -1), failing.getStats());
    }

    // ===== invalidation =====

    @Test
    void shouldInvalidateSingleEntry() {
        service.set(RESEARCH, Map.of("name", "Acme"), sampleResult());
        service.set(RESEARCH, Map.of("name", "Globex"), sampleResult());

        service.invalidate(RESEARCH, Map.of("name", "Acme"));

        assertTrue(service.get(RESEARCH, Map.of("name", "Acme"), CompanyResearchResult.class).isEmpty());
        assertTrue(service.get(RESEARCH, Map.of("name", "Globex"), CompanyResearchResult.class).isPresent());
    }

    @Test
    void shouldInvalidateWholeNamespace() {
        service.set(RESEARCH, Map.of("name", "Acme"), sampleResult());
        service.set(RESEARCH, Map.of("name", "Globex"), sampleResult());
        service.set("job-search", Map.of("keywords", "billing"), "cached");

        assertEquals(2, service.invalidatePattern(RESEARCH + ":"));
        assertEquals(new CacheStats("memory", 1), service.getStats());
    }

    private static CompanyResearchResult sampleResult() {
        return CompanyResearchResult.builder()
                .company(CompanyIdentity.builder().name("Acme").domain("acme.com").build())
                .automationScore(AutomationScore.of(7.5, 0.8))
                .summary("Analysis complete")
                .findings(List.of(Finding.builder()
                        .title("Manual Data Entry")
                        .detail("Roles mention spreadsheets")
                        .confidence(0.7)
                        .tag("manual-process")
                        .build()))
                .generatedAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }
}
