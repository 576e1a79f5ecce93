package me.golemcore.scout.adapter.inbound.web.controller;

import me.golemcore.scout.adapter.inbound.web.dto.StatusResponse;
import me.golemcore.scout.domain.exception.BackendUnavailableException;
import me.golemcore.scout.domain.model.CacheStats;
import me.golemcore.scout.domain.model.QuotaStatus;
import me.golemcore.scout.domain.service.AdmissionService;
import me.golemcore.scout.domain.service.ResultCacheService;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import me.golemcore.scout.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatusControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private AdmissionService admissionService;
    private ResultCacheService cacheService;
    private LlmPort llmPort;
    private StatusController controller;

    @BeforeEach
    void setUp() {
        admissionService = mock(AdmissionService.class);
        cacheService = mock(ResultCacheService.class);
        llmPort = mock(LlmPort.class);
        controller = new StatusController(admissionService, cacheService, llmPort, new ScoutProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        when(cacheService.getStats()).thenReturn(new CacheStats("memory", 3));
    }

    @Test
    void shouldReportHealthyWithQuota() {
        QuotaStatus quota = QuotaStatus.builder().dailyUsed(2).dailyLimit(50).dailyRemaining(48).build();
        when(admissionService.getStatus("acme")).thenReturn(quota);
        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.getProviderId()).thenReturn("langchain4j");

        StepVerifier.create(controller.status("acme"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    StatusResponse body = response.getBody();
                    assertEquals("healthy", body.getStatus());
                    assertEquals(NOW, body.getTimestamp());
                    assertEquals(quota, body.getRateLimit());
                    assertEquals("memory", body.getHealth().getCache());
                    assertEquals("langchain4j", body.getHealth().getLlm());
                    assertEquals(3, body.getCache().keys());
                })
                .verifyComplete();
    }

    @Test
    void shouldUseAnonymousTenantWithoutHeader() {
        when(admissionService.getStatus("anonymous")).thenReturn(QuotaStatus.builder().build());

        controller.status(null).block();

        verify(admissionService).getStatus("anonymous");
    }

    @Test
    void shouldReportDegradedWhenCounterStoreFails() {
        when(cacheService.getStats()).thenReturn(new CacheStats("redis", 0));
        when(admissionService.getStatus("acme"))
                .thenThrow(new BackendUnavailableException("redis down", new RuntimeException()));
        when(llmPort.isAvailable()).thenReturn(false);

        StepVerifier.create(controller.status("acme"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
                    StatusResponse body = response.getBody();
                    assertEquals("degraded", body.getStatus());
                    assertEquals("redis", body.getHealth().getCache());
                    assertEquals("unavailable", body.getHealth().getLlm());
                    assertNull(body.getRateLimit());
                })
                .verifyComplete();
    }
}
