package me.golemcore.scout.domain.pipeline.stage;

import me.golemcore.scout.domain.exception.CapabilityUnavailableException;
import me.golemcore.scout.domain.model.CompanyIdentity;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.PotentialLevel;
import me.golemcore.scout.domain.model.ProcurementRecord;
import me.golemcore.scout.domain.pipeline.AnalysisCapability;
import me.golemcore.scout.domain.pipeline.PipelineRun;
import me.golemcore.scout.domain.pipeline.PipelineRunFixtures;
import me.golemcore.scout.domain.pipeline.StageOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SynthesisStageTest {

    private static final EvidenceBundle BUNDLE = EvidenceBundle.builder()
            .company(CompanyIdentity.builder().name("Acme").build())
            .procurement(List.of(ProcurementRecord.builder().agency("GSA").amount(250_000.0).build()))
            .build();

    private SynthesisStage stage;

    @BeforeEach
    void setUp() {
        stage = new SynthesisStage();
    }

    // ===== Priority =====

    @Test
    void shouldMultiplyPriorityForImpactTags() {
        Finding plain = Finding.builder().title("Plain").confidence(0.8).build();
        Finding both = Finding.builder().title("Both").confidence(0.5)
                .tag(Finding.TAG_HIGH_IMPACT).tag(Finding.TAG_QUICK_WIN).build();

        assertEquals(0.8, SynthesisStage.priority(plain), 1e-9);
        assertEquals(0.975, SynthesisStage.priority(both), 1e-9);
    }

    @Test
    void shouldPlaceSummaryFirstThenByPriority() {
        Finding summary = Finding.builder().title("Summary").confidence(0.1).build();
        Finding low = Finding.builder().title("Low").confidence(0.6).build();
        Finding impact = Finding.builder().title("Impact").confidence(0.6).tag(Finding.TAG_HIGH_IMPACT).build();
        Finding high = Finding.builder().title("High").confidence(0.85).build();

        List<Finding> ordered = SynthesisStage.prioritize(summary, List.of(low, impact, high));

        assertEquals(List.of("Summary", "Impact", "High", "Low"), ordered.stream().map(Finding::getTitle).toList());
    }

    // ===== Deterministic variant =====

    @Test
    void shouldScoreAndSummarizeVerifiedFindings() {
        PipelineRun run = PipelineRunFixtures.withFindings(BUNDLE, List.of(
                Finding.builder().title("Invoices").detail("Manual invoice matching").confidence(0.8)
                        .tag(Finding.TAG_AUTOMATION_OPPORTUNITY).build(),
                Finding.builder().title("Reports").detail("Weekly reports").confidence(0.9)
                        .tag(Finding.TAG_AUTOMATION_OPPORTUNITY).build()));

        StageOutcome outcome = stage.runDeterministic(run);

        assertEquals(8.3, outcome.automationScore().getScore());
        assertEquals(PotentialLevel.HIGH, outcome.automationScore().getLevel());
        Finding summary = outcome.findings().get(0);
        assertEquals("Overall Automation Opportunity Assessment", summary.getTitle());
        assertTrue(summary.hasTag(Finding.TAG_SYNTHESIS));
        assertTrue(summary.hasTag("high-potential"));
        assertEquals(0.6, summary.getConfidence(), 1e-9);
        assertTrue(summary.getDetail().startsWith("Acme shows high-potential potential for AI automation (score: 8.3/10)."));
        assertTrue(summary.getDetail().contains("Identified 2 specific automation opportunities."));
        assertEquals(3, outcome.findings().size());
        assertEquals("Reports", outcome.findings().get(1).getTitle());
    }

    @Test
    void shouldSummarizeEvenWithoutFindings() {
        StageOutcome outcome = stage.runDeterministic(PipelineRunFixtures.empty(
                EvidenceBundle.identityOnly(CompanyIdentity.builder().name("Quiet Co").build())));

        assertEquals(1, outcome.findings().size());
        assertEquals(0.0, outcome.automationScore().getScore());
        assertTrue(outcome.findings().get(0).hasTag("low-potential"));
    }

    // ===== Capability variant =====

    @Test
    void shouldTakeScoreFromStrategyText() {
        AnalysisCapability capability = mock(AnalysisCapability.class);
        when(capability.complete(anyString(), anyString()))
                .thenReturn("Score: 6.5\nStart with invoice automation, then reporting.");

        StageOutcome outcome = stage.runWithCapability(PipelineRunFixtures.empty(BUNDLE), capability);

        assertEquals(6.5, outcome.automationScore().getScore());
        assertEquals(PotentialLevel.MODERATE, outcome.automationScore().getLevel());
        Finding summary = outcome.findings().get(0);
        assertEquals("Comprehensive Automation Strategy", summary.getTitle());
        assertEquals(0.9, summary.getConfidence());
        assertTrue(summary.hasTag("executive-summary"));
    }

    @Test
    void shouldClampOutOfRangeScore() {
        AnalysisCapability capability = mock(AnalysisCapability.class);
        when(capability.complete(anyString(), anyString())).thenReturn("Overall score 14");

        StageOutcome outcome = stage.runWithCapability(PipelineRunFixtures.empty(BUNDLE), capability);

        assertEquals(10.0, outcome.automationScore().getScore());
    }

    @Test
    void shouldFailWhenStrategyCarriesNoScore() {
        AnalysisCapability capability = mock(AnalysisCapability.class);
        when(capability.complete(anyString(), anyString())).thenReturn("Automate everything.");
        PipelineRun run = PipelineRunFixtures.empty(BUNDLE);

        assertThrows(CapabilityUnavailableException.class, () -> stage.runWithCapability(run, capability));
    }
}
