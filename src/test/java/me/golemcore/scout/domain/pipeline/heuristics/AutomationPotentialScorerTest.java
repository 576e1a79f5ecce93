package me.golemcore.scout.domain.pipeline.heuristics;

import me.golemcore.scout.domain.model.AutomationScore;
import me.golemcore.scout.domain.model.CompanyIdentity;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.JobItem;
import me.golemcore.scout.domain.model.NewsItem;
import me.golemcore.scout.domain.model.PotentialLevel;
import me.golemcore.scout.domain.model.ProcurementRecord;
import me.golemcore.scout.domain.model.TechnologySignal;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AutomationPotentialScorerTest {

    @Test
    void shouldScoreZeroWithoutAnyFactor() {
        AutomationScore score = AutomationPotentialScorer.score(emptyBundle(), List.of());

        assertEquals(0.0, score.getScore());
        assertEquals(0.5, score.getConfidence(), 1e-9);
        assertEquals(PotentialLevel.LOW, score.getLevel());
    }

    @Test
    void shouldAverageApplicableFactorsAndScaleByFive() {
        List<Finding> findings = List.of(
                opportunity("Invoice handling", "Manual invoice matching every week"),
                opportunity("Report assembly", "Weekly reports compiled by hand"));
        EvidenceBundle bundle = EvidenceBundle.builder()
                .company(CompanyIdentity.builder().name("Acme").build())
                .procurement(List.of(ProcurementRecord.builder().agency("GSA").amount(250_000.0).build()))
                .build();

        AutomationScore score = AutomationPotentialScorer.score(bundle, findings);

        // (1.0 + 2 + 2) / 3 * 5
        assertEquals(8.3, score.getScore());
        assertEquals(0.6, score.getConfidence(), 1e-9);
        assertEquals(PotentialLevel.HIGH, score.getLevel());
    }

    @Test
    void shouldCapOpportunityFactorAtTwoPoints() {
        List<Finding> findings = IntStream.range(0, 6)
                .mapToObj(i -> opportunity("Opportunity " + i, "Detail"))
                .toList();

        AutomationScore score = AutomationPotentialScorer.score(emptyBundle(), findings);

        assertEquals(10.0, score.getScore());
        assertEquals(0.6, score.getConfidence(), 1e-9);
    }

    @Test
    void shouldScoreLegacyTechnologyBelowModern() {
        EvidenceBundle legacy = bundleWithTechnology("Microsoft Access");
        EvidenceBundle modern = bundleWithTechnology("Salesforce Cloud");

        assertEquals(5.0, AutomationPotentialScorer.score(legacy, List.of()).getScore());
        assertEquals(10.0, AutomationPotentialScorer.score(modern, List.of()).getScore());
    }

    @Test
    void shouldTreatFiveJobsAsGrowthFactor() {
        EvidenceBundle bundle = EvidenceBundle.builder()
                .company(CompanyIdentity.builder().name("Acme").build())
                .jobs(IntStream.range(0, 5).mapToObj(i -> JobItem.builder().title("Role " + i).build()).toList())
                .build();

        AutomationScore score = AutomationPotentialScorer.score(bundle, List.of());

        assertEquals(7.5, score.getScore());
        assertEquals(PotentialLevel.HIGH, score.getLevel());
    }

    @Test
    void shouldCapConfidenceAtNinetyFivePercent() {
        EvidenceBundle bundle = EvidenceBundle.builder()
                .company(CompanyIdentity.builder().name("Acme").build())
                .jobs(List.of(JobItem.builder().title("Clerk").build()))
                .technologies(List.of(TechnologySignal.builder().name("Excel").build()))
                .news(List.of(NewsItem.builder().title("Acme expands").build()))
                .procurement(List.of(ProcurementRecord.builder().agency("GSA").build()))
                .build();
        List<Finding> findings = IntStream.range(0, 6).mapToObj(i -> opportunity("F" + i, "d")).toList();

        assertEquals(0.95, AutomationPotentialScorer.confidence(bundle, findings), 1e-9);
    }

    private static Finding opportunity(String title, String detail) {
        return Finding.builder()
                .title(title)
                .detail(detail)
                .confidence(0.8)
                .tag(Finding.TAG_AUTOMATION_OPPORTUNITY)
                .build();
    }

    private static EvidenceBundle emptyBundle() {
        return EvidenceBundle.identityOnly(CompanyIdentity.builder().name("Acme").build());
    }

    private static EvidenceBundle bundleWithTechnology(String name) {
        return EvidenceBundle.builder()
                .company(CompanyIdentity.builder().name("Acme").build())
                .technologies(List.of(TechnologySignal.builder().name(name).build()))
                .build();
    }
}
