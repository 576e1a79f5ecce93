package me.golemcore.scout.domain.pipeline.heuristics;

import me.golemcore.scout.domain.model.CompanyIdentity;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.JobItem;
import me.golemcore.scout.domain.model.ProcurementRecord;
import me.golemcore.scout.domain.model.SocialProfile;
import me.golemcore.scout.domain.model.TechnologySignal;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BusinessModelAnalyzerTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);

    @Test
    void shouldDetectB2bFromProcurementAndEnterpriseRoles() {
        EvidenceBundle bundle = EvidenceBundle.builder()
                .company(CompanyIdentity.builder().name("Acme Federal").build())
                .jobs(List.of(JobItem.builder().title("Enterprise Account Executive").build()))
                .technologies(List.of(TechnologySignal.builder().name("Salesforce").build()))
                .procurement(List.of(ProcurementRecord.builder().agency("GSA").amount(150_000.0).build(),
                        ProcurementRecord.builder().agency("DOD").amount(50_000.0).build()))
                .build();

        List<Finding> findings = BusinessModelAnalyzer.analyze(bundle, TODAY);

        Finding model = findings.get(0);
        assertEquals("B2B Business Model Detected", model.getTitle());
        assertEquals(0.9, model.getConfidence(), 1e-9);

        Finding contractor = findings.get(1);
        assertEquals("Government Contractor", contractor.getTitle());
        assertTrue(contractor.getDetail().contains("2 contracts totaling $200,000"));
        assertEquals("https://www.usaspending.gov/search/Acme+Federal", contractor.getSources().get(0).getUrl());
    }

    @Test
    void shouldDetectB2cFromConsumerAudience() {
        EvidenceBundle bundle = EvidenceBundle.builder()
                .company(CompanyIdentity.builder().name("ShopCo").build())
                .socialProfiles(List.of(SocialProfile.builder().platform("instagram").followers(25_000L).build()))
                .technologies(List.of(TechnologySignal.builder().name("Shopify").build()))
                .build();

        List<Finding> findings = BusinessModelAnalyzer.analyze(bundle, TODAY);

        assertEquals("B2C Business Model Detected", findings.get(0).getTitle());
        assertEquals(0.8, findings.get(0).getConfidence(), 1e-9);
    }

    @Test
    void shouldDetectServiceBusinessWithThreeServiceRoles() {
        EvidenceBundle bundle = EvidenceBundle.builder()
                .company(CompanyIdentity.builder().name("Consultly").build())
                .jobs(List.of(
                        JobItem.builder().title("Senior Consultant").build(),
                        JobItem.builder().title("Customer Success Manager").build(),
                        JobItem.builder().title("Support Specialist").build(),
                        JobItem.builder().title("Product Designer").build()))
                .build();

        List<Finding> findings = BusinessModelAnalyzer.analyze(bundle, TODAY);

        Finding services = findings.stream().filter(f -> "Service-Based Business Model".equals(f.getTitle()))
                .findFirst().orElseThrow();
        assertTrue(services.hasTag(Finding.TAG_AUTOMATION_OPPORTUNITY));
        assertEquals(3, services.sourceCount());
    }

    @Test
    void shouldStayQuietWithoutSignals() {
        assertTrue(BusinessModelAnalyzer.analyze(EvidenceBundle.identityOnly(new CompanyIdentity()), TODAY).isEmpty());
    }
}
