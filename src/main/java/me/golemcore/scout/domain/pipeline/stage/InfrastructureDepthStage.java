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

package me.golemcore.scout.domain.pipeline.stage;

import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.ProcurementRecord;
import me.golemcore.scout.domain.model.SourceCitation;
import me.golemcore.scout.domain.model.TechnologySignal;
import me.golemcore.scout.domain.pipeline.AnalysisCapability;
import me.golemcore.scout.domain.pipeline.AnalysisStage;
import me.golemcore.scout.domain.pipeline.PipelineRun;
import me.golemcore.scout.domain.pipeline.StageOutcome;
import me.golemcore.scout.domain.pipeline.heuristics.BusinessModelAnalyzer;
import me.golemcore.scout.domain.pipeline.heuristics.TechStackAnalyzer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stage 3: technology stack breadth and procurement history, for process
 * maturity and compliance-automation opportunities.
 */
@Component
public class InfrastructureDepthStage implements AnalysisStage {

    public static final String NAME = "infrastructure-depth";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 30;
    }

    @Override
    public StageOutcome runDeterministic(PipelineRun run) {
        EvidenceBundle bundle = run.getBundle();
        List<Finding> findings = new ArrayList<>();

        List<TechnologySignal> technologies = bundle.technologiesOrEmpty();
        if (!technologies.isEmpty()) {
            String stackUrl = TechStackAnalyzer.stackUrl(bundle);
            Finding.FindingBuilder assessment = Finding.builder()
                    .title("Technical Infrastructure Assessment")
                    .detail("Current stack includes " + StagePrompts.technologyList(technologies)
                            + ". Opportunities for automation and optimization identified.")
                    .confidence(0.75)
                    .tag("tech-stack").tag("infrastructure");
            technologies.forEach(t -> assessment.source(SourceCitation.of("Tech: " + t.label(),
                    t.getSlug() != null ? stackUrl : null)));
            findings.add(assessment.build());
        }

        List<ProcurementRecord> procurement = bundle.procurementOrEmpty();
        if (!procurement.isEmpty()) {
            double totalValue = procurement.stream().mapToDouble(BusinessModelAnalyzer::amountOf).sum();
            Finding.FindingBuilder contracts = Finding.builder()
                    .title("Government Contract Holder")
                    .detail("Active in government procurement with " + procurement.size() + " contracts worth $"
                            + BusinessModelAnalyzer.formatAmount(totalValue)
                            + ". Strong indicator of process maturity.")
                    .confidence(0.9)
                    .tag("procurement").tag("enterprise").tag("high-value");
            procurement.forEach(p -> contracts.source(procurementSource(p)));
            findings.add(contracts.build());
            findings.add(complianceOpportunity(procurement));
        }

        if (findings.isEmpty()) {
            findings.add(Finding.builder()
                    .title("Limited Infrastructure Evidence")
                    .detail("No technology or procurement records were found to assess infrastructure maturity.")
                    .confidence(0.4)
                    .tag("infrastructure")
                    .source(SourceCitation.builder().title("Infrastructure Analysis")
                            .date(run.getAnalysisDate().toString()).build())
                    .build());
        }
        return StageOutcome.of(findings);
    }

    @Override
    public StageOutcome runWithCapability(PipelineRun run, AnalysisCapability capability) {
        List<Finding> findings = new ArrayList<>(capability.extractFindings(infrastructurePrompt(run)));
        List<ProcurementRecord> procurement = run.getBundle().procurementOrEmpty();
        if (!procurement.isEmpty()) {
            findings.add(complianceOpportunity(procurement));
        }
        return StageOutcome.of(StagePrompts.withTags(findings, "infrastructure", NAME));
    }

    private static Finding complianceOpportunity(List<ProcurementRecord> procurement) {
        Finding.FindingBuilder finding = Finding.builder()
                .title("Compliance Reporting Automation")
                .detail("Company has " + procurement.size() + " government contracts, indicating mature processes "
                        + "and compliance needs. Strong opportunity for compliance automation and reporting systems.")
                .confidence(0.9)
                .tag("procurement").tag("compliance").tag("high-value").tag(Finding.TAG_AUTOMATION_OPPORTUNITY);
        procurement.forEach(p -> finding.source(procurementSource(p)));
        return finding.build();
    }

    private static SourceCitation procurementSource(ProcurementRecord record) {
        return SourceCitation.builder().title(record.getAgency() + " Contract").date(record.getDate()).build();
    }

    private static String infrastructurePrompt(PipelineRun run) {
        EvidenceBundle bundle = run.getBundle();
        String stack = bundle.technologiesOrEmpty().stream()
                .map(t -> "- " + t.label() + ": " + t.getCategory() + " ("
                        + (t.getDescription() != null ? t.getDescription() : "N/A") + ")")
                .collect(Collectors.joining("\n"));
        return "Perform deep technical and infrastructure analysis:\n\n"
                + StagePrompts.companyContext(bundle, run.getNotes())
                + "Tech Stack Details:\n" + stack + "\n\n"
                + "Archive History: " + bundle.archivesOrEmpty().size() + " snapshots\n"
                + "Procurement: "
                + (bundle.procurementOrEmpty().isEmpty() ? "No government contracts" : "Government contractor")
                + "\n\nAnalyze:\n"
                + "1. Infrastructure modernization needs\n"
                + "2. Data management and analytics gaps\n"
                + "3. Security and compliance automation opportunities\n"
                + "4. Integration and API opportunities\n"
                + "5. Cloud migration or optimization potential\n"
                + "6. DevOps and deployment automation needs\n\n"
                + "Focus on high-impact, high-ROI opportunities.";
    }
}
