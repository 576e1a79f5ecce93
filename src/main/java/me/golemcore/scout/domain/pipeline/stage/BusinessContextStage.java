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

import me.golemcore.scout.domain.model.CorporateProfile;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.JobItem;
import me.golemcore.scout.domain.model.NewsItem;
import me.golemcore.scout.domain.model.SourceCitation;
import me.golemcore.scout.domain.pipeline.AnalysisCapability;
import me.golemcore.scout.domain.pipeline.AnalysisStage;
import me.golemcore.scout.domain.pipeline.PipelineRun;
import me.golemcore.scout.domain.pipeline.StageOutcome;
import me.golemcore.scout.domain.pipeline.heuristics.BusinessModelAnalyzer;
import me.golemcore.scout.domain.pipeline.heuristics.GrowthSignalAnalyzer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Stage 2: business-model classification and growth velocity from the
 * corporate profile, news, social and hiring signals.
 */
@Component
public class BusinessContextStage implements AnalysisStage {

    public static final String NAME = "business-context";

    private static final int PROMPT_HEADLINES = 5;
    private static final int PROMPT_NEWS = 10;
    private static final int COMMON_ROLES = 5;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public StageOutcome runDeterministic(PipelineRun run) {
        List<Finding> findings = new ArrayList<>();
        findings.addAll(BusinessModelAnalyzer.analyze(run.getBundle(), run.getAnalysisDate()));
        findings.addAll(GrowthSignalAnalyzer.analyze(run.getBundle(), run.getAnalysisDate()));
        if (findings.isEmpty()) {
            // Low confidence with a single source: cross-verification drops it.
            findings.add(Finding.builder()
                    .title("Business Model Unclear")
                    .detail("Available evidence does not indicate a clear business model or growth trajectory.")
                    .confidence(0.4)
                    .tag("business-model")
                    .source(SourceCitation.builder().title("Business Model Analysis")
                            .date(run.getAnalysisDate().toString()).build())
                    .build());
        }
        return StageOutcome.of(findings);
    }

    @Override
    public StageOutcome runWithCapability(PipelineRun run, AnalysisCapability capability) {
        List<Finding> findings = new ArrayList<>();
        findings.addAll(capability.extractFindings(businessPrompt(run)));
        findings.addAll(capability.extractFindings(growthPrompt(run.getBundle())));
        return StageOutcome.of(StagePrompts.withTags(findings, "business-analysis", NAME));
    }

    private static String businessPrompt(PipelineRun run) {
        EvidenceBundle bundle = run.getBundle();
        CorporateProfile profile = bundle.getCorporateProfile();
        String headlines = bundle.newsOrEmpty().stream()
                .limit(PROMPT_HEADLINES)
                .map(NewsItem::getTitle)
                .collect(Collectors.joining("; "));
        String social = bundle.socialProfilesOrEmpty().stream()
                .map(s -> s.getPlatform() + ": " + (s.getFollowers() != null ? s.getFollowers() : "N/A")
                        + " followers")
                .collect(Collectors.joining(", "));
        return "Analyze this company's business model and market position:\n\n"
                + StagePrompts.companyContext(bundle, run.getNotes())
                + "Industry: " + (profile != null && profile.getIndustry() != null ? profile.getIndustry() : "Unknown")
                + "\nEmployees: "
                + (profile != null && profile.getEmployees() != null ? profile.getEmployees() : "Unknown")
                + "\nNews Headlines: " + headlines
                + "\nSocial Presence: " + social + "\n\n"
                + "Analyze:\n"
                + "1. Business model type (B2B, B2C, marketplace, etc.)\n"
                + "2. Growth indicators and scaling challenges\n"
                + "3. Competitive pressures requiring efficiency\n"
                + "4. Customer service or operational bottlenecks\n"
                + "5. Market opportunities for AI differentiation";
    }

    private static String growthPrompt(EvidenceBundle bundle) {
        String news = bundle.newsOrEmpty().stream()
                .limit(PROMPT_NEWS)
                .map(n -> "- " + n.getTitle() + " (" + n.getSource() + ")")
                .collect(Collectors.joining("\n"));
        return "Based on this company's profile, analyze growth and scaling opportunities:\n\n"
                + "Company: " + bundle.companyName() + "\n"
                + "Recent News:\n" + news + "\n\n"
                + "Job Growth: " + bundle.jobsOrEmpty().size() + " open positions\n"
                + "High-demand roles: " + String.join(", ", mostCommonRoles(bundle.jobsOrEmpty())) + "\n\n"
                + "Identify:\n"
                + "1. Growth trajectory and scaling challenges\n"
                + "2. Operational bottlenecks from rapid growth\n"
                + "3. Need for scalable solutions\n"
                + "4. Process standardization opportunities\n"
                + "5. Customer experience improvement areas";
    }

    /**
     * Most frequent role names, taking the part of each title before a dash.
     */
    static List<String> mostCommonRoles(List<JobItem> jobs) {
        Map<String, Long> counts = jobs.stream()
                .map(JobItem::getTitle)
                .filter(title -> title != null && !title.isBlank())
                .map(title -> title.split("[-–]")[0].trim())
                .collect(Collectors.groupingBy(role -> role, LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(COMMON_ROLES)
                .map(Map.Entry::getKey)
                .toList();
    }
}
