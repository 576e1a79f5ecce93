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
import me.golemcore.scout.domain.model.JobItem;
import me.golemcore.scout.domain.pipeline.AnalysisCapability;
import me.golemcore.scout.domain.pipeline.AnalysisStage;
import me.golemcore.scout.domain.pipeline.PipelineRun;
import me.golemcore.scout.domain.pipeline.StageOutcome;
import me.golemcore.scout.domain.pipeline.heuristics.JobPostingAnalyzer;
import me.golemcore.scout.domain.pipeline.heuristics.TechStackAnalyzer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stage 1: manual-process and legacy-technology indicators in job postings
 * and detected technologies.
 */
@Component
public class TechnicalSignalStage implements AnalysisStage {

    public static final String NAME = "technical-signal";

    private static final int PROMPT_JOB_TITLES = 10;
    private static final int PROMPT_JOB_DETAILS = 20;
    private static final int EXCERPT_LENGTH = 200;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public StageOutcome runDeterministic(PipelineRun run) {
        List<Finding> findings = new ArrayList<>();
        findings.addAll(TechStackAnalyzer.analyze(run.getBundle(), run.getAnalysisDate()));
        findings.addAll(JobPostingAnalyzer.analyze(run.getBundle(), run.getAnalysisDate()));
        return StageOutcome.of(findings);
    }

    @Override
    public StageOutcome runWithCapability(PipelineRun run, AnalysisCapability capability) {
        EvidenceBundle bundle = run.getBundle();
        List<Finding> findings = new ArrayList<>(StagePrompts.withTags(
                capability.extractFindings(technicalPrompt(run)), "tech-analysis", NAME));
        if (!bundle.jobsOrEmpty().isEmpty()) {
            findings.addAll(StagePrompts.withTags(
                    capability.extractFindings(jobPrompt(bundle)), "job-analysis", NAME));
        }
        return StageOutcome.of(findings);
    }

    private static String technicalPrompt(PipelineRun run) {
        EvidenceBundle bundle = run.getBundle();
        String titles = bundle.jobsOrEmpty().stream()
                .limit(PROMPT_JOB_TITLES)
                .map(JobItem::getTitle)
                .collect(Collectors.joining(", "));
        return "Analyze this company's technical profile for automation opportunities:\n\n"
                + StagePrompts.companyContext(bundle, run.getNotes())
                + "Job Titles: " + titles + "\n\n"
                + "Focus on:\n"
                + "1. Technology gaps that could benefit from AI/automation\n"
                + "2. Manual processes evident in job postings\n"
                + "3. Legacy systems that need modernization\n"
                + "4. Integration opportunities\n\n"
                + "Provide specific, actionable findings.";
    }

    private static String jobPrompt(EvidenceBundle bundle) {
        StringBuilder sb = new StringBuilder("Analyze these job postings to identify automation opportunities:\n\n");
        List<JobItem> jobs = bundle.jobsOrEmpty();
        for (int i = 0; i < Math.min(jobs.size(), PROMPT_JOB_DETAILS); i++) {
            JobItem job = jobs.get(i);
            sb.append(i + 1).append(". ").append(job.getTitle()).append(" at ").append(bundle.companyName());
            if (job.getLocation() != null) {
                sb.append("\n   Location: ").append(job.getLocation());
            }
            if (job.getText() != null && !job.getText().isBlank()) {
                sb.append("\n   Description excerpt: ").append(StagePrompts.truncate(job.getText(), EXCERPT_LENGTH));
            }
            sb.append('\n');
        }
        sb.append("\nIdentify:\n")
                .append("1. Repetitive tasks mentioned across multiple roles\n")
                .append("2. Manual processes that could be automated\n")
                .append("3. High-volume operations\n")
                .append("4. Data entry or processing roles\n")
                .append("5. Coordination/scheduling tasks\n\n")
                .append("For each pattern found, estimate the potential impact and feasibility of automation.");
        return sb.toString();
    }
}
