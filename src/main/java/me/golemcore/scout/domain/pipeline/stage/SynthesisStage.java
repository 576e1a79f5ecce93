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

import me.golemcore.scout.domain.exception.CapabilityUnavailableException;
import me.golemcore.scout.domain.model.AutomationScore;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.SourceCitation;
import me.golemcore.scout.domain.pipeline.AnalysisCapability;
import me.golemcore.scout.domain.pipeline.AnalysisStage;
import me.golemcore.scout.domain.pipeline.PipelineRun;
import me.golemcore.scout.domain.pipeline.StageOutcome;
import me.golemcore.scout.domain.pipeline.heuristics.AutomationPotentialScorer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stage 5: computes the automation score, appends one summary finding and
 * orders the final list with the summary first, then by priority
 * ({@code confidence x 1.5 for high-impact x 1.3 for quick-win}, descending).
 */
@Component
public class SynthesisStage implements AnalysisStage {

    public static final String NAME = "synthesis";

    static final double HIGH_IMPACT_MULTIPLIER = 1.5;
    static final double QUICK_WIN_MULTIPLIER = 1.3;

    private static final Pattern SCORE_PATTERN = Pattern.compile("score[:\\s]+(\\d+(?:\\.\\d+)?)",
            Pattern.CASE_INSENSITIVE);
    private static final int PROMPT_FINDINGS = 10;
    private static final double CAPABILITY_SUMMARY_CONFIDENCE = 0.9;

    private static final String STRATEGY_INSTRUCTION = """
            You are an automation strategist. Write plain text, not JSON.
            Begin with a line of the form "Score: <0-10>" rating the overall automation potential.
            """;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 50;
    }

    @Override
    public boolean refinesFindings() {
        return true;
    }

    @Override
    public StageOutcome runDeterministic(PipelineRun run) {
        List<Finding> verified = run.getFindings();
        AutomationScore score = AutomationPotentialScorer.score(run.getBundle(), verified);
        Finding summary = Finding.builder()
                .title("Overall Automation Opportunity Assessment")
                .detail(summaryText(run.getBundle(), verified, score))
                .confidence(score.getConfidence())
                .tag(Finding.TAG_SYNTHESIS).tag(Finding.TAG_RECOMMENDATION).tag(score.getLevel().getTag())
                .source(SourceCitation.builder().title("Comprehensive Analysis")
                        .date(run.getAnalysisDate().toString()).build())
                .build();
        return new StageOutcome(prioritize(summary, verified), score);
    }

    @Override
    public StageOutcome runWithCapability(PipelineRun run, AnalysisCapability capability) {
        List<Finding> verified = run.getFindings();
        String strategy = capability.complete(STRATEGY_INSTRUCTION, strategyPrompt(run, verified));
        Matcher matcher = SCORE_PATTERN.matcher(strategy);
        if (!matcher.find()) {
            throw new CapabilityUnavailableException("Synthesis response carries no score");
        }
        AutomationScore score = AutomationScore.of(Double.parseDouble(matcher.group(1)),
                AutomationPotentialScorer.confidence(run.getBundle(), verified));
        Finding summary = Finding.builder()
                .title("Comprehensive Automation Strategy")
                .detail(strategy.trim())
                .confidence(CAPABILITY_SUMMARY_CONFIDENCE)
                .tag(Finding.TAG_SYNTHESIS).tag(Finding.TAG_RECOMMENDATION).tag("executive-summary")
                .tag(score.getLevel().getTag())
                .source(SourceCitation.builder().title("AI Analysis Synthesis")
                        .date(run.getAnalysisDate().toString()).build())
                .build();
        return new StageOutcome(prioritize(summary, verified), score);
    }

    static double priority(Finding finding) {
        double priority = finding.getConfidence();
        if (finding.hasTag(Finding.TAG_HIGH_IMPACT)) {
            priority *= HIGH_IMPACT_MULTIPLIER;
        }
        if (finding.hasTag(Finding.TAG_QUICK_WIN)) {
            priority *= QUICK_WIN_MULTIPLIER;
        }
        return priority;
    }

    static List<Finding> prioritize(Finding summary, List<Finding> verified) {
        List<Finding> ordered = new ArrayList<>(verified.size() + 1);
        ordered.add(summary);
        verified.stream()
                .sorted(Comparator.comparingDouble(SynthesisStage::priority).reversed())
                .forEach(ordered::add);
        return ordered;
    }

    static String summaryText(EvidenceBundle bundle, List<Finding> findings, AutomationScore score) {
        long opportunities = findings.stream()
                .filter(f -> f.hasTag(Finding.TAG_AUTOMATION_OPPORTUNITY) || f.hasTag(Finding.TAG_HIGH_IMPACT))
                .count();
        StringBuilder sb = new StringBuilder();
        sb.append(bundle.companyName()).append(" shows ").append(score.getLevel().getTag())
                .append(" potential for AI automation (score: ").append(score.getScore()).append("/10).");
        if (opportunities > 0) {
            sb.append(" Identified ").append(opportunities).append(" specific automation opportunities.");
        }
        if (!bundle.jobsOrEmpty().isEmpty()) {
            sb.append(" Active hiring indicates growth and potential for process optimization.");
        }
        if (!bundle.technologiesOrEmpty().isEmpty()) {
            sb.append(" Existing tech stack suggests openness to technology adoption.");
        }
        if (findings.stream().anyMatch(f -> f.hasTag(Finding.TAG_GROWTH))) {
            sb.append(" Growth signals indicate scaling challenges that AI could address.");
        }
        return sb.toString();
    }

    private static String strategyPrompt(PipelineRun run, List<Finding> verified) {
        StringBuilder sb = new StringBuilder("Create a comprehensive automation strategy based on these findings:\n\n");
        sb.append(StagePrompts.companyContext(run.getBundle(), run.getNotes()));
        sb.append("Verified Opportunities: ").append(verified.size()).append("\nTop Findings:\n");
        verified.stream().limit(PROMPT_FINDINGS)
                .forEach(f -> sb.append("- ").append(f.getTitle()).append(": ").append(f.getDetail()).append('\n'));
        sb.append("\nCreate:\n")
                .append("1. Executive summary of automation potential (1-10 score with justification)\n")
                .append("2. Top 3 quick wins (low effort, high impact)\n")
                .append("3. Strategic initiatives (high effort, transformational impact)\n")
                .append("4. Implementation roadmap suggestion\n")
                .append("5. Expected ROI and timeline estimates\n\n")
                .append("Be specific and actionable. Focus on realistic outcomes.");
        return sb.toString();
    }
}
