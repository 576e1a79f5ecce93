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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.domain.exception.CapabilityUnavailableException;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.pipeline.AnalysisCapability;
import me.golemcore.scout.domain.pipeline.AnalysisStage;
import me.golemcore.scout.domain.pipeline.PipelineRun;
import me.golemcore.scout.domain.pipeline.StageOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 4: filters, re-weights and de-duplicates the findings of stages 1-3.
 *
 * <p>
 * Rules, applied in order:
 * <ol>
 * <li>drop findings below {@value #MIN_CONFIDENCE} confidence that have fewer
 * than {@value #MIN_SOURCES_FOR_WEAK} sources</li>
 * <li>multiply confidence by {@value #CORROBORATION_BOOST} (capped at 1) for
 * findings with at least {@value #CORROBORATED_SOURCES} sources</li>
 * <li>keep one finding per title and tag set, the one with higher
 * confidence</li>
 * </ol>
 * The capability variant first lets the model drop or re-weight findings,
 * then applies the same rules.
 */
@Component
@Slf4j
public class CrossVerificationStage implements AnalysisStage {

    public static final String NAME = "cross-verification";

    static final double MIN_CONFIDENCE = 0.5;
    static final int MIN_SOURCES_FOR_WEAK = 2;
    static final int CORROBORATED_SOURCES = 3;
    static final double CORROBORATION_BOOST = 1.2;

    private static final int MAX_REVIEWED = 15;

    private static final String REVIEW_INSTRUCTION = """
            You review preliminary automation findings for accuracy and impact.
            Answer ONLY with a JSON array with one object per finding you assessed:
            {"index": <finding number>, "keep": true|false, "confidence": <adjusted number 0-1>}.
            Drop findings that contradict the company data or are not actionable.
            """;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 40;
    }

    @Override
    public boolean refinesFindings() {
        return true;
    }

    @Override
    public StageOutcome runDeterministic(PipelineRun run) {
        return StageOutcome.of(verify(run.getFindings()));
    }

    @Override
    public StageOutcome runWithCapability(PipelineRun run, AnalysisCapability capability) {
        List<Finding> preliminary = run.getFindings();
        if (preliminary.isEmpty()) {
            return StageOutcome.of(List.of());
        }
        String answer = capability.complete(REVIEW_INSTRUCTION, reviewPrompt(run, preliminary));
        JsonNode reviews = capability.getParser().readArray(answer);

        Map<Integer, JsonNode> byIndex = new HashMap<>();
        for (JsonNode review : reviews) {
            if (review.hasNonNull("index") && review.get("index").canConvertToInt()) {
                byIndex.put(review.get("index").asInt(), review);
            }
        }
        if (byIndex.isEmpty()) {
            throw new CapabilityUnavailableException("Verification response contains no finding reviews");
        }

        List<Finding> reviewed = new ArrayList<>();
        for (int i = 0; i < preliminary.size(); i++) {
            Finding finding = preliminary.get(i);
            JsonNode review = byIndex.get(i + 1);
            if (review == null) {
                reviewed.add(finding);
                continue;
            }
            if (!review.path("keep").asBoolean(true)) {
                log.debug("[Pipeline] Verification dropped '{}'", finding.getTitle());
                continue;
            }
            JsonNode confidence = review.get("confidence");
            reviewed.add(confidence != null && confidence.isNumber()
                    ? finding.withConfidence(confidence.asDouble())
                    : finding);
        }
        return StageOutcome.of(verify(reviewed));
    }

    public static List<Finding> verify(List<Finding> preliminary) {
        Map<String, Finding> unique = new LinkedHashMap<>();
        for (Finding finding : preliminary) {
            if (finding.getConfidence() < MIN_CONFIDENCE && finding.sourceCount() < MIN_SOURCES_FOR_WEAK) {
                continue;
            }
            Finding weighted = finding.sourceCount() >= CORROBORATED_SOURCES
                    ? finding.withConfidence(finding.getConfidence() * CORROBORATION_BOOST)
                    : finding;
            unique.merge(weighted.deduplicationKey(), weighted,
                    (existing, candidate) -> candidate.getConfidence() > existing.getConfidence()
                            ? candidate
                            : existing);
        }
        return new ArrayList<>(unique.values());
    }

    private static String reviewPrompt(PipelineRun run, List<Finding> preliminary) {
        StringBuilder sb = new StringBuilder("Review and verify these preliminary findings for accuracy and impact:\n\n");
        sb.append(StagePrompts.companyContext(run.getBundle(), run.getNotes())).append('\n');
        for (int i = 0; i < Math.min(preliminary.size(), MAX_REVIEWED); i++) {
            Finding finding = preliminary.get(i);
            sb.append("Finding ").append(i + 1).append(": ").append(finding.getTitle()).append('\n')
                    .append("Detail: ").append(finding.getDetail()).append('\n')
                    .append("Confidence: ").append(finding.getConfidence()).append('\n')
                    .append("Tags: ").append(String.join(", ", finding.getTags())).append("\n\n");
        }
        sb.append("For each finding verify it against the company profile, assess implementation difficulty ")
                .append("and adjust its confidence.");
        return sb.toString();
    }
}
