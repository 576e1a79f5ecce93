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

package me.golemcore.scout.domain.pipeline.heuristics;

import me.golemcore.scout.domain.model.AutomationScore;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.TechnologySignal;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Scores automation potential on a 0-10 scale from five factors, each worth up
 * to two points:
 * <ol>
 * <li>findings tagged as automation opportunities (half a point each)</li>
 * <li>growth findings or at least five open positions</li>
 * <li>repetitive, manual or high-volume work described in findings</li>
 * <li>technology adoption, more for modern tooling</li>
 * <li>procurement history, more for contracts above 100k</li>
 * </ol>
 * Only factors that apply are averaged, then scaled by five. Confidence grows
 * by 0.1 per available data point from 0.5, capped at 0.95.
 */
public final class AutomationPotentialScorer {

    private static final List<String> MODERN_KEYWORDS = List.of("cloud", "saas", "api", "automation");
    private static final List<String> REPETITIVE_WORDING = List.of("repetitive", "manual", "high volume",
            "high-volume");
    private static final double HIGH_VALUE_CONTRACT = 100_000;
    private static final int MANY_JOBS = 5;
    private static final int MANY_FINDINGS = 5;

    private AutomationPotentialScorer() {
    }

    public static AutomationScore score(EvidenceBundle bundle, List<Finding> findings) {
        double score = 0;
        int factors = 0;

        long opportunities = findings.stream().filter(f -> f.hasTag(Finding.TAG_AUTOMATION_OPPORTUNITY)).count();
        if (opportunities > 0) {
            score += Math.min(opportunities * 0.5, 2);
            factors++;
        }

        boolean growth = findings.stream().anyMatch(f -> f.hasTag(Finding.TAG_GROWTH));
        if (growth || bundle.jobsOrEmpty().size() >= MANY_JOBS) {
            score += 1.5;
            factors++;
        }

        boolean repetitive = findings.stream().anyMatch(f -> {
            String detail = f.getDetail() != null ? f.getDetail().toLowerCase(Locale.ROOT) : "";
            return REPETITIVE_WORDING.stream().anyMatch(detail::contains);
        });
        if (repetitive) {
            score += 2;
            factors++;
        }

        List<TechnologySignal> technologies = bundle.technologiesOrEmpty();
        if (!technologies.isEmpty()) {
            boolean modern = technologies.stream().anyMatch(t -> {
                String label = t.label().toLowerCase(Locale.ROOT);
                return MODERN_KEYWORDS.stream().anyMatch(label::contains);
            });
            score += modern ? 2 : 1;
            factors++;
        }

        if (!bundle.procurementOrEmpty().isEmpty()) {
            boolean highValue = bundle.procurementOrEmpty().stream()
                    .anyMatch(p -> BusinessModelAnalyzer.amountOf(p) > HIGH_VALUE_CONTRACT);
            score += highValue ? 2 : 1;
            factors++;
        }

        double finalScore = factors > 0 ? (score / factors) * 5 : 0;
        return AutomationScore.of(finalScore, confidence(bundle, findings));
    }

    public static double confidence(EvidenceBundle bundle, List<Finding> findings) {
        long dataPoints = Stream.of(
                !bundle.jobsOrEmpty().isEmpty(),
                !bundle.technologiesOrEmpty().isEmpty(),
                !bundle.newsOrEmpty().isEmpty(),
                !bundle.procurementOrEmpty().isEmpty(),
                findings.size() > MANY_FINDINGS)
                .filter(Boolean::booleanValue).count();
        return Math.min(0.5 + dataPoints * 0.1, 0.95);
    }
}
