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

import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.SourceCitation;
import me.golemcore.scout.domain.model.TechnologySignal;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword classification of detected technologies: legacy versus modern
 * tooling, category coverage and capability gaps.
 */
public final class TechStackAnalyzer {

    static final List<String> LEGACY_INDICATORS = List.of(
            "excel", "access", "vba", "sharepoint", "on-premise", "legacy",
            "manual", "paper-based", "fax", "phone-based");

    static final List<String> MODERN_INDICATORS = List.of(
            "cloud", "saas", "api", "automation", "ai", "machine learning",
            "analytics", "dashboard", "real-time", "integration");

    private static final Map<String, List<String>> CATEGORIES = new LinkedHashMap<>();

    static {
        CATEGORIES.put("Analytics", List.of("analytics", "tableau", "powerbi", "looker", "datadog"));
        CATEGORIES.put("Automation", List.of("zapier", "uipath", "workato", "automation", "n8n"));
        CATEGORIES.put("Integration", List.of("mulesoft", "segment", "integration", "api"));
        CATEGORIES.put("Cloud", List.of("aws", "azure", "gcp", "cloud"));
        CATEGORIES.put("Communication", List.of("slack", "teams", "zoom", "email"));
        CATEGORIES.put("CRM", List.of("salesforce", "hubspot", "pipedrive", "zoho"));
        CATEGORIES.put("Development", List.of("github", "gitlab", "jira", "jenkins"));
        CATEGORIES.put("Marketing", List.of("marketo", "mailchimp", "hootsuite", "buffer"));
        CATEGORIES.put("Productivity", List.of("office", "gsuite", "notion", "asana", "monday"));
    }

    private static final List<String> EXPECTED_CAPABILITIES = List.of("Analytics", "Automation", "Integration");
    private static final int DIVERSE_CATEGORY_COUNT = 4;
    private static final int MAX_LISTED_SOURCES = 5;

    private TechStackAnalyzer() {
    }

    public static List<Finding> analyze(EvidenceBundle bundle, LocalDate today) {
        List<Finding> findings = new ArrayList<>();
        List<TechnologySignal> technologies = bundle.technologiesOrEmpty();

        if (technologies.isEmpty()) {
            findings.add(Finding.builder()
                    .title("Limited Technology Visibility")
                    .detail("No modern tech stack detected. May indicate reliance on legacy systems or manual processes.")
                    .confidence(0.6)
                    .tag("tech-gap").tag(Finding.TAG_AUTOMATION_OPPORTUNITY)
                    .source(SourceCitation.builder().title("Tech Stack Analysis").date(today.toString()).build())
                    .build());
            return findings;
        }

        Map<String, List<String>> byCategory = categorize(technologies);
        boolean hasLegacy = technologies.stream().anyMatch(t -> matchesAny(t, LEGACY_INDICATORS));
        boolean hasModern = technologies.stream().anyMatch(t -> matchesAny(t, MODERN_INDICATORS));
        String stackUrl = stackUrl(bundle);

        if (hasLegacy) {
            findings.add(Finding.builder()
                    .title("Legacy Systems Detected")
                    .detail("Presence of legacy tools indicates opportunities for modernization and automation.")
                    .confidence(0.8)
                    .tag("legacy-tech").tag(Finding.TAG_AUTOMATION_OPPORTUNITY).tag(Finding.TAG_HIGH_IMPACT)
                    .source(SourceCitation.of("Technology Stack", stackUrl))
                    .build());
        } else if (hasModern) {
            findings.add(Finding.builder()
                    .title("Modern Tech Stack")
                    .detail("Company uses modern tools, indicating openness to technology adoption and integration.")
                    .confidence(0.85)
                    .tag("modern-tech").tag("tech-forward")
                    .source(SourceCitation.of("Technology Stack", stackUrl))
                    .build());
        }

        List<String> missing = EXPECTED_CAPABILITIES.stream()
                .filter(category -> !byCategory.containsKey(category))
                .toList();
        if (!missing.isEmpty()) {
            findings.add(Finding.builder()
                    .title("Technology Gaps Identified")
                    .detail("Missing capabilities in: " + String.join(", ", missing)
                            + ". These represent automation opportunities.")
                    .confidence(0.75)
                    .tag("tech-gap").tag(Finding.TAG_AUTOMATION_OPPORTUNITY)
                    .source(SourceCitation.builder().title("Gap Analysis").date(today.toString()).build())
                    .build());
        }

        if (byCategory.size() >= DIVERSE_CATEGORY_COUNT) {
            Finding.FindingBuilder diverse = Finding.builder()
                    .title("Diverse Technology Adoption")
                    .detail("Uses tools across " + byCategory.size() + " categories: "
                            + String.join(", ", byCategory.keySet()))
                    .confidence(0.9)
                    .tag("tech-adoption").tag("tech-forward");
            technologies.stream()
                    .limit(MAX_LISTED_SOURCES)
                    .forEach(t -> diverse.source(SourceCitation.of(t.label().isEmpty() ? "Unknown Tool" : t.label())));
            findings.add(diverse.build());
        }

        return findings;
    }

    /**
     * Groups technology labels by the first category whose keyword they
     * contain, in category declaration order.
     */
    static Map<String, List<String>> categorize(List<TechnologySignal> technologies) {
        Map<String, List<String>> byCategory = new LinkedHashMap<>();
        for (TechnologySignal technology : technologies) {
            String label = technology.label().toLowerCase(Locale.ROOT);
            for (Map.Entry<String, List<String>> category : CATEGORIES.entrySet()) {
                if (category.getValue().stream().anyMatch(label::contains)) {
                    byCategory.computeIfAbsent(category.getKey(), k -> new ArrayList<>()).add(technology.label());
                    break;
                }
            }
        }
        return byCategory;
    }

    static boolean matchesAny(TechnologySignal technology, List<String> indicators) {
        String label = technology.label().toLowerCase(Locale.ROOT);
        return indicators.stream().anyMatch(label::contains);
    }

    public static String stackUrl(EvidenceBundle bundle) {
        String slug = bundle.companyName().toLowerCase(Locale.ROOT).trim().replaceAll("[^a-z0-9]+", "-");
        return slug.isEmpty() ? null : "https://stackshare.io/companies/" + slug;
    }
}
