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
import me.golemcore.scout.domain.model.JobItem;
import me.golemcore.scout.domain.model.SourceCitation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Scans job postings for manual, repetitive and high-volume work.
 */
public final class JobPostingAnalyzer {

    static final List<String> AUTOMATION_KEYWORDS = List.of(
            "data entry", "manual process", "repetitive", "excel", "spreadsheet",
            "coordinate", "schedule", "track", "monitor", "report", "analyze",
            "customer service", "support tickets", "inventory", "compliance",
            "documentation", "filing", "processing", "reconciliation");

    static final List<String> HIGH_VOLUME_INDICATORS = List.of(
            "high volume", "fast-paced", "multiple", "numerous", "heavy",
            "extensive", "large amount", "significant");

    private static final Map<String, List<String>> ROLE_CATEGORIES = new LinkedHashMap<>();

    static {
        ROLE_CATEGORIES.put("Operations", List.of("operations", "coordinator", "specialist", "analyst", "manager"));
        ROLE_CATEGORIES.put("Customer Service",
                List.of("customer", "support", "service", "success", "representative"));
        ROLE_CATEGORIES.put("Data/Analytics", List.of("data", "analytics", "reporting", "insights"));
        ROLE_CATEGORIES.put("Administrative", List.of("admin", "assistant", "clerk", "office", "receptionist"));
        ROLE_CATEGORIES.put("Sales", List.of("sales", "account", "business development", "bd ", "bdr", "sdr"));
        ROLE_CATEGORIES.put("Technical", List.of("engineer", "developer", "technical", "it ", "software"));
        ROLE_CATEGORIES.put("Finance", List.of("finance", "accounting", "bookkeeper", "controller", "payroll"));
        ROLE_CATEGORIES.put("HR", List.of("hr ", "human resources", "recruiter", "talent", "people"));
    }

    private static final int LISTED_OPPORTUNITIES = 3;
    private static final int MAX_LISTED_SOURCES = 5;

    private JobPostingAnalyzer() {
    }

    public static List<Finding> analyze(EvidenceBundle bundle, LocalDate today) {
        List<Finding> findings = new ArrayList<>();
        List<JobItem> jobs = bundle.jobsOrEmpty();
        if (jobs.isEmpty()) {
            return findings;
        }

        List<String> opportunities = new ArrayList<>();
        Map<String, Integer> roles = new LinkedHashMap<>();

        for (JobItem job : jobs) {
            String title = nullToEmpty(job.getTitle());
            String combined = (title + " " + nullToEmpty(job.getText())).toLowerCase(Locale.ROOT);
            String role = categorizeRole(title.toLowerCase(Locale.ROOT));
            roles.merge(role, 1, Integer::sum);

            List<String> matched = AUTOMATION_KEYWORDS.stream().filter(combined::contains).toList();
            if (matched.isEmpty()) {
                continue;
            }
            opportunities.add(title + ": " + String.join(", ", matched));

            boolean highVolume = HIGH_VOLUME_INDICATORS.stream().anyMatch(combined::contains);
            if (highVolume) {
                findings.add(Finding.builder()
                        .title("High-Volume " + role + " Role Identified")
                        .detail(title + " indicates high-volume " + String.join(", ", matched)
                                + " tasks. Prime candidate for automation.")
                        .confidence(0.85)
                        .tag(Finding.TAG_AUTOMATION_OPPORTUNITY).tag(Finding.TAG_HIGH_IMPACT).tag("job-posting")
                        .source(SourceCitation.of(title, job.getUrl()))
                        .build());
            }
        }

        if (!opportunities.isEmpty()) {
            String listed = opportunities.stream().limit(LISTED_OPPORTUNITIES).collect(Collectors.joining("; "));
            Finding.FindingBuilder summary = Finding.builder()
                    .title("Multiple Automation Opportunities in Job Postings")
                    .detail("Found " + opportunities.size() + " roles with automation potential: " + listed
                            + (opportunities.size() > LISTED_OPPORTUNITIES ? "..." : ""))
                    .confidence(0.8)
                    .tag(Finding.TAG_AUTOMATION_OPPORTUNITY).tag("job-analysis");
            jobs.stream().limit(MAX_LISTED_SOURCES)
                    .forEach(j -> summary.source(SourceCitation.of(nullToEmpty(j.getTitle()), j.getUrl())));
            findings.add(summary.build());
        }

        String topRoles = roles.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(3)
                .map(e -> e.getKey() + " (" + e.getValue() + ")")
                .collect(Collectors.joining(", "));
        findings.add(Finding.builder()
                .title("Hiring Pattern Analysis")
                .detail("Primary hiring focus: " + topRoles + ". Total open positions: " + jobs.size())
                .confidence(0.9)
                .tag("hiring-patterns").tag(Finding.TAG_GROWTH)
                .source(SourceCitation.builder().title("Job Postings Analysis").date(today.toString()).build())
                .build());

        return findings;
    }

    static String categorizeRole(String lowerTitle) {
        for (Map.Entry<String, List<String>> category : ROLE_CATEGORIES.entrySet()) {
            if (category.getValue().stream().anyMatch(lowerTitle::contains)) {
                return category.getKey();
            }
        }
        return "Other";
    }

    static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
