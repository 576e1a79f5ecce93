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

import me.golemcore.scout.domain.model.ArchiveSnapshot;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.JobItem;
import me.golemcore.scout.domain.model.NewsItem;
import me.golemcore.scout.domain.model.SocialProfile;
import me.golemcore.scout.domain.model.SourceCitation;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Growth velocity from hiring volume, department spread, recent news, social
 * reach and website history.
 */
public final class GrowthSignalAnalyzer {

    static final List<String> GROWTH_NEWS_KEYWORDS = List.of(
            "funding", "investment", "acquisition", "expansion", "partnership", "launch", "new market");

    private static final Map<String, List<String>> DEPARTMENTS = new LinkedHashMap<>();

    static {
        DEPARTMENTS.put("Engineering", List.of("engineer", "developer", "architect", "devops"));
        DEPARTMENTS.put("Sales", List.of("sales", "account executive", "bdr", "sdr"));
        DEPARTMENTS.put("Marketing", List.of("marketing", "content", "seo", "growth"));
        DEPARTMENTS.put("Operations", List.of("operations", "ops ", "coordinator"));
        DEPARTMENTS.put("Customer Success", List.of("customer success", "support", "service"));
        DEPARTMENTS.put("Product", List.of("product manager", "product owner", "pm "));
        DEPARTMENTS.put("Finance", List.of("finance", "accounting", "controller"));
        DEPARTMENTS.put("HR", List.of("human resources", "hr ", "recruiter", "talent"));
    }

    private static final int MULTI_DEPARTMENT_COUNT = 4;
    private static final int RECENT_NEWS_MONTHS = 6;
    private static final long STRONG_SOCIAL_FOLLOWERS = 50_000;
    private static final double DAYS_PER_YEAR = 365.0;

    private GrowthSignalAnalyzer() {
    }

    public static List<Finding> analyze(EvidenceBundle bundle, LocalDate today) {
        List<Finding> findings = new ArrayList<>();
        analyzeHiring(bundle.jobsOrEmpty(), today, findings);
        analyzeNews(bundle.newsOrEmpty(), today, findings);
        analyzeSocial(bundle.socialProfilesOrEmpty(), findings);
        analyzeArchives(bundle.archivesOrEmpty(), findings);
        return findings;
    }

    private static void analyzeHiring(List<JobItem> jobs, LocalDate today, List<Finding> findings) {
        if (jobs.isEmpty()) {
            return;
        }
        int jobCount = jobs.size();
        String growthLevel;
        double confidence;
        if (jobCount >= 20) {
            growthLevel = "Rapid Growth";
            confidence = 0.95;
        } else if (jobCount >= 10) {
            growthLevel = "Strong Growth";
            confidence = 0.9;
        } else if (jobCount >= 5) {
            growthLevel = "Moderate Growth";
            confidence = 0.85;
        } else {
            growthLevel = "Steady Growth";
            confidence = 0.8;
        }

        findings.add(Finding.builder()
                .title(growthLevel + " Indicated by Hiring")
                .detail(jobCount + " open positions indicate " + growthLevel.toLowerCase(Locale.ROOT)
                        + ". Growing companies need scalable processes and automation.")
                .confidence(confidence)
                .tag(Finding.TAG_GROWTH).tag("hiring").tag("scaling")
                .source(SourceCitation.builder().title("Job Postings Analysis").date(today.toString()).build())
                .build());

        Set<String> departments = new LinkedHashSet<>();
        for (JobItem job : jobs) {
            extractDepartment(job.getTitle()).ifPresent(departments::add);
        }
        if (departments.size() >= MULTI_DEPARTMENT_COUNT) {
            Finding.FindingBuilder expansion = Finding.builder()
                    .title("Multi-Department Expansion")
                    .detail("Hiring across " + departments.size() + " departments: " + String.join(", ", departments)
                            + ". Indicates company-wide growth.")
                    .confidence(0.85)
                    .tag(Finding.TAG_GROWTH).tag("expansion").tag("scaling");
            jobs.stream().limit(5).forEach(j -> expansion.source(SourceCitation.of(j.getTitle(), j.getUrl())));
            findings.add(expansion.build());
        }
    }

    private static void analyzeNews(List<NewsItem> news, LocalDate today, List<Finding> findings) {
        LocalDate cutoff = today.minusMonths(RECENT_NEWS_MONTHS);
        List<NewsItem> growthNews = news.stream()
                .filter(n -> isRecent(n, cutoff))
                .filter(n -> {
                    String title = n.getTitle() != null ? n.getTitle().toLowerCase(Locale.ROOT) : "";
                    return GROWTH_NEWS_KEYWORDS.stream().anyMatch(title::contains);
                })
                .toList();
        if (growthNews.isEmpty()) {
            return;
        }
        Finding.FindingBuilder finding = Finding.builder()
                .title("Recent Growth Activity in News")
                .detail(growthNews.size() + " recent news items about growth: " + growthNews.get(0).getTitle())
                .confidence(0.9)
                .tag(Finding.TAG_GROWTH).tag("news").tag("expansion");
        growthNews.stream().limit(3).forEach(n -> finding.source(SourceCitation.builder()
                .title(n.getTitle())
                .url(n.getUrl())
                .date(n.getDate())
                .build()));
        findings.add(finding.build());
    }

    private static void analyzeSocial(List<SocialProfile> profiles, List<Finding> findings) {
        if (profiles.isEmpty()) {
            return;
        }
        long totalFollowers = profiles.stream()
                .mapToLong(p -> p.getFollowers() != null ? p.getFollowers() : 0L)
                .sum();
        if (totalFollowers <= STRONG_SOCIAL_FOLLOWERS) {
            return;
        }
        Finding.FindingBuilder finding = Finding.builder()
                .title("Strong Social Media Presence")
                .detail(String.format(Locale.US, "%,d", totalFollowers) + " total followers across "
                        + profiles.size() + " platforms. Indicates brand strength and growth.")
                .confidence(0.8)
                .tag(Finding.TAG_GROWTH).tag("social-media").tag("brand");
        profiles.forEach(p -> finding.source(SourceCitation.of(p.getPlatform() + " Profile", p.getUrl())));
        findings.add(finding.build());
    }

    // Snapshots arrive newest first.
    private static void analyzeArchives(List<ArchiveSnapshot> archives, List<Finding> findings) {
        if (archives.size() < 2) {
            return;
        }
        ArchiveSnapshot newest = archives.get(0);
        ArchiveSnapshot oldest = archives.get(archives.size() - 1);
        Optional<LocalDate> newDate = EvidenceDates.parse(newest.getDate());
        Optional<LocalDate> oldDate = EvidenceDates.parse(oldest.getDate());
        if (newDate.isEmpty() || oldDate.isEmpty()) {
            return;
        }
        double years = ChronoUnit.DAYS.between(oldDate.get(), newDate.get()) / DAYS_PER_YEAR;
        if (years <= 1) {
            return;
        }
        findings.add(Finding.builder()
                .title("Website Evolution Tracked")
                .detail("Website has evolved over " + Math.round(years)
                        + " years. Regular updates indicate active business growth.")
                .confidence(0.75)
                .tag(Finding.TAG_GROWTH).tag("digital-presence")
                .source(SourceCitation.builder().title("Latest Website").url(newest.getUrl())
                        .date(newest.getDate()).build())
                .source(SourceCitation.builder().title("Historical Website").url(oldest.getSnapshotUrl())
                        .date(oldest.getDate()).build())
                .build());
    }

    // Undated items count as recent; unparseable dates do not.
    private static boolean isRecent(NewsItem item, LocalDate cutoff) {
        if (item.getDate() == null || item.getDate().isBlank()) {
            return true;
        }
        return EvidenceDates.parse(item.getDate()).map(d -> d.isAfter(cutoff)).orElse(false);
    }

    static Optional<String> extractDepartment(String jobTitle) {
        if (jobTitle == null) {
            return Optional.empty();
        }
        String title = jobTitle.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> department : DEPARTMENTS.entrySet()) {
            if (department.getValue().stream().anyMatch(title::contains)) {
                return Optional.of(department.getKey());
            }
        }
        return Optional.empty();
    }
}
