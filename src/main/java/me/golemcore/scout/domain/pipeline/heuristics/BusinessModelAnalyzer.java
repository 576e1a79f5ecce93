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
import me.golemcore.scout.domain.model.ProcurementRecord;
import me.golemcore.scout.domain.model.SocialProfile;
import me.golemcore.scout.domain.model.SourceCitation;
import me.golemcore.scout.domain.model.TechnologySignal;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Classifies the business model from hiring, technology, procurement and
 * social signals: enterprise-facing versus consumer-facing, government
 * contracting, and service versus product orientation.
 */
public final class BusinessModelAnalyzer {

    private static final List<String> B2B_TECHNOLOGIES = List.of("salesforce", "hubspot", "dynamics");
    private static final List<String> B2C_TECHNOLOGIES = List.of("shopify", "woocommerce", "magento");
    private static final List<String> SERVICE_ROLE_TERMS = List.of("consultant", "service", "support", "success",
            "account");
    private static final List<String> PRODUCT_ROLE_TERMS = List.of("product", "engineer", "developer", "designer");
    private static final long CONSUMER_AUDIENCE_FOLLOWERS = 10_000;
    private static final int MIN_SERVICE_ROLES = 3;

    private BusinessModelAnalyzer() {
    }

    public static List<Finding> analyze(EvidenceBundle bundle, LocalDate today) {
        List<Finding> findings = new ArrayList<>();
        List<JobItem> jobs = bundle.jobsOrEmpty();
        List<ProcurementRecord> procurement = bundle.procurementOrEmpty();

        long b2b = Stream.of(
                !procurement.isEmpty(),
                anyTitleContains(jobs, "enterprise"),
                anyTitleContains(jobs, "b2b"),
                anyTechnologyNamed(bundle.technologiesOrEmpty(), B2B_TECHNOLOGIES))
                .filter(Boolean::booleanValue).count();
        long b2c = Stream.of(
                bundle.socialProfilesOrEmpty().stream().anyMatch(BusinessModelAnalyzer::hasConsumerAudience),
                anyTitleContains(jobs, "consumer"),
                anyTitleContains(jobs, "retail"),
                anyTechnologyNamed(bundle.technologiesOrEmpty(), B2C_TECHNOLOGIES))
                .filter(Boolean::booleanValue).count();

        if (b2b > b2c) {
            findings.add(Finding.builder()
                    .title("B2B Business Model Detected")
                    .detail("Company appears to focus on business customers. B2B companies often have complex "
                            + "processes ripe for automation.")
                    .confidence(Math.min(0.6 + b2b * 0.1, 0.9))
                    .tag("b2b").tag("business-model")
                    .source(SourceCitation.builder().title("Business Model Analysis").date(today.toString()).build())
                    .build());
        } else if (b2c > b2b) {
            findings.add(Finding.builder()
                    .title("B2C Business Model Detected")
                    .detail("Company appears to focus on consumers. B2C companies often need automation for scale "
                            + "and customer service.")
                    .confidence(Math.min(0.6 + b2c * 0.1, 0.9))
                    .tag("b2c").tag("business-model")
                    .source(SourceCitation.builder().title("Business Model Analysis").date(today.toString()).build())
                    .build());
        }

        if (!procurement.isEmpty()) {
            double totalValue = procurement.stream().mapToDouble(BusinessModelAnalyzer::amountOf).sum();
            Finding.FindingBuilder contractor = Finding.builder()
                    .title("Government Contractor")
                    .detail("Active government contractor with " + procurement.size() + " contracts totaling $"
                            + formatAmount(totalValue)
                            + ". Indicates established processes and compliance needs.")
                    .confidence(0.95)
                    .tag("government").tag("enterprise").tag("compliance").tag("high-value");
            String spendingUrl = "https://www.usaspending.gov/search/"
                    + URLEncoder.encode(bundle.companyName(), StandardCharsets.UTF_8);
            procurement.stream().limit(3).forEach(p -> contractor.source(SourceCitation.builder()
                    .title(p.getAgency() + " Contract")
                    .date(p.getDate())
                    .url(spendingUrl)
                    .build()));
            findings.add(contractor.build());
        }

        long serviceRoles = jobs.stream().filter(j -> titleContainsAny(j, SERVICE_ROLE_TERMS)).count();
        long productRoles = jobs.stream().filter(j -> titleContainsAny(j, PRODUCT_ROLE_TERMS)).count();
        if (serviceRoles > productRoles && serviceRoles >= MIN_SERVICE_ROLES) {
            Finding.FindingBuilder services = Finding.builder()
                    .title("Service-Based Business Model")
                    .detail("Heavy focus on service roles (" + serviceRoles + " positions). Service businesses "
                            + "benefit from automation for consistency and scale.")
                    .confidence(0.8)
                    .tag("services").tag("business-model").tag(Finding.TAG_AUTOMATION_OPPORTUNITY);
            jobs.stream().limit(3).forEach(j -> services.source(SourceCitation.of(j.getTitle(), j.getUrl())));
            findings.add(services.build());
        }

        return findings;
    }

    public static double amountOf(ProcurementRecord record) {
        return record.getAmount() != null ? record.getAmount() : 0.0;
    }

    public static String formatAmount(double amount) {
        return String.format(Locale.US, "%,.0f", amount);
    }

    private static boolean hasConsumerAudience(SocialProfile profile) {
        return profile.getFollowers() != null && profile.getFollowers() > CONSUMER_AUDIENCE_FOLLOWERS;
    }

    private static boolean anyTitleContains(List<JobItem> jobs, String term) {
        return jobs.stream().anyMatch(j -> lowerTitle(j).contains(term));
    }

    private static boolean titleContainsAny(JobItem job, List<String> terms) {
        String title = lowerTitle(job);
        return terms.stream().anyMatch(title::contains);
    }

    private static boolean anyTechnologyNamed(List<TechnologySignal> technologies, List<String> names) {
        return technologies.stream()
                .map(t -> t.getName() != null ? t.getName().toLowerCase(Locale.ROOT) : "")
                .anyMatch(names::contains);
    }

    private static String lowerTitle(JobItem job) {
        return job.getTitle() != null ? job.getTitle().toLowerCase(Locale.ROOT) : "";
    }
}
