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

package me.golemcore.scout.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated raw evidence about one company, used as pipeline input.
 *
 * <p>
 * Every facet is independently optional: a {@code null} facet and an empty
 * facet mean the same thing. Readers go through the {@code *OrEmpty()}
 * accessors so that stages never have to null-check.
 *
 * <p>
 * A bundle is owned by a single pipeline run and is never mutated while the
 * run is in progress.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EvidenceBundle {

    private CompanyIdentity company;
    private CorporateProfile corporateProfile;
    private List<NewsItem> news;
    private List<JobItem> jobs;
    private List<TechnologySignal> technologies;
    private List<SocialProfile> socialProfiles;
    private List<ProcurementRecord> procurement;
    private List<ArchiveSnapshot> archives;

    /**
     * A bundle carrying only the identity, with every facet absent.
     */
    public static EvidenceBundle identityOnly(CompanyIdentity company) {
        return EvidenceBundle.builder().company(company).build();
    }

    public String companyName() {
        return company != null ? company.displayName() : "";
    }

    public String companyDomain() {
        return company != null && company.getDomain() != null ? company.getDomain() : "";
    }

    public List<NewsItem> newsOrEmpty() {
        return orEmpty(news);
    }

    public List<JobItem> jobsOrEmpty() {
        return orEmpty(jobs);
    }

    public List<TechnologySignal> technologiesOrEmpty() {
        return orEmpty(technologies);
    }

    public List<SocialProfile> socialProfilesOrEmpty() {
        return orEmpty(socialProfiles);
    }

    public List<ProcurementRecord> procurementOrEmpty() {
        return orEmpty(procurement);
    }

    public List<ArchiveSnapshot> archivesOrEmpty() {
        return orEmpty(archives);
    }

    /**
     * Every URL referenced by any facet, de-duplicated, in facet order.
     */
    public List<EvidenceLink> collectEvidenceLinks() {
        Map<String, EvidenceLink> links = new LinkedHashMap<>();
        if (company != null) {
            addLink(links, company.getHomepageUrl(), company.displayName());
        }
        for (NewsItem item : newsOrEmpty()) {
            addLink(links, item.getUrl(), item.getTitle());
        }
        for (JobItem item : jobsOrEmpty()) {
            addLink(links, item.getUrl(), item.getTitle());
        }
        for (SocialProfile profile : socialProfilesOrEmpty()) {
            addLink(links, profile.getUrl(), profile.getPlatform());
        }
        for (ArchiveSnapshot snapshot : archivesOrEmpty()) {
            addLink(links, snapshot.getSnapshotUrl(), "Archived snapshot " + snapshot.getDate());
        }
        return new ArrayList<>(links.values());
    }

    private static void addLink(Map<String, EvidenceLink> links, String url, String title) {
        if (url == null || url.isBlank()) {
            return;
        }
        links.putIfAbsent(url, new EvidenceLink(url, title));
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }
}
