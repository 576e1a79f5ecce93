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
import me.golemcore.scout.domain.model.TechnologySignal;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt fragments shared by the capability-backed stage variants.
 */
final class StagePrompts {

    private StagePrompts() {
    }

    /**
     * Company header every capability prompt starts with.
     */
    static String companyContext(EvidenceBundle bundle, String notes) {
        StringBuilder sb = new StringBuilder();
        sb.append("Company: ").append(bundle.companyName()).append('\n');
        sb.append("Domain: ").append(bundle.companyDomain()).append('\n');
        sb.append("Jobs: ").append(bundle.jobsOrEmpty().size()).append(" open positions\n");
        sb.append("Tech Stack: ").append(technologyList(bundle.technologiesOrEmpty())).append('\n');
        sb.append("News Items: ").append(bundle.newsOrEmpty().size()).append('\n');
        if (notes != null && !notes.isBlank()) {
            sb.append("Analyst notes: ").append(notes.trim()).append('\n');
        }
        return sb.toString();
    }

    static String technologyList(List<TechnologySignal> technologies) {
        if (technologies.isEmpty()) {
            return "none detected";
        }
        return technologies.stream().map(TechnologySignal::label).collect(Collectors.joining(", "));
    }

    /**
     * Adds tags to every finding, skipping tags a finding already carries.
     */
    static List<Finding> withTags(List<Finding> findings, String... tags) {
        return findings.stream().map(finding -> {
            Finding.FindingBuilder builder = finding.toBuilder();
            for (String tag : tags) {
                if (!finding.hasTag(tag)) {
                    builder.tag(tag);
                }
            }
            return builder.build();
        }).toList();
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }
}
