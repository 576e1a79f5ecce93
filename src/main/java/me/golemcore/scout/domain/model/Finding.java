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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.TreeSet;

/**
 * One discrete, confidence-scored observation produced by a pipeline stage.
 *
 * <p>
 * Findings are immutable. Later stages filter them, append new ones, or
 * replace them with a re-weighted copy via {@link #withConfidence(double)};
 * the title and detail written by a stage are never edited afterwards.
 *
 * <p>
 * Tags carry set semantics (duplicates are meaningless, order is not part of
 * identity) and drive categorization and weighting.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Finding {

    public static final String TAG_AUTOMATION_OPPORTUNITY = "automation-opportunity";
    public static final String TAG_HIGH_IMPACT = "high-impact";
    public static final String TAG_QUICK_WIN = "quick-win";
    public static final String TAG_GROWTH = "growth";
    public static final String TAG_SYNTHESIS = "synthesis";
    public static final String TAG_RECOMMENDATION = "recommendation";

    String title;
    String detail;
    double confidence;

    @Singular
    List<String> tags;

    @Singular
    List<SourceCitation> sources;

    public boolean hasTag(String tag) {
        return tags != null && tags.contains(tag);
    }

    public int sourceCount() {
        return sources != null ? sources.size() : 0;
    }

    /**
     * Returns a copy carrying a new confidence, clamped to [0,1].
     */
    public Finding withConfidence(double newConfidence) {
        return toBuilder().confidence(clamp(newConfidence)).build();
    }

    /**
     * Identity used for de-duplication: title plus the sorted tag set.
     */
    public String deduplicationKey() {
        TreeSet<String> sorted = new TreeSet<>();
        if (tags != null) {
            sorted.addAll(tags);
        }
        return title + "|" + String.join(",", sorted);
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
