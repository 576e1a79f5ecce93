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

/**
 * Scalar automation-opportunity score in [0,10] with the confidence of the
 * estimate and its qualitative level.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationScore {

    public static final double MAX_SCORE = 10.0;

    private double score;
    private double confidence;
    private PotentialLevel level;

    public static AutomationScore of(double rawScore, double confidence) {
        double bounded = Math.max(0.0, Math.min(MAX_SCORE, rawScore));
        double rounded = Math.round(bounded * 10.0) / 10.0;
        return AutomationScore.builder()
                .score(rounded)
                .confidence(Finding.clamp(confidence))
                .level(PotentialLevel.fromScore(rounded))
                .build();
    }
}
