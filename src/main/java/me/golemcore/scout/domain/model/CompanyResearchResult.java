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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a deep research run on one company.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyResearchResult {

    private CompanyIdentity company;
    private AutomationScore automationScore;
    private String summary;

    @Builder.Default
    private List<Finding> findings = new ArrayList<>();

    /** Stage name to the strategy that produced its findings. */
    @Builder.Default
    private Map<String, StageStrategy> stageStrategies = new LinkedHashMap<>();

    @Builder.Default
    private List<EvidenceLink> evidence = new ArrayList<>();

    private String notes;
    private Instant generatedAt;
}
