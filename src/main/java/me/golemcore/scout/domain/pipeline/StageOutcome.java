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

package me.golemcore.scout.domain.pipeline;

import me.golemcore.scout.domain.model.AutomationScore;
import me.golemcore.scout.domain.model.Finding;

import java.util.List;

/**
 * Findings produced by one stage, plus the automation score when the stage
 * computes one.
 */
public record StageOutcome(List<Finding> findings, AutomationScore automationScore) {

    public StageOutcome {
        findings = findings != null ? List.copyOf(findings) : List.of();
    }

    public static StageOutcome of(List<Finding> findings) {
        return new StageOutcome(findings, null);
    }

    public boolean isEmpty() {
        return findings.isEmpty();
    }
}
