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
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.StageStrategy;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one pipeline run over one company's evidence.
 *
 * <p>
 * Gathering stages append to the working finding list; refining stages
 * (verification, synthesis) replace it. Each stage's own output and the
 * strategy that produced it are kept per stage name in execution order.
 *
 * <p>
 * A run is confined to the thread executing the pipeline.
 */
public class PipelineRun {

    private final EvidenceBundle bundle;
    private final String notes;
    private final LocalDate analysisDate;
    private boolean capabilityAvailable;

    private final Map<String, List<Finding>> stageFindings = new LinkedHashMap<>();
    private final Map<String, StageStrategy> stageStrategies = new LinkedHashMap<>();
    private List<Finding> findings = new ArrayList<>();
    private AutomationScore automationScore;

    public PipelineRun(EvidenceBundle bundle, String notes, LocalDate analysisDate, boolean capabilityAvailable) {
        this.bundle = bundle;
        this.notes = notes;
        this.analysisDate = analysisDate;
        this.capabilityAvailable = capabilityAvailable;
    }

    public EvidenceBundle getBundle() {
        return bundle;
    }

    public String getNotes() {
        return notes;
    }

    public LocalDate getAnalysisDate() {
        return analysisDate;
    }

    public boolean isCapabilityAvailable() {
        return capabilityAvailable;
    }

    /**
     * Switches the remaining stages of this run to their deterministic variant.
     */
    void disableCapability() {
        capabilityAvailable = false;
    }

    /**
     * Current working finding list.
     */
    public List<Finding> getFindings() {
        return Collections.unmodifiableList(findings);
    }

    public Map<String, List<Finding>> getStageFindings() {
        return Collections.unmodifiableMap(stageFindings);
    }

    public Map<String, StageStrategy> getStageStrategies() {
        return Collections.unmodifiableMap(stageStrategies);
    }

    public AutomationScore getAutomationScore() {
        return automationScore;
    }

    void recordStage(String stageName, StageStrategy strategy, StageOutcome outcome, boolean replacesFindings) {
        List<Finding> produced = List.copyOf(outcome.findings());
        stageFindings.put(stageName, produced);
        stageStrategies.put(stageName, strategy);
        if (replacesFindings) {
            findings = new ArrayList<>(produced);
        } else {
            findings.addAll(produced);
        }
        if (outcome.automationScore() != null) {
            automationScore = outcome.automationScore();
        }
    }

    void setAutomationScore(AutomationScore automationScore) {
        this.automationScore = automationScore;
    }
}
