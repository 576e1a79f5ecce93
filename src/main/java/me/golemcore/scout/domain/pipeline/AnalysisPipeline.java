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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.domain.exception.CapabilityTimeoutException;
import me.golemcore.scout.domain.model.AutomationScore;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.StageStrategy;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Runs the ordered {@link AnalysisStage}s over one evidence bundle.
 *
 * <p>
 * Capability availability is checked once per run. When available, each stage
 * first tries its capability-backed variant and falls back to the
 * deterministic one for that stage alone on any failure or empty result. A
 * stage whose deterministic variant also fails contributes no findings; the
 * run always completes.
 *
 * <p>
 * All capability calls of a run share one time budget. The first capability
 * timeout switches the rest of the run to deterministic variants, so an
 * unresponsive capability costs at most that budget per run.
 *
 * <p>
 * Stages run sequentially on the calling thread. An interrupt between stages
 * aborts the run with {@link CancellationException}.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AnalysisPipeline {

    private final List<AnalysisStage> stages;
    private final AnalysisCapability capability;
    private final Clock clock;

    public AnalysisPipeline(List<AnalysisStage> stages, AnalysisCapability capability, Clock clock) {
        this.stages = stages.stream().sorted(Comparator.comparingInt(AnalysisStage::getOrder)).toList();
        this.capability = capability;
        this.clock = clock;
        log.info("[Pipeline] Registered stages: {}", this.stages.stream().map(AnalysisStage::getName).toList());
    }

    public PipelineRun run(EvidenceBundle bundle, String notes) {
        boolean capabilityAvailable = capability.isAvailable();
        PipelineRun run = new PipelineRun(bundle, notes, LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC),
                capabilityAvailable);
        log.debug("[Pipeline] Analyzing {} ({} mode)", bundle.companyName(),
                capabilityAvailable ? "capability" : "deterministic");

        AnalysisCapability runCapability = capabilityAvailable ? capability.forRun() : capability;
        for (AnalysisStage stage : stages) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Pipeline interrupted before stage " + stage.getName());
            }
            executeStage(stage, run, runCapability);
        }

        if (run.getAutomationScore() == null) {
            run.setAutomationScore(AutomationScore.of(0, 0));
        }
        log.debug("[Pipeline] {} finished: {} findings, score {}", bundle.companyName(), run.getFindings().size(),
                run.getAutomationScore().getScore());
        return run;
    }

    public List<AnalysisStage> getStages() {
        return stages;
    }

    private void executeStage(AnalysisStage stage, PipelineRun run, AnalysisCapability runCapability) {
        if (run.isCapabilityAvailable()) {
            try {
                StageOutcome outcome = stage.runWithCapability(run, runCapability);
                if (outcome != null && !outcome.isEmpty()) {
                    run.recordStage(stage.getName(), StageStrategy.CAPABILITY, outcome, stage.refinesFindings());
                    return;
                }
                log.warn("[Pipeline] Stage {} got no findings from capability, using deterministic variant",
                        stage.getName());
            } catch (CapabilityTimeoutException e) {
                run.disableCapability();
                log.warn("[Pipeline] Stage {} capability timed out, remaining stages run deterministically: {}",
                        stage.getName(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[Pipeline] Stage {} capability failed, using deterministic variant: {}",
                        stage.getName(), e.getMessage());
            }
        }

        try {
            StageOutcome outcome = stage.runDeterministic(run);
            run.recordStage(stage.getName(), StageStrategy.DETERMINISTIC, outcome, stage.refinesFindings());
        } catch (RuntimeException e) {
            // Working findings stay as they were, even for refining stages.
            log.error("[Pipeline] Stage {} failed, continuing without its findings", stage.getName(), e);
            run.recordStage(stage.getName(), StageStrategy.DETERMINISTIC, StageOutcome.of(List.of()), false);
        }
    }
}
