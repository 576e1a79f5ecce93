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

/**
 * One ordered stage of the analysis pipeline.
 *
 * <p>
 * Every stage has two variants over the same inputs: a capability-backed one
 * that delegates to the natural-language analysis capability, and a
 * deterministic one that uses keyword and heuristic rules and is always
 * available. The pipeline decides which to try; a stage never falls back on
 * its own.
 */
public interface AnalysisStage {

    /**
     * Get the stage name.
     */
    String getName();

    /**
     * Get the processing order (lower = earlier).
     */
    int getOrder();

    /**
     * Whether this stage's output replaces the working finding list instead of
     * being appended to it.
     */
    default boolean refinesFindings() {
        return false;
    }

    /**
     * Keyword and heuristic variant. Must not depend on any external service.
     */
    StageOutcome runDeterministic(PipelineRun run);

    /**
     * Capability-backed variant. Any exception, or an outcome without
     * findings, makes the pipeline use {@link #runDeterministic(PipelineRun)}
     * for this stage instead.
     */
    StageOutcome runWithCapability(PipelineRun run, AnalysisCapability capability);
}
