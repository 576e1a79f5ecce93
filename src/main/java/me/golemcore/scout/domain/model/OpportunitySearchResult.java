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
import java.util.List;

/**
 * Result of a keyword opportunity search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpportunitySearchResult {

    private String keywords;
    private String location;
    private String notes;
    private int totalJobsFound;
    private int companiesFound;

    /** Companies whose evidence was collected and whose pipeline completed. */
    private int companiesAnalyzed;

    @Builder.Default
    private List<CompanyOpportunity> opportunities = new ArrayList<>();

    private String summary;
    private Instant generatedAt;
}
