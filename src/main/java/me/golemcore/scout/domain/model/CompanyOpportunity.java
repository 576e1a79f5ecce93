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
import java.util.List;

/**
 * One company's entry in a keyword opportunity search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyOpportunity {

    private String company;
    private int jobCount;

    @Builder.Default
    private List<JobPosting> jobs = new ArrayList<>();

    private double automationScore;
    private double confidence;
    private PotentialLevel level;

    @Builder.Default
    private List<Finding> findings = new ArrayList<>();
}
