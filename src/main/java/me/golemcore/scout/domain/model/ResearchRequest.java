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
 * Input of both orchestrator operations. Keyword search reads
 * {@code keywords}/{@code location}; deep research reads the company fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchRequest {

    private String keywords;
    private String location;
    private String companyName;
    private String companyUrl;
    private String notes;
    private String tenantId;

    public boolean hasKeywords() {
        return keywords != null && !keywords.isBlank();
    }

    public boolean hasCompany() {
        return (companyName != null && !companyName.isBlank())
                || (companyUrl != null && !companyUrl.isBlank());
    }
}
