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

package me.golemcore.scout.port.outbound;

import me.golemcore.scout.domain.model.CompanyIdentity;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.JobPosting;
import me.golemcore.scout.domain.model.JobSearchQuery;

import java.util.List;

/**
 * Port for the external evidence collector.
 *
 * <p>
 * How evidence is gathered and from which providers is entirely up to the
 * implementation; callers only rely on the returned shapes. Failures are
 * reported as
 * {@link me.golemcore.scout.domain.exception.EvidenceCollectionException}.
 */
public interface EvidencePort {

    /**
     * Collects the evidence bundle for one company. Facets the collector could
     * not fill are left empty.
     */
    EvidenceBundle collect(CompanyIdentity company);

    /**
     * Searches job boards for postings matching the query.
     */
    List<JobPosting> searchJobs(JobSearchQuery query);
}
