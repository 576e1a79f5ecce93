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

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A source backing a {@link Finding}: a title plus optional link and date.
 */
@Value
@Builder
@Jacksonized
public class SourceCitation {

    String title;
    String url;
    String date;

    public static SourceCitation of(String title) {
        return SourceCitation.builder().title(title).build();
    }

    public static SourceCitation of(String title, String url) {
        return SourceCitation.builder().title(title).url(url).build();
    }
}
