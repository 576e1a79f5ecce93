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

package me.golemcore.scout.domain.pipeline.heuristics;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Lenient parsing of the date strings evidence sources report: plain ISO
 * dates or ISO timestamps with or without an offset.
 */
public final class EvidenceDates {

    private static final int ISO_DATE_LENGTH = 10;

    private EvidenceDates() {
    }

    public static Optional<LocalDate> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() == ISO_DATE_LENGTH) {
                return Optional.of(LocalDate.parse(trimmed));
            }
            return Optional.of(LocalDate.from(DateTimeFormatter.ISO_DATE_TIME.parse(trimmed)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
