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

/**
 * Qualitative band of an automation score.
 */
public enum PotentialLevel {

    HIGH("high-potential"), MODERATE("moderate-potential"), LOW("low-potential");

    private static final double HIGH_THRESHOLD = 7.0;
    private static final double MODERATE_THRESHOLD = 4.0;

    private final String tag;

    PotentialLevel(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static PotentialLevel fromScore(double score) {
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MODERATE_THRESHOLD) {
            return MODERATE;
        }
        return LOW;
    }
}
