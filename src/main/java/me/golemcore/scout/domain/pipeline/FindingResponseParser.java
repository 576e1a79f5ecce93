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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.scout.domain.exception.CapabilityUnavailableException;
import me.golemcore.scout.domain.model.Finding;
import me.golemcore.scout.domain.model.SourceCitation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts structured findings from free-text capability responses.
 *
 * <p>
 * The response is expected to contain a JSON array of objects with
 * {@code title}, {@code detail}, {@code confidence}, {@code tags} and
 * {@code sources}. Markdown code fences and prose around the array are
 * ignored. Objects without a title are skipped; confidence defaults to 0.5
 * and is clamped to [0,1].
 */
@Component
public class FindingResponseParser {

    private static final double DEFAULT_CONFIDENCE = 0.5;

    private final ObjectMapper objectMapper;

    public FindingResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws CapabilityUnavailableException
     *             if the text holds no parseable JSON array
     */
    public List<Finding> parse(String text) {
        JsonNode array = readArray(text);
        List<Finding> findings = new ArrayList<>();
        for (JsonNode node : array) {
            if (!node.isObject()) {
                continue;
            }
            String title = node.path("title").asText("").trim();
            if (title.isEmpty()) {
                continue;
            }
            Finding.FindingBuilder builder = Finding.builder()
                    .title(title)
                    .detail(node.path("detail").asText(""))
                    .confidence(Finding.clamp(readConfidence(node.get("confidence"))));
            readTags(node.get("tags")).forEach(builder::tag);
            readSources(node.get("sources")).forEach(builder::source);
            findings.add(builder.build());
        }
        return findings;
    }

    /**
     * Returns the JSON array embedded in the text.
     *
     * @throws CapabilityUnavailableException
     *             if none can be found
     */
    public JsonNode readArray(String text) {
        if (text == null || text.isBlank()) {
            throw new CapabilityUnavailableException("Empty capability response");
        }
        String stripped = text.replace("```json", "").replace("```", "");
        int start = stripped.indexOf('[');
        int end = stripped.lastIndexOf(']');
        if (start < 0 || end <= start) {
            throw new CapabilityUnavailableException("Capability response contains no JSON array");
        }
        try {
            JsonNode node = objectMapper.readTree(stripped.substring(start, end + 1));
            if (!node.isArray()) {
                throw new CapabilityUnavailableException("Capability response is not a JSON array");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new CapabilityUnavailableException("Malformed capability response: " + e.getOriginalMessage(), e);
        }
    }

    private static double readConfidence(JsonNode node) {
        if (node == null || node.isNull()) {
            return DEFAULT_CONFIDENCE;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            return DEFAULT_CONFIDENCE;
        }
    }

    private static List<String> readTags(JsonNode node) {
        List<String> tags = new ArrayList<>();
        if (node == null || node.isNull()) {
            return tags;
        }
        if (node.isArray()) {
            node.forEach(tag -> addTag(tags, tag.asText("")));
        } else {
            for (String tag : node.asText("").split(",")) {
                addTag(tags, tag);
            }
        }
        return tags;
    }

    private static void addTag(List<String> tags, String raw) {
        String tag = raw.trim();
        if (!tag.isEmpty() && !tags.contains(tag)) {
            tags.add(tag);
        }
    }

    private static List<SourceCitation> readSources(JsonNode node) {
        List<SourceCitation> sources = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return sources;
        }
        for (JsonNode source : node) {
            if (source.isTextual()) {
                sources.add(SourceCitation.of(source.asText()));
            } else if (source.isObject() && source.hasNonNull("title")) {
                sources.add(SourceCitation.builder()
                        .title(source.get("title").asText())
                        .url(source.hasNonNull("url") ? source.get("url").asText() : null)
                        .date(source.hasNonNull("date") ? source.get("date").asText() : null)
                        .build());
            }
        }
        return sources;
    }
}
