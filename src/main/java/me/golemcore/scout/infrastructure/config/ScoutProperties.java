package me.golemcore.scout.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for Scout, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code scout.*} prefix:
 * <ul>
 * <li>{@link AdmissionProperties} - per-tenant daily and concurrency quotas</li>
 * <li>{@link StoreProperties} - counter/cache backend selection</li>
 * <li>{@link CacheProperties} - cache flag and per-namespace TTLs</li>
 * <li>{@link LlmProperties} - optional analysis capability</li>
 * <li>{@link EvidenceProperties} - evidence collector endpoint</li>
 * <li>{@link ResearchProperties} - orchestration limits and timeouts</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * </ul>
 *
 * <p>
 * This object is the only place backend selection is decided; components
 * receive it (or the beans built from it) through their constructors.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "scout")
@Data
public class ScoutProperties {

    /** Store backend value that selects the in-process implementations. */
    public static final String MEMORY_BACKEND = "memory";

    private String version = "1.0.0";
    private AdmissionProperties admission = new AdmissionProperties();
    private StoreProperties store = new StoreProperties();
    private CacheProperties cache = new CacheProperties();
    private LlmProperties llm = new LlmProperties();
    private EvidenceProperties evidence = new EvidenceProperties();
    private ResearchProperties research = new ResearchProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== ADMISSION ====================

    @Data
    public static class AdmissionProperties {
        private int dailyLimit = 50;
        private int concurrencyLimit = 3;

        /** Lifetime of a daily counter, measured from its first increment. */
        private Duration dailyWindow = Duration.ofHours(24);

        /** Orphan-key ceiling for the concurrency counter. */
        private Duration concurrencyKeyTtl = Duration.ofHours(1);
    }

    // ==================== STORES ====================

    @Data
    public static class StoreProperties {
        /**
         * Redis connection URL. Empty or {@code memory} selects the in-process
         * stores.
         */
        private String redisUrl = "";

        private Duration commandTimeout = Duration.ofSeconds(2);
        private Duration connectTimeout = Duration.ofSeconds(5);

        /** How often the in-process stores evict expired keys. */
        private Duration sweepInterval = Duration.ofSeconds(60);

        public boolean isDistributed() {
            return redisUrl != null && !redisUrl.isBlank() && !MEMORY_BACKEND.equalsIgnoreCase(redisUrl.trim());
        }
    }

    // ==================== CACHE ====================

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private TtlProperties ttl = new TtlProperties();
    }

    @Data
    public static class TtlProperties {
        private Duration evidence = Duration.ofHours(1);
        private Duration jobSearch = Duration.ofMinutes(30);
        private Duration research = Duration.ofHours(24);
        private Duration defaultTtl = Duration.ofHours(1);
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "none";

        /** Upper bound for one capability-backed stage call. */
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Total capability time of one pipeline run. Keep it, plus the evidence
         * timeout, below the research request timeout.
         */
        private Duration runBudget = Duration.ofSeconds(60);

        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /** {@code openai} (any OpenAI-compatible endpoint) or {@code anthropic}. */
        private String vendor = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.3;
        private int maxTokens = 2048;
    }

    // ==================== EVIDENCE ====================

    @Data
    public static class EvidenceProperties {
        private String url = "";
        private String apiKey;
        private int timeoutSeconds = 30;
    }

    // ==================== RESEARCH ====================

    @Data
    public static class ResearchProperties {
        /** How many companies of a keyword search get a full analysis. */
        private int maxCompanies = 10;

        /** Concurrent company analyses within one search. */
        private int parallelism = 4;

        /** Bound on evidence collection plus pipeline for one request. */
        private Duration requestTimeout = Duration.ofSeconds(120);
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
