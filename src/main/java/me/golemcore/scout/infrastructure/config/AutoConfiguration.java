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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans and startup logging.
 *
 * <p>
 * This configuration provides:
 * <ul>
 * <li>a UTC {@link Clock}, so that daily quota keys and cache expiry agree on
 * one time source</li>
 * <li>the application {@link ObjectMapper}</li>
 * <li>the bounded executor that runs per-company analyses of a keyword
 * search</li>
 * <li>the request executor that runs each request's evidence collection and
 * pipeline under its overall timeout; admission bounds its size</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ScoutProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = "researchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService researchExecutor() {
        int parallelism = Math.max(1, properties.getResearch().getParallelism());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "research-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(name = "researchRequestExecutor", destroyMethod = "shutdownNow")
    public ExecutorService researchRequestExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "research-request-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Scout v{} starting...", properties.getVersion());
        log.info("Admission: {} requests/day, {} concurrent per tenant",
                properties.getAdmission().getDailyLimit(), properties.getAdmission().getConcurrencyLimit());
        log.info("Cache: {}", properties.getCache().isEnabled() ? "enabled" : "disabled");
        log.info("LLM Provider: {}", properties.getLlm().getProvider());
        Duration worstCase = properties.getLlm().getRunBudget()
                .plusSeconds(properties.getEvidence().getTimeoutSeconds());
        if (worstCase.compareTo(properties.getResearch().getRequestTimeout()) >= 0) {
            log.warn("LLM run budget {} plus evidence timeout {}s reaches the request timeout {}; "
                    + "slow LLM answers will time requests out instead of falling back",
                    properties.getLlm().getRunBudget(), properties.getEvidence().getTimeoutSeconds(),
                    properties.getResearch().getRequestTimeout());
        }
        String evidenceUrl = properties.getEvidence().getUrl();
        log.info("Evidence service: {}", evidenceUrl == null || evidenceUrl.isBlank() ? "not configured" : evidenceUrl);
    }
}
