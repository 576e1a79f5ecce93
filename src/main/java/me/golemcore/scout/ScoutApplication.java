package me.golemcore.scout;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Scout.
 *
 * <p>
 * Scout answers two kinds of research requests: a keyword search for companies
 * hiring into automatable roles, and a deep analysis of one named company. Both
 * return confidence-scored automation opportunities.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters) with an ordered stage
 * pipeline:
 *
 * <pre>
 * Input Layer        → ResearchController, StatusController
 * Domain Layer       → ResearchOrchestrator, AdmissionService, ResultCacheService,
 *                      AnalysisPipeline (technical → business → infrastructure
 *                      → verification → synthesis)
 * Infrastructure     → Counter/Cache stores (memory, Redis), Evidence and LLM adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code scout.*}
 * prefix. Redis auto-configuration is disabled; the store backend is chosen by
 * {@code scout.store.redis-url} in
 * {@link me.golemcore.scout.infrastructure.config.StoreConfiguration}.
 *
 * @since 1.0
 */
@SpringBootApplication(exclude = {
        RedisAutoConfiguration.class,
        RedisReactiveAutoConfiguration.class,
        RedisRepositoriesAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class ScoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScoutApplication.class, args);
    }

}
