package me.golemcore.scout.adapter.outbound.evidence;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.domain.exception.EvidenceCollectionException;
import me.golemcore.scout.domain.model.CompanyIdentity;
import me.golemcore.scout.domain.model.EvidenceBundle;
import me.golemcore.scout.domain.model.JobPosting;
import me.golemcore.scout.domain.model.JobSearchQuery;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import me.golemcore.scout.port.outbound.EvidencePort;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Evidence collector adapter - talks to the evidence service REST API over
 * HTTP.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /evidence?name=&amp;domain=&amp;homepageUrl= - evidence bundle for
 * one company
 * <li>GET /jobs?keywords=&amp;location= - job postings matching a search
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code scout.evidence.url} - service base URL; empty disables collection
 * <li>{@code scout.evidence.api-key} - optional bearer token
 * <li>{@code scout.evidence.timeout-seconds} - per-call timeout
 * </ul>
 *
 * <p>
 * Without a configured URL the adapter returns identity-only bundles and no
 * postings, so the pipeline still runs on what the request itself names.
 *
 * @see me.golemcore.scout.port.outbound.EvidencePort
 */
@Component
@Slf4j
public class HttpEvidenceAdapter implements EvidencePort {

    private static final TypeReference<List<JobPosting>> POSTINGS = new TypeReference<>() {
    };

    private final ScoutProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpEvidenceAdapter(ScoutProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        int timeoutSeconds = properties.getEvidence().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public EvidenceBundle collect(CompanyIdentity company) {
        if (!isConfigured()) {
            log.debug("[Evidence] No evidence service configured, using identity only for '{}'",
                    company.displayName());
            return EvidenceBundle.identityOnly(company);
        }

        HttpUrl.Builder url = baseUrl().newBuilder().addPathSegment("evidence");
        addQuery(url, "name", company.getName());
        addQuery(url, "domain", company.getDomain());
        addQuery(url, "homepageUrl", company.getHomepageUrl());

        String body = get(url.build(), "evidence for " + company.displayName());
        try {
            EvidenceBundle bundle = objectMapper.readValue(body, EvidenceBundle.class);
            if (bundle == null) {
                return EvidenceBundle.identityOnly(company);
            }
            if (bundle.getCompany() == null) {
                bundle.setCompany(company);
            }
            log.debug("[Evidence] Collected evidence for '{}': {} news, {} jobs, {} technologies",
                    company.displayName(), bundle.newsOrEmpty().size(), bundle.jobsOrEmpty().size(),
                    bundle.technologiesOrEmpty().size());
            return bundle;
        } catch (IOException e) {
            throw new EvidenceCollectionException(
                    "Malformed evidence response for " + company.displayName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<JobPosting> searchJobs(JobSearchQuery query) {
        if (!isConfigured()) {
            log.warn("[Evidence] No evidence service configured, job search for '{}' returns nothing",
                    query.getKeywords());
            return List.of();
        }

        HttpUrl.Builder url = baseUrl().newBuilder().addPathSegment("jobs");
        addQuery(url, "keywords", query.getKeywords());
        addQuery(url, "location", query.getLocation());

        String body = get(url.build(), "job search '" + query.getKeywords() + "'");
        try {
            List<JobPosting> postings = objectMapper.readValue(body, POSTINGS);
            log.debug("[Evidence] Job search '{}' returned {} postings", query.getKeywords(),
                    postings != null ? postings.size() : 0);
            return postings != null ? postings : List.of();
        } catch (IOException e) {
            throw new EvidenceCollectionException("Malformed job search response: " + e.getMessage(), e);
        }
    }

    public boolean isConfigured() {
        String url = properties.getEvidence().getUrl();
        return url != null && !url.isBlank();
    }

    private String get(HttpUrl url, String what) {
        Request.Builder requestBuilder = new Request.Builder().url(url).get();
        addApiKeyHeader(requestBuilder);

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                log.warn("[Evidence] Request for {} failed: HTTP {}", what, response.code());
                throw new EvidenceCollectionException("Evidence service returned HTTP " + response.code()
                        + " for " + what);
            }
            return responseBody.string();
        } catch (IOException e) {
            log.warn("[Evidence] Request for {} failed: {}", what, e.getMessage());
            throw new EvidenceCollectionException("Evidence service unreachable for " + what, e);
        }
    }

    private HttpUrl baseUrl() {
        String url = properties.getEvidence().getUrl().trim();
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new EvidenceCollectionException("Invalid evidence service URL: " + url);
        }
        return parsed;
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getEvidence().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    private static void addQuery(HttpUrl.Builder url, String name, String value) {
        if (value != null && !value.isBlank()) {
            url.addQueryParameter(name, value);
        }
    }
}
