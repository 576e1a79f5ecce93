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

package me.golemcore.scout.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.domain.exception.AdmissionDeniedException;
import me.golemcore.scout.domain.model.QuotaStatus;
import me.golemcore.scout.infrastructure.config.ScoutProperties;
import me.golemcore.scout.port.outbound.CounterStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Per-tenant admission control with a daily quota and a concurrency quota.
 *
 * <p>
 * Both quotas live in the {@link CounterStorePort}:
 * <ul>
 * <li>{@code rate:daily:<tenant>:<yyyy-MM-dd>} counts admissions of the UTC
 * day and expires 24 hours after its first increment, so a new day starts
 * from a fresh key rather than an explicit reset</li>
 * <li>{@code rate:concurrent:<tenant>} counts running requests and is deleted
 * when it drops to zero</li>
 * </ul>
 *
 * <p>
 * Counter store outages never reject a caller: {@link #tryAdmit(String)}
 * admits on any store error, and slot bookkeeping errors are only logged.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AdmissionService {

    public static final String ANONYMOUS_TENANT = "anonymous";

    static final String DAILY_KEY_PREFIX = "rate:daily:";
    static final String CONCURRENT_KEY_PREFIX = "rate:concurrent:";

    private final CounterStorePort counterStore;
    private final ScoutProperties.AdmissionProperties limits;
    private final Clock clock;

    public AdmissionService(CounterStorePort counterStore, ScoutProperties properties, Clock clock) {
        this.counterStore = counterStore;
        this.limits = properties.getAdmission();
        this.clock = clock;
    }

    /**
     * Reserves one unit of the tenant's daily quota if both quotas allow it.
     *
     * @return {@code true} when admitted, also when the counter store is down
     */
    public boolean tryAdmit(String tenantId) {
        String tenant = normalizeTenant(tenantId);
        String dailyKey = dailyKey(tenant);
        try {
            long daily = counterStore.increment(dailyKey);
            if (daily == 1) {
                counterStore.expire(dailyKey, limits.getDailyWindow());
            }
            if (daily > limits.getDailyLimit()) {
                counterStore.decrement(dailyKey);
                log.info("[Admission] Daily limit {} reached for tenant {}", limits.getDailyLimit(), tenant);
                return false;
            }

            long concurrent = counterStore.get(concurrentKey(tenant)).orElse(0L);
            if (concurrent >= limits.getConcurrencyLimit()) {
                counterStore.decrement(dailyKey);
                log.info("[Admission] Concurrency limit {} reached for tenant {}",
                        limits.getConcurrencyLimit(), tenant);
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            log.warn("[Admission] Counter store unavailable, admitting tenant {}: {}", tenant, e.getMessage());
            return true;
        }
    }

    /**
     * Takes a concurrency slot and refreshes the orphan-key expiry.
     */
    public void markStarted(String tenantId) {
        String key = concurrentKey(normalizeTenant(tenantId));
        try {
            counterStore.increment(key);
            counterStore.expire(key, limits.getConcurrencyKeyTtl());
        } catch (RuntimeException e) {
            log.warn("[Admission] Failed to record start for {}: {}", key, e.getMessage());
        }
    }

    /**
     * Releases a concurrency slot, deleting the key once it reaches zero.
     */
    public void markFinished(String tenantId) {
        String key = concurrentKey(normalizeTenant(tenantId));
        try {
            long remaining = counterStore.decrement(key);
            if (remaining <= 0) {
                counterStore.delete(key);
            }
        } catch (RuntimeException e) {
            log.warn("[Admission] Failed to record finish for {}: {}", key, e.getMessage());
        }
    }

    /**
     * Admits the tenant and takes a concurrency slot. The returned slot must
     * be closed on every exit path, which try-with-resources guarantees.
     *
     * @throws AdmissionDeniedException
     *             when either quota is exhausted
     */
    public AdmissionSlot acquire(String tenantId) {
        String tenant = normalizeTenant(tenantId);
        if (!tryAdmit(tenant)) {
            throw new AdmissionDeniedException(tenant, limits.getDailyWindow());
        }
        markStarted(tenant);
        return new AdmissionSlot(this, tenant);
    }

    /**
     * Read-only view of the tenant's quotas. Counter store errors propagate so
     * that health checks can report them.
     */
    public QuotaStatus getStatus(String tenantId) {
        String tenant = normalizeTenant(tenantId);
        long dailyUsed = counterStore.get(dailyKey(tenant)).orElse(0L);
        long concurrentUsed = Math.max(0L, counterStore.get(concurrentKey(tenant)).orElse(0L));
        return QuotaStatus.builder()
                .dailyUsed(dailyUsed)
                .dailyLimit(limits.getDailyLimit())
                .dailyRemaining(Math.max(0L, limits.getDailyLimit() - dailyUsed))
                .concurrentUsed(concurrentUsed)
                .concurrentLimit(limits.getConcurrencyLimit())
                .resetAt(nextResetAt())
                .build();
    }

    public Duration getRetryAfter() {
        return limits.getDailyWindow();
    }

    String dailyKey(String tenant) {
        return DAILY_KEY_PREFIX + tenant + ":" + today();
    }

    String concurrentKey(String tenant) {
        return CONCURRENT_KEY_PREFIX + tenant;
    }

    Instant nextResetAt() {
        return today().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    public static String normalizeTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return ANONYMOUS_TENANT;
        }
        return tenantId.trim();
    }
}
