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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A held concurrency slot. Closing it releases the slot exactly once, no
 * matter how many times {@link #close()} is called.
 */
public final class AdmissionSlot implements AutoCloseable {

    private final AdmissionService admissionService;
    private final String tenantId;
    private final AtomicBoolean released = new AtomicBoolean(false);

    AdmissionSlot(AdmissionService admissionService, String tenantId) {
        this.admissionService = admissionService;
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            admissionService.markFinished(tenantId);
        }
    }
}
