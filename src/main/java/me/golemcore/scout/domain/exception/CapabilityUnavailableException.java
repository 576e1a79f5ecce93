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

package me.golemcore.scout.domain.exception;

/**
 * The optional analysis capability failed, timed out or answered with
 * something that could not be parsed. Pipeline stages recover from it by
 * switching to their deterministic variant.
 */
public class CapabilityUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CapabilityUnavailableException(String message) {
        super(message);
    }

    public CapabilityUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
