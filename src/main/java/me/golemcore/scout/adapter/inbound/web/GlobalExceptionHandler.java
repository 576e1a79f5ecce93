package me.golemcore.scout.adapter.inbound.web;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scout.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.scout.domain.exception.AdmissionDeniedException;
import me.golemcore.scout.domain.exception.EvidenceCollectionException;
import me.golemcore.scout.domain.exception.ResearchTimeoutException;
import me.golemcore.scout.domain.exception.ValidationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Maps domain exceptions to {@link ApiErrorResponse} bodies for the research
 * API. Unexpected errors never leak their message to the client.
 */
@ControllerAdvice(basePackages = "me.golemcore.scout.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
    static final String EXTERNAL_SERVICE_ERROR = "EXTERNAL_SERVICE_ERROR";
    static final String TIMEOUT_ERROR = "TIMEOUT_ERROR";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(AdmissionDeniedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleAdmissionDenied(AdmissionDeniedException ex) {
        log.warn("[API] Rate limit exceeded for tenant {}", ex.getTenantId());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.TOO_MANY_REQUESTS.value())
                .code(RATE_LIMIT_EXCEEDED)
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfter().getSeconds()))
                .body(body));
    }

    @ExceptionHandler(ValidationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleValidation(ValidationException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInput(ServerWebInputException ex) {
        log.warn("[API] Unreadable request: {}", ex.getReason());
        return Mono.just(error(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, "Malformed request body"));
    }

    @ExceptionHandler(EvidenceCollectionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleEvidence(EvidenceCollectionException ex) {
        log.warn("[API] Evidence collection failed: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.BAD_GATEWAY, EXTERNAL_SERVICE_ERROR,
                "Evidence collection failed, please try again later"));
    }

    @ExceptionHandler(ResearchTimeoutException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleTimeout(ResearchTimeoutException ex) {
        log.warn("[API] {}", ex.getMessage());
        return Mono.just(error(HttpStatus.GATEWAY_TIMEOUT, TIMEOUT_ERROR, "Research timed out, please try again"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return Mono.just(error(status, status.name(), ex.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Internal server error"));
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String code, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .code(code)
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
