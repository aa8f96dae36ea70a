/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.ai;

/**
 * Result of probing one provider.
 *
 * @param provider provider name
 * @param success whether the probe produced text
 * @param latencyMs wall-clock time of the probe
 * @param failureKind failure classification, or null on success
 * @param detail failure detail, or null on success
 */
public record ProviderDiagnostic(String provider, boolean success, long latencyMs,
                                 CompletionResult.FailureKind failureKind, String detail) {

    static ProviderDiagnostic of(CompletionResult result, String provider, long latencyMs) {
        return new ProviderDiagnostic(provider, result.isSuccess(), latencyMs,
                result.failureKind().orElse(null), result.isSuccess() ? null : result.detail());
    }
}
