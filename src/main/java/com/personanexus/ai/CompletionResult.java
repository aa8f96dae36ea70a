/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.ai;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a completion call: either generated text or a classified failure.
 */
public final class CompletionResult {

    public enum FailureKind {
        TIMEOUT,
        HTTP_ERROR,
        EMPTY_RESPONSE,
        TRANSPORT_ERROR,
        DISABLED
    }

    private final String text;
    private final FailureKind failureKind;
    private final String detail;
    private final String provider;

    private CompletionResult(String text, FailureKind failureKind, String detail, String provider) {
        this.text = text;
        this.failureKind = failureKind;
        this.detail = detail;
        this.provider = provider;
    }

    public static CompletionResult success(String text, String provider) {
        Objects.requireNonNull(text, "text");
        return new CompletionResult(text, null, null, provider);
    }

    public static CompletionResult failure(FailureKind kind, String detail, String provider) {
        Objects.requireNonNull(kind, "kind");
        return new CompletionResult(null, kind, detail != null ? detail : kind.name(), provider);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    /**
     * @return generated text, empty for failures
     */
    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    /**
     * @return failure classification, empty for successes
     */
    public Optional<FailureKind> failureKind() {
        return Optional.ofNullable(failureKind);
    }

    public String detail() {
        return detail;
    }

    public String provider() {
        return provider;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "CompletionResult{success, provider=" + provider + ", chars=" + text.length() + "}"
                : "CompletionResult{" + failureKind + ", provider=" + provider + ", detail=" + detail + "}";
    }
}
