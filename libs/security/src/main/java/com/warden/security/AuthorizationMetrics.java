package com.warden.security;

import com.warden.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Counters and a timer for credential validation, and a gauge of pending impersonation contexts.
 */
public final class AuthorizationMetrics {

    public static final String ACCEPTED = "warden.credentials.accepted";
    public static final String REJECTED = "warden.credentials.rejected";
    public static final String PENDING_IMPERSONATIONS = "warden.impersonation.pending";
    public static final String VALIDATION_TIME = "warden.credentials.validation";

    private final MetricFactory metrics;

    public AuthorizationMetrics(MetricFactory metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
    }

    /** Metrics recorded into a private registry that nothing reads. */
    public static AuthorizationMetrics detached() {
        return new AuthorizationMetrics(new MetricFactory(new SimpleMeterRegistry(), "warden"));
    }

    /**
     * Counts the outcome and returns the result unchanged.
     */
    public <T> ValidationResult<T> record(CredentialKind kind, ValidationResult<T> result) {
        if (result.valid()) {
            metrics.counter(ACCEPTED, "Credentials accepted", "kind", tag(kind)).increment();
        } else {
            metrics.counter(REJECTED, "Credentials rejected",
                    "kind", tag(kind),
                    "status", result.error().statusCode().symbolicName()).increment();
        }
        return result;
    }

    /** Runs one credential validation, recording its duration. */
    public <T> T time(CredentialKind kind, Supplier<T> validation) {
        return metrics.timer(VALIDATION_TIME, "Credential validation time", "kind", tag(kind)).record(validation);
    }

    /** Publishes the registry's pending count as a gauge. */
    public void bindPendingImpersonations(ImpersonationContextRegistry registry) {
        metrics.gauge(PENDING_IMPERSONATIONS, "Impersonation contexts awaiting request completion",
                registry::pendingCount);
    }

    private static String tag(CredentialKind kind) {
        return kind == null ? "unknown" : kind.name().toLowerCase(Locale.ROOT);
    }
}
