package com.warden.observability;

import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Scopes SLF4J MDC keys to the validation of a single request.
 * <p>
 * Validation hooks run on the worker thread that owns the request. The keys set here
 * ({@code requestId}, {@code policyId}) appear on every log statement issued while the
 * hook runs, and the previous values are restored afterwards so that the host's own
 * MDC entries survive.
 */
public final class RequestLogContext {

    /** MDC key for the request id. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the user token policy id. */
    public static final String MDC_POLICY_ID = "policyId";

    private RequestLogContext() {
        // utility class
    }

    /**
     * Runs the supplier with the request id in MDC.
     *
     * @param requestId the request id (may be null, in which case the key is removed)
     * @param action    the work to execute
     * @return the supplier's result
     */
    public static <T> T callWithRequest(String requestId, Supplier<T> action) {
        return callWith(Map.of(MDC_REQUEST_ID, nullToEmpty(requestId)), action);
    }

    /**
     * Runs the supplier with the policy id in MDC.
     *
     * @param policyId the user token policy id
     * @param action   the work to execute
     * @return the supplier's result
     */
    public static <T> T callWithPolicy(String policyId, Supplier<T> action) {
        return callWith(Map.of(MDC_POLICY_ID, nullToEmpty(policyId)), action);
    }

    /**
     * Runs the supplier with the given MDC entries, then restores whatever values those keys
     * held before (or removes them if they were unset). Empty values remove the key for the
     * duration of the call.
     */
    public static <T> T callWith(Map<String, String> entries, Supplier<T> action) {
        Map<String, String> previous = new HashMap<>();
        for (String key : entries.keySet()) {
            previous.put(key, MDC.get(key));
        }
        try {
            entries.forEach(RequestLogContext::setMdc);
            return action.get();
        } finally {
            previous.forEach(RequestLogContext::setMdc);
        }
    }

    private static void setMdc(String key, String value) {
        if (value != null && !value.isEmpty()) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
