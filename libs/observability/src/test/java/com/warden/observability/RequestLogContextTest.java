package com.warden.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("RequestLogContext")
class RequestLogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("sets request id for the duration of the call")
    void setsRequestId() {
        String seen = RequestLogContext.callWithRequest("42",
                () -> MDC.get(RequestLogContext.MDC_REQUEST_ID));

        assertThat(seen).isEqualTo("42");
        assertThat(MDC.get(RequestLogContext.MDC_REQUEST_ID)).isNull();
    }

    @Test
    @DisplayName("restores the previous value after the call")
    void restoresPreviousValue() {
        MDC.put(RequestLogContext.MDC_POLICY_ID, "outer");

        String seen = RequestLogContext.callWithPolicy("inner",
                () -> MDC.get(RequestLogContext.MDC_POLICY_ID));

        assertThat(seen).isEqualTo("inner");
        assertThat(MDC.get(RequestLogContext.MDC_POLICY_ID)).isEqualTo("outer");
    }

    @Test
    @DisplayName("restores MDC when the action throws")
    void restoresOnException() {
        assertThatThrownBy(() -> RequestLogContext.callWithRequest("7", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(MDC.get(RequestLogContext.MDC_REQUEST_ID)).isNull();
    }

    @Test
    @DisplayName("null request id leaves the key unset")
    void nullRequestId() {
        String seen = RequestLogContext.callWith(Map.of(RequestLogContext.MDC_REQUEST_ID, ""),
                () -> MDC.get(RequestLogContext.MDC_REQUEST_ID));

        assertThat(seen).isNull();
        assertThat(RequestLogContext.callWithRequest(null,
                () -> MDC.get(RequestLogContext.MDC_REQUEST_ID))).isNull();
    }
}
