package com.strata.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear")
    class Lifecycle {

        @Test
        @DisplayName("is empty when nothing was set")
        void emptyByDefault() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("populates and clears the MDC")
        void mirrorsMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "tenant-1", "user-1", "/api/upload"));

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isEqualTo("tenant-1");
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isEqualTo("user-1");

            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isNull();
        }

        @Test
        @DisplayName("rejects a null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("bindPrincipal()")
    class BindPrincipal {

        @Test
        @DisplayName("adds user and tenant while keeping the correlation id")
        void bindsPrincipal() {
            CorrelationContextHolder.set(new CorrelationContext("corr-2", null, null, "/api/stats"));

            CorrelationContextHolder.bindPrincipal("user-9", "tenant-9");

            var ctx = CorrelationContextHolder.get().orElseThrow();
            assertThat(ctx.correlationId()).isEqualTo("corr-2");
            assertThat(ctx.userId()).isEqualTo("user-9");
            assertThat(ctx.tenantId()).isEqualTo("tenant-9");
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isEqualTo("user-9");
        }

        @Test
        @DisplayName("Root principal leaves the tenant key out of the MDC")
        void rootHasNoTenant() {
            CorrelationContextHolder.set(new CorrelationContext("corr-3", null, null, "/api/stats"));

            CorrelationContextHolder.bindPrincipal("root-1", null);

            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isNull();
        }

        @Test
        @DisplayName("does nothing without a context")
        void noContext() {
            CorrelationContextHolder.bindPrincipal("user-1", "tenant-1");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }

    @Test
    @DisplayName("blank correlation id is rejected")
    void blankCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext(" ", null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }
}
