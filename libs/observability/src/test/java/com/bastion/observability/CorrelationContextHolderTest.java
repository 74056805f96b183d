package com.bastion.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge,
 * user attribution and scoped execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1", "42", "req-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
        }

        @Test
        @DisplayName("should clear context")
        void shouldClearContext() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));
            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should reject blank correlation id")
        void shouldRejectBlankCorrelationId() {
            assertThatThrownBy(() -> CorrelationContext.of(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "42", "req-1"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("userId")).isEqualTo("42");
            assertThat(MDC.get("requestId")).isEqualTo("req-1");
        }

        @Test
        @DisplayName("should clear MDC keys when context is cleared")
        void shouldClearMdcOnClear() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "42", "req-1"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("requestId")).isNull();
        }

        @Test
        @DisplayName("should not set MDC for null optional fields")
        void shouldNotSetMdcForNullFields() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("requestId")).isNull();
        }
    }

    @Nested
    @DisplayName("attachUser")
    class AttachUser {

        @Test
        @DisplayName("should attribute the current context to a user and update MDC")
        void shouldAttachUser() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", null, "req-1"));

            CorrelationContextHolder.attachUser("7");

            assertThat(CorrelationContextHolder.get())
                    .hasValueSatisfying(ctx -> {
                        assertThat(ctx.userId()).isEqualTo("7");
                        assertThat(ctx.correlationId()).isEqualTo("corr-1");
                        assertThat(ctx.requestId()).isEqualTo("req-1");
                    });
            assertThat(MDC.get("userId")).isEqualTo("7");
        }

        @Test
        @DisplayName("should do nothing when no context is set")
        void shouldIgnoreWithoutContext() {
            CorrelationContextHolder.attachUser("7");

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get("userId")).isNull();
        }
    }

    @Nested
    @DisplayName("Thread isolation")
    class ThreadIsolation {

        @Test
        @DisplayName("should not leak context across threads")
        void shouldNotLeakAcrossThreads() throws InterruptedException {
            CorrelationContextHolder.set(CorrelationContext.of("main-corr"));

            AtomicReference<Boolean> otherThreadHasContext = new AtomicReference<>();
            Thread other = new Thread(() ->
                    otherThreadHasContext.set(CorrelationContextHolder.get().isPresent()));
            other.start();
            other.join();

            assertThat(otherThreadHasContext.get()).isFalse();
        }
    }
}
