package strata.core.service.remote;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import strata.core.port.out.CacheMetrics;
import strata.core.service.remote.RemoteCallGuard.RemoteTimeoutException;

@DisplayName("RemoteCallGuard")
@ExtendWith(MockitoExtension.class)
class RemoteCallGuardTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String OPERATION_NAME = "get";

    @Mock
    private CacheMetrics metrics;

    private List<Throwable> failures;
    private RemoteCallGuard guard;

    @BeforeEach
    void setUp() {
        failures = new ArrayList<>();
        guard = new RemoteCallGuard(TIMEOUT, metrics, (operation, key, cause) -> failures.add(cause));
    }

    @Nested
    @DisplayName("withTimeout()")
    class WithTimeoutTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResultWithinTimeout() {
            final var result = guard.withTimeout(Uni.createFrom().item("pong"), "ping", TIMEOUT)
                    .await()
                    .indefinitely();

            assertEquals("pong", result);
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should fail with RemoteTimeoutException when operation times out")
        void shouldFailOnTimeout() {
            final var operation = Uni.createFrom().<String>nothing();

            final var exception = assertThrows(
                    RemoteTimeoutException.class,
                    () -> guard.withTimeout(operation, "ping", TIMEOUT).await().indefinitely());

            assertEquals("ping", exception.getOperation());
            verify(metrics).recordRemoteTimeout(eq("ping"));
        }

        @Test
        @DisplayName("should propagate other failures")
        void shouldPropagateFailures() {
            final var operation = Uni.createFrom().<String>failure(new IllegalStateException("boom"));

            assertThrows(
                    IllegalStateException.class,
                    () -> guard.withTimeout(operation, "ping", TIMEOUT).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("withTimeoutGraceful()")
    class WithTimeoutGracefulTests {

        @Test
        @DisplayName("should return the result when the operation completes in time")
        void shouldReturnResult() {
            final var result = guard.withTimeoutGraceful(
                            Uni.createFrom().item(Optional.of("value")), OPERATION_NAME, "k")
                    .await()
                    .indefinitely();

            assertEquals(Optional.of("value"), result);
            assertTrue(failures.isEmpty());
        }

        @Test
        @DisplayName("should return empty and report the timeout")
        void shouldReturnEmptyOnTimeout() {
            final var result = guard.withTimeoutGraceful(
                            Uni.createFrom().<Optional<String>>nothing(), OPERATION_NAME, "k")
                    .await()
                    .indefinitely();

            assertTrue(result.isEmpty());
            verify(metrics).recordRemoteTimeout(eq(OPERATION_NAME));
            assertEquals(1, failures.size());
            assertInstanceOf(TimeoutException.class, failures.get(0));
        }

        @Test
        @DisplayName("should return empty and report failures")
        void shouldReturnEmptyOnFailure() {
            final var result = guard.withTimeoutGraceful(
                            Uni.createFrom().<Optional<String>>failure(new RuntimeException("connection reset")),
                            OPERATION_NAME,
                            "k")
                    .await()
                    .indefinitely();

            assertTrue(result.isEmpty());
            verify(metrics).recordRemoteFailure(eq(OPERATION_NAME), eq("RuntimeException"));
            assertEquals("connection reset", failures.get(0).getMessage());
        }

        @Test
        @DisplayName("should treat a null item as empty")
        void shouldTreatNullAsEmpty() {
            final var result = guard.withTimeoutGraceful(
                            Uni.createFrom().<Optional<String>>nullItem(), OPERATION_NAME, "k")
                    .await()
                    .indefinitely();

            assertTrue(result.isEmpty());
        }
    }

    @Nested
    @DisplayName("withTimeoutFallback()")
    class WithTimeoutFallbackTests {

        @Test
        @DisplayName("should return the fallback on timeout")
        void shouldReturnFallbackOnTimeout() {
            final var result = guard.withTimeoutFallback(
                            Uni.createFrom().<Boolean>nothing(), "set", "k", () -> false)
                    .await()
                    .indefinitely();

            assertFalse(result);
            verify(metrics).recordRemoteTimeout(eq("set"));
        }

        @Test
        @DisplayName("should return the fallback on failure")
        void shouldReturnFallbackOnFailure() {
            final var result = guard.withTimeoutFallback(
                            Uni.createFrom().<Long>failure(new RuntimeException("down")), "delete", null, () -> 0L)
                    .await()
                    .indefinitely();

            assertEquals(0L, result);
        }
    }

    @Nested
    @DisplayName("In-flight tracking")
    class InFlightTests {

        @Test
        @DisplayName("should count calls only while they run")
        void shouldCountCallsWhileRunning() {
            assertEquals(0, guard.inFlight());

            guard.withTimeoutFallback(Uni.createFrom().item(true), "set", "k", () -> false)
                    .await()
                    .indefinitely();

            assertEquals(0, guard.inFlight());
            assertTrue(guard.awaitIdle(Duration.ofMillis(10)));
        }

        @Test
        @DisplayName("awaitIdle should time out while a call is outstanding")
        void awaitIdleShouldTimeOut() {
            var slowGuard = new RemoteCallGuard(Duration.ofSeconds(30), metrics, null);
            var cancellable = slowGuard.withTimeoutFallback(Uni.createFrom().<Boolean>nothing(), "set", "k", () -> false)
                    .subscribe()
                    .with(ignored -> {});
            try {
                assertEquals(1, slowGuard.inFlight());
                assertFalse(slowGuard.awaitIdle(Duration.ofMillis(50)));
            } finally {
                cancellable.cancel();
            }
            assertEquals(0, slowGuard.inFlight());
        }
    }
}
