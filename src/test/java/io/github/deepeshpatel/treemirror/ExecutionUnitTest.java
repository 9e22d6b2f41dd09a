package io.github.deepeshpatel.treemirror;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionUnitTest {
    private final ExecutorService pool = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @ParameterizedTest
    @EnumSource(ExecutionUnitKind.class)
    @DisplayName("Unit runs its body and can be joined")
    void testStartAndJoin(ExecutionUnitKind kind) throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ExecutionUnit unit = kind.create("unit", () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, pool);

        unit.start();
        assertTrue(unit.isAlive());
        assertFalse(unit.join(Duration.ofMillis(100)), "Body is still blocked");

        release.countDown();
        assertTrue(unit.join(Duration.ofSeconds(2)));
        assertFalse(unit.isAlive());
        assertEquals("unit", unit.name());
    }

    @ParameterizedTest
    @EnumSource(ExecutionUnitKind.class)
    @DisplayName("Unit starts only once")
    void testStartOnce(ExecutionUnitKind kind) throws Exception {
        ExecutionUnit unit = kind.create("once", () -> { }, pool);
        unit.start();

        assertThrows(IllegalStateException.class, unit::start);
        unit.join();
    }

    @ParameterizedTest
    @EnumSource(ExecutionUnitKind.class)
    @DisplayName("Joining a unit that never started returns at once")
    void testJoinUnstarted(ExecutionUnitKind kind) throws Exception {
        ExecutionUnit unit = kind.create("idle", () -> { }, pool);

        assertTrue(unit.join(Duration.ofMillis(10)));
        assertFalse(unit.isAlive());
    }

    @ParameterizedTest
    @EnumSource(ExecutionUnitKind.class)
    @DisplayName("Escaped failure is captured and joining still succeeds")
    void testFailureCaptured(ExecutionUnitKind kind) throws Exception {
        ExecutionUnit unit = kind.create("failing", () -> {
            throw new IllegalArgumentException("boom");
        }, pool);

        unit.start();
        assertTrue(unit.join(Duration.ofSeconds(2)));

        Throwable failure = ((AbstractExecutionUnit) unit).failure().orElseThrow();
        assertEquals("boom", failure.getMessage());
    }
}
