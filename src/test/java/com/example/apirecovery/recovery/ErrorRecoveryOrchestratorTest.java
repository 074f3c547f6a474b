package com.example.apirecovery.recovery;

import com.example.apirecovery.circuitBreaker.CircuitBreaker;
import com.example.apirecovery.config.CircuitBreakerConfig;
import com.example.apirecovery.config.LimitConfig;
import com.example.apirecovery.config.QueueConfig;
import com.example.apirecovery.config.RecoveryConfig;
import com.example.apirecovery.config.RetryConfig;
import com.example.apirecovery.exception.CircuitOpenException;
import com.example.apirecovery.exception.QueueOverflowException;
import com.example.apirecovery.exception.QueueTimeoutException;
import com.example.apirecovery.exception.RateLimitExceededException;
import com.example.apirecovery.exception.RetryExhaustedException;
import com.example.apirecovery.limit.LimitManager;
import com.example.apirecovery.model.HealthLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorRecoveryOrchestrator Tests")
class ErrorRecoveryOrchestratorTest {
    private ErrorRecoveryOrchestrator orchestrator;
    private final List<RecoveryEvent> events = Collections.synchronizedList(new ArrayList<>());

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    private static RecoveryConfig testConfig() {
        RecoveryConfig config = new RecoveryConfig();
        config.setMonitoringEnabled(false);
        config.setCircuitBreaker(new CircuitBreakerConfig(5, 60_000, 3, 120_000, 3));
        config.setRetry(RetryConfig.builder().maxAttempts(2).baseDelay(10).maxDelay(100).jitter(false).build());
        config.setQueue(QueueConfig.builder().rateLimitPerSecond(0).build());
        return config;
    }

    private ErrorRecoveryOrchestrator start(RecoveryConfig config) {
        orchestrator = new ErrorRecoveryOrchestrator(config);
        for (RecoveryEvent event : RecoveryEvent.values()) {
            orchestrator.addEventListener(event, (e, data) -> events.add(e));
        }
        return orchestrator;
    }

    private static Supplier<CompletableFuture<String>> failingWith(RuntimeException error, AtomicInteger invocations) {
        return () -> {
            invocations.incrementAndGet();
            return CompletableFuture.failedFuture(error);
        };
    }

    private static Supplier<CompletableFuture<String>> value(String value) {
        return () -> CompletableFuture.completedFuture(value);
    }

    @Test
    @DisplayName("Should resolve with the fallback value when every attempt fails")
    void shouldUseFallbackAfterRetriesFail() throws Exception {
        start(testConfig());
        AtomicInteger invocations = new AtomicInteger();

        String result = orchestrator.executeWithRecovery("svc",
                failingWith(new RuntimeException("503 Service Unavailable"), invocations),
                RecoveryOptions.withFallback(value("cached"))).get(5, TimeUnit.SECONDS);

        assertEquals("cached", result);
        assertEquals(2, invocations.get());
        ErrorRecoveryStats stats = orchestrator.getStats();
        assertEquals(1, stats.getFallbacksUsed());
        assertEquals(1, stats.getRecoveredRequests());
        assertEquals(1, stats.getFailedRequests());
        assertEquals(List.of(RecoveryEvent.RETRY_EXHAUSTED, RecoveryEvent.FALLBACK_TRIGGERED,
                RecoveryEvent.RECOVERY_SUCCESSFUL), events);
    }

    @Test
    @DisplayName("Should compute availability from successful and recovered requests")
    void shouldComputeAvailability() throws Exception {
        start(testConfig());
        RuntimeException badRequest = new IllegalStateException("bad request");
        AtomicInteger invocations = new AtomicInteger();

        for (int i = 0; i < 7; i++) {
            orchestrator.executeWithRecovery("svc", value("ok")).get(5, TimeUnit.SECONDS);
        }
        for (int i = 0; i < 2; i++) {
            orchestrator.executeWithRecovery("svc", failingWith(badRequest, invocations),
                    RecoveryOptions.withFallback(value("cached"))).get(5, TimeUnit.SECONDS);
        }
        CompletableFuture<String> unrecovered = orchestrator.executeWithRecovery("svc", failingWith(badRequest, invocations));
        ExecutionException ex = assertThrows(ExecutionException.class, () -> unrecovered.get(5, TimeUnit.SECONDS));
        assertSame(badRequest, ex.getCause());

        ErrorRecoveryStats stats = orchestrator.getStats();
        assertEquals(10, stats.getTotalRequests());
        assertEquals(7, stats.getSuccessfulRequests());
        assertEquals(3, stats.getFailedRequests());
        assertEquals(2, stats.getRecoveredRequests());
        assertEquals(90.0, stats.getAvailability(), 0.0001);
        assertEquals(3, invocations.get());
    }

    @Test
    @DisplayName("Should fail fast with CircuitOpenException once the breaker opens")
    void shouldSurfaceCircuitOpen() throws Exception {
        start(testConfig());
        AtomicInteger invocations = new AtomicInteger();
        RecoveryOptions<String> noRetry = RecoveryOptions.<String>builder().skipRetry(true).build();

        for (int i = 0; i < 5; i++) {
            CompletableFuture<String> call = orchestrator.executeWithRecovery("svc",
                    failingWith(new RuntimeException("502 Bad Gateway"), invocations), noRetry);
            assertThrows(ExecutionException.class, () -> call.get(5, TimeUnit.SECONDS));
        }
        CompletableFuture<String> sixth = orchestrator.executeWithRecovery("svc",
                failingWith(new RuntimeException("502 Bad Gateway"), invocations), noRetry);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> sixth.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CircuitOpenException.class, ex.getCause());
        assertEquals(5, invocations.get());
    }

    @Test
    @DisplayName("Should surface RetryExhaustedException without a fallback")
    void shouldSurfaceRetryExhausted() {
        start(testConfig());
        AtomicInteger invocations = new AtomicInteger();

        CompletableFuture<String> result = orchestrator.executeWithRecovery("svc",
                failingWith(new RuntimeException("ECONNRESET"), invocations));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(RetryExhaustedException.class, ex.getCause());
        assertEquals(List.of(RecoveryEvent.RETRY_EXHAUSTED), events);
    }

    @Test
    @DisplayName("Should surface QueueOverflowException and emit queue-overflow")
    void shouldSurfaceQueueOverflow() {
        RecoveryConfig config = testConfig();
        config.setQueue(QueueConfig.builder().maxSize(0).backpressureThreshold(0).rateLimitPerSecond(0).build());
        start(config);
        AtomicInteger invocations = new AtomicInteger();

        CompletableFuture<String> result = orchestrator.executeWithRecovery("svc",
                failingWith(new RuntimeException("never"), invocations));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(QueueOverflowException.class, ex.getCause());
        assertEquals(0, invocations.get());
        assertEquals(List.of(RecoveryEvent.QUEUE_OVERFLOW), events);
    }

    @Test
    @DisplayName("Should recover with the fallback when the circuit is open")
    void shouldUseFallbackWhenCircuitOpen() throws Exception {
        start(testConfig());
        orchestrator.getCircuitBreakerManager().getBreaker("svc").forceState(CircuitBreaker.State.OPEN);
        AtomicInteger invocations = new AtomicInteger();

        String result = orchestrator.executeWithRecovery("svc",
                failingWith(new RuntimeException("never"), invocations),
                RecoveryOptions.withFallback(value("cached"))).get(5, TimeUnit.SECONDS);

        assertEquals("cached", result);
        assertEquals(0, invocations.get());
        assertRecoveredOnce();
        assertEquals(List.of(RecoveryEvent.FALLBACK_TRIGGERED, RecoveryEvent.RECOVERY_SUCCESSFUL), events);
    }

    @Test
    @DisplayName("Should recover with the fallback when the queue is full")
    void shouldUseFallbackOnQueueOverflow() throws Exception {
        RecoveryConfig config = testConfig();
        config.setQueue(QueueConfig.builder().maxSize(0).backpressureThreshold(0).rateLimitPerSecond(0).build());
        start(config);
        AtomicInteger invocations = new AtomicInteger();

        String result = orchestrator.executeWithRecovery("svc",
                failingWith(new RuntimeException("never"), invocations),
                RecoveryOptions.withFallback(value("cached"))).get(5, TimeUnit.SECONDS);

        assertEquals("cached", result);
        assertEquals(0, invocations.get());
        assertRecoveredOnce();
        assertEquals(List.of(RecoveryEvent.QUEUE_OVERFLOW, RecoveryEvent.FALLBACK_TRIGGERED,
                RecoveryEvent.RECOVERY_SUCCESSFUL), events);
    }

    @Test
    @DisplayName("Should surface QueueTimeoutException when a request waits past its deadline")
    void shouldSurfaceQueueTimeout() {
        RecoveryConfig config = testConfig();
        config.setQueue(QueueConfig.builder().timeout(50).rateLimitPerSecond(0).build());
        start(config);
        orchestrator.getRequestQueue().pause();
        AtomicInteger invocations = new AtomicInteger();

        CompletableFuture<String> result = orchestrator.executeWithRecovery("svc",
                failingWith(new RuntimeException("never"), invocations));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(QueueTimeoutException.class, ex.getCause());
        assertEquals(0, invocations.get());
        ErrorRecoveryStats stats = orchestrator.getStats();
        assertEquals(1, stats.getFailedRequests());
        assertEquals(0, stats.getFallbacksUsed());
        assertEquals(0, stats.getRecoveredRequests());
    }

    @Test
    @DisplayName("Should recover with the fallback when a request waits past its deadline")
    void shouldUseFallbackOnQueueTimeout() throws Exception {
        RecoveryConfig config = testConfig();
        config.setQueue(QueueConfig.builder().timeout(50).rateLimitPerSecond(0).build());
        start(config);
        orchestrator.getRequestQueue().pause();
        AtomicInteger invocations = new AtomicInteger();

        String result = orchestrator.executeWithRecovery("svc",
                failingWith(new RuntimeException("never"), invocations),
                RecoveryOptions.withFallback(value("cached"))).get(5, TimeUnit.SECONDS);

        assertEquals("cached", result);
        assertEquals(0, invocations.get());
        assertRecoveredOnce();
        assertEquals(List.of(RecoveryEvent.FALLBACK_TRIGGERED, RecoveryEvent.RECOVERY_SUCCESSFUL), events);
    }

    @Test
    @DisplayName("Should treat missing options as the defaults")
    void shouldAcceptNullOptions() throws Exception {
        start(testConfig());

        assertEquals("ok", orchestrator.executeWithRecovery("svc", value("ok"), null).get(5, TimeUnit.SECONDS));
        assertEquals(1, orchestrator.getStats().getSuccessfulRequests());
        assertEquals(1, orchestrator.getStats().getQueueStats().getCompletedRequests());
    }

    private void assertRecoveredOnce() {
        ErrorRecoveryStats stats = orchestrator.getStats();
        assertEquals(1, stats.getTotalRequests());
        assertEquals(1, stats.getFailedRequests());
        assertEquals(1, stats.getFallbacksUsed());
        assertEquals(1, stats.getRecoveredRequests());
    }

    @Test
    @DisplayName("Should keep the original error and attach the fallback failure as suppressed")
    void shouldKeepOriginalErrorWhenFallbackFails() {
        start(testConfig());
        IllegalStateException primary = new IllegalStateException("primary down");
        RuntimeException fallbackError = new RuntimeException("fallback down");

        CompletableFuture<String> result = orchestrator.executeWithRecovery("svc",
                failingWith(primary, new AtomicInteger()),
                RecoveryOptions.withFallback(() -> CompletableFuture.failedFuture(fallbackError)));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertSame(primary, ex.getCause());
        assertSame(fallbackError, ex.getCause().getSuppressed()[0]);
        assertEquals(1, orchestrator.getStats().getFallbacksUsed());
        assertEquals(0, orchestrator.getStats().getRecoveredRequests());
        assertEquals(List.of(RecoveryEvent.FALLBACK_TRIGGERED), events);
    }

    @Test
    @DisplayName("Should ignore the fallback when graceful degradation is disabled")
    void shouldIgnoreFallbackWithoutGracefulDegradation() {
        RecoveryConfig config = testConfig();
        config.setGracefulDegradation(false);
        start(config);
        IllegalStateException primary = new IllegalStateException("primary down");
        AtomicInteger fallbackCalls = new AtomicInteger();

        CompletableFuture<String> result = orchestrator.executeWithRecovery("svc",
                failingWith(primary, new AtomicInteger()),
                RecoveryOptions.withFallback(() -> {
                    fallbackCalls.incrementAndGet();
                    return CompletableFuture.completedFuture("cached");
                }));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertSame(primary, ex.getCause());
        assertEquals(0, fallbackCalls.get());
    }

    @Test
    @DisplayName("Should isolate a throwing listener from the call and other listeners")
    void shouldIsolateListenerErrors() throws Exception {
        orchestrator = new ErrorRecoveryOrchestrator(testConfig());
        AtomicInteger delivered = new AtomicInteger();
        orchestrator.addEventListener(RecoveryEvent.FALLBACK_TRIGGERED, (e, data) -> {
            throw new IllegalStateException("listener bug");
        });
        orchestrator.addEventListener(RecoveryEvent.FALLBACK_TRIGGERED, (e, data) -> {
            assertEquals("svc", data.get("operationName"));
            delivered.incrementAndGet();
        });

        String result = orchestrator.executeWithRecovery("svc",
                failingWith(new IllegalStateException("primary down"), new AtomicInteger()),
                RecoveryOptions.withFallback(value("cached"))).get(5, TimeUnit.SECONDS);

        assertEquals("cached", result);
        assertEquals(1, delivered.get());
    }

    @Test
    @DisplayName("Should stop delivering to a removed listener")
    void shouldRemoveListener() throws Exception {
        orchestrator = new ErrorRecoveryOrchestrator(testConfig());
        AtomicInteger delivered = new AtomicInteger();
        RecoveryEventListener listener = (e, data) -> delivered.incrementAndGet();
        orchestrator.addEventListener(RecoveryEvent.FALLBACK_TRIGGERED, listener);
        assertTrue(orchestrator.removeEventListener(RecoveryEvent.FALLBACK_TRIGGERED, listener));

        orchestrator.executeWithRecovery("svc", failingWith(new IllegalStateException("down"), new AtomicInteger()),
                RecoveryOptions.withFallback(value("cached"))).get(5, TimeUnit.SECONDS);

        assertEquals(0, delivered.get());
    }

    @Test
    @DisplayName("Should bypass every layer when all skip flags are set")
    void shouldBypassSkippedLayers() throws Exception {
        start(testConfig());
        RecoveryOptions<String> bypass = RecoveryOptions.<String>builder()
                .skipQueue(true).skipRetry(true).skipCircuitBreaker(true).build();

        assertEquals("direct", orchestrator.executeWithRecovery("svc", value("direct"), bypass).get(5, TimeUnit.SECONDS));

        ErrorRecoveryStats stats = orchestrator.getStats();
        assertTrue(stats.getCircuitBreakers().isEmpty());
        assertEquals(0, stats.getQueueStats().getCompletedRequests());
        assertEquals(1, stats.getSuccessfulRequests());
    }

    @Test
    @DisplayName("Should report each circuit transition once")
    void shouldReportCircuitTransitionsOnce() {
        start(testConfig());
        CircuitBreaker breaker = orchestrator.getCircuitBreakerManager().getBreaker("svc");

        orchestrator.checkCircuitStates();
        assertTrue(events.isEmpty());

        breaker.forceState(CircuitBreaker.State.OPEN);
        orchestrator.checkCircuitStates();
        orchestrator.checkCircuitStates();
        assertEquals(List.of(RecoveryEvent.CIRCUIT_OPENED), events);

        breaker.forceState(CircuitBreaker.State.CLOSED);
        orchestrator.checkCircuitStates();
        orchestrator.checkCircuitStates();
        assertEquals(List.of(RecoveryEvent.CIRCUIT_OPENED, RecoveryEvent.CIRCUIT_CLOSED), events);
    }

    @Test
    @DisplayName("Should poll circuit states on the monitoring interval")
    void shouldPollCircuitStates() throws Exception {
        RecoveryConfig config = testConfig();
        config.setMonitoringEnabled(true);
        config.setMonitoringIntervalMs(20);
        orchestrator = new ErrorRecoveryOrchestrator(config);
        CountDownLatch opened = new CountDownLatch(1);
        orchestrator.addEventListener(RecoveryEvent.CIRCUIT_OPENED, (e, data) -> {
            assertEquals("svc", data.get("endpoint"));
            opened.countDown();
        });

        orchestrator.getCircuitBreakerManager().getBreaker("svc").forceState(CircuitBreaker.State.OPEN);

        assertTrue(opened.await(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Should block with RateLimitExceededException when the gate is attached")
    void shouldApplyRateLimitGate() throws Exception {
        LimitConfig limitConfig = new LimitConfig();
        limitConfig.setEnabled(true);
        limitConfig.setStrategy("FixedWindow");
        limitConfig.setMaxRequests(1);
        limitConfig.setWindowMs(60_000);
        orchestrator = new ErrorRecoveryOrchestrator(testConfig(), new LimitManager(limitConfig));

        assertEquals("ok", orchestrator.executeWithRecovery("svc", value("ok")).get(5, TimeUnit.SECONDS));
        CompletableFuture<String> second = orchestrator.executeWithRecovery("svc", value("ok"));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> second.get(5, TimeUnit.SECONDS));
        assertInstanceOf(RateLimitExceededException.class, ex.getCause());
        assertTrue(orchestrator.getHealthStatus().getComponents().containsKey("rateLimit"));
    }

    @Test
    @DisplayName("Should build a report with percentage trends")
    void shouldGenerateReport() throws Exception {
        start(testConfig());
        orchestrator.executeWithRecovery("svc", value("ok")).get(5, TimeUnit.SECONDS);
        orchestrator.executeWithRecovery("svc", failingWith(new IllegalStateException("down"), new AtomicInteger()),
                RecoveryOptions.withFallback(value("cached"))).get(5, TimeUnit.SECONDS);

        RecoveryReport report = orchestrator.generateReport();

        assertEquals(2, report.getSummary().getTotalRequests());
        assertEquals("100.00%", report.getSummary().getAvailability());
        assertEquals("50.00%", report.getTrends().getSuccessRate());
        assertEquals("100.00%", report.getTrends().getRecoveryRate());
        assertEquals("50.00%", report.getTrends().getFallbackUsage());
        assertTrue(report.getRecommendations().contains("High failure rate detected - check upstream services"));
        assertTrue(report.getRecommendations().contains("Frequent fallback usage - investigate primary service issues"));
        assertTrue(report.render().contains("Availability: 100.00%"));
    }

    @Test
    @DisplayName("Should report CRITICAL health when breaker availability drops")
    void shouldReportHealth() throws Exception {
        start(testConfig());
        assertEquals(HealthLevel.HEALTHY, orchestrator.getHealthStatus().getStatus());

        orchestrator.executeWithRecovery("svc", value("ok")).get(5, TimeUnit.SECONDS);
        orchestrator.executeWithRecovery("svc", failingWith(new IllegalStateException("down"), new AtomicInteger()),
                RecoveryOptions.withFallback(value("cached"))).get(5, TimeUnit.SECONDS);

        HealthStatus health = orchestrator.getHealthStatus();
        assertEquals(HealthLevel.CRITICAL, health.getStatus());
        assertTrue(health.getComponents().containsKey("circuitBreakers"));
        assertTrue(health.getComponents().containsKey("queue"));
    }

    @Test
    @DisplayName("Should reset counters, breakers and retry statistics")
    void shouldResetStats() throws Exception {
        start(testConfig());
        orchestrator.executeWithRecovery("svc", failingWith(new RuntimeException("503"), new AtomicInteger()),
                RecoveryOptions.withFallback(value("cached"))).get(5, TimeUnit.SECONDS);

        orchestrator.resetStats();

        ErrorRecoveryStats stats = orchestrator.getStats();
        assertEquals(0, stats.getTotalRequests());
        assertEquals(100.0, stats.getAvailability());
        assertEquals(0, stats.getRetryStats().getTotalAttempts());
        assertEquals(0, stats.getCircuitBreakers().get("svc").getTotalCalls());
    }

    @Test
    @DisplayName("Should apply valid config updates and reject invalid ones")
    void shouldUpdateConfig() {
        start(testConfig());

        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.updateConfig(c -> c.getQueue().setMaxConcurrent(0)));
        assertEquals(20, orchestrator.getConfig().getQueue().getMaxConcurrent());

        orchestrator.updateConfig(c -> {
            c.getQueue().setMaxConcurrent(5);
            c.getCircuitBreaker().setFailureThreshold(2);
        });
        assertEquals(5, orchestrator.getRequestQueue().getConfig().getMaxConcurrent());
        assertEquals(2, orchestrator.getCircuitBreakerManager().getBreaker("new-endpoint").getConfig().getFailureThreshold());
    }

    @Test
    @DisplayName("Should build valid configs from every profile")
    void shouldBuildProfiles() {
        for (RecoveryProfile profile : RecoveryProfile.values()) {
            assertDoesNotThrow(() -> profile.toConfig().validate(), profile.name());
        }
        assertEquals(5000, RecoveryProfile.PRODUCTION.toConfig().getQueue().getMaxSize());
        assertFalse(RecoveryProfile.DEVELOPMENT.toConfig().getRetry().isJitter());
        assertEquals(10, RecoveryProfile.HIGH_RESILIENCE.toConfig().getCircuitBreaker().getFailureThreshold());
    }
}
