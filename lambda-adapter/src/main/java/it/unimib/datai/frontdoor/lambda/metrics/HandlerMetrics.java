package it.unimib.datai.frontdoor.lambda.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import it.unimib.datai.frontdoor.common.model.OriginKind;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class HandlerMetrics {
    private final MeterRegistry registry;
    private final Map<String, Counter> invocationCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> coldStartCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> initFailureCounters = new ConcurrentHashMap<>();
    private final Map<String, Timer> initDurationTimers = new ConcurrentHashMap<>();
    private final Map<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    public HandlerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void invocation(String function, OriginKind origin) {
        counter(invocationCounters, "frontdoor_invocations_total", function, origin).increment();
    }

    public void error(String function, OriginKind origin) {
        counter(errorCounters, "frontdoor_errors_total", function, origin).increment();
    }

    public void coldStart(String function) {
        counter(coldStartCounters, "frontdoor_cold_starts_total", function, null).increment();
    }

    public void initFailure(String function) {
        counter(initFailureCounters, "frontdoor_init_failures_total", function, null).increment();
    }

    public Timer initDuration(String function) {
        return initDurationTimers.computeIfAbsent(function, name -> Timer.builder("frontdoor_init_duration_ms")
                .tag("function", name)
                .register(registry));
    }

    public Timer latency(String function, OriginKind origin) {
        return latencyTimers.computeIfAbsent(key(function, origin), key -> Timer.builder("frontdoor_latency_ms")
                .tag("function", function)
                .tag("origin", origin.name())
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry));
    }

    private Counter counter(Map<String, Counter> map, String name, String function, OriginKind origin) {
        return map.computeIfAbsent(key(function, origin), key -> {
            Counter.Builder builder = Counter.builder(name).tag("function", function);
            if (origin != null) {
                builder.tag("origin", origin.name());
            }
            return builder.register(registry);
        });
    }

    private static String key(String function, OriginKind origin) {
        return origin == null ? function : function + "|" + origin.name();
    }
}
