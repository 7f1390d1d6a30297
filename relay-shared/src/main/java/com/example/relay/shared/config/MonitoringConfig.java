package com.example.relay.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the relay: sessions, command lifecycle and media fan-out.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder relayMetrics() {
        return registry -> {
            registry.counter("relay.commands.enqueued");
            registry.counter("relay.commands.delivered");
            registry.counter("relay.commands.expired");
            registry.counter("relay.sessions.superseded");
            registry.counter("relay.media.dropped", "reason", "stale-session");
            registry.counter("relay.messages.malformed");
        };
    }

    @Bean
    public RelayMetricsCollector relayMetricsCollector(MeterRegistry registry) {
        return new RelayMetricsCollector(registry);
    }

    /**
     * Caches meters by name and tags so hot paths don't go through the registry lookup.
     */
    public static class RelayMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public RelayMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            incrementCounter(name, 1, tags);
        }

        public void incrementCounter(String name, double amount, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment(amount);
        }

        public void recordTimer(String name, long durationMillis, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k -> Timer.builder(name).tags(tags).register(registry))
                  .record(durationMillis, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, long value, String... tags) {
            String key = name + "_" + String.join("_", tags);
            AtomicLong gauge = gauges.computeIfAbsent(key, k -> {
                AtomicLong newGauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), newGauge);
                return newGauge;
            });
            gauge.set(value);
        }

        public long getCounterValue(String name, String... tags) {
            Counter counter = counters.get(name + "_" + String.join("_", tags));
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
