package com.sales.forecast.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MetricsConfig {

    private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRowsDropped(String stage, int count) {
        Counter.builder("pipeline.rows.dropped")
                .tag("stage", stage)
                .register(registry)
                .increment(count);
    }

    public void recordUnseenEntities(String field, int count) {
        Counter.builder("pipeline.unseen.entities")
                .tag("field", field)
                .register(registry)
                .increment(count);
    }

    public void recordPredictions(String mode, int count) {
        Counter.builder("prediction.rows")
                .tag("mode", mode)
                .register(registry)
                .increment(count);
    }

    public void recordTrainingDuration(Duration duration) {
        Timer.builder("training.duration")
                .register(registry)
                .record(duration);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void logSummary() {
        for (Meter meter : registry.getMeters()) {
            StringBuilder line = new StringBuilder(meter.getId().getName());
            for (Tag tag : meter.getId().getTags()) {
                line.append(' ').append(tag.getKey()).append('=').append(tag.getValue());
            }
            for (Measurement measurement : meter.measure()) {
                line.append(' ').append(measurement.getStatistic().name().toLowerCase())
                        .append('=').append(measurement.getValue());
            }
            log.info("metric {}", line);
        }
    }
}
