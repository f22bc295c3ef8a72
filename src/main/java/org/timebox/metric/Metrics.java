package org.timebox.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.Objects;

/**
 * Submits counters describing how deadline-bounded invocations end.
 */
public class Metrics {

    private static final String VARIANT_TAG = "variant";

    private final MeterRegistry meterRegistry;

    public Metrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry);
    }

    /**
     * Increments counter of the given deadline lifecycle event for the entry point variant,
     * e.g. {@code "raising"} or {@code "optional"}.
     */
    public void updateDeadlineMetric(MetricName metricName, String variant) {
        meterRegistry.counter(metricName.toString(), Tags.of(VARIANT_TAG, variant)).increment();
    }
}
