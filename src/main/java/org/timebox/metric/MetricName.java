package org.timebox.metric;

public enum MetricName {

    // deadline lifecycle
    deadline_started("deadline.started"),
    deadline_completed("deadline.completed"),
    deadline_failed("deadline.failed"),
    deadline_cancelled("deadline.cancelled"),
    deadline_timed_out("deadline.timed_out"),
    deadline_immediate_timeout("deadline.immediate_timeout");

    private final String name;

    MetricName(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
