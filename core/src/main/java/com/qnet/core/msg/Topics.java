package com.qnet.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Control topic for alerts raised by the health and performance monitors.
     * Published by the load-balancer, consumed by external alert sinks.
     */
    public static final String CONTROL_ALERTS = "qnet.control.alerts";

    /**
     * Control topic for failover results (one message per handled node failure).
     */
    public static final String CONTROL_FAILOVER = "qnet.control.failover";
}
