package com.redis.resilience.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Whether the reconnector and health monitor loops are currently scheduled.
 */
public final class BackgroundTaskStatus {

    private final boolean reconnectTaskActive;
    private final boolean healthMonitorActive;

    public BackgroundTaskStatus(boolean reconnectTaskActive, boolean healthMonitorActive) {
        this.reconnectTaskActive = reconnectTaskActive;
        this.healthMonitorActive = healthMonitorActive;
    }

    public boolean isReconnectTaskActive() {
        return reconnectTaskActive;
    }

    public boolean isHealthMonitorActive() {
        return healthMonitorActive;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("reconnectTaskActive", reconnectTaskActive);
        map.put("healthMonitorActive", healthMonitorActive);
        return map;
    }

    @Override
    public String toString() {
        return "BackgroundTaskStatus{reconnectTaskActive=" + reconnectTaskActive
            + ", healthMonitorActive=" + healthMonitorActive + '}';
    }
}
