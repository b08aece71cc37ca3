package com.ciaagent.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Per-server connectivity health. Written only by {@link McpManager}; readers get copies.
 */
public class ConnectionMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionMonitor.class);

    static final int MAX_CONSECUTIVE_FAILURES = 3;
    static final Duration MAX_AGE = Duration.ofMinutes(5);
    static final Duration STALE_AFTER = Duration.ofMinutes(10);
    private static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final Map<String, HealthRecord> health = new ConcurrentHashMap<>();
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public ConnectionMonitor() {
        this(Clock.systemUTC());
    }

    public ConnectionMonitor(Clock clock) {
        this.clock = clock;
    }

    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "mcp-health-monitor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::sweep, SWEEP_INTERVAL.toMillis(),
                SWEEP_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        scheduler = null;
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    /** A successful check resets the failure streak; a failed one extends it and keeps the last known error. */
    public void updateHealth(String server, boolean connected, String error) {
        health.compute(server, (name, current) -> new HealthRecord(
                connected,
                clock.instant(),
                connected ? 0 : (current != null ? current.consecutiveFailures() : 0) + 1,
                error != null ? error : current != null ? current.lastError() : null));
    }

    public HealthRecord getHealth(String server) {
        return health.get(server);
    }

    public Map<String, HealthRecord> getAllHealth() {
        return new TreeMap<>(health);
    }

    public void removeServer(String server) {
        health.remove(server);
    }

    public boolean isHealthy(String server) {
        var record = health.get(server);
        if (record == null) return false;
        return record.connected()
                && record.consecutiveFailures() < MAX_CONSECUTIVE_FAILURES
                && Duration.between(record.lastCheck(), clock.instant()).compareTo(MAX_AGE) < 0;
    }

    public List<String> getUnhealthyServers() {
        var unhealthy = new ArrayList<String>();
        for (var server : new TreeMap<>(health).keySet()) {
            if (!isHealthy(server)) unhealthy.add(server);
        }
        return unhealthy;
    }

    void sweep() {
        var now = clock.instant();
        health.entrySet().removeIf(e -> {
            boolean stale = Duration.between(e.getValue().lastCheck(), now).compareTo(STALE_AFTER) > 0;
            if (stale) log.debug("Dropping stale health record for '{}'", e.getKey());
            return stale;
        });
    }
}
