package io.autopilot4j.config;

import io.autopilot4j.Autopilot;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges Autopilot start/stop lifecycle with the Spring container lifecycle.
 */
public class AutopilotLifecycle implements SmartLifecycle {
    private final Autopilot autopilot;
    private final boolean autoStartup;
    private volatile boolean running = false;

    public AutopilotLifecycle(Autopilot autopilot, boolean autoStartup) {
        this.autopilot = autopilot;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        autopilot.start();
        running = true;
    }

    @Override
    public void stop() {
        autopilot.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
