package io.recur4j.config;

import io.recur4j.engine.SchedulerEngine;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the scheduler engine once the context is refreshed and stops it, draining in-flight
 * runs, when the context closes.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final SchedulerEngine engine;

    public SchedulerLifecycle(SchedulerEngine engine) {
        this.engine = engine;
    }

    @Override
    public void start() {
        engine.start();
    }

    @Override
    public void stop() {
        engine.stop();
    }

    @Override
    public boolean isRunning() {
        return engine.isStarted();
    }

    // last to start, first to stop
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
