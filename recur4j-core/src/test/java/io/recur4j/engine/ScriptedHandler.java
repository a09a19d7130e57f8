package io.recur4j.engine;

import io.recur4j.JobHandler;
import io.recur4j.core.JobType;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handler whose body is swapped per test.
 */
public class ScriptedHandler implements JobHandler<Map<String, Object>> {

    private final JobType type;
    private volatile Callable<String> body = () -> "ok";
    private final AtomicInteger invocations = new AtomicInteger();
    private volatile Map<String, Object> lastPayload;

    public ScriptedHandler() {
        this(JobType.CUSTOM);
    }

    public ScriptedHandler(JobType type) {
        this.type = type;
    }

    public void body(Callable<String> body) {
        this.body = body;
    }

    public int invocations() {
        return invocations.get();
    }

    public Map<String, Object> lastPayload() {
        return lastPayload;
    }

    @Override
    public JobType type() {
        return type;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Class<Map<String, Object>> payloadClass() {
        return (Class<Map<String, Object>>) (Class<?>) Map.class;
    }

    @Override
    public String execute(Map<String, Object> payload) throws Exception {
        invocations.incrementAndGet();
        lastPayload = payload;
        return body.call();
    }
}
