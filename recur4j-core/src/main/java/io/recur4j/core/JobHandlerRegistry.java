package io.recur4j.core;

import io.recur4j.JobHandler;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.HashSet;
import java.util.Set;

/**
 * Handlers keyed by {@link JobType}, built once at startup.
 *
 * <p>A type without its own handler resolves to the {@link JobType#CUSTOM} handler, which
 * must therefore be registered.
 */
public class JobHandlerRegistry {

    private final Map<JobType, JobHandler<?>> handlersByType;

    public JobHandlerRegistry(List<? extends JobHandler<?>> handlers) {
        Map<JobType, JobHandler<?>> byType = new EnumMap<>(JobType.class);
        for (JobHandler<?> h : handlers) {
            JobType type = h.type();
            if (type == null) {
                throw new IllegalStateException("JobHandler has no type: " + h.getClass().getName());
            }
            if (byType.putIfAbsent(type, h) != null) {
                throw new IllegalStateException("Duplicate JobHandler type: " + type.value());
            }
        }
        if (!byType.containsKey(JobType.CUSTOM)) {
            throw new IllegalStateException("No JobHandler registered for default type: " + JobType.CUSTOM.value());
        }
        this.handlersByType = Map.copyOf(byType);
    }

    /**
     * Registry over {@code builtIns}, with each of {@code overrides} replacing the built-in of
     * the same type. Overrides must not repeat a type among themselves.
     */
    public static JobHandlerRegistry withOverrides(List<? extends JobHandler<?>> builtIns,
                                                   List<? extends JobHandler<?>> overrides) {
        Map<JobType, JobHandler<?>> merged = new LinkedHashMap<>();
        for (JobHandler<?> h : builtIns) {
            merged.put(h.type(), h);
        }
        Set<JobType> seen = new HashSet<>();
        for (JobHandler<?> h : overrides) {
            if (!seen.add(h.type())) {
                throw new IllegalStateException("Duplicate JobHandler type: " + h.type().value());
            }
            merged.put(h.type(), h);
        }
        return new JobHandlerRegistry(new ArrayList<>(merged.values()));
    }

    public JobHandler<?> resolve(JobType type) {
        JobHandler<?> handler = type == null ? null : handlersByType.get(type);
        return handler != null ? handler : handlersByType.get(JobType.CUSTOM);
    }

    public boolean hasHandler(JobType type) {
        return handlersByType.containsKey(type);
    }
}
