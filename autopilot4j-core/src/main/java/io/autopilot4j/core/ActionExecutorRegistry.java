package io.autopilot4j.core;

import io.autopilot4j.ActionExecutor;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public class ActionExecutorRegistry {

    private final Map<String, ActionExecutor<?>> executorsByType;

    public ActionExecutorRegistry(List<ActionExecutor<?>> executors) {
        this.executorsByType = executors.stream()
                .collect(Collectors.toUnmodifiableMap(
                        ActionExecutor::jobType,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate ActionExecutor for job type: " + a.jobType());
                        }
                ));
    }

    public Optional<ActionExecutor<?>> find(String jobType) {
        return Optional.ofNullable(executorsByType.get(jobType));
    }

    public ActionExecutor<?> getRequired(String jobType) {
        ActionExecutor<?> executor = executorsByType.get(jobType);
        if (executor == null) {
            throw new IllegalStateException("No ActionExecutor registered for job type: " + jobType);
        }
        return executor;
    }

    public Set<String> jobTypes() {
        return executorsByType.keySet();
    }
}
