package com.example.jobrunner.service.handler;

import com.example.jobrunner.domain.enums.TaskType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Resolves the {@code task_type} code stored on a task row to its handler.
 * <p>
 * One handler per {@link TaskType}; types left without a handler are reported at startup
 * and fail at dispatch.
 */
@Slf4j
@Component
public class TaskHandlerRegistry {

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);
    private final List<TaskHandler> handlerBeans;

    public TaskHandlerRegistry(List<TaskHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var previous = handlers.put(handler.getTaskType(), handler);
            if (previous != null) {
                log.warn("Task type {} handled by both {} and {}; using {}", handler.getTaskType(),
                        previous.getClass().getSimpleName(), handler.getClass().getSimpleName(),
                        handler.getClass().getSimpleName());
            }
        }

        var unhandled = handlers.isEmpty() ? EnumSet.allOf(TaskType.class) : EnumSet.complementOf(EnumSet.copyOf(handlers.keySet()));
        log.info("Task handlers registered for {}", handlers.keySet());
        if (!unhandled.isEmpty()) {
            log.warn("No handler registered for task types {}; such tasks will fail", unhandled);
        }
    }

    /**
     * Handler for a stored task type code
     *
     * @throws IllegalArgumentException if the code is unknown or has no handler
     */
    public TaskHandler resolve(String taskTypeCode) {
        var taskType = TaskType.fromCode(taskTypeCode);
        var handler = handlers.get(taskType);
        if (handler == null) {
            throw new IllegalArgumentException("No handler registered for task type: " + taskTypeCode);
        }
        return handler;
    }
}
