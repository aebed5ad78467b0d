package com.example.syncengine.job;

import com.example.syncengine.entity.JobKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class JobHandlerRegistry {

    private final Map<JobKind, JobHandler> handlers = new EnumMap<>(JobKind.class);

    public JobHandlerRegistry(List<JobHandler> jobHandlers) {
        for (JobHandler handler : jobHandlers) {
            for (JobKind kind : handler.supportedKinds()) {
                JobHandler previous = handlers.putIfAbsent(kind, handler);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate handlers for job kind " + kind + ": "
                            + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
                }
            }
        }
        log.info("✅ Registered job handlers for kinds={}", handlers.keySet());
    }

    public Optional<JobHandler> handlerFor(JobKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }
}
