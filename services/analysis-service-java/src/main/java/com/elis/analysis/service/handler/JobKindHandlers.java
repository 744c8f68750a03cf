package com.elis.analysis.service.handler;

import com.elis.analysis.model.JobKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class JobKindHandlers {

    private static final Logger log = LoggerFactory.getLogger(JobKindHandlers.class);

    private final Map<JobKind, JobKindHandler> registry = new EnumMap<>(JobKind.class);

    public JobKindHandlers(List<JobKindHandler> handlers) {
        for (JobKindHandler handler : handlers) {
            JobKindHandler existing = registry.put(handler.kind(), handler);
            if (existing != null) {
                throw new IllegalStateException("Duplicate handlers for " + handler.kind() + ": "
                        + existing.getClass().getName() + " and " + handler.getClass().getName());
            }
        }
        for (JobKind kind : JobKind.values()) {
            if (!registry.containsKey(kind)) {
                throw new IllegalStateException("No handler registered for " + kind);
            }
        }
        log.info("Registered handlers for {}", registry.keySet());
    }

    public JobKindHandler forKind(JobKind kind) {
        return registry.get(kind);
    }
}
