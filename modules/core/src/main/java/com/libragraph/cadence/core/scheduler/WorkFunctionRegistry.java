package com.libragraph.cadence.core.scheduler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@ApplicationScoped
public class WorkFunctionRegistry {

    private static final Logger log = Logger.getLogger(WorkFunctionRegistry.class);

    private final Map<String, WorkFunction> registry = new HashMap<>();

    @Inject
    public WorkFunctionRegistry(Instance<WorkFunction> functions) {
        this((Iterable<WorkFunction>) functions);
    }

    public WorkFunctionRegistry(Iterable<WorkFunction> functions) {
        for (WorkFunction fn : functions) {
            String ref = fn.workRef();
            WorkFunction existing = registry.put(ref, fn);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate work function '" + ref + "': " +
                                existing.getClass().getName() + " and " + fn.getClass().getName());
            }
            log.infof("Registered work function: %s -> %s", ref, fn.getClass().getSimpleName());
        }
        log.infof("WorkFunctionRegistry initialized with %d functions", registry.size());
    }

    public Optional<WorkFunction> lookup(String workRef) {
        return Optional.ofNullable(registry.get(workRef));
    }

    public WorkFunction require(String workRef) {
        return lookup(workRef).orElseThrow(() -> new UnknownWorkFunctionException(workRef));
    }
}
