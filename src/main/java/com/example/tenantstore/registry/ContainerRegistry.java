package com.example.tenantstore.registry;

import com.example.tenantstore.key.EntityFamily;
import com.example.tenantstore.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the process-wide {@link DocumentStore} and memoizes one {@link ContainerHandle} per
 * entity family. Construct once at startup and pass to every repository.
 */
public class ContainerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ContainerRegistry.class);

    private final DocumentStore store;
    private final Clock clock;
    private final ConcurrentMap<EntityFamily, ContainerHandle> handles = new ConcurrentHashMap<>();

    public ContainerRegistry(DocumentStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Returns the handle for a family, resolving the container on first use. Concurrent first
     * callers block until the single resolution finishes; a failed resolution is not cached.
     */
    public ContainerHandle getHandle(EntityFamily family) {
        ContainerHandle handle = handles.get(family);
        if (handle != null) {
            return handle;
        }
        return handles.computeIfAbsent(family, this::resolve);
    }

    public boolean isResolved(EntityFamily family) {
        return handles.containsKey(family);
    }

    private ContainerHandle resolve(EntityFamily family) {
        logger.info("Resolving container {} for {}", family.getContainer(), family);
        store.resolveContainer(family.getContainer(), family.getKeyFields());
        return new ContainerHandle(family, store);
    }

    /**
     * Pings every family's container. Failures are reported in the result rather than thrown.
     * Only reads: unresolved containers are not created or indexed by a health check.
     */
    public HealthReport healthCheck() {
        Map<String, HealthReport.FamilyHealth> families = new LinkedHashMap<>();
        boolean allUp = true;
        for (EntityFamily family : EntityFamily.values()) {
            long start = System.nanoTime();
            String error = null;
            try {
                store.ping(family.getContainer());
            } catch (RuntimeException e) {
                logger.warn("Health check failed for {}: {}", family.getContainer(), e.getMessage());
                error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                allUp = false;
            }
            long latencyMs = (System.nanoTime() - start) / 1_000_000;
            families.put(family.name(), new HealthReport.FamilyHealth(
                    family.getContainer(), error == null ? HealthReport.UP : HealthReport.DOWN, latencyMs, error));
        }
        return HealthReport.builder()
                .status(allUp ? HealthReport.UP : HealthReport.DOWN)
                .checkedAt(clock.instant())
                .families(families)
                .build();
    }
}
