package com.platform.healthmonitor.probe;

import com.platform.healthmonitor.error.EntityNotFoundException;
import com.platform.healthmonitor.error.ProbeSourceException;
import com.platform.healthmonitor.model.EntityDescriptor;
import com.platform.healthmonitor.model.EntityStatus;

import java.util.List;
import java.util.Optional;

/**
 * Source of container listings and point-in-time health observations.
 * Implementations must be thread-safe: probes run concurrently on the worker pool.
 */
public interface ProbeSource {
    
    /**
     * List the containers currently running.
     * 
     * @throws ProbeSourceException if the listing could not be retrieved
     */
    List<EntityDescriptor> listEntities();
    
    /**
     * Probe the health of one container.
     * 
     * @return HEALTHY, STARTING or UNHEALTHY; empty when the container has no healthcheck
     * @throws EntityNotFoundException if the container vanished
     * @throws ProbeSourceException on transport failure
     */
    Optional<EntityStatus> probe(String entityId);
    
    /**
     * Recent log output of a container. Best effort: failures are described in
     * the returned text instead of thrown.
     */
    String recentDiagnostics(String entityId, int maxLines);
}
