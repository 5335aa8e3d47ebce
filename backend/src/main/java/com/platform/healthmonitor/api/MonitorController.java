package com.platform.healthmonitor.api;

import com.platform.healthmonitor.error.ResourceNotFoundException;
import com.platform.healthmonitor.lifecycle.ApplicationLifecycleManager;
import com.platform.healthmonitor.model.EntityRecord;
import com.platform.healthmonitor.probe.PassSummary;
import com.platform.healthmonitor.probe.ProbeScheduler;
import com.platform.healthmonitor.retry.RetryScheduler;
import com.platform.healthmonitor.state.EntityStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

/**
 * Read access to tracked containers and armed retries, plus on-demand passes.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
@RequiredArgsConstructor
public class MonitorController {
    
    private final EntityStateStore stateStore;
    private final RetryScheduler retryScheduler;
    private final ProbeScheduler probeScheduler;
    private final ApplicationLifecycleManager lifecycleManager;
    
    @GetMapping("/entities")
    public ResponseEntity<List<EntityRecord>> getEntities() {
        return ResponseEntity.ok(stateStore.snapshot());
    }
    
    @GetMapping("/entities/{entityId}")
    public ResponseEntity<EntityRecord> getEntity(@PathVariable String entityId) {
        return stateStore.get(entityId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new ResourceNotFoundException("Container", entityId));
    }
    
    @GetMapping("/retries")
    public ResponseEntity<Set<String>> getRetries() {
        return ResponseEntity.ok(retryScheduler.activeRetries());
    }
    
    /**
     * Run a probe pass now. Answers 409 once shutdown has begun.
     */
    @PostMapping("/passes")
    public ResponseEntity<PassSummary> runPass() {
        log.info("Manual probe pass requested");
        return ResponseEntity.ok(probeScheduler.runOnce());
    }
    
    @GetMapping("/status")
    public ResponseEntity<MonitorStatus> getStatus() {
        return ResponseEntity.ok(new MonitorStatus(
            lifecycleManager.getCurrentPhase(),
            stateStore.size(),
            retryScheduler.activeRetries().size(),
            probeScheduler.getLastSummary().orElse(null)
        ));
    }
    
    public record MonitorStatus(
        ApplicationLifecycleManager.LifecyclePhase phase,
        int trackedEntities,
        int activeRetries,
        PassSummary lastPass
    ) {}
}
