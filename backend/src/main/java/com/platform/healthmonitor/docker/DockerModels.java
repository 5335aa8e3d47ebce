package com.platform.healthmonitor.docker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * DTOs for the subset of the Docker Engine API used by the monitor.
 */
public class DockerModels {
    
    /**
     * Entry of {@code GET /containers/json}.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContainerSummary {
        @JsonProperty("Id")
        private String id;
        
        @JsonProperty("Names")
        private List<String> names;
        
        @JsonProperty("Labels")
        private Map<String, String> labels;
        
        @JsonProperty("State")
        private String state;
        
        /**
         * Primary name without the leading slash, or the short id when unnamed.
         */
        public String primaryName() {
            if (names != null && !names.isEmpty()) {
                String name = names.get(0);
                return name.startsWith("/") ? name.substring(1) : name;
            }
            return id != null && id.length() > 12 ? id.substring(0, 12) : id;
        }
    }
    
    /**
     * Body of {@code GET /containers/{name}/json}.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContainerInspect {
        @JsonProperty("Name")
        private String name;
        
        @JsonProperty("State")
        private ContainerState state;
        
        @JsonProperty("Config")
        private ContainerConfig config;
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContainerState {
        @JsonProperty("Status")
        private String status;
        
        @JsonProperty("Running")
        private boolean running;
        
        @JsonProperty("Health")
        private Health health;
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Health {
        @JsonProperty("Status")
        private String status;
        
        @JsonProperty("FailingStreak")
        private int failingStreak;
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContainerConfig {
        @JsonProperty("Tty")
        private boolean tty;
    }
}
