package com.platform.healthmonitor.docker;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the project a container belongs to.
 * 
 * The Compose project label wins; otherwise the name prefix before the first dash,
 * following the {@code project-service-1} naming of Compose.
 */
public final class ProjectNameResolver {
    
    public static final String COMPOSE_PROJECT_LABEL = "com.docker.compose.project";
    public static final String UNKNOWN_PROJECT = "unknown";
    
    private static final Pattern NAME_PREFIX = Pattern.compile("^([^-]+)-");
    
    private ProjectNameResolver() {
    }
    
    public static String resolve(String containerName, Map<String, String> labels) {
        if (labels != null) {
            String project = labels.get(COMPOSE_PROJECT_LABEL);
            if (project != null && !project.isBlank()) {
                return project;
            }
        }
        
        if (containerName != null) {
            Matcher matcher = NAME_PREFIX.matcher(containerName);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return UNKNOWN_PROJECT;
    }
}
