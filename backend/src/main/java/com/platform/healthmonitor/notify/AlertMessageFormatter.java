package com.platform.healthmonitor.notify;

import com.platform.healthmonitor.config.HealthMonitorProperties;
import com.platform.healthmonitor.model.Alert;
import com.platform.healthmonitor.model.EntityStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Renders alerts as plain-text messages for human operators.
 */
@Component
public class AlertMessageFormatter {
    
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    
    private final String serverName;
    private final ZoneId zone;
    
    @Autowired
    public AlertMessageFormatter(HealthMonitorProperties properties) {
        this(properties.getAlert().getServerName(), ZoneId.systemDefault());
    }
    
    public AlertMessageFormatter(String serverName, ZoneId zone) {
        this.serverName = serverName;
        this.zone = zone;
    }
    
    public String subject(Alert alert) {
        String marker = alert.severity() == Alert.Severity.INFO ? "[OK]" : "!?";
        return String.format("%s %s: [%s] %s - Health Status Changed",
            marker, alert.severity(), alert.group(), alert.entityId());
    }
    
    public String body(Alert alert) {
        StringBuilder body = new StringBuilder();
        body.append("Docker Container Health Alert\n")
            .append("==============================\n\n")
            .append(line("Server:", serverName))
            .append(line("Project:", alert.group()))
            .append(line("Container:", alert.entityId()))
            .append(line("Status Change:", alert.statusChange()))
            .append(line("Severity:", alert.severity().name()))
            .append(line("Time:", TIME_FORMAT.format(alert.timestamp().atZone(zone))))
            .append("\nDetails:\n--------\n")
            .append(alert.details())
            .append("\n\nAction Required:\n----------------\n")
            .append(actionSteps(alert))
            .append("\n\nProject Context:\n----------------\n")
            .append("Container name: ").append(alert.entityId()).append('\n')
            .append("Project name:   ").append(alert.group()).append('\n')
            .append("Status:         ").append(alert.status().getWireValue()).append('\n')
            .append("\n---\n")
            .append("Automated alert from Multi-Project Docker Health Monitor\n")
            .append("Server: ").append(serverName).append('\n')
            .append("Monitoring all containers with healthchecks\n");
        return body.toString();
    }
    
    private String actionSteps(Alert alert) {
        String container = alert.entityId();
        String project = alert.group();
        
        if (alert.status() == EntityStatus.UNHEALTHY) {
            return String.join("\n",
                "1. Check container logs:",
                "   docker logs " + container,
                "",
                "2. Inspect container:",
                "   docker inspect " + container,
                "",
                "3. Restart container:",
                "   docker restart " + container,
                "",
                "   Or navigate to project and restart:",
                "   cd /path/to/" + project,
                "   docker compose restart",
                "",
                "4. Check application health endpoint",
                "",
                "5. Review recent code changes or deployments");
        }
        if (alert.status() == EntityStatus.NOT_FOUND) {
            return String.join("\n",
                "1. Check if container is running:",
                "   docker ps -a | grep " + container,
                "",
                "2. Navigate to project directory:",
                "   cd /path/to/" + project,
                "",
                "3. Check docker-compose status:",
                "   docker compose ps",
                "",
                "4. Restart services:",
                "   docker compose up -d",
                "",
                "5. Check docker-compose.yml configuration");
        }
        return "Monitor the situation and check logs for more information.";
    }
    
    private static String line(String label, String value) {
        return String.format("%-17s%s%n", label, value);
    }
}
