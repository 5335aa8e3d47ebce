package com.platform.healthmonitor.notify;

import com.platform.healthmonitor.config.HealthMonitorProperties;
import com.platform.healthmonitor.error.NotificationException;
import com.platform.healthmonitor.model.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.stereotype.Component;

import java.util.Properties;

/**
 * Sends alerts as plain-text e-mail through the configured SMTP server.
 * SMTP connection settings come from the standard {@code spring.mail.*} properties.
 * Port 465 uses implicit SSL unless {@code mail.smtp.ssl.enable} is set explicitly;
 * other ports keep the configured STARTTLS setting.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "healthmonitor.alert.email.enabled", havingValue = "true", matchIfMissing = true)
public class EmailAlertNotifier implements AlertNotifier {
    
    static final int IMPLICIT_SSL_PORT = 465;
    static final String SSL_ENABLE = "mail.smtp.ssl.enable";
    static final String STARTTLS_ENABLE = "mail.smtp.starttls.enable";
    
    private final JavaMailSender mailSender;
    private final AlertMessageFormatter formatter;
    private final String from;
    
    public EmailAlertNotifier(
            JavaMailSender mailSender,
            AlertMessageFormatter formatter,
            HealthMonitorProperties properties,
            @Value("${spring.mail.username:}") String smtpUser) {
        this.mailSender = mailSender;
        this.formatter = formatter;
        String configuredFrom = properties.getAlert().getEmail().getFrom();
        this.from = configuredFrom != null && !configuredFrom.isBlank() ? configuredFrom : smtpUser;
        
        if (mailSender instanceof JavaMailSenderImpl smtpSender) {
            configureTransportSecurity(smtpSender);
        }
    }
    
    static void configureTransportSecurity(JavaMailSenderImpl smtpSender) {
        Properties mailProperties = smtpSender.getJavaMailProperties();
        if (smtpSender.getPort() == IMPLICIT_SSL_PORT && !mailProperties.containsKey(SSL_ENABLE)) {
            mailProperties.setProperty(SSL_ENABLE, "true");
            mailProperties.setProperty(STARTTLS_ENABLE, "false");
            log.info("SMTP port {} detected, using implicit SSL", IMPLICIT_SSL_PORT);
        }
    }
    
    @Override
    public String channel() {
        return "email";
    }
    
    @Override
    public void notify(Alert alert) {
        SimpleMailMessage message = new SimpleMailMessage();
        if (from != null && !from.isBlank()) {
            message.setFrom(from);
        }
        message.setTo(alert.recipients().toArray(String[]::new));
        message.setSubject(formatter.subject(alert));
        message.setText(formatter.body(alert));
        
        try {
            mailSender.send(message);
            log.debug("Alert e-mail for {} handed to SMTP server", alert.entityId());
        } catch (MailException e) {
            throw new NotificationException(channel(), 
                "Failed to send alert e-mail for " + alert.entityId() + ": " + e.getMessage(), e);
        }
    }
}
