package tech.yump.secretmanager.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.secretmanager.audit.AuditBackend;
import tech.yump.secretmanager.audit.FileAuditBackend;
import tech.yump.secretmanager.audit.LogAuditBackend;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class AuditConfiguration {

    private final ObjectMapper objectMapper;

    @Bean
    @ConditionalOnProperty(name = "secretmanager.audit.backend", havingValue = "slf4j", matchIfMissing = true)
    public AuditBackend logAuditBackend() {
        log.info("Configuring SLF4J Audit Backend");
        return new LogAuditBackend(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "secretmanager.audit.backend", havingValue = "file")
    public AuditBackend fileAuditBackend() {
        // The file itself comes from logback-spring.xml (profile 'audit-file')
        log.info("Configuring File Audit Backend. Logger '{}' must be routed by Logback; path property '{}'.",
                FileAuditBackend.AUDIT_LOGGER_NAME, SecretManagerProperties.AuditProperties.FileAuditProperties.PATH_PROPERTY);
        return new FileAuditBackend(objectMapper);
    }
}
