package tech.yump.secretmanager.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import tech.yump.secretmanager.audit.AuditBackend;
import tech.yump.secretmanager.audit.AuditHelper;
import tech.yump.secretmanager.audit.FileAuditBackend;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * With the file backend and the 'audit-file' profile, events go to the audit file only.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@TestPropertySource(properties = {
        "secretmanager.audit.backend=file",
        "secretmanager.audit.file.path=target/test-audit/integration-audit.log"
})
@ActiveProfiles({"test", "audit-file"})
@ExtendWith(OutputCaptureExtension.class)
@DisplayName("Integration Test: File Audit Backend")
class FileAuditBackendIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgresContainer = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("testdb")
            .withUsername("testuser")
            .withPassword("testpassword");

    @DynamicPropertySource
    static void postgresProperties(DynamicPropertyRegistry registry) {
        registry.add("secretmanager.database.connection-url", postgresContainer::getJdbcUrl);
        registry.add("secretmanager.database.username", postgresContainer::getUsername);
        registry.add("secretmanager.database.password", postgresContainer::getPassword);
    }

    private static final Path auditLogPath = Paths.get("target/test-audit/integration-audit.log");

    // Logback opens the file while the context starts
    static {
        try {
            Files.createDirectories(auditLogPath.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create test audit directory", e);
        }
    }

    @Autowired
    private AuditBackend auditBackend;
    @Autowired
    private AuditHelper auditHelper;

    @AfterEach
    void cleanupLogFile() throws IOException {
        Files.deleteIfExists(auditLogPath);
    }

    @Test
    void shouldUseFileAuditBackendAndLogToFile(CapturedOutput output) {
        assertThat(auditBackend).isInstanceOf(FileAuditBackend.class);

        String eventId = UUID.randomUUID().toString();
        auditHelper.logInternalEvent("test_file", "write_log", "success", "tester", Map.of("id", eventId));

        await().atMost(10, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(auditLogPath).exists().content().contains(eventId));

        assertThat(auditLogPath).content()
                .startsWith("{")
                .endsWith("}\n")
                .contains("\"type\":\"test_file\"")
                .contains("\"action\":\"write_log\"")
                .contains("\"outcome\":\"success\"")
                .contains("\"principal\":\"tester\"");

        assertThat(output.getOut())
                .doesNotContain("AUDIT_EVENT:")
                .doesNotContain(eventId);
    }
}
