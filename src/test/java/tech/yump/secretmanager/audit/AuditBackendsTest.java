package tech.yump.secretmanager.audit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuditBackendsTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private Logger fileAuditLogger;
    private Logger logBackendLogger;
    private ListAppender<ILoggingEvent> fileAppender;
    private ListAppender<ILoggingEvent> logAppender;

    @BeforeEach
    void attachAppenders() {
        fileAuditLogger = (Logger) LoggerFactory.getLogger(FileAuditBackend.AUDIT_LOGGER_NAME);
        logBackendLogger = (Logger) LoggerFactory.getLogger(LogAuditBackend.class);
        fileAppender = new ListAppender<>();
        logAppender = new ListAppender<>();
        fileAppender.start();
        logAppender.start();
        fileAuditLogger.addAppender(fileAppender);
        logBackendLogger.addAppender(logAppender);
    }

    @AfterEach
    void detachAppenders() {
        fileAuditLogger.detachAppender(fileAppender);
        logBackendLogger.detachAppender(logAppender);
    }

    private static AuditEvent sampleEvent() {
        return AuditEvent.builder()
                .timestamp(Instant.parse("2024-05-01T12:00:00Z"))
                .type("secret_operation")
                .action("delete_secret")
                .outcome("failure")
                .authInfo(AuditEvent.AuthInfo.builder().principal("system").build())
                .data(Map.of("vault_path", "secret/metadata/archestra/api-1"))
                .build();
    }

    @Test
    @DisplayName("File backend writes one JSON object per event on the dedicated logger")
    void fileBackend_writesJsonLine() throws Exception {
        new FileAuditBackend(objectMapper).logEvent(sampleEvent());

        assertThat(fileAppender.list).hasSize(1);
        ILoggingEvent logged = fileAppender.list.get(0);
        assertThat(logged.getLevel()).isEqualTo(Level.INFO);

        JsonNode json = objectMapper.readTree(logged.getFormattedMessage());
        assertThat(json.path("action").asText()).isEqualTo("delete_secret");
        assertThat(json.path("authInfo").path("principal").asText()).isEqualTo("system");
        assertThat(json.path("data").path("vault_path").asText()).isEqualTo("secret/metadata/archestra/api-1");
        assertThat(json.has("requestInfo")).isFalse();
    }

    @Test
    @DisplayName("File backend writes nothing to the audit file when serialization fails")
    void fileBackend_serializationFailure() {
        // Plain ObjectMapper cannot serialize Instant
        new FileAuditBackend(new ObjectMapper()).logEvent(sampleEvent());

        assertThat(fileAppender.list).isEmpty();
    }

    @Test
    @DisplayName("Log backend prefixes events with AUDIT_EVENT")
    void logBackend_prefixesEvent() {
        new LogAuditBackend(objectMapper).logEvent(sampleEvent());

        assertThat(logAppender.list).hasSize(1);
        assertThat(logAppender.list.get(0).getFormattedMessage())
                .startsWith("AUDIT_EVENT: {")
                .contains("\"outcome\":\"failure\"");
    }

    @Test
    @DisplayName("Log backend falls back to type/action/outcome when serialization fails")
    void logBackend_fallback() {
        new LogAuditBackend(new ObjectMapper()).logEvent(sampleEvent());

        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message)
                        .isEqualTo("AUDIT_EVENT_FALLBACK: type=secret_operation, action=delete_secret, outcome=failure"));
    }

    @Test
    void nullEvent_ignored() {
        new FileAuditBackend(objectMapper).logEvent(null);
        new LogAuditBackend(objectMapper).logEvent(null);

        assertThat(fileAppender.list).isEmpty();
        assertThat(logAppender.list).extracting(ILoggingEvent::getLevel).containsOnly(Level.WARN);
    }
}
