package tech.yump.secretmanager.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes audit events as JSON lines to the application log at INFO.
 */
@Slf4j
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    static final String EVENT_PREFIX = "AUDIT_EVENT: ";

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        try {
            log.info(EVENT_PREFIX + "{}", objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize AuditEvent to JSON. Logging type/action/outcome only.", e);
            log.info("AUDIT_EVENT_FALLBACK: type={}, action={}, outcome={}", event.type(), event.action(), event.outcome());
        }
    }
}
