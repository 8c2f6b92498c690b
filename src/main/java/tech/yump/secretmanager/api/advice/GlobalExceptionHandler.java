package tech.yump.secretmanager.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.secretmanager.audit.AuditHelper;
import tech.yump.secretmanager.secrets.ConnectivityCheckNotSupportedException;
import tech.yump.secretmanager.secrets.SecretManagerException;
import tech.yump.secretmanager.secrets.SecretsManagerConfigurationException;
import tech.yump.secretmanager.secrets.vault.VaultAccessException;
import tech.yump.secretmanager.secrets.vault.VaultAuthenticationException;
import tech.yump.secretmanager.storage.StorageException;

import java.util.Map;

/**
 * Maps failures to RFC 7807 problem details and audits each one. Vault detail never reaches the body:
 * the managers' exception messages are already the generic, caller-safe ones.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    static final String CONFIGURATION_MESSAGE = "The secrets backend is not configured correctly. Contact your administrator.";
    static final String STORAGE_MESSAGE = "An error occurred while accessing secret storage.";
    static final String UNEXPECTED_MESSAGE = "An unexpected internal error occurred.";

    private final AuditHelper auditHelper;

    @ExceptionHandler(ConnectivityCheckNotSupportedException.class)
    public ResponseEntity<ProblemDetail> handleNotSupported(ConnectivityCheckNotSupportedException ex, HttpServletRequest request) {
        log.info("Connectivity check not supported: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return respond(HttpStatus.NOT_IMPLEMENTED, "Not Supported", ex.getMessage(), AuditHelper.SECRET_OPERATION, request);
    }

    @ExceptionHandler({VaultAuthenticationException.class, VaultAccessException.class})
    public ResponseEntity<ProblemDetail> handleVaultFailure(SecretManagerException ex, HttpServletRequest request) {
        // Root cause was logged with full detail by the manager
        log.warn("Vault operation failed ({}). Request: {} {}", ex.getClass().getSimpleName(), request.getMethod(), request.getRequestURI());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Secrets Backend Error", ex.getMessage(), AuditHelper.SECRET_OPERATION, request);
    }

    @ExceptionHandler(SecretsManagerConfigurationException.class)
    public ResponseEntity<ProblemDetail> handleConfiguration(SecretsManagerConfigurationException ex, HttpServletRequest request) {
        log.error("Secrets backend misconfigured: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Configuration Error", CONFIGURATION_MESSAGE, AuditHelper.SECRET_OPERATION, request);
    }

    @ExceptionHandler({SecretManagerException.class, StorageException.class})
    public ResponseEntity<ProblemDetail> handleSecretManagerException(RuntimeException ex, HttpServletRequest request) {
        log.error("Secret storage error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Secret Storage Error", STORAGE_MESSAGE, AuditHelper.SECRET_OPERATION, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), "request_validation", request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {
        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}", request.getDescription(false), ex.getMessage());

        if (request instanceof ServletWebRequest servletWebRequest) {
            audit("request_validation", servletWebRequest.getRequest(), status.value(), message);
        }
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", UNEXPECTED_MESSAGE, "system_error", request);
    }

    private ResponseEntity<ProblemDetail> respond(HttpStatus status, String title, String detail, String eventType,
                                                  HttpServletRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        audit(eventType, request, status.value(), detail);
        return ResponseEntity.status(status).body(problemDetail);
    }

    private void audit(String eventType, HttpServletRequest request, int status, String message) {
        auditHelper.logHttpEvent(eventType, determineAction(request), "failure", status, message,
                Map.of("path", request.getRequestURI()));
    }

    private static String determineAction(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.endsWith("/api/secrets/check-connectivity")) return "check_connectivity";
        if (path.endsWith("/api/secrets/type")) return "get_secrets_type";
        if (path.endsWith("/api/secrets/features")) return "get_secrets_features";
        return "unknown";
    }
}
