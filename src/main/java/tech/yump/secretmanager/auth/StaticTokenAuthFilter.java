package tech.yump.secretmanager.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.secretmanager.audit.AuditBackend;
import tech.yump.secretmanager.audit.AuditEvent;
import tech.yump.secretmanager.config.SecretManagerProperties.AuthProperties.StaticToken;
import tech.yump.secretmanager.config.SecretManagerProperties.AuthProperties.StaticTokenAuthProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Tags every request with an id (request attribute and MDC) and, when enabled, authenticates
 * operators by the {@value #API_TOKEN_HEADER} header.
 * <p>
 * An unknown token is audited and the request continues unauthenticated; authorization rules in
 * {@code SecurityConfig} reject it.
 */
@Slf4j
public class StaticTokenAuthFilter extends OncePerRequestFilter {

  public static final String API_TOKEN_HEADER = "X-Api-Token";
  public static final String REQUEST_ID_ATTR = "auditRequestId";
  public static final String MDC_REQUEST_ID_KEY = "requestId";
  public static final String OPERATOR_ROLE = "ROLE_OPERATOR";

  private final boolean staticAuthEnabled;
  private final List<StaticToken> tokens;
  private final AuditBackend auditBackend;

  public StaticTokenAuthFilter(StaticTokenAuthProperties staticTokenProps, AuditBackend auditBackend) {
    this.staticAuthEnabled = staticTokenProps != null && staticTokenProps.enabled();
    this.tokens = Optional.ofNullable(staticTokenProps)
            .map(StaticTokenAuthProperties::tokens)
            .orElse(Collections.emptyList());
    this.auditBackend = auditBackend;

    log.debug("StaticTokenAuthFilter initialized. Enabled: {}, Tokens: {}", staticAuthEnabled, tokens.size());
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    String requestId = UUID.randomUUID().toString();
    request.setAttribute(REQUEST_ID_ATTR, requestId);
    MDC.put(MDC_REQUEST_ID_KEY, requestId);

    try {
      if (staticAuthEnabled) {
        authenticate(request);
      }
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID_KEY);
    }
  }

  private void authenticate(HttpServletRequest request) {
    String header = request.getHeader(API_TOKEN_HEADER);
    if (!StringUtils.hasText(header) || SecurityContextHolder.getContext().getAuthentication() != null) {
      log.trace("No {} header or already authenticated for {}", API_TOKEN_HEADER, request.getRequestURI());
      return;
    }

    String provided = header.trim();
    Optional<StaticToken> match = tokens.stream()
            .filter(candidate -> constantTimeEquals(candidate.token(), provided))
            .findFirst();

    if (match.isEmpty()) {
      log.warn("Invalid or unknown operator token received for URI: {}", request.getRequestURI());
      audit("failure", null, request, Map.of("reason", "invalid_token"));
      return;
    }

    String operator = match.get().name();
    List<GrantedAuthority> authorities = List.of(new SimpleGrantedAuthority(OPERATOR_ROLE));
    UsernamePasswordAuthenticationToken authentication =
            new UsernamePasswordAuthenticationToken(operator, null, authorities);
    authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
    SecurityContextHolder.getContext().setAuthentication(authentication);

    log.debug("Authenticated operator '{}' for URI: {}", operator, request.getRequestURI());
    audit("success", operator, request, null);
  }

  private void audit(String outcome, String principal, HttpServletRequest request, Map<String, Object> data) {
    try {
      AuditEvent.AuthInfo.AuthInfoBuilder authInfo = AuditEvent.AuthInfo.builder()
              .principal(principal)
              .sourceAddress(request.getRemoteAddr());
      if (principal != null) {
        authInfo.metadata(Map.of("roles", List.of("OPERATOR")));
      }

      AuditEvent event = AuditEvent.builder()
              .timestamp(Instant.now())
              .type("auth")
              .action("token_validation")
              .outcome(outcome)
              .authInfo(authInfo.build())
              .requestInfo(AuditEvent.RequestInfo.builder()
                      .requestId((String) request.getAttribute(REQUEST_ID_ATTR))
                      .httpMethod(request.getMethod())
                      .path(request.getRequestURI())
                      .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
                      .build())
              .data(data)
              .build();
      auditBackend.logEvent(event);
    } catch (Exception e) {
      log.error("Failed to log audit event in StaticTokenAuthFilter: {}", e.getMessage(), e);
    }
  }

  private static boolean constantTimeEquals(String expected, String provided) {
    return expected != null && MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
  }
}
