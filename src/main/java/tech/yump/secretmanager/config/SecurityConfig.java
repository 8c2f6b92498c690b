package tech.yump.secretmanager.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import tech.yump.secretmanager.audit.AuditBackend;
import tech.yump.secretmanager.auth.StaticTokenAuthFilter;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

  private final SecretManagerProperties properties;
  private final AuditBackend auditBackend;

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    SecretManagerProperties.AuthProperties.StaticTokenAuthProperties staticTokens =
            properties.auth() != null ? properties.auth().staticTokens() : null;
    boolean staticAuthEnabled = staticTokens != null && staticTokens.enabled();

    http
            .csrf(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            // Also assigns request ids, so it is installed even with auth disabled
            .addFilterBefore(new StaticTokenAuthFilter(staticTokens, auditBackend), UsernamePasswordAuthenticationFilter.class);

    if (staticAuthEnabled) {
      log.info("Operator token authentication enabled for /api/**.");
      http.authorizeHttpRequests(authz -> authz
              .requestMatchers("/api/**").hasRole("OPERATOR")
              .anyRequest().permitAll());
    } else {
      log.warn("Operator token authentication is disabled (secretmanager.auth.static-tokens.enabled=false). "
              + "Diagnostics endpoints are accessible without authentication. THIS IS INSECURE FOR PRODUCTION.");
      http.authorizeHttpRequests(authz -> authz.anyRequest().permitAll());
    }

    return http.build();
  }
}
