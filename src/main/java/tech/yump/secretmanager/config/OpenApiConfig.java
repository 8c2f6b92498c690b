package tech.yump.secretmanager.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.secretmanager.auth.StaticTokenAuthFilter;

@Configuration
public class OpenApiConfig {

    private static final String SECURITY_SCHEME_NAME = "OperatorTokenAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme apiKeyScheme = new SecurityScheme()
                .name(StaticTokenAuthFilter.API_TOKEN_HEADER)
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .description("Operator token ('" + StaticTokenAuthFilter.API_TOKEN_HEADER
                        + "'), required when secretmanager.auth.static-tokens.enabled=true.");

        return new OpenAPI()
                .info(new Info().title("Secret Manager").description("Secret storage backend diagnostics"))
                .components(new Components().addSecuritySchemes(SECURITY_SCHEME_NAME, apiKeyScheme))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME));
    }
}
