package tech.yump.secretmanager.secrets.vault.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Creates one {@link RestTemplateVaultTransport} (with its own {@link RestTemplate}) per manager.
 */
@Slf4j
public class RestTemplateVaultTransportFactory implements VaultTransportFactory {

    private final RestTemplateBuilder restTemplateBuilder;
    private final ObjectMapper objectMapper;
    private final Duration connectTimeout;
    private final Duration readTimeout;

    public RestTemplateVaultTransportFactory(RestTemplateBuilder restTemplateBuilder, ObjectMapper objectMapper,
                                             Duration connectTimeout, Duration readTimeout) {
        this.restTemplateBuilder = restTemplateBuilder;
        this.objectMapper = objectMapper;
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    @Override
    public VaultTransport create(String address, Supplier<String> tokenSupplier) {
        log.debug("Creating Vault transport for {} (connect timeout {}, read timeout {})", address, connectTimeout, readTimeout);
        RestTemplate restTemplate = restTemplateBuilder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
        return new RestTemplateVaultTransport(restTemplate, address, tokenSupplier, objectMapper);
    }
}
