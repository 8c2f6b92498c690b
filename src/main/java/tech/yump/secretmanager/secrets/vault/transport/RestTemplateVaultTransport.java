package tech.yump.secretmanager.secrets.vault.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link VaultTransport} over Spring's {@link RestTemplate}, speaking Vault's JSON HTTP API.
 */
@Slf4j
public class RestTemplateVaultTransport implements VaultTransport {

    static final String TOKEN_HEADER = "X-Vault-Token";

    private final RestTemplate restTemplate;
    private final String address;
    private final Supplier<String> tokenSupplier;
    private final ObjectMapper objectMapper;

    public RestTemplateVaultTransport(RestTemplate restTemplate, String address,
                                      Supplier<String> tokenSupplier, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.address = address;
        this.tokenSupplier = tokenSupplier;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode read(String path) {
        return exchange(HttpMethod.GET, uri(path, false), null, path);
    }

    @Override
    public JsonNode write(String path, Map<String, ?> payload) {
        return exchange(HttpMethod.POST, uri(path, false), payload, path);
    }

    @Override
    public void delete(String path) {
        exchange(HttpMethod.DELETE, uri(path, false), null, path);
    }

    @Override
    public List<String> list(String path) {
        JsonNode body = exchange(HttpMethod.GET, uri(path, true), null, path);
        List<String> keys = new ArrayList<>();
        body.path("data").path("keys").forEach(key -> keys.add(key.asText()));
        return keys;
    }

    @Override
    public JsonNode kubernetesLogin(String mountPoint, String role, String jwt) {
        String path = "auth/" + mountPoint + "/login";
        return exchange(HttpMethod.POST, uri(path, false), Map.of("role", role, "jwt", jwt), path);
    }

    private JsonNode exchange(HttpMethod method, URI uri, Object body, String path) {
        log.debug("Vault request: {} {}", method, path);
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(uri, method, new HttpEntity<>(body, headers()), JsonNode.class);
            return response.getBody() != null ? response.getBody() : MissingNode.getInstance();
        } catch (RestClientResponseException e) {
            // Includes statuses Spring does not know
            int status = e.getStatusCode().value();
            log.debug("Vault answered {} for {} {}", status, method, path);
            throw new VaultTransportException("Vault " + method + " " + path + " failed with status " + status,
                    status, parseErrors(e.getResponseBodyAsString()), e);
        } catch (ResourceAccessException e) {
            log.debug("Vault unreachable for {} {}: {}", method, path, e.getMessage());
            throw new VaultTransportException("Vault " + method + " " + path + " failed: " + e.getMessage(),
                    0, List.of(), e);
        } catch (RestClientException e) {
            // e.g. a non-JSON 2xx answer from a proxy in front of Vault
            log.debug("Unusable Vault response for {} {}: {}", method, path, e.getMessage());
            throw new VaultTransportException("Vault " + method + " " + path + " returned an unusable response: " + e.getMessage(),
                    0, List.of(), e);
        }
    }

    private URI uri(String path, boolean list) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(address)
                .path("/v1/")
                .path(path);
        if (list) {
            builder.queryParam("list", "true");
        }
        return builder.build().encode().toUri();
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        String token = tokenSupplier.get();
        if (StringUtils.hasText(token)) {
            headers.set(TOKEN_HEADER, token);
        }
        return headers;
    }

    private List<String> parseErrors(String responseBody) {
        if (!StringUtils.hasText(responseBody)) {
            return List.of();
        }
        List<String> errors = new ArrayList<>();
        try {
            objectMapper.readTree(responseBody).path("errors").forEach(err -> errors.add(err.asText()));
        } catch (JsonProcessingException e) {
            log.debug("Vault error body is not JSON; reporting status only");
        }
        return errors;
    }
}
