package tech.yump.secretmanager.secrets.vault.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.http.ContentStreamProvider;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.http.SdkHttpRequest;
import software.amazon.awssdk.http.auth.aws.signer.AwsV4HttpSigner;
import software.amazon.awssdk.http.auth.spi.signer.SignedRequest;
import tech.yump.secretmanager.secrets.vault.VaultAuthMethod;
import tech.yump.secretmanager.secrets.vault.VaultAuthenticationException;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransport;
import tech.yump.secretmanager.secrets.vault.transport.VaultTransportException;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Vault AWS IAM login: a SigV4-signed STS {@code GetCallerIdentity} request is handed to Vault, which
 * replays it against STS to learn the caller's identity. Nothing is sent to AWS from here.
 */
@Slf4j
public class AwsIamLoginStrategy implements VaultLoginStrategy {

    static final String STS_REQUEST_BODY = "Action=GetCallerIdentity&Version=2011-06-15";
    static final String CONTENT_TYPE = "application/x-www-form-urlencoded; charset=utf-8";
    static final String SERVER_ID_HEADER = "X-Vault-AWS-IAM-Server-ID";
    private static final String SIGNING_NAME = "sts";

    private final String role;
    private final String mountPoint;
    private final String region;
    private final String stsEndpoint;
    private final String iamServerId;
    private final AwsCredentialsProvider credentialsProvider;
    private final ObjectMapper objectMapper;
    private final AwsV4HttpSigner signer = AwsV4HttpSigner.create();

    public AwsIamLoginStrategy(String role, String mountPoint, String region, String stsEndpoint, String iamServerId,
                               AwsCredentialsProvider credentialsProvider, ObjectMapper objectMapper) {
        this.role = role;
        this.mountPoint = mountPoint;
        this.region = region;
        this.stsEndpoint = stsEndpoint;
        this.iamServerId = iamServerId;
        this.credentialsProvider = credentialsProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    public VaultAuthMethod method() {
        return VaultAuthMethod.AWS;
    }

    @Override
    public String login(VaultTransport transport) {
        Map<String, Object> payload = buildLoginPayload();
        String loginPath = "auth/" + mountPoint + "/login";
        try {
            JsonNode response = transport.write(loginPath, payload);
            String clientToken = VaultLoginStrategy.clientToken(response, method());
            log.info("Authenticated with Vault via AWS IAM auth (role: {}, region: {}, mount: {})", role, region, mountPoint);
            return clientToken;
        } catch (VaultTransportException e) {
            throw new VaultAuthenticationException("AWS IAM login at " + loginPath + " failed: " + e.vaultErrorMessage(), e);
        }
    }

    /**
     * Signs the STS request and wraps it in Vault's {@code iam_*} login fields.
     */
    Map<String, Object> buildLoginPayload() {
        String stsUrl = stsEndpoint.endsWith("/") ? stsEndpoint : stsEndpoint + "/";
        byte[] body = STS_REQUEST_BODY.getBytes(StandardCharsets.UTF_8);

        Map<String, String> signedHeaders = signedHeaders(URI.create(stsUrl), body);
        String headersJson;
        try {
            headersJson = objectMapper.writeValueAsString(signedHeaders);
        } catch (JsonProcessingException e) {
            throw new VaultAuthenticationException("Failed to encode signed STS headers", e);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("role", role);
        payload.put("iam_http_request_method", "POST");
        payload.put("iam_request_url", base64(stsUrl.getBytes(StandardCharsets.UTF_8)));
        payload.put("iam_request_body", base64(body));
        payload.put("iam_request_headers", base64(headersJson.getBytes(StandardCharsets.UTF_8)));
        return payload;
    }

    private Map<String, String> signedHeaders(URI stsUri, byte[] body) {
        SdkHttpRequest.Builder request = SdkHttpRequest.builder()
                .method(SdkHttpMethod.POST)
                .uri(stsUri)
                .putHeader("Host", hostHeader(stsUri))
                .putHeader("Content-Type", CONTENT_TYPE);
        if (iamServerId != null) {
            request.putHeader(SERVER_ID_HEADER, iamServerId);
        }

        SignedRequest signed;
        try {
            // Default chain: env vars, shared profile, then container/instance role
            AwsCredentials credentials = credentialsProvider.resolveCredentials();
            signed = signer.sign(r -> r
                    .identity(credentials)
                    .request(request.build())
                    .payload(ContentStreamProvider.fromByteArray(body))
                    .putProperty(AwsV4HttpSigner.SERVICE_SIGNING_NAME, SIGNING_NAME)
                    .putProperty(AwsV4HttpSigner.REGION_NAME, region));
        } catch (RuntimeException e) {
            throw new VaultAuthenticationException("Failed to sign STS GetCallerIdentity request: " + e.getMessage(), e);
        }

        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        signed.request().headers().forEach((name, values) -> headers.put(name, String.join(",", values)));
        return headers;
    }

    private static String hostHeader(URI uri) {
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("https".equalsIgnoreCase(uri.getScheme()) && port == 443)
                || ("http".equalsIgnoreCase(uri.getScheme()) && port == 80);
        return defaultPort ? uri.getHost() : uri.getHost() + ":" + port;
    }

    private static String base64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }
}
