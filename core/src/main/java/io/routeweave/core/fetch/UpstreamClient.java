package io.routeweave.core.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.TrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based reader for the upstream routing authority.
 *
 * <p>
 * Issues {@code GET} requests with optional HTTP basic auth, enforces a
 * per-request timeout and a response size limit, and maps JDK I/O failures
 * onto the {@link UpstreamException} hierarchy. Redirects are not followed.
 *
 * <p>
 * One instance is created per data source by the composition root and shared
 * by every fetch; the underlying {@link HttpClient} is thread-safe.
 */
public final class UpstreamClient {

    private static final Logger LOG = LoggerFactory.getLogger(UpstreamClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Responses larger than this are rejected. */
    public static final int DEFAULT_MAX_BODY_BYTES = 10 * 1024 * 1024;

    private final HttpClient httpClient;
    private final Duration timeout;
    private final String authorization;
    private final int maxBodyBytes;

    /**
     * Creates a client.
     *
     * @param timeout       connect and per-request timeout
     * @param username      basic auth user, null or empty for none
     * @param password      basic auth password
     * @param skipTlsVerify accept any server certificate
     * @param maxBodyBytes  response size limit
     */
    public UpstreamClient(Duration timeout, String username, String password, boolean skipTlsVerify, int maxBodyBytes) {
        this.timeout = timeout;
        this.maxBodyBytes = maxBodyBytes;
        this.authorization = username != null && !username.isEmpty()
                ? "Basic " + Base64.getEncoder()
                        .encodeToString((username + ":" + (password == null ? "" : password))
                                .getBytes(StandardCharsets.UTF_8))
                : null;

        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER);
        if (skipTlsVerify) {
            builder.sslContext(trustAllContext());
            LOG.warn("TLS certificate verification is disabled for upstream requests");
        }
        this.httpClient = builder.build();
    }

    /** Creates a client without authentication, TLS verification on, 10 MB limit. */
    public UpstreamClient(Duration timeout) {
        this(timeout, null, null, false, DEFAULT_MAX_BODY_BYTES);
    }

    /**
     * Issues a {@code GET} and returns the raw response, whatever its status.
     *
     * @param url absolute URL
     * @return the response
     * @throws UpstreamConnectException           if the host cannot be reached
     * @throws UpstreamTimeoutException           if the host does not answer in time
     * @throws UpstreamResponseTooLargeException if the body exceeds the limit
     * @throws InterruptedException               if the calling thread is interrupted
     */
    public UpstreamResponse get(String url) throws UpstreamException, InterruptedException {
        return get(url, timeout);
    }

    /**
     * Issues a {@code GET} bounded by the smaller of the client timeout and
     * {@code deadline}.
     *
     * @param url      absolute URL
     * @param deadline remaining time the caller is willing to wait
     * @return the response
     */
    public UpstreamResponse get(String url, Duration deadline) throws UpstreamException, InterruptedException {
        Duration requestTimeout = deadline.compareTo(timeout) < 0 ? deadline : timeout;
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new UpstreamTimeoutException("Deadline exceeded before requesting " + url, null);
        }

        URI target;
        try {
            target = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new UpstreamConnectException("Invalid upstream URL: " + url, e);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(target)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET();
        if (authorization != null) {
            request.header("Authorization", authorization);
        }

        LOG.debug("GET {}", target);

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpConnectTimeoutException e) {
            throw new UpstreamConnectException("Connect timeout to " + target, e);
        } catch (HttpTimeoutException e) {
            throw new UpstreamTimeoutException("Read timeout from " + target, e);
        } catch (ConnectException e) {
            throw new UpstreamConnectException("Connection refused by " + target, e);
        } catch (SSLException e) {
            throw new UpstreamConnectException("TLS failure talking to " + target + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UpstreamConnectException("Failed to connect to " + target, e);
        } catch (IllegalArgumentException e) {
            throw new UpstreamConnectException("Unsupported upstream URL: " + target, e);
        }

        String body = readBody(response, target);

        Map<String, String> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> {
            if (!values.isEmpty()) {
                headers.put(name.toLowerCase(), values.get(0));
            }
        });

        LOG.debug("GET {} -> {}", target, response.statusCode());
        return new UpstreamResponse(response.statusCode(), headers, body);
    }

    /**
     * Issues a {@code GET} and parses the 2xx body as JSON.
     *
     * @param url absolute URL
     * @return the parsed body
     * @throws UpstreamStatusException if the status is not 2xx
     * @throws UpstreamDecodeException if the body is not valid JSON
     */
    public JsonNode getJson(String url) throws UpstreamException, InterruptedException {
        return getJson(url, timeout);
    }

    /** As {@link #getJson(String)}, bounded by {@code deadline}. */
    public JsonNode getJson(String url, Duration deadline) throws UpstreamException, InterruptedException {
        UpstreamResponse response = get(url, deadline);
        if (!response.isSuccess()) {
            throw new UpstreamStatusException(url, response.statusCode(), response.body());
        }
        try {
            JsonNode node = MAPPER.readTree(response.body());
            if (node == null || node.isMissingNode()) {
                throw new UpstreamDecodeException("Empty response body from " + url);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new UpstreamDecodeException("Malformed JSON from " + url + ": " + e.getOriginalMessage(), e);
        }
    }

    /** Returns the underlying {@link HttpClient}, package-private for tests. */
    HttpClient httpClient() {
        return httpClient;
    }

    private String readBody(HttpResponse<InputStream> response, URI target)
            throws UpstreamException {
        try (InputStream in = response.body()) {
            byte[] bytes = in.readNBytes(maxBodyBytes + 1);
            if (bytes.length > maxBodyBytes) {
                throw new UpstreamResponseTooLargeException(
                        "Response from " + target + " exceeds " + maxBodyBytes + " bytes");
            }
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (HttpTimeoutException e) {
            throw new UpstreamTimeoutException("Read timeout from " + target, e);
        } catch (IOException e) {
            throw new UpstreamConnectException("Failed reading response from " + target, e);
        }
    }

    private static SSLContext trustAllContext() {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {new TrustAllTrustManager()}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot create trust-all SSL context", e);
        }
    }
}
